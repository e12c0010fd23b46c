package com.e2eq.rls.model.rebac;

import java.util.Map;

/** Relationship step with every default resolved. */
public record CompiledRelationshipStep(String from,
                                       String to,
                                       String fromColumn,
                                       String toColumn,
                                       String alias,
                                       JoinType joinType,
                                       Map<String, Object> additionalConditions) {
}
