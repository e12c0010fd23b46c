package com.e2eq.rls.model.rebac;

import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyType;

import java.util.Set;

/**
 * Registry form of a relationship policy: the path is resolved, operations never contain
 * {@link Operation#ALL} and {@code order} records registration order for stable sorting.
 */
public record CompiledReBAcPolicy(String name,
                                  PolicyType type,
                                  Set<Operation> operations,
                                  CompiledRelationshipPath relationshipPath,
                                  RelationshipCondition endCondition,
                                  int priority,
                                  int order) {

   public boolean appliesTo(Operation operation) {
      return operations.contains(operation);
   }

   public boolean isNegated() {
      return type == PolicyType.DENY;
   }
}
