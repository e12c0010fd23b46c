package com.e2eq.rls.model.rebac;

import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyType;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Relationship based policy. Instead of a condition it names a relationship path and an end condition
 * for the last table of that path. An {@link PolicyType#ALLOW} policy requires a matching row to exist,
 * a {@link PolicyType#DENY} policy requires that none exists.
 */
@Value
@Builder(toBuilder = true)
public class ReBAcPolicyDefinition {
   String name;
   Set<Operation> operations;
   String relationshipPath;
   RelationshipCondition endCondition;
   @Builder.Default
   PolicyType policyType = PolicyType.ALLOW;
   @Builder.Default
   int priority = 0;
}
