package com.e2eq.rls.model.rebac;

import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyType;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Builders for relationship policies.
 */
public final class ReBAcPolicies {
   public static final int DEFAULT_DENY_PRIORITY = 100;

   private ReBAcPolicies() {}

   public static ReBAcPolicyDefinition allowRelation(Operation operation, String relationshipPath,
                                                     RelationshipCondition endCondition) {
      return allowRelation(EnumSet.of(operation), relationshipPath, endCondition, null, null);
   }

   public static ReBAcPolicyDefinition allowRelation(Operation operation, String relationshipPath,
                                                     Map<String, Object> endCondition) {
      return allowRelation(EnumSet.of(operation), relationshipPath, RelationshipCondition.literal(endCondition), null, null);
   }

   public static ReBAcPolicyDefinition allowRelation(Set<Operation> operations, String relationshipPath,
                                                     RelationshipCondition endCondition, String name, Integer priority) {
      return ReBAcPolicyDefinition.builder()
         .name(name)
         .operations(operations)
         .relationshipPath(relationshipPath)
         .endCondition(endCondition)
         .policyType(PolicyType.ALLOW)
         .priority(priority != null ? priority : 0)
         .build();
   }

   public static ReBAcPolicyDefinition denyRelation(Operation operation, String relationshipPath,
                                                    RelationshipCondition endCondition) {
      return denyRelation(EnumSet.of(operation), relationshipPath, endCondition, null, null);
   }

   public static ReBAcPolicyDefinition denyRelation(Operation operation, String relationshipPath,
                                                    Map<String, Object> endCondition) {
      return denyRelation(EnumSet.of(operation), relationshipPath, RelationshipCondition.literal(endCondition), null, null);
   }

   /** Deny relations default to priority 100 so they are applied first. */
   public static ReBAcPolicyDefinition denyRelation(Set<Operation> operations, String relationshipPath,
                                                    RelationshipCondition endCondition, String name, Integer priority) {
      return ReBAcPolicyDefinition.builder()
         .name(name)
         .operations(operations)
         .relationshipPath(relationshipPath)
         .endCondition(endCondition)
         .policyType(PolicyType.DENY)
         .priority(priority != null ? priority : DEFAULT_DENY_PRIORITY)
         .build();
   }
}
