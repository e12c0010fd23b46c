package com.e2eq.rls.model.policy;

import java.util.Set;

/**
 * Registry form of a policy: named, with operations expanded and {@code order} recording registration
 * order for stable sorting.
 */
public record CompiledPolicy(String name,
                             PolicyType type,
                             Set<Operation> operations,
                             int priority,
                             int order,
                             PolicyDefinition definition) {

   public boolean appliesTo(Operation operation) {
      return operations.contains(operation);
   }

   public boolean isActive(PolicyActivationContext ctx) {
      return definition.isActive(ctx);
   }

   public FilterCondition filterCondition() {
      return ((FilterPolicy) definition).condition();
   }

   public AsyncPolicyCondition condition() {
      if (definition instanceof AllowPolicy allow) {
         return allow.condition();
      }
      if (definition instanceof DenyPolicy deny) {
         return deny.condition();
      }
      if (definition instanceof ValidatePolicy validate) {
         return validate.condition();
      }
      throw new IllegalStateException("Policy " + name + " of type " + type.value() + " has no boolean condition");
   }
}
