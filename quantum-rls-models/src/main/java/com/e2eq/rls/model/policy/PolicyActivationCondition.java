package com.e2eq.rls.model.policy;

@FunctionalInterface
public interface PolicyActivationCondition {

   boolean isActive(PolicyActivationContext ctx);

   default PolicyActivationCondition and(PolicyActivationCondition other) {
      if (other == null) {
         return this;
      }
      return ctx -> isActive(ctx) && other.isActive(ctx);
   }
}
