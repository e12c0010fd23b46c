package com.e2eq.rls.model.policy;

import com.e2eq.rls.model.context.PolicyEvaluationContext;
import io.smallrye.mutiny.Uni;

/**
 * Synchronous boolean condition of an allow, deny or validate policy.
 */
@FunctionalInterface
public interface PolicyCondition {

   boolean test(PolicyEvaluationContext ctx);

   static PolicyCondition always() {
      return ctx -> true;
   }

   default AsyncPolicyCondition async() {
      return ctx -> Uni.createFrom().item(() -> test(ctx));
   }
}
