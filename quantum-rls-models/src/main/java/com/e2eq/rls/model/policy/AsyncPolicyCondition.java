package com.e2eq.rls.model.policy;

import com.e2eq.rls.model.context.PolicyEvaluationContext;
import io.smallrye.mutiny.Uni;

/**
 * Condition that may suspend, e.g. to look something up. The returned Uni is awaited before the
 * decision it contributes to is final; a failure propagates to the caller.
 */
@FunctionalInterface
public interface AsyncPolicyCondition {

   Uni<Boolean> evaluate(PolicyEvaluationContext ctx);
}
