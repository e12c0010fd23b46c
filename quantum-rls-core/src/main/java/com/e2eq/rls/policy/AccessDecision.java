package com.e2eq.rls.policy;

import com.e2eq.rls.model.policy.PolicyType;

import java.util.List;

/**
 * Outcome of evaluating the allow, deny and validate policies of one operation.
 *
 * @param policyName        policy that decided, null when the outcome is a default or bypass
 * @param evaluatedPolicies policies whose conditions ran, in evaluation order
 */
public record AccessDecision(boolean allowed,
                             DecisionType decision,
                             String policyName,
                             String reason,
                             List<EvaluatedPolicy> evaluatedPolicies) {

   public enum DecisionType {
      /** An allow policy granted the operation, or the context bypasses policies. */
      ALLOW,
      /** A deny or validate policy rejected the operation, or no allow policy matched. */
      DENY,
      /** No allow policy exists; the table's default applied. */
      DEFAULT
   }

   public record EvaluatedPolicy(String name, PolicyType type, boolean result) {}

   public AccessDecision {
      evaluatedPolicies = List.copyOf(evaluatedPolicies);
   }

   static AccessDecision allow(String policyName, String reason, List<EvaluatedPolicy> evaluated) {
      return new AccessDecision(true, DecisionType.ALLOW, policyName, reason, evaluated);
   }

   static AccessDecision deny(String policyName, String reason, List<EvaluatedPolicy> evaluated) {
      return new AccessDecision(false, DecisionType.DENY, policyName, reason, evaluated);
   }

   static AccessDecision byDefault(boolean allowed, String reason, List<EvaluatedPolicy> evaluated) {
      return new AccessDecision(allowed, DecisionType.DEFAULT, null, reason, evaluated);
   }
}
