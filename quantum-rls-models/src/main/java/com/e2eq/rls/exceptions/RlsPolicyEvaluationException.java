package com.e2eq.rls.exceptions;

/**
 * Wraps an error raised by a policy condition. The original error is always kept as the cause so
 * callers see what actually failed; an evaluation error is never turned into an allow.
 */
public class RlsPolicyEvaluationException extends RlsException {
   private static final long serialVersionUID = 1L;

   private final String operation;
   private final String table;
   private final String policyName;

   public RlsPolicyEvaluationException(String operation, String table, String policyName, Throwable cause) {
      super(String.format("Policy evaluation error during %s on %s (policy: %s): %s",
               operation, table, policyName, cause == null ? "unknown" : cause.getMessage()),
            RlsErrorCode.RLS_POLICY_EVALUATION_ERROR, cause);
      this.operation = operation;
      this.table = table;
      this.policyName = policyName;
   }

   public String getOperation() {
      return operation;
   }

   public String getTable() {
      return table;
   }

   public String getPolicyName() {
      return policyName;
   }
}
