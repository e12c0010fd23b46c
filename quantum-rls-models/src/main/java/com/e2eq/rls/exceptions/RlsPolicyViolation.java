package com.e2eq.rls.exceptions;

/**
 * Thrown when a create, update, delete or read of a single row is rejected by policy.
 */
public class RlsPolicyViolation extends RlsException {
   private static final long serialVersionUID = 1L;

   private final String operation;
   private final String table;
   private final String reason;
   private final String policyName;

   public RlsPolicyViolation(String operation, String table, String reason) {
      this(operation, table, reason, null);
   }

   public RlsPolicyViolation(String operation, String table, String reason, String policyName) {
      super(buildMessage(operation, table, reason, policyName), RlsErrorCode.RLS_POLICY_VIOLATION);
      this.operation = operation;
      this.table = table;
      this.reason = reason;
      this.policyName = policyName;
   }

   private static String buildMessage(String operation, String table, String reason, String policyName) {
      String msg = String.format("RLS policy violation: %s on %s - %s", operation, table, reason);
      return policyName != null ? msg + " (policy: " + policyName + ")" : msg;
   }

   public String getOperation() {
      return operation;
   }

   public String getTable() {
      return table;
   }

   public String getReason() {
      return reason;
   }

   public String getPolicyName() {
      return policyName;
   }
}
