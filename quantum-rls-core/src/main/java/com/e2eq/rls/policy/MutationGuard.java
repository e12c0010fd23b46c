package com.e2eq.rls.policy;

import com.e2eq.rls.exceptions.RlsPolicyViolation;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.context.RlsContextManager;
import com.e2eq.rls.model.policy.Operation;

import java.util.Map;

/**
 * Single row checks for mutations, run against the ambient context. Update and delete checks need
 * the existing row; fetching it is the caller's job.
 */
public class MutationGuard {
   private final PolicyEvaluator evaluator;

   public MutationGuard(PolicyEvaluator evaluator) {
      this.evaluator = evaluator;
   }

   /**
    * @throws RlsPolicyViolation when policy rejects the insert
    */
   public void checkCreate(String table, Map<String, Object> data) {
      enforce(table, Operation.CREATE, null, data);
   }

   public void checkUpdate(String table, Map<String, Object> existingRow, Map<String, Object> data) {
      enforce(table, Operation.UPDATE, existingRow, data);
   }

   public void checkDelete(String table, Map<String, Object> existingRow) {
      enforce(table, Operation.DELETE, existingRow, null);
   }

   /** Read check of a single row already in hand; does not throw on denial. */
   public boolean checkRead(String table, Map<String, Object> row) {
      return decide(table, Operation.READ, row, null).allowed();
   }

   public AccessDecision decide(String table, Operation operation, Map<String, Object> row, Map<String, Object> data) {
      RlsContext ctx = RlsContextManager.getContext();
      return evaluator.evaluate(table, operation, ctx, row, data);
   }

   private void enforce(String table, Operation operation, Map<String, Object> row, Map<String, Object> data) {
      AccessDecision decision = decide(table, operation, row, data);
      if (!decision.allowed()) {
         throw new RlsPolicyViolation(operation.value(), table, decision.reason(), decision.policyName());
      }
   }
}
