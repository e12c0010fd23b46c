package com.e2eq.rls.model.policy;

import java.util.Objects;
import java.util.Set;

/**
 * Checked against the create or update payload rather than an existing row.
 */
public record ValidatePolicy(String name,
                             Set<Operation> operations,
                             AsyncPolicyCondition condition,
                             int priority,
                             PolicyActivationCondition activation) implements PolicyDefinition {

   public ValidatePolicy {
      operations = Policies.requireOperations(operations, "validate");
      Objects.requireNonNull(condition, "validate condition cannot be null");
   }

   @Override
   public PolicyType type() {
      return PolicyType.VALIDATE;
   }

   @Override
   public ValidatePolicy withName(String name) {
      return new ValidatePolicy(name, operations, condition, priority, activation);
   }

   @Override
   public ValidatePolicy withActivation(PolicyActivationCondition added) {
      return new ValidatePolicy(name, operations, condition, priority, PolicyDefinition.combine(activation, added));
   }
}
