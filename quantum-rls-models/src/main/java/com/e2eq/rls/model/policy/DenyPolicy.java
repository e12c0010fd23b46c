package com.e2eq.rls.model.policy;

import java.util.Objects;
import java.util.Set;

/**
 * Rejects the operation when its condition holds. A passing deny wins over any allow.
 */
public record DenyPolicy(String name,
                         Set<Operation> operations,
                         AsyncPolicyCondition condition,
                         int priority,
                         PolicyActivationCondition activation) implements PolicyDefinition {

   public DenyPolicy {
      operations = Policies.requireOperations(operations, "deny");
      Objects.requireNonNull(condition, "deny condition cannot be null");
   }

   @Override
   public PolicyType type() {
      return PolicyType.DENY;
   }

   @Override
   public DenyPolicy withName(String name) {
      return new DenyPolicy(name, operations, condition, priority, activation);
   }

   @Override
   public DenyPolicy withActivation(PolicyActivationCondition added) {
      return new DenyPolicy(name, operations, condition, priority, PolicyDefinition.combine(activation, added));
   }
}
