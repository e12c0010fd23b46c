package com.e2eq.rls.model.policy;

import java.util.Objects;
import java.util.Set;

public record AllowPolicy(String name,
                          Set<Operation> operations,
                          AsyncPolicyCondition condition,
                          int priority,
                          PolicyActivationCondition activation) implements PolicyDefinition {

   public AllowPolicy {
      operations = Policies.requireOperations(operations, "allow");
      Objects.requireNonNull(condition, "allow condition cannot be null");
   }

   @Override
   public PolicyType type() {
      return PolicyType.ALLOW;
   }

   @Override
   public AllowPolicy withName(String name) {
      return new AllowPolicy(name, operations, condition, priority, activation);
   }

   @Override
   public AllowPolicy withActivation(PolicyActivationCondition added) {
      return new AllowPolicy(name, operations, condition, priority, PolicyDefinition.combine(activation, added));
   }
}
