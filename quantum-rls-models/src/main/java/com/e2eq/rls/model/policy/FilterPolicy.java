package com.e2eq.rls.model.policy;

import java.util.Objects;
import java.util.Set;

/**
 * Narrows reads with a plain column mapping. Evaluated before any row is fetched and always applied,
 * whatever allow and deny decide.
 */
public record FilterPolicy(String name,
                           Set<Operation> operations,
                           FilterCondition condition,
                           int priority,
                           PolicyActivationCondition activation) implements PolicyDefinition {

   public FilterPolicy {
      operations = Policies.requireOperations(operations, "filter");
      Objects.requireNonNull(condition, "filter condition cannot be null");
   }

   @Override
   public PolicyType type() {
      return PolicyType.FILTER;
   }

   @Override
   public FilterPolicy withName(String name) {
      return new FilterPolicy(name, operations, condition, priority, activation);
   }

   @Override
   public FilterPolicy withActivation(PolicyActivationCondition added) {
      return new FilterPolicy(name, operations, condition, priority, PolicyDefinition.combine(activation, added));
   }
}
