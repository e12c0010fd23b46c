package com.e2eq.rls.model.policy;

import java.util.Set;

/**
 * Declarative rule attached to a table. The four variants ({@link FilterPolicy}, {@link AllowPolicy},
 * {@link DenyPolicy}, {@link ValidatePolicy}) each carry only the condition shape they need; callers
 * dispatch on {@link #type()}.
 *
 * {@link #operations()} may contain {@link Operation#ALL}; it is expanded when the policy is compiled.
 */
public interface PolicyDefinition {
   int DEFAULT_PRIORITY = 0;

   /** Optional; the registry derives {@code {table}_{type}_{index}} when null. */
   String name();

   PolicyType type();

   Set<Operation> operations();

   int priority();

   /** Null when the policy is always active. */
   PolicyActivationCondition activation();

   PolicyDefinition withName(String name);

   /**
    * Returns a copy whose activation condition is the given one combined with any existing one. Both
    * must pass for the policy to be active.
    */
   PolicyDefinition withActivation(PolicyActivationCondition activation);

   default boolean isActive(PolicyActivationContext ctx) {
      PolicyActivationCondition activation = activation();
      return activation == null || activation.isActive(ctx);
   }

   static PolicyActivationCondition combine(PolicyActivationCondition existing, PolicyActivationCondition added) {
      if (existing == null) {
         return added;
      }
      return existing.and(added);
   }
}
