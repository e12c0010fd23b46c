package com.e2eq.rls.model.policy;

import com.e2eq.rls.exceptions.RlsErrorCode;
import com.e2eq.rls.exceptions.RlsException;

import java.time.ZoneId;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builders for policy definitions.
 *
 * <pre>
 * Policies.filter(Operation.READ, ctx -&gt; Map.of("tenant_id", ctx.getAuth().getTenantId()));
 * Policies.deny(Operation.DELETE, ctx -&gt; !ctx.getAuth().hasRole("admin"));
 * Policies.whenEnvironment(List.of("production"), Policies.deny(Operation.ALL));
 * </pre>
 */
public final class Policies {
   /** Deny policies run ahead of everything else unless told otherwise. */
   public static final int DEFAULT_DENY_PRIORITY = 100;

   private Policies() {}

   // --------------------
   // allow
   // --------------------

   public static AllowPolicy allow(Operation operation, PolicyCondition condition) {
      return allow(EnumSet.of(operation), condition, PolicyOptions.none());
   }

   public static AllowPolicy allow(Set<Operation> operations, PolicyCondition condition) {
      return allow(operations, condition, PolicyOptions.none());
   }

   public static AllowPolicy allow(Set<Operation> operations, PolicyCondition condition, PolicyOptions options) {
      requireCondition(condition, "allow");
      return allowAsync(operations, condition.async(), options);
   }

   public static AllowPolicy allowAsync(Operation operation, AsyncPolicyCondition condition) {
      return allowAsync(EnumSet.of(operation), condition, PolicyOptions.none());
   }

   public static AllowPolicy allowAsync(Set<Operation> operations, AsyncPolicyCondition condition, PolicyOptions options) {
      requireCondition(condition, "allow");
      return new AllowPolicy(options.getName(), operations, condition,
         options.priorityOr(PolicyDefinition.DEFAULT_PRIORITY), options.getActivation());
   }

   // --------------------
   // deny
   // --------------------

   /** Unconditional deny. */
   public static DenyPolicy deny(Operation operation) {
      return deny(EnumSet.of(operation), PolicyCondition.always(), PolicyOptions.none());
   }

   public static DenyPolicy deny(Operation operation, PolicyCondition condition) {
      return deny(EnumSet.of(operation), condition, PolicyOptions.none());
   }

   public static DenyPolicy deny(Set<Operation> operations, PolicyCondition condition) {
      return deny(operations, condition, PolicyOptions.none());
   }

   /**
    * A null condition denies unconditionally.
    */
   public static DenyPolicy deny(Set<Operation> operations, PolicyCondition condition, PolicyOptions options) {
      PolicyCondition effective = condition != null ? condition : PolicyCondition.always();
      return denyAsync(operations, effective.async(), options);
   }

   public static DenyPolicy denyAsync(Operation operation, AsyncPolicyCondition condition) {
      return denyAsync(EnumSet.of(operation), condition, PolicyOptions.none());
   }

   public static DenyPolicy denyAsync(Set<Operation> operations, AsyncPolicyCondition condition, PolicyOptions options) {
      requireCondition(condition, "deny");
      return new DenyPolicy(options.getName(), operations, condition,
         options.priorityOr(DEFAULT_DENY_PRIORITY), options.getActivation());
   }

   // --------------------
   // filter
   // --------------------

   public static FilterPolicy filter(Operation operation, FilterCondition condition) {
      return filter(operation, condition, PolicyOptions.none());
   }

   /**
    * Filters only apply to reads; {@link Operation#ALL} is coerced to {@link Operation#READ}.
    */
   public static FilterPolicy filter(Operation operation, FilterCondition condition, PolicyOptions options) {
      if (operation != Operation.READ && operation != Operation.ALL) {
         throw new RlsException("Filter policies only support read or all, got " + operation.value(),
            RlsErrorCode.RLS_POLICY_INVALID);
      }
      requireCondition(condition, "filter");
      return new FilterPolicy(options.getName(), EnumSet.of(Operation.READ), condition,
         options.priorityOr(PolicyDefinition.DEFAULT_PRIORITY), options.getActivation());
   }

   // --------------------
   // validate
   // --------------------

   public static ValidatePolicy validate(Operation operation, PolicyCondition condition) {
      return validate(operation, condition, PolicyOptions.none());
   }

   public static ValidatePolicy validate(Operation operation, PolicyCondition condition, PolicyOptions options) {
      requireCondition(condition, "validate");
      return validateAsync(operation, condition.async(), options);
   }

   public static ValidatePolicy validateAsync(Operation operation, AsyncPolicyCondition condition) {
      return validateAsync(operation, condition, PolicyOptions.none());
   }

   /**
    * Validation runs against payloads, so only create, update and all (meaning both) are accepted.
    */
   public static ValidatePolicy validateAsync(Operation operation, AsyncPolicyCondition condition, PolicyOptions options) {
      Set<Operation> ops = switch (operation) {
         case CREATE -> EnumSet.of(Operation.CREATE);
         case UPDATE -> EnumSet.of(Operation.UPDATE);
         case ALL -> EnumSet.of(Operation.CREATE, Operation.UPDATE);
         default -> throw new RlsException("Validate policies only support create, update or all, got "
            + operation.value(), RlsErrorCode.RLS_POLICY_INVALID);
      };
      requireCondition(condition, "validate");
      return new ValidatePolicy(options.getName(), ops, condition,
         options.priorityOr(PolicyDefinition.DEFAULT_PRIORITY), options.getActivation());
   }

   // --------------------
   // Conditional activation
   // --------------------

   public static PolicyDefinition whenEnvironment(Collection<String> environments, PolicyDefinition policy) {
      List<String> envs = List.copyOf(environments);
      return policy.withActivation(ctx -> ctx.getEnvironment() != null && envs.contains(ctx.getEnvironment()));
   }

   public static PolicyDefinition whenFeature(String feature, PolicyDefinition policy) {
      return policy.withActivation(ctx -> ctx.hasFeature(feature));
   }

   /**
    * Active between {@code startHour} (inclusive) and {@code endHour} (exclusive), in the system time
    * zone. A start after the end wraps around midnight, so 22 to 6 covers the night shift.
    */
   public static PolicyDefinition whenTimeRange(int startHour, int endHour, PolicyDefinition policy) {
      return whenTimeRange(startHour, endHour, ZoneId.systemDefault(), policy);
   }

   public static PolicyDefinition whenTimeRange(int startHour, int endHour, ZoneId zone, PolicyDefinition policy) {
      return policy.withActivation(ctx -> {
         int hour = ctx.getTimestamp().atZone(zone).getHour();
         if (startHour > endHour) {
            return hour >= startHour || hour < endHour;
         }
         return hour >= startHour && hour < endHour;
      });
   }

   public static PolicyDefinition whenCondition(PolicyActivationCondition condition, PolicyDefinition policy) {
      return policy.withActivation(condition);
   }

   // --------------------
   // helpers
   // --------------------

   public static Set<Operation> ops(Operation... operations) {
      return EnumSet.copyOf(Arrays.asList(operations));
   }

   static Set<Operation> requireOperations(Set<Operation> operations, String type) {
      if (operations == null || operations.isEmpty()) {
         throw new RlsException("A " + type + " policy needs at least one operation", RlsErrorCode.RLS_POLICY_INVALID);
      }
      return Set.copyOf(operations);
   }

   private static void requireCondition(Object condition, String type) {
      if (condition == null) {
         throw new RlsException("A " + type + " policy needs a condition", RlsErrorCode.RLS_POLICY_INVALID);
      }
   }
}
