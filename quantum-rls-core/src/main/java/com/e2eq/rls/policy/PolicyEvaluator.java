package com.e2eq.rls.policy;

import com.e2eq.rls.exceptions.RlsContextException;
import com.e2eq.rls.exceptions.RlsException;
import com.e2eq.rls.exceptions.RlsPolicyEvaluationException;
import com.e2eq.rls.model.context.PolicyEvaluationContext;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.policy.CompiledPolicy;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyActivationContext;
import com.e2eq.rls.sql.SqlFragmentBuilder;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies the policies of a {@link PolicyRegistry} to one operation.
 *
 * Order of evaluation:
 * <ol>
 *    <li>a system context, or a role listed in the table's skipFor, bypasses everything</li>
 *    <li>deny policies, highest priority first; the first one whose condition holds denies</li>
 *    <li>for create and update with a payload, every validate policy must pass against it</li>
 *    <li>allow policies: if any exist one of them must pass; if none exist the operation is allowed
 *        unless the table is configured with defaultDeny</li>
 * </ol>
 * Inactive policies (activation condition false) are skipped. A condition that throws or fails is
 * reported as {@link RlsPolicyEvaluationException} with the original error as cause; it never counts
 * as a pass.
 */
public class PolicyEvaluator {
   private static final Logger LOG = Logger.getLogger(PolicyEvaluator.class);

   private final PolicyRegistry registry;
   private final String environment;
   private final Set<String> features;
   private final Clock clock;

   public PolicyEvaluator(PolicyRegistry registry) {
      this(registry, null, Set.of(), Clock.systemDefaultZone());
   }

   public PolicyEvaluator(PolicyRegistry registry, String environment, Set<String> features) {
      this(registry, environment, features, Clock.systemDefaultZone());
   }

   public PolicyEvaluator(PolicyRegistry registry, String environment, Set<String> features, Clock clock) {
      this.registry = registry;
      this.environment = environment;
      this.features = features == null ? Set.of() : Set.copyOf(features);
      this.clock = clock;
   }

   public PolicyRegistry getRegistry() {
      return registry;
   }

   public PolicyActivationContext activationContext(RlsContext ctx) {
      return PolicyActivationContext.builder()
         .auth(ctx.getAuth())
         .environment(environment)
         .features(features)
         .timestamp(clock.instant())
         .meta(ctx.getMeta())
         .build();
   }

   /** True when the context skips the table's policies: system identity or a skipFor role. */
   public boolean bypasses(String table, RlsContext ctx) {
      return ctx.isSystem() || ctx.getAuth().hasAnyRole(registry.getSkipFor(table));
   }

   // --------------------
   // filters
   // --------------------

   /**
    * Evaluates every active filter policy of the table, highest priority first. Callers AND all
    * returned mappings together.
    */
   public List<AppliedFilter> evaluateFilters(String table, RlsContext ctx) {
      requireContext(ctx);
      List<AppliedFilter> result = new ArrayList<>();
      List<CompiledPolicy> filters = registry.getFilters(table);
      if (filters.isEmpty()) {
         return result;
      }
      PolicyActivationContext activation = activationContext(ctx);
      PolicyEvaluationContext evalCtx = PolicyEvaluationContext.from(ctx, table, Operation.READ.value());
      for (CompiledPolicy filter : filters) {
         if (!isActive(filter, activation, table, Operation.READ)) {
            continue;
         }
         Map<String, Object> conditions;
         try {
            conditions = filter.filterCondition().apply(evalCtx);
         } catch (RlsException e) {
            throw e;
         } catch (RuntimeException e) {
            throw new RlsPolicyEvaluationException(Operation.READ.value(), table, filter.name(), e);
         }
         if (conditions != null && !conditions.isEmpty()) {
            SqlFragmentBuilder.validateConditions(conditions, "filter policy " + filter.name() + " on " + table);
            result.add(new AppliedFilter(filter.name(), conditions));
         }
      }
      return result;
   }

   // --------------------
   // allow / deny / validate
   // --------------------

   public AccessDecision evaluate(String table, Operation operation, RlsContext ctx,
                                  Map<String, Object> row, Map<String, Object> data) {
      return evaluateAsync(table, operation, ctx, row, data).await().indefinitely();
   }

   public Uni<AccessDecision> evaluateAsync(String table, Operation operation, RlsContext ctx,
                                            Map<String, Object> row, Map<String, Object> data) {
      requireContext(ctx);
      if (ctx.isSystem()) {
         return Uni.createFrom().item(AccessDecision.allow(null, "system context bypasses RLS", List.of()));
      }
      if (ctx.getAuth().hasAnyRole(registry.getSkipFor(table))) {
         return Uni.createFrom().item(AccessDecision.allow(null, "role listed in skipFor of " + table, List.of()));
      }

      PolicyActivationContext activation = activationContext(ctx);
      PolicyEvaluationContext evalCtx = PolicyEvaluationContext.from(ctx, table, operation.value(), row, data);
      List<AccessDecision.EvaluatedPolicy> evaluated = new ArrayList<>();

      List<CompiledPolicy> denies = active(registry.getDenies(table, operation), activation, table, operation);
      List<CompiledPolicy> validates = data != null && (operation == Operation.CREATE || operation == Operation.UPDATE)
         ? active(registry.getValidates(table, operation), activation, table, operation)
         : List.of();
      List<CompiledPolicy> allows = active(registry.getAllows(table, operation), activation, table, operation);

      return firstWith(true, denies, 0, evalCtx, evaluated, table, operation)
         .onItem().transformToUni(deny -> {
            if (deny.isPresent()) {
               return Uni.createFrom().item(AccessDecision.deny(deny.get().name(),
                  "denied by policy " + deny.get().name(), evaluated));
            }
            return firstWith(false, validates, 0, evalCtx, evaluated, table, operation)
               .onItem().transformToUni(failed -> {
                  if (failed.isPresent()) {
                     return Uni.createFrom().item(AccessDecision.deny(failed.get().name(),
                        "validation failed: " + failed.get().name(), evaluated));
                  }
                  return decideAllows(allows, evalCtx, evaluated, table, operation);
               });
         })
         .invoke(decision -> {
            if (LOG.isDebugEnabled()) {
               LOG.debugf("[RLS] %s on %s for %s: %s (%s)", operation.value(), table,
                  ctx.getAuth().getUserId(), decision.decision(), decision.reason());
            }
         });
   }

   private Uni<AccessDecision> decideAllows(List<CompiledPolicy> allows, PolicyEvaluationContext evalCtx,
                                            List<AccessDecision.EvaluatedPolicy> evaluated, String table, Operation operation) {
      if (allows.isEmpty()) {
         if (registry.hasDefaultDeny(table)) {
            return Uni.createFrom().item(AccessDecision.byDefault(false,
               "no allow policy for " + operation.value() + " and table denies by default", evaluated));
         }
         return Uni.createFrom().item(AccessDecision.byDefault(true,
            "no allow policy for " + operation.value() + ", allowed by default", evaluated));
      }
      return firstWith(true, allows, 0, evalCtx, evaluated, table, operation)
         .onItem().transform(allow -> allow
            .map(p -> AccessDecision.allow(p.name(), "allowed by policy " + p.name(), evaluated))
            .orElseGet(() -> AccessDecision.deny(null, "no allow policy matched", evaluated)));
   }

   /**
    * Evaluates the policies one after the other and yields the first whose condition equals
    * {@code expected}.
    */
   private Uni<Optional<CompiledPolicy>> firstWith(boolean expected, List<CompiledPolicy> policies, int index,
                                                   PolicyEvaluationContext evalCtx, List<AccessDecision.EvaluatedPolicy> evaluated,
                                                   String table, Operation operation) {
      if (index >= policies.size()) {
         return Uni.createFrom().item(Optional.empty());
      }
      CompiledPolicy policy = policies.get(index);
      return check(policy, evalCtx, evaluated, table, operation)
         .onItem().transformToUni(result -> result == expected
            ? Uni.createFrom().item(Optional.of(policy))
            : firstWith(expected, policies, index + 1, evalCtx, evaluated, table, operation));
   }

   private Uni<Boolean> check(CompiledPolicy policy, PolicyEvaluationContext evalCtx, List<AccessDecision.EvaluatedPolicy> evaluated,
                              String table, Operation operation) {
      return Uni.createFrom().deferred(() -> {
            Uni<Boolean> result = policy.condition().evaluate(evalCtx);
            if (result == null) {
               throw new IllegalStateException("condition returned no result");
            }
            return result;
         })
         .onItem().transform(value -> {
            if (value == null) {
               throw new IllegalStateException("condition produced null instead of a boolean");
            }
            evaluated.add(new AccessDecision.EvaluatedPolicy(policy.name(), policy.type(), value));
            return value;
         })
         .onFailure(f -> !(f instanceof RlsException))
         .transform(f -> new RlsPolicyEvaluationException(operation.value(), table, policy.name(), f));
   }

   private List<CompiledPolicy> active(List<CompiledPolicy> policies, PolicyActivationContext activation,
                                       String table, Operation operation) {
      List<CompiledPolicy> result = new ArrayList<>(policies.size());
      for (CompiledPolicy p : policies) {
         if (isActive(p, activation, table, operation)) {
            result.add(p);
         }
      }
      return result;
   }

   private boolean isActive(CompiledPolicy policy, PolicyActivationContext activation, String table, Operation operation) {
      try {
         boolean active = policy.isActive(activation);
         if (!active && LOG.isDebugEnabled()) {
            LOG.debugf("[RLS] Policy %s on %s inactive", policy.name(), table);
         }
         return active;
      } catch (RlsException e) {
         throw e;
      } catch (RuntimeException e) {
         throw new RlsPolicyEvaluationException(operation.value(), table, policy.name(), e);
      }
   }

   private static void requireContext(RlsContext ctx) {
      if (ctx == null) {
         throw new RlsContextException();
      }
   }
}
