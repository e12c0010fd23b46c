package com.e2eq.rls.testing;

import com.e2eq.rls.model.context.AuthContext;
import com.e2eq.rls.model.context.PolicyEvaluationContext;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.policy.CompiledPolicy;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyType;
import com.e2eq.rls.model.policy.RlsSchema;
import com.e2eq.rls.model.rebac.CompiledReBAcPolicy;
import com.e2eq.rls.policy.AccessDecision;
import com.e2eq.rls.policy.PolicyEvaluator;
import com.e2eq.rls.policy.PolicyRegistry;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a schema without a database, for unit tests of policies.
 *
 * <pre>
 * PolicyTester tester = new PolicyTester(schema);
 * AccessDecision d = tester.evaluate("posts", Operation.UPDATE, TestContext.builder()
 *    .auth(owner).row(Map.of("author_id", "u1")).build());
 * PolicyAssertions.assertAllowed(d);
 * </pre>
 */
public class PolicyTester {
   private static final Logger LOG = Logger.getLogger(PolicyTester.class);

   private final PolicyRegistry registry;
   private final PolicyEvaluator evaluator;

   public PolicyTester(RlsSchema schema) {
      this(schema, null, Set.of());
   }

   public PolicyTester(RlsSchema schema, String environment, Set<String> features) {
      this.registry = new PolicyRegistry(schema);
      this.evaluator = new PolicyEvaluator(registry, environment, features);
   }

   public AccessDecision evaluate(String table, Operation operation, TestContext context) {
      if (!registry.hasTable(table)) {
         return new AccessDecision(true, AccessDecision.DecisionType.DEFAULT, null, "Table has no RLS policies",
            List.of());
      }
      return evaluator.evaluate(table, operation, context.toRlsContext(), context.getRow(), context.getData());
   }

   public FilterEvaluationResult getFilters(String table, AuthContext auth) {
      return getFilters(table, auth, Map.of());
   }

   public FilterEvaluationResult getFilters(String table, AuthContext auth, Map<String, Object> meta) {
      if (!registry.hasTable(table)) {
         return FilterEvaluationResult.none();
      }
      RlsContext ctx = RlsContext.builder().auth(auth).meta(meta == null ? Map.of() : meta).build();
      if (evaluator.bypasses(table, ctx)) {
         return FilterEvaluationResult.none();
      }
      return new FilterEvaluationResult(evaluator.evaluateFilters(table, ctx));
   }

   /**
    * Runs one allow, deny or validate policy in isolation, against the first operation it covers.
    * Empty when the table has no such policy. A condition that fails answers false.
    */
   public Optional<Boolean> testPolicy(String table, String policyName, TestContext context) {
      for (Operation op : List.of(Operation.READ, Operation.CREATE, Operation.UPDATE, Operation.DELETE)) {
         for (CompiledPolicy policy : registry.getRules(table, op)) {
            if (policy.type() == PolicyType.FILTER || !policy.name().equals(policyName)) {
               continue;
            }
            PolicyEvaluationContext evalCtx = PolicyEvaluationContext.from(context.toRlsContext(), table,
               op.value(), context.getRow(), context.getData());
            try {
               Boolean result = policy.condition().evaluate(evalCtx).await().indefinitely();
               return Optional.of(Boolean.TRUE.equals(result));
            } catch (RuntimeException e) {
               LOG.warnf(e, "[RLS] Policy %s on %s failed; counted as false", policyName, table);
               return Optional.of(false);
            }
         }
      }
      return Optional.empty();
   }

   public PolicyListing listPolicies(String table) {
      Set<String> allows = new LinkedHashSet<>();
      Set<String> denies = new LinkedHashSet<>();
      Set<String> validates = new LinkedHashSet<>();
      List<String> filters = new ArrayList<>();
      for (CompiledPolicy p : registry.getRules(table, Operation.ALL)) {
         switch (p.type()) {
            case ALLOW -> allows.add(p.name());
            case DENY -> denies.add(p.name());
            case VALIDATE -> validates.add(p.name());
            case FILTER -> filters.add(p.name());
         }
      }
      List<String> rebac = new ArrayList<>();
      for (CompiledReBAcPolicy p : registry.getReBAcRegistry().getPolicies(table, Operation.ALL)) {
         rebac.add(p.name());
      }
      return new PolicyListing(List.copyOf(allows), List.copyOf(denies), List.copyOf(filters),
         List.copyOf(validates), List.copyOf(rebac));
   }

   public List<String> getTables() {
      return registry.getTables();
   }

   public PolicyRegistry getRegistry() {
      return registry;
   }
}
