package com.e2eq.rls.rebac;

import com.e2eq.rls.exceptions.RlsException;
import com.e2eq.rls.exceptions.RlsPolicyEvaluationException;
import com.e2eq.rls.model.context.PolicyEvaluationContext;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.context.RlsContextManager;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.rebac.CompiledReBAcPolicy;
import com.e2eq.rls.model.rebac.CompiledRelationshipStep;
import com.e2eq.rls.model.rebac.RelationshipCondition;
import com.e2eq.rls.sql.RewritableQuery;
import com.e2eq.rls.sql.SqlDialect;
import com.e2eq.rls.sql.SqlDialects;
import com.e2eq.rls.sql.SqlFragmentBuilder;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * Turns relationship policies into {@code EXISTS} / {@code NOT EXISTS} subqueries and adds them to
 * reads.
 *
 * For a path products, shops, organizations, employees and end condition
 * {@code {user_id: "123", status: "active"}} the postgres output is
 * <pre>
 * EXISTS (SELECT 1 FROM "shops"
 *    JOIN "organizations" ON "shops"."organization_id" = "organizations"."id"
 *    JOIN "employees" ON "organizations"."id" = "employees"."organization_id"
 *    WHERE "shops"."id" = "products"."shop_id"
 *    AND "employees"."user_id" = $1 AND "employees"."status" = $2)
 * </pre>
 * (on one line). Parameters are listed in the order their placeholders appear.
 */
public class ReBAcTransformer {
   private static final Logger LOG = Logger.getLogger(ReBAcTransformer.class);

   private final ReBAcRegistry registry;
   private final ReBAcQueryOptions options;

   public ReBAcTransformer(ReBAcRegistry registry) {
      this(registry, ReBAcQueryOptions.defaults());
   }

   /**
    * @throws com.e2eq.rls.exceptions.RlsSchemaException if the dialect is not supported
    */
   public ReBAcTransformer(ReBAcRegistry registry, String dialect) {
      this(registry, ReBAcQueryOptions.builder().dialect(SqlDialects.forName(dialect)).build());
   }

   public ReBAcTransformer(ReBAcRegistry registry, ReBAcQueryOptions options) {
      this.registry = registry;
      this.options = options;
   }

   public SqlDialect getDialect() {
      return options.getDialect();
   }

   public <Q extends RewritableQuery<Q>> Q transform(Q query, String table) {
      return transform(query, table, Operation.READ);
   }

   /**
    * Adds one subquery per applicable policy, in priority order. The same query instance comes back
    * when there is no ambient context, when the context is a system context, or when the table has no
    * relationship policy for the operation.
    */
   public <Q extends RewritableQuery<Q>> Q transform(Q query, String table, Operation operation) {
      return transform(query, table, operation, options.getMainTableAlias());
   }

   /** As {@link #transform(RewritableQuery, String, Operation)}, anchoring on the given alias. */
   public <Q extends RewritableQuery<Q>> Q transform(Q query, String table, Operation operation, String mainTableAlias) {
      RlsContext ctx = RlsContextManager.getContextOrNull();
      if (ctx == null) {
         return query;
      }
      if (ctx.isSystem()) {
         LOG.debugf("[ReBAC] Bypassing relationship checks (system context): %s", table);
         return query;
      }
      List<CompiledReBAcPolicy> policies = registry.getPolicies(table, operation);
      if (policies.isEmpty()) {
         return query;
      }

      Q result = query;
      for (CompiledReBAcPolicy policy : policies) {
         ReBAcSubquery subquery = generateExistsSql(policy, ctx, table, mainTableAlias, operation);
         result = result.withPredicate(subquery.fragment());
         if (LOG.isDebugEnabled()) {
            LOG.debugf("[ReBAC] Applied %s on %s: %s", policy.name(), table, subquery.sql());
         }
      }
      return result;
   }

   public ReBAcSubquery generateExistsSql(CompiledReBAcPolicy policy, RlsContext ctx, String mainTable) {
      return generateExistsSql(policy, ctx, mainTable, null, Operation.READ);
   }

   public ReBAcSubquery generateExistsSql(CompiledReBAcPolicy policy, RlsContext ctx, String mainTable,
                                          String mainTableAlias) {
      return generateExistsSql(policy, ctx, mainTable, mainTableAlias, Operation.READ);
   }

   ReBAcSubquery generateExistsSql(CompiledReBAcPolicy policy, RlsContext ctx, String mainTable,
                                   String mainTableAlias, Operation operation) {
      Map<String, Object> endConditions = evaluateEndCondition(policy, ctx, mainTable, operation);
      String mainReference = mainTableAlias != null ? mainTableAlias : mainTable;
      List<CompiledRelationshipStep> steps = policy.relationshipPath().steps();
      CompiledRelationshipStep first = steps.get(0);
      CompiledRelationshipStep last = steps.get(steps.size() - 1);

      SqlFragmentBuilder sql = new SqlFragmentBuilder(options.getDialect());
      sql.append(policy.isNegated() ? "NOT EXISTS (" : "EXISTS (");
      sql.append("SELECT 1 FROM ").identifier(first.to());
      appendAlias(sql, first);

      for (int i = 1; i < steps.size(); i++) {
         CompiledRelationshipStep step = steps.get(i);
         CompiledRelationshipStep prev = steps.get(i - 1);
         sql.append(" ").append(step.joinType().keyword()).append(" ").identifier(step.to());
         appendAlias(sql, step);
         sql.append(" ON ").qualified(prev.alias(), step.fromColumn())
            .append(" = ").qualified(step.alias(), step.toColumn());
         sql.andConditions(step.alias(), step.additionalConditions());
      }

      sql.append(" WHERE ").qualified(first.alias(), first.toColumn())
         .append(" = ").qualified(mainReference, first.fromColumn());
      sql.andConditions(first.alias(), first.additionalConditions());

      sql.andConditions(last.alias(), endConditions);
      sql.append(")");

      return new ReBAcSubquery(sql.build(), policy.isNegated());
   }

   private Map<String, Object> evaluateEndCondition(CompiledReBAcPolicy policy, RlsContext ctx, String table,
                                                    Operation operation) {
      RelationshipCondition condition = policy.endCondition();
      PolicyEvaluationContext evalCtx = PolicyEvaluationContext.from(ctx, table, operation.value());
      Map<String, Object> result;
      try {
         result = condition.apply(evalCtx);
      } catch (RlsException e) {
         throw e;
      } catch (RuntimeException e) {
         throw new RlsPolicyEvaluationException(operation.value(), table, policy.name(), e);
      }
      if (result == null) {
         return Map.of();
      }
      SqlFragmentBuilder.validateConditions(result, "ReBAC policy " + policy.name() + " on " + table);
      return result;
   }

   private static void appendAlias(SqlFragmentBuilder sql, CompiledRelationshipStep step) {
      if (!step.alias().equals(step.to())) {
         sql.append(" AS ").identifier(step.alias());
      }
   }
}
