package com.e2eq.rls.policy;

import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.context.RlsContextManager;
import com.e2eq.rls.sql.RewritableQuery;
import com.e2eq.rls.sql.SqlDialect;
import com.e2eq.rls.sql.SqlFragmentBuilder;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * Adds the column conditions of a table's filter policies to a read. Each condition becomes its own
 * predicate qualified by the table (or alias), so two filters on the same column both apply.
 */
public class SelectTransformer {
   private static final Logger LOG = Logger.getLogger(SelectTransformer.class);

   private final PolicyEvaluator evaluator;
   private final SqlDialect dialect;

   public SelectTransformer(PolicyEvaluator evaluator, SqlDialect dialect) {
      this.evaluator = evaluator;
      this.dialect = dialect;
   }

   public <Q extends RewritableQuery<Q>> Q transform(Q query, String table) {
      return transform(query, table, table);
   }

   /**
    * Without an ambient context, for system contexts and for skipFor roles the query is returned
    * unchanged; handling a missing context is up to the caller.
    */
   public <Q extends RewritableQuery<Q>> Q transform(Q query, String table, String reference) {
      RlsContext ctx = RlsContextManager.getContextOrNull();
      if (ctx == null || evaluator.bypasses(table, ctx)) {
         return query;
      }

      List<AppliedFilter> filters = evaluator.evaluateFilters(table, ctx);
      Q result = query;
      for (AppliedFilter filter : filters) {
         for (Map.Entry<String, Object> condition : filter.conditions().entrySet()) {
            if (SqlFragmentBuilder.isAbsent(condition.getValue())) {
               continue;
            }
            result = result.withPredicate(new SqlFragmentBuilder(dialect)
               .condition(reference, condition.getKey(), condition.getValue())
               .build());
         }
         if (LOG.isDebugEnabled()) {
            LOG.debugf("[RLS] Applied filter %s to %s", filter.policyName(), table);
         }
      }
      return result;
   }
}
