package com.e2eq.rls.enforcement;

import com.e2eq.rls.config.RlsConfig;
import com.e2eq.rls.config.RlsOptions;
import com.e2eq.rls.exceptions.RlsContextException;
import com.e2eq.rls.exceptions.RlsException;
import com.e2eq.rls.exceptions.RlsSchemaException;
import com.e2eq.rls.io.YamlRlsSchemaLoader;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.context.RlsContextManager;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.RlsSchema;
import com.e2eq.rls.policy.MutationGuard;
import com.e2eq.rls.policy.PolicyEvaluator;
import com.e2eq.rls.policy.PolicyRegistry;
import com.e2eq.rls.policy.SelectTransformer;
import com.e2eq.rls.rebac.ReBAcQueryOptions;
import com.e2eq.rls.rebac.ReBAcTransformer;
import com.e2eq.rls.sql.RewritableQuery;
import com.e2eq.rls.sql.SqlFragment;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point tying the registries, the evaluator and both transformers to a query layer.
 *
 * Reads go through {@link #interceptQuery}; writes go through a {@link RowStore} wrapped by
 * {@link #guard(RowStore)}. Policies are compiled once, in the constructor.
 */
public class RlsEnforcer {
   private static final Logger LOG = Logger.getLogger(RlsEnforcer.class);

   private final RlsOptions options;
   private final PolicyRegistry registry;
   private final PolicyEvaluator evaluator;
   private final SelectTransformer selectTransformer;
   private final ReBAcTransformer rebacTransformer;
   private final MutationGuard mutationGuard;

   public RlsEnforcer(RlsSchema schema) {
      this(schema, RlsOptions.defaults());
   }

   public RlsEnforcer(RlsSchema schema, RlsOptions options) {
      LOG.infof("[RLS] Initializing enforcer (tables=%d, excludeTables=%d, bypassRoles=%d, dialect=%s)",
         schema.getTables().size(), options.getExcludeTables().size(), options.getBypassRoles().size(),
         options.getDialect().name());
      this.options = options;
      this.registry = new PolicyRegistry(schema);
      this.evaluator = new PolicyEvaluator(registry, options.getEnvironment(), options.getFeatures());
      this.selectTransformer = new SelectTransformer(evaluator, options.getDialect());
      this.rebacTransformer = new ReBAcTransformer(registry.getReBAcRegistry(),
         ReBAcQueryOptions.builder().dialect(options.getDialect()).build());
      this.mutationGuard = new MutationGuard(evaluator);
   }

   /**
    * Builds an enforcer from mapped configuration, loading the schema from {@code schema-location}.
    *
    * @throws RlsSchemaException when no location is configured or the file can not be read
    */
   public static RlsEnforcer fromConfig(RlsConfig config) {
      String location = config.schemaLocation()
         .orElseThrow(() -> new RlsSchemaException("quantum.rls.schema-location is not configured"));
      RlsSchema schema;
      try {
         schema = new YamlRlsSchemaLoader().loadFromLocation(location);
      } catch (IOException e) {
         throw new RlsSchemaException("Unable to read RLS schema from " + location,
            Map.of("location", location), e);
      }
      return new RlsEnforcer(schema, RlsOptions.from(config));
   }

   // --------------------
   // queries
   // --------------------

   /**
    * Applies row level security to one statement.
    * <ul>
    *    <li>excluded tables and statements flagged {@code skipRLS} pass through</li>
    *    <li>without a context the statement fails when context is required, otherwise a read is
    *        closed with an always false predicate unless unfiltered queries are allowed</li>
    *    <li>system contexts, bypass roles and the table's skipFor roles pass through</li>
    *    <li>reads get the filter predicates, then the relationship predicates</li>
    *    <li>writes are flagged in the metadata; they are checked by the guarded store</li>
    * </ul>
    *
    * @throws RlsContextException when there is no context and one is required
    */
   public <Q extends RewritableQuery<Q>> Q interceptQuery(Q query, QueryContext queryContext) {
      String table = queryContext.getTable();
      if (options.isExcluded(table)) {
         LOG.debugf("[RLS] Skipping RLS for excluded table: %s", table);
         return query;
      }
      if (queryContext.isSkipRls()) {
         LOG.debugf("[RLS] Skipping RLS (explicit skip): %s", table);
         return query;
      }

      RlsContext ctx = RlsContextManager.getContextOrNull();
      if (ctx == null) {
         return withoutContext(query, queryContext);
      }
      if (isBypassed(ctx) || evaluator.bypasses(table, ctx)) {
         LOG.debugf("[RLS] Bypassing RLS (system or bypass role): %s", table);
         return query;
      }

      if (queryContext.getKind() == QueryContext.Kind.SELECT) {
         try {
            Q filtered = selectTransformer.transform(query, table, queryContext.reference());
            Q result = rebacTransformer.transform(filtered, table, Operation.READ, queryContext.getAlias());
            if (options.isAuditDecisions()) {
               LOG.infof("[RLS] Filter applied: table=%s user=%s", table, ctx.getAuth().getUserId());
            }
            return result;
         } catch (RlsException e) {
            LOG.errorf(e, "[RLS] Error applying filter on %s", table);
            throw e;
         }
      }

      if (queryContext.isMutation()) {
         queryContext.getMetadata().put(QueryContext.RLS_REQUIRED, Boolean.TRUE);
         queryContext.getMetadata().put(QueryContext.RLS_TABLE, table);
      }
      return query;
   }

   private <Q extends RewritableQuery<Q>> Q withoutContext(Q query, QueryContext queryContext) {
      String table = queryContext.getTable();
      String kind = queryContext.getKind().name().toLowerCase(Locale.ROOT);
      if (options.isRequireContext()) {
         throw new RlsContextException("RLS context required but not found for " + kind + " on " + table
            + ". Provide a context or disable quantum.rls.require-context and enable "
            + "quantum.rls.allow-unfiltered-queries if this is intended.");
      }
      if (!options.isAllowUnfilteredQueries()) {
         LOG.warnf("[RLS] Missing context for %s on %s; reads return no rows", kind, table);
         if (queryContext.getKind() == QueryContext.Kind.SELECT) {
            return query.withPredicate(SqlFragment.alwaysFalse(options.getDialect()));
         }
         return query;
      }
      LOG.warnf("[RLS] No context for %s on %s; running unfiltered because allow-unfiltered-queries is set",
         kind, table);
      return query;
   }

   // --------------------
   // writes
   // --------------------

   /**
    * Wraps the store's writes with policy checks. Stores of excluded tables and of tables without
    * policies come back unchanged.
    */
   public RowStore guard(RowStore store) {
      String table = store.getTableName();
      if (options.isExcluded(table)) {
         LOG.debugf("[RLS] Skipping store guard for excluded table: %s", table);
         return store;
      }
      if (!registry.hasTable(table)) {
         LOG.debugf("[RLS] Table \"%s\" not in RLS schema, skipping", table);
         return store;
      }
      LOG.debugf("[RLS] Guarding store for table: %s", table);
      return new GuardedRowStore(store, mutationGuard, this, options);
   }

   /**
    * Whether the current context may perform the operation on the row. Never throws for a denial or
    * an evaluation failure; both answer false. An update is checked without a payload, so validate
    * policies do not take part.
    */
   public boolean canAccess(String table, Operation operation, Map<String, Object> row) {
      RlsContext ctx = RlsContextManager.getContextOrNull();
      if (ctx == null) {
         return false;
      }
      if (isBypassed(ctx)) {
         return true;
      }
      try {
         switch (operation) {
            case READ:
               return mutationGuard.checkRead(table, row);
            case CREATE:
               mutationGuard.checkCreate(table, row);
               return true;
            case UPDATE:
               mutationGuard.checkUpdate(table, row, null);
               return true;
            case DELETE:
               mutationGuard.checkDelete(table, row);
               return true;
            default:
               return false;
         }
      } catch (RlsException e) {
         LOG.debugf("[RLS] Access check failed: table=%s operation=%s error=%s", table, operation.value(),
            e.getMessage());
         return false;
      }
   }

   /**
    * Runs the action as a system context derived from the current one.
    *
    * @throws RlsContextException when there is no current context
    */
   public <T> T withoutRls(Supplier<T> action) {
      return RlsContextManager.asSystem(action);
   }

   /** System identity or one of the configured bypass roles. */
   public boolean isBypassed(RlsContext ctx) {
      return ctx.isSystem() || ctx.getAuth().hasAnyRole(options.getBypassRoles());
   }

   public PolicyRegistry getRegistry() {
      return registry;
   }

   public PolicyEvaluator getEvaluator() {
      return evaluator;
   }

   public RlsOptions getOptions() {
      return options;
   }
}
