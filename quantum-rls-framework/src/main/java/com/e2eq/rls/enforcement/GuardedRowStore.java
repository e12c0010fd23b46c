package com.e2eq.rls.enforcement;

import com.e2eq.rls.config.RlsOptions;
import com.e2eq.rls.exceptions.RlsPolicyViolation;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.context.RlsContextManager;
import com.e2eq.rls.policy.MutationGuard;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * A {@link RowStore} whose writes are checked by the mutation guard first. Update and delete load the
 * existing row by the configured primary key column; a row that does not exist is left to the
 * delegate to report.
 */
class GuardedRowStore implements RowStore {
   private static final Logger LOG = Logger.getLogger(GuardedRowStore.class);

   private final RowStore delegate;
   private final MutationGuard guard;
   private final RlsEnforcer enforcer;
   private final RlsOptions options;

   GuardedRowStore(RowStore delegate, MutationGuard guard, RlsEnforcer enforcer, RlsOptions options) {
      this.delegate = delegate;
      this.guard = guard;
      this.enforcer = enforcer;
      this.options = options;
   }

   @Override
   public String getTableName() {
      return delegate.getTableName();
   }

   @Override
   public Map<String, Object> create(Map<String, Object> data) {
      RlsContext ctx = RlsContextManager.getContextOrNull();
      if (needsCheck(ctx)) {
         String table = getTableName();
         try {
            guard.checkCreate(table, data);
            if (options.isAuditDecisions()) {
               LOG.infof("[RLS] Create allowed: table=%s user=%s", table, ctx.getAuth().getUserId());
            }
         } catch (RlsPolicyViolation violation) {
            reportViolation(violation, ctx, null);
            throw violation;
         }
      }
      return delegate.create(data);
   }

   @Override
   public Optional<Map<String, Object>> findBy(String column, Object value) {
      return delegate.findBy(column, value);
   }

   @Override
   public Map<String, Object> update(Object id, Map<String, Object> data) {
      RlsContext ctx = RlsContextManager.getContextOrNull();
      if (needsCheck(ctx)) {
         Optional<Map<String, Object>> existing = delegate.findBy(options.getPrimaryKeyColumn(), id);
         if (existing.isPresent()) {
            String table = getTableName();
            try {
               guard.checkUpdate(table, existing.get(), data);
               if (options.isAuditDecisions()) {
                  LOG.infof("[RLS] Update allowed: table=%s id=%s user=%s", table, id, ctx.getAuth().getUserId());
               }
            } catch (RlsPolicyViolation violation) {
               reportViolation(violation, ctx, id);
               throw violation;
            }
         }
      }
      return delegate.update(id, data);
   }

   @Override
   public boolean delete(Object id) {
      RlsContext ctx = RlsContextManager.getContextOrNull();
      if (needsCheck(ctx)) {
         Optional<Map<String, Object>> existing = delegate.findBy(options.getPrimaryKeyColumn(), id);
         if (existing.isPresent()) {
            String table = getTableName();
            try {
               guard.checkDelete(table, existing.get());
               if (options.isAuditDecisions()) {
                  LOG.infof("[RLS] Delete allowed: table=%s id=%s user=%s", table, id, ctx.getAuth().getUserId());
               }
            } catch (RlsPolicyViolation violation) {
               reportViolation(violation, ctx, id);
               throw violation;
            }
         }
      }
      return delegate.delete(id);
   }

   private boolean needsCheck(RlsContext ctx) {
      return ctx != null && !enforcer.isBypassed(ctx);
   }

   private void reportViolation(RlsPolicyViolation violation, RlsContext ctx, Object id) {
      if (options.getOnViolation() != null) {
         options.getOnViolation().accept(violation);
      }
      if (options.isAuditDecisions()) {
         LOG.warnf("[RLS] %s denied: table=%s id=%s user=%s reason=%s", violation.getOperation(),
            violation.getTable(), id, ctx.getAuth().getUserId(), violation.getReason());
      }
   }
}
