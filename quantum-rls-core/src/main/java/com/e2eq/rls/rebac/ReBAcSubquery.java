package com.e2eq.rls.rebac;

import com.e2eq.rls.sql.SqlFragment;

import java.util.List;

/**
 * {@code EXISTS (...)} or {@code NOT EXISTS (...)} predicate generated for one relationship policy.
 */
public record ReBAcSubquery(SqlFragment fragment, boolean negated) {

   public String sql() {
      return fragment.getSql();
   }

   public List<Object> parameters() {
      return fragment.getParameters();
   }
}
