package com.e2eq.rls.rebac;

import com.e2eq.rls.sql.PostgresDialect;
import com.e2eq.rls.sql.SqlDialect;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReBAcQueryOptions {
   /** Alias of the main table in the outer query; defaults to the table name. */
   String mainTableAlias;
   @Builder.Default
   SqlDialect dialect = PostgresDialect.INSTANCE;

   public static ReBAcQueryOptions defaults() {
      return ReBAcQueryOptions.builder().build();
   }
}
