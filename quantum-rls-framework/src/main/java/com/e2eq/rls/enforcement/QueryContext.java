package com.e2eq.rls.enforcement;

import lombok.Builder;
import lombok.Value;

import java.util.HashMap;
import java.util.Map;

/**
 * What the query layer knows about a statement when it hands it to {@link RlsEnforcer#interceptQuery}.
 * The metadata map is shared with the caller; the enforcer writes markers into it.
 */
@Value
@Builder
public class QueryContext {
   public static final String SKIP_RLS = "skipRLS";
   public static final String RLS_REQUIRED = "__rlsRequired";
   public static final String RLS_TABLE = "__rlsTable";

   public enum Kind {
      SELECT, INSERT, UPDATE, DELETE
   }

   Kind kind;
   String table;
   String alias;
   @Builder.Default
   Map<String, Object> metadata = new HashMap<>();

   public static QueryContext select(String table) {
      return QueryContext.builder().kind(Kind.SELECT).table(table).build();
   }

   public static QueryContext select(String table, String alias) {
      return QueryContext.builder().kind(Kind.SELECT).table(table).alias(alias).build();
   }

   public static QueryContext mutation(Kind kind, String table) {
      return QueryContext.builder().kind(kind).table(table).build();
   }

   public boolean isSkipRls() {
      return Boolean.TRUE.equals(metadata.get(SKIP_RLS));
   }

   public boolean isMutation() {
      return kind == Kind.INSERT || kind == Kind.UPDATE || kind == Kind.DELETE;
   }

   /** Alias when set, table name otherwise. */
   public String reference() {
      return alias != null ? alias : table;
   }
}
