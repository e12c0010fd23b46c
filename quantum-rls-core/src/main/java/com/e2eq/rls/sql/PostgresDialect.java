package com.e2eq.rls.sql;

/** Double quoted identifiers, numbered {@code $n} placeholders. */
public final class PostgresDialect implements SqlDialect {
   public static final PostgresDialect INSTANCE = new PostgresDialect();

   private PostgresDialect() {}

   @Override
   public String name() {
      return "postgres";
   }

   @Override
   public char identifierQuote() {
      return '"';
   }

   @Override
   public String placeholder(int index) {
      return "$" + index;
   }
}
