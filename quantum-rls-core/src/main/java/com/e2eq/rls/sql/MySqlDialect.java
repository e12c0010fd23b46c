package com.e2eq.rls.sql;

/** Backtick quoted identifiers, positional {@code ?} placeholders. */
public final class MySqlDialect implements SqlDialect {
   public static final MySqlDialect INSTANCE = new MySqlDialect();

   private MySqlDialect() {}

   @Override
   public String name() {
      return "mysql";
   }

   @Override
   public char identifierQuote() {
      return '`';
   }

   @Override
   public String placeholder(int index) {
      return "?";
   }
}
