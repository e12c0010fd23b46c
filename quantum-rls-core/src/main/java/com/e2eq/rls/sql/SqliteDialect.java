package com.e2eq.rls.sql;

public final class SqliteDialect implements SqlDialect {
   public static final SqliteDialect INSTANCE = new SqliteDialect();

   private SqliteDialect() {}

   @Override
   public String name() {
      return "sqlite";
   }

   @Override
   public char identifierQuote() {
      return '"';
   }

   @Override
   public String placeholder(int index) {
      return "?";
   }
}
