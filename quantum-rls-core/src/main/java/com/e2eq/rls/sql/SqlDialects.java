package com.e2eq.rls.sql;

import com.e2eq.rls.exceptions.RlsSchemaException;

import java.util.Locale;
import java.util.Map;

public final class SqlDialects {
   private SqlDialects() {}

   /**
    * Resolves a dialect by name ({@code postgres}, {@code mysql}, {@code sqlite}; {@code postgresql} is
    * accepted as an alias).
    *
    * @throws RlsSchemaException for any other name
    */
   public static SqlDialect forName(String name) {
      if (name == null || name.isBlank()) {
         throw new RlsSchemaException("SQL dialect can not be blank", Map.of("dialect", String.valueOf(name)));
      }
      return switch (name.trim().toLowerCase(Locale.ROOT)) {
         case "postgres", "postgresql" -> PostgresDialect.INSTANCE;
         case "mysql" -> MySqlDialect.INSTANCE;
         case "sqlite" -> SqliteDialect.INSTANCE;
         default -> throw new RlsSchemaException("Unsupported SQL dialect '" + name + "'", Map.of("dialect", name));
      };
   }
}
