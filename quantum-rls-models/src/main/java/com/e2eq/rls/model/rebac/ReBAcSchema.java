package com.e2eq.rls.model.rebac;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relationship configuration per table, kept in declaration order.
 */
public final class ReBAcSchema {
   private final Map<String, TableReBAcConfig> tables = new LinkedHashMap<>();

   public static ReBAcSchema create() {
      return new ReBAcSchema();
   }

   public ReBAcSchema table(String table, TableReBAcConfig config) {
      tables.put(table, config);
      return this;
   }

   public Map<String, TableReBAcConfig> getTables() {
      return Collections.unmodifiableMap(tables);
   }
}
