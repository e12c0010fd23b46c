package com.e2eq.rls.model.policy;

import com.e2eq.rls.model.rebac.RelationshipPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table name to {@link TableRlsConfig}, in declaration order, plus relationship paths shared by all
 * tables.
 */
public final class RlsSchema {
   private final Map<String, TableRlsConfig> tables = new LinkedHashMap<>();
   private final List<RelationshipPath> relationships = new ArrayList<>();

   public static RlsSchema create() {
      return new RlsSchema();
   }

   public RlsSchema table(String table, TableRlsConfig config) {
      tables.put(table, config);
      return this;
   }

   /** Registers a path globally, before any table is compiled. */
   public RlsSchema relationship(RelationshipPath path) {
      relationships.add(path);
      return this;
   }

   public Map<String, TableRlsConfig> getTables() {
      return Collections.unmodifiableMap(tables);
   }

   public TableRlsConfig getTable(String table) {
      return tables.get(table);
   }

   public List<RelationshipPath> getRelationships() {
      return Collections.unmodifiableList(relationships);
   }

   public boolean isEmpty() {
      return tables.isEmpty() && relationships.isEmpty();
   }

   /**
    * Combines schemas. Tables present in several schemas get the concatenation of their policies and
    * relationships, the union of their skipFor roles, and defaultDeny if any of them asks for it.
    * Global relationship paths are concatenated.
    */
   public static RlsSchema merge(RlsSchema... schemas) {
      RlsSchema merged = new RlsSchema();
      for (RlsSchema schema : schemas) {
         if (schema == null) {
            continue;
         }
         merged.relationships.addAll(schema.relationships);
         for (Map.Entry<String, TableRlsConfig> e : schema.tables.entrySet()) {
            merged.tables.merge(e.getKey(), e.getValue(), RlsSchema::mergeTable);
         }
      }
      return merged;
   }

   private static TableRlsConfig mergeTable(TableRlsConfig a, TableRlsConfig b) {
      Set<String> skipFor = new LinkedHashSet<>(a.getSkipFor());
      skipFor.addAll(b.getSkipFor());
      return a.toBuilder()
         .policies(b.getPolicies())
         .clearSkipFor()
         .skipFor(skipFor)
         .defaultDeny(a.isDefaultDeny() || b.isDefaultDeny())
         .relationships(b.getRelationships())
         .rebacPolicies(b.getRebacPolicies())
         .build();
   }
}
