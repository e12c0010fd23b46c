package com.e2eq.rls.policy;

import com.e2eq.rls.exceptions.RlsSchemaException;
import com.e2eq.rls.model.policy.CompiledPolicy;
import com.e2eq.rls.model.policy.FilterCondition;
import com.e2eq.rls.model.policy.FilterPolicy;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyDefinition;
import com.e2eq.rls.model.policy.PolicyType;
import com.e2eq.rls.model.policy.RlsSchema;
import com.e2eq.rls.model.policy.TableRlsConfig;
import com.e2eq.rls.model.rebac.RelationshipPath;
import com.e2eq.rls.model.rebac.TableReBAcConfig;
import com.e2eq.rls.rebac.ReBAcRegistry;
import com.e2eq.rls.sql.SqlFragmentBuilder;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per table policy store.
 *
 * Policies are compiled on registration: names are derived as {@code {table}_{type}_{index}} when
 * missing, {@link Operation#ALL} is expanded for the policy type, and the table's list is sorted by
 * descending priority with ties kept in registration order. Relationship paths and relationship
 * policies of a table are handed to the {@link ReBAcRegistry}, which validates them.
 *
 * Built once at startup; mutation must not interleave with concurrent reads.
 */
public class PolicyRegistry {
   private static final Logger LOG = Logger.getLogger(PolicyRegistry.class);

   private static final Comparator<CompiledPolicy> PRIORITY_ORDER =
      Comparator.comparingInt(CompiledPolicy::priority).reversed()
         .thenComparingInt(CompiledPolicy::order);

   private record TableEntry(List<CompiledPolicy> policies, Set<String> skipFor, boolean defaultDeny) {}

   private final Map<String, TableEntry> tables = new LinkedHashMap<>();
   private final ReBAcRegistry rebacRegistry;

   public PolicyRegistry() {
      this(new ReBAcRegistry());
   }

   public PolicyRegistry(ReBAcRegistry rebacRegistry) {
      this.rebacRegistry = rebacRegistry;
   }

   public PolicyRegistry(RlsSchema schema) {
      this(new ReBAcRegistry());
      loadSchema(schema);
   }

   public void loadSchema(RlsSchema schema) {
      for (RelationshipPath path : schema.getRelationships()) {
         registerRelationship(path);
      }
      for (Map.Entry<String, TableRlsConfig> e : schema.getTables().entrySet()) {
         if (e.getValue() != null) {
            registerTable(e.getKey(), e.getValue());
         }
      }
      LOG.infof("[RLS] Loaded schema with %d tables", schema.getTables().size());
   }

   public void registerTable(String table, List<PolicyDefinition> policies) {
      registerTable(table, TableRlsConfig.builder().policies(policies).build());
   }

   /**
    * @throws RlsSchemaException when the table is already registered, two policies share a name, a
    *                            policy declares operations its type does not support, or a relationship
    *                            policy references an unknown path
    */
   public void registerTable(String table, TableRlsConfig config) {
      if (StringUtils.isBlank(table)) {
         throw new RlsSchemaException("Table name can not be blank");
      }
      if (tables.containsKey(table)) {
         throw new RlsSchemaException("Table \"" + table + "\" is already registered", Map.of("table", table));
      }

      List<CompiledPolicy> compiled = new ArrayList<>();
      Set<String> names = new HashSet<>();
      List<PolicyDefinition> policies = config.getPolicies();
      for (int i = 0; i < policies.size(); i++) {
         CompiledPolicy policy = compile(table, policies.get(i), i);
         if (!names.add(policy.name())) {
            throw new RlsSchemaException("Duplicate policy name \"" + policy.name() + "\" on table \"" + table + "\"",
               Map.of("table", table, "policy", policy.name()));
         }
         compiled.add(policy);
      }
      compiled.sort(PRIORITY_ORDER);
      Set<String> skipFor = skipFor(table, config.getSkipFor());

      // ReBAC commits its own state, so it goes last
      if (config.hasReBAc()) {
         rebacRegistry.registerTable(table, TableReBAcConfig.builder()
            .relationships(config.getRelationships())
            .policies(config.getRebacPolicies())
            .build());
      }

      tables.put(table, new TableEntry(Collections.unmodifiableList(compiled), skipFor, config.isDefaultDeny()));
      LOG.infof("[RLS] Registered table: %s (policies=%d, skipFor=%s, defaultDeny=%s)",
         table, compiled.size(), config.getSkipFor(), config.isDefaultDeny());
   }

   private static Set<String> skipFor(String table, Collection<String> roles) {
      if (roles == null) {
         return Set.of();
      }
      for (String role : roles) {
         if (StringUtils.isBlank(role)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("table", table);
            details.put("role", role);
            throw new RlsSchemaException("skipFor of table \"" + table + "\" has a blank role", details);
         }
      }
      return Set.copyOf(roles);
   }

   /** Global relationship path, visible to every table. */
   public void registerRelationship(RelationshipPath path) {
      rebacRegistry.registerRelationship(path);
   }

   /**
    * Every policy of the table covering the operation, highest priority first, ties in registration
    * order. Empty for unregistered tables.
    */
   public List<CompiledPolicy> getRules(String table, Operation operation) {
      TableEntry entry = tables.get(table);
      if (entry == null) {
         return List.of();
      }
      List<CompiledPolicy> result = new ArrayList<>();
      for (CompiledPolicy p : entry.policies()) {
         if (operation == Operation.ALL || p.appliesTo(operation)) {
            result.add(p);
         }
      }
      return result;
   }

   public List<CompiledPolicy> getFilters(String table) {
      return ofType(table, Operation.READ, PolicyType.FILTER);
   }

   public List<CompiledPolicy> getAllows(String table, Operation operation) {
      return ofType(table, operation, PolicyType.ALLOW);
   }

   public List<CompiledPolicy> getDenies(String table, Operation operation) {
      return ofType(table, operation, PolicyType.DENY);
   }

   public List<CompiledPolicy> getValidates(String table, Operation operation) {
      return ofType(table, operation, PolicyType.VALIDATE);
   }

   public Set<String> getSkipFor(String table) {
      TableEntry entry = tables.get(table);
      return entry == null ? Set.of() : entry.skipFor();
   }

   public boolean hasDefaultDeny(String table) {
      TableEntry entry = tables.get(table);
      return entry != null && entry.defaultDeny();
   }

   public boolean hasTable(String table) {
      return tables.containsKey(table);
   }

   public List<String> getTables() {
      return List.copyOf(tables.keySet());
   }

   public ReBAcRegistry getReBAcRegistry() {
      return rebacRegistry;
   }

   /** Removes table and global registrations; test isolation only. */
   public void clear() {
      tables.clear();
      rebacRegistry.clear();
   }

   private List<CompiledPolicy> ofType(String table, Operation operation, PolicyType type) {
      List<CompiledPolicy> result = new ArrayList<>();
      for (CompiledPolicy p : getRules(table, operation)) {
         if (p.type() == type) {
            result.add(p);
         }
      }
      return result;
   }

   private CompiledPolicy compile(String table, PolicyDefinition definition, int index) {
      if (definition == null) {
         throw new RlsSchemaException("Policy " + index + " on table \"" + table + "\" is null",
            Map.of("table", table, "index", index));
      }
      PolicyType type = definition.type();
      String name = StringUtils.isNotBlank(definition.name())
         ? definition.name()
         : table + "_" + type.value() + "_" + index;

      Set<Operation> operations = Operation.normalize(definition.operations(), type);
      Set<Operation> supported = switch (type) {
         case FILTER -> EnumSet.of(Operation.READ);
         case VALIDATE -> EnumSet.of(Operation.CREATE, Operation.UPDATE);
         case ALLOW, DENY -> Operation.concrete();
      };
      if (operations.isEmpty() || !supported.containsAll(operations)) {
         Map<String, Object> details = new LinkedHashMap<>();
         details.put("table", table);
         details.put("policy", name);
         details.put("operations", operations);
         throw new RlsSchemaException("Policy \"" + name + "\" of type " + type.value()
            + " does not support operations " + operations, details);
      }

      if (definition instanceof FilterPolicy filter && filter.condition() instanceof FilterCondition.Literal literal) {
         SqlFragmentBuilder.validateConditions(literal.mapping(), "filter policy " + name);
      }

      return new CompiledPolicy(name, type, operations, definition.priority(), index, definition);
   }
}
