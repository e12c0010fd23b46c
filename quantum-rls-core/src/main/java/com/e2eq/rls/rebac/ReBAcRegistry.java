package com.e2eq.rls.rebac;

import com.e2eq.rls.exceptions.RlsSchemaException;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyType;
import com.e2eq.rls.model.rebac.CompiledReBAcPolicy;
import com.e2eq.rls.model.rebac.CompiledRelationshipPath;
import com.e2eq.rls.model.rebac.CompiledRelationshipStep;
import com.e2eq.rls.model.rebac.JoinType;
import com.e2eq.rls.model.rebac.ReBAcPolicyDefinition;
import com.e2eq.rls.model.rebac.ReBAcSchema;
import com.e2eq.rls.model.rebac.RelationshipCondition;
import com.e2eq.rls.model.rebac.RelationshipPath;
import com.e2eq.rls.model.rebac.RelationshipStep;
import com.e2eq.rls.model.rebac.TableReBAcConfig;
import com.e2eq.rls.sql.SqlFragmentBuilder;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Relationship paths and relationship policies, compiled at registration time.
 *
 * Paths are registered globally or under a table; a table scoped path shadows a global path of the same
 * name for that table and is also published globally so other tables can reference it. Compilation
 * fills every step default and checks that the steps form a connected chain. Policies are resolved
 * against their path when registered, so a policy naming an unknown path fails at startup.
 *
 * Registration is meant to complete before traffic starts; reads need no locking afterwards.
 */
public class ReBAcRegistry {
   private static final Logger LOG = Logger.getLogger(ReBAcRegistry.class);

   private static final Comparator<CompiledReBAcPolicy> PRIORITY_ORDER =
      Comparator.comparingInt(CompiledReBAcPolicy::priority).reversed()
         .thenComparingInt(CompiledReBAcPolicy::order);

   private record TableEntry(Map<String, CompiledRelationshipPath> relationships, List<CompiledReBAcPolicy> policies) {}

   private final Map<String, TableEntry> tables = new LinkedHashMap<>();
   private final Map<String, CompiledRelationshipPath> globalRelationships = new LinkedHashMap<>();

   public ReBAcRegistry() {
   }

   public ReBAcRegistry(ReBAcSchema schema) {
      loadSchema(schema);
   }

   public void loadSchema(ReBAcSchema schema) {
      for (Map.Entry<String, TableReBAcConfig> e : schema.getTables().entrySet()) {
         if (e.getValue() != null) {
            registerTable(e.getKey(), e.getValue());
         }
      }
   }

   public void registerRelationship(RelationshipPath path) {
      require(path != null, "Relationship path can not be null", Map.of());
      require(path.getSteps() != null && !path.getSteps().isEmpty(),
         "Relationship path \"" + path.getName() + "\" has no steps", Map.of("path", String.valueOf(path.getName())));
      CompiledRelationshipPath compiled = compileRelationshipPath(path, path.getSteps().get(0).getFrom());
      globalRelationships.put(path.getName(), compiled);
      LOG.debugf("[ReBAC] Registered global relationship %s (%d steps)", path.getName(), compiled.steps().size());
   }

   public void registerTable(String table, TableReBAcConfig config) {
      require(StringUtils.isNotBlank(table), "Table name can not be blank", Map.of());
      require(!tables.containsKey(table), "Table \"" + table + "\" is already registered for ReBAC", Map.of("table", table));

      Map<String, CompiledRelationshipPath> relationships = new LinkedHashMap<>();
      for (RelationshipPath rel : config.getRelationships()) {
         CompiledRelationshipPath compiled = compileRelationshipPath(rel, table);
         relationships.put(rel.getName(), compiled);
      }

      List<CompiledReBAcPolicy> policies = new ArrayList<>();
      Set<String> names = new HashSet<>();
      List<ReBAcPolicyDefinition> definitions = config.getPolicies();
      for (int i = 0; i < definitions.size(); i++) {
         ReBAcPolicyDefinition definition = definitions.get(i);
         String name = definition.getName() != null ? definition.getName() : table + "_rebac_policy_" + i;
         require(names.add(name), "Duplicate ReBAC policy name \"" + name + "\" on table \"" + table + "\"",
            Map.of("table", table, "policy", name));
         policies.add(compilePolicy(definition, name, table, i, relationships));
      }
      policies.sort(PRIORITY_ORDER);

      // published only once the whole table compiled
      globalRelationships.putAll(relationships);
      tables.put(table, new TableEntry(Collections.unmodifiableMap(relationships), Collections.unmodifiableList(policies)));
      LOG.infof("[ReBAC] Registered table: %s (relationships=%d, policies=%d)", table, relationships.size(), policies.size());
   }

   /**
    * Relationship policies for the table that cover the operation, highest priority first, ties in
    * registration order. Empty for unknown tables.
    */
   public List<CompiledReBAcPolicy> getPolicies(String table, Operation operation) {
      TableEntry entry = tables.get(table);
      if (entry == null) {
         return List.of();
      }
      List<CompiledReBAcPolicy> result = new ArrayList<>();
      for (CompiledReBAcPolicy p : entry.policies()) {
         if (operation == Operation.ALL || p.appliesTo(operation)) {
            result.add(p);
         }
      }
      return result;
   }

   /** Table scoped lookup first, global fallback second. */
   public Optional<CompiledRelationshipPath> getRelationship(String name, String table) {
      if (table != null) {
         TableEntry entry = tables.get(table);
         if (entry != null && entry.relationships().containsKey(name)) {
            return Optional.of(entry.relationships().get(name));
         }
      }
      return Optional.ofNullable(globalRelationships.get(name));
   }

   public Optional<CompiledRelationshipPath> getRelationship(String name) {
      return getRelationship(name, null);
   }

   public boolean hasTable(String table) {
      return tables.containsKey(table);
   }

   public List<String> getTables() {
      return List.copyOf(tables.keySet());
   }

   /** Removes every registration; test isolation only. */
   public void clear() {
      tables.clear();
      globalRelationships.clear();
   }

   // --------------------
   // compilation
   // --------------------

   CompiledRelationshipPath compileRelationshipPath(RelationshipPath path, String sourceTable) {
      String name = path.getName();
      require(StringUtils.isNotBlank(name), "Relationship path needs a name", Map.of());
      require(path.getSteps() != null && !path.getSteps().isEmpty(),
         "Relationship path \"" + name + "\" must have at least one step", Map.of("path", name));

      List<CompiledRelationshipStep> steps = new ArrayList<>();
      for (int i = 0; i < path.getSteps().size(); i++) {
         RelationshipStep step = path.getSteps().get(i);
         require(StringUtils.isNotBlank(step.getFrom()) && StringUtils.isNotBlank(step.getTo()),
            "Relationship step " + i + " in \"" + name + "\" must have 'from' and 'to' tables",
            Map.of("path", name, "step", i));
         Map<String, Object> additional = step.getAdditionalConditions() == null
            ? Map.of() : step.getAdditionalConditions();
         SqlFragmentBuilder.validateConditions(additional, "relationship path " + name + " step " + i);
         steps.add(new CompiledRelationshipStep(
            step.getFrom(),
            step.getTo(),
            StringUtils.defaultIfBlank(step.getFromColumn(), step.getTo() + "_id"),
            StringUtils.defaultIfBlank(step.getToColumn(), "id"),
            StringUtils.defaultIfBlank(step.getAlias(), step.getTo()),
            step.getJoinType() != null ? step.getJoinType() : JoinType.INNER,
            additional));
      }

      for (int i = 1; i < steps.size(); i++) {
         CompiledRelationshipStep prev = steps.get(i - 1);
         CompiledRelationshipStep current = steps.get(i);
         require(current.from().equals(prev.to()) || current.from().equals(prev.alias()),
            "Relationship path \"" + name + "\" has broken chain at step " + i + ": expected '" + prev.to()
               + "' but got '" + current.from() + "'",
            Map.of("path", name, "step", i));
      }

      return new CompiledRelationshipPath(name, steps, sourceTable, steps.get(steps.size() - 1).to());
   }

   private CompiledReBAcPolicy compilePolicy(ReBAcPolicyDefinition policy,
                                             String name,
                                             String table,
                                             int order,
                                             Map<String, CompiledRelationshipPath> tableRelationships) {
      CompiledRelationshipPath path = tableRelationships.get(policy.getRelationshipPath());
      if (path == null) {
         path = globalRelationships.get(policy.getRelationshipPath());
      }
      if (path == null) {
         Map<String, Object> details = new LinkedHashMap<>();
         details.put("policy", name);
         details.put("table", table);
         details.put("relationshipPath", policy.getRelationshipPath());
         throw new RlsSchemaException("ReBAC policy \"" + name + "\" references unknown relationship path \""
            + policy.getRelationshipPath() + "\"", details);
      }

      PolicyType type = policy.getPolicyType() != null ? policy.getPolicyType() : PolicyType.ALLOW;
      require(type == PolicyType.ALLOW || type == PolicyType.DENY,
         "ReBAC policy \"" + name + "\" must be allow or deny, got " + type.value(),
         Map.of("policy", name, "table", table));

      Set<Operation> operations = Operation.normalize(policy.getOperations(), type);
      require(!operations.isEmpty(), "ReBAC policy \"" + name + "\" needs at least one operation",
         Map.of("policy", name, "table", table));

      RelationshipCondition endCondition = policy.getEndCondition();
      require(endCondition != null, "ReBAC policy \"" + name + "\" needs an end condition",
         Map.of("policy", name, "table", table));
      if (endCondition instanceof RelationshipCondition.Literal literal) {
         SqlFragmentBuilder.validateConditions(literal.mapping(), "ReBAC policy " + name);
      }

      return new CompiledReBAcPolicy(name, type, operations, path, endCondition, policy.getPriority(), order);
   }

   private static void require(boolean condition, String message, Map<String, ?> details) {
      if (!condition) {
         throw new RlsSchemaException(message, details);
      }
   }
}
