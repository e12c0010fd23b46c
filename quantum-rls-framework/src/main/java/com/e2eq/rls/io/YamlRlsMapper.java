package com.e2eq.rls.io;

import com.e2eq.rls.exceptions.RlsSchemaException;
import com.e2eq.rls.model.policy.FilterCondition;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.Policies;
import com.e2eq.rls.model.policy.PolicyCondition;
import com.e2eq.rls.model.policy.PolicyDefinition;
import com.e2eq.rls.model.policy.PolicyOptions;
import com.e2eq.rls.model.policy.PolicyType;
import com.e2eq.rls.model.policy.RlsSchema;
import com.e2eq.rls.model.policy.TableRlsConfig;
import com.e2eq.rls.model.rebac.JoinType;
import com.e2eq.rls.model.rebac.ReBAcPolicyDefinition;
import com.e2eq.rls.model.rebac.RelationshipCondition;
import com.e2eq.rls.model.rebac.RelationshipPath;
import com.e2eq.rls.model.rebac.RelationshipStep;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts the YAML representation of a schema into an {@link RlsSchema}. Declarative conditions are
 * turned into policy conditions here; placeholders are resolved per evaluation.
 */
public final class YamlRlsMapper {

   private YamlRlsMapper() {
   }

   public static RlsSchema toSchema(YamlRlsFile file) {
      RlsSchema schema = RlsSchema.create();
      if (file == null) {
         return schema;
      }
      if (file.relationships != null) {
         for (YamlRelationshipPath path : file.relationships) {
            schema.relationship(toPath(path));
         }
      }
      if (file.tables != null) {
         for (Map.Entry<String, YamlTable> e : file.tables.entrySet()) {
            schema.table(e.getKey(), toTable(e.getKey(), e.getValue()));
         }
      }
      return schema;
   }

   static TableRlsConfig toTable(String table, YamlTable yt) {
      TableRlsConfig.TableRlsConfigBuilder builder = TableRlsConfig.builder();
      if (yt == null) {
         return builder.build();
      }
      if (yt.policies != null) {
         for (YamlPolicy yp : yt.policies) {
            if (yp != null) {
               builder.policy(toPolicy(table, yp));
            }
         }
      }
      if (yt.skipFor != null) {
         builder.skipFor(yt.skipFor);
      }
      builder.defaultDeny(Boolean.TRUE.equals(yt.defaultDeny));
      if (yt.relationships != null) {
         for (YamlRelationshipPath path : yt.relationships) {
            builder.relationship(toPath(path));
         }
      }
      if (yt.rebacPolicies != null) {
         for (YamlReBAcPolicy rp : yt.rebacPolicies) {
            if (rp != null) {
               builder.rebacPolicy(toReBAcPolicy(table, rp));
            }
         }
      }
      return builder.build();
   }

   // --------------------
   // policies
   // --------------------

   static PolicyDefinition toPolicy(String table, YamlPolicy yp) {
      PolicyType type = parseType(table, yp);
      Set<Operation> operations = parseOperations(table, yp.name, yp.operations);
      PolicyOptions options = PolicyOptions.builder().name(yp.name).priority(yp.priority).build();

      PolicyDefinition policy = switch (type) {
         case FILTER -> Policies.filter(filterOperation(table, yp.name, operations), toFilterCondition(table, yp),
            options);
         case ALLOW -> Policies.allow(operations, toCondition(yp.roles, yp.match, false), options);
         case DENY -> Policies.deny(operations, toCondition(yp.roles, yp.match, false), options);
         case VALIDATE -> Policies.validate(validateOperation(operations), toCondition(yp.roles, yp.match, true),
            options);
      };

      if (yp.environments != null && !yp.environments.isEmpty()) {
         policy = Policies.whenEnvironment(yp.environments, policy);
      }
      if (StringUtils.isNotBlank(yp.feature)) {
         policy = Policies.whenFeature(yp.feature, policy);
      }
      return policy;
   }

   private static FilterCondition toFilterCondition(String table, YamlPolicy yp) {
      if (yp.filter == null || yp.filter.isEmpty()) {
         throw new RlsSchemaException("Filter policy on table \"" + table + "\" needs a 'filter' mapping",
            details(table, yp.name));
      }
      Map<String, Object> mapping = new LinkedHashMap<>(yp.filter);
      if (!ContextVariables.hasPlaceholders(mapping)) {
         return FilterCondition.literal(mapping);
      }
      return ctx -> ContextVariables.of(ctx).resolve(mapping);
   }

   /**
    * Roles are an any-of test on the caller. Match compares columns of the existing row, or of the
    * payload for validate policies; a list value matches any of its elements. No roles and no match
    * means the condition always holds.
    */
   static PolicyCondition toCondition(List<String> roles, Map<String, Object> match, boolean againstPayload) {
      Set<String> anyOf = roles == null ? Set.of() : Set.copyOf(roles);
      Map<String, Object> expected = match == null ? Map.of() : new LinkedHashMap<>(match);
      if (anyOf.isEmpty() && expected.isEmpty()) {
         return PolicyCondition.always();
      }
      return ctx -> {
         if (!anyOf.isEmpty() && (ctx.getAuth() == null || !ctx.getAuth().hasAnyRole(anyOf))) {
            return false;
         }
         if (expected.isEmpty()) {
            return true;
         }
         Map<String, Object> actual = againstPayload ? ctx.getData() : ctx.getRow();
         if (actual == null) {
            return false;
         }
         Map<String, Object> resolved = ContextVariables.of(ctx).resolve(expected);
         for (Map.Entry<String, Object> e : resolved.entrySet()) {
            if (!matches(actual.get(e.getKey()), e.getValue())) {
               return false;
            }
         }
         return true;
      };
   }

   private static boolean matches(Object actual, Object expected) {
      if (expected instanceof Collection<?> candidates) {
         for (Object candidate : candidates) {
            if (matches(actual, candidate)) {
               return true;
            }
         }
         return false;
      }
      if (Objects.equals(actual, expected)) {
         return true;
      }
      // numbers read from YAML and ids read from a row or context rarely share a type
      return actual != null && expected != null && actual.toString().equals(expected.toString());
   }

   // --------------------
   // relationships
   // --------------------

   static RelationshipPath toPath(YamlRelationshipPath yp) {
      if (yp == null) {
         throw new RlsSchemaException("Relationship path entry is empty");
      }
      RelationshipPath.RelationshipPathBuilder builder = RelationshipPath.builder()
         .name(yp.name)
         .description(yp.description);
      if (yp.steps != null) {
         for (YamlRelationshipPath.Step s : yp.steps) {
            if (s == null) {
               continue;
            }
            RelationshipStep.RelationshipStepBuilder step = RelationshipStep.builder()
               .from(s.from)
               .to(s.to)
               .fromColumn(s.fromColumn)
               .toColumn(s.toColumn)
               .alias(s.alias)
               .joinType(JoinType.fromValue(s.joinType));
            if (s.additionalConditions != null) {
               step.additionalConditions(s.additionalConditions);
            }
            builder.step(step.build());
         }
      }
      return builder.build();
   }

   static ReBAcPolicyDefinition toReBAcPolicy(String table, YamlReBAcPolicy rp) {
      PolicyType type = StringUtils.isBlank(rp.policyType)
         ? PolicyType.ALLOW
         : parseType(table, rp.name, rp.policyType);
      if (type != PolicyType.ALLOW && type != PolicyType.DENY) {
         throw new RlsSchemaException("ReBAC policy on table \"" + table + "\" must be allow or deny, got "
            + rp.policyType, details(table, rp.name));
      }
      if (rp.endCondition == null) {
         throw new RlsSchemaException("ReBAC policy on table \"" + table + "\" needs an endCondition",
            details(table, rp.name));
      }
      Map<String, Object> mapping = new LinkedHashMap<>(rp.endCondition);
      RelationshipCondition endCondition = ContextVariables.hasPlaceholders(mapping)
         ? ctx -> ContextVariables.of(ctx).resolve(mapping)
         : RelationshipCondition.literal(mapping);

      int defaultPriority = type == PolicyType.DENY ? Policies.DEFAULT_DENY_PRIORITY : 0;
      return ReBAcPolicyDefinition.builder()
         .name(rp.name)
         .policyType(type)
         .operations(parseOperations(table, rp.name, rp.operations))
         .relationshipPath(rp.relationshipPath)
         .endCondition(endCondition)
         .priority(rp.priority != null ? rp.priority : defaultPriority)
         .build();
   }

   // --------------------
   // parsing helpers
   // --------------------

   private static PolicyType parseType(String table, YamlPolicy yp) {
      if (StringUtils.isBlank(yp.type)) {
         throw new RlsSchemaException("Policy on table \"" + table + "\" has no type", details(table, yp.name));
      }
      return parseType(table, yp.name, yp.type);
   }

   private static PolicyType parseType(String table, String name, String value) {
      try {
         return PolicyType.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
         Map<String, Object> details = details(table, name);
         details.put("type", value);
         throw new RlsSchemaException("Unknown policy type '" + value + "' on table \"" + table + "\"", details, e);
      }
   }

   private static Set<Operation> parseOperations(String table, String name, List<String> values) {
      if (values == null || values.isEmpty()) {
         throw new RlsSchemaException("Policy on table \"" + table + "\" declares no operation", details(table, name));
      }
      Set<Operation> operations = EnumSet.noneOf(Operation.class);
      for (String value : values) {
         operations.add(Operation.fromValue(value));
      }
      return operations;
   }

   private static Operation filterOperation(String table, String name, Set<Operation> operations) {
      for (Operation op : operations) {
         if (op != Operation.READ && op != Operation.ALL) {
            throw new RlsSchemaException("Filter policies only support read or all, got " + op.value(),
               details(table, name));
         }
      }
      return Operation.READ;
   }

   private static Operation validateOperation(Set<Operation> operations) {
      if (operations.contains(Operation.ALL)
         || operations.containsAll(EnumSet.of(Operation.CREATE, Operation.UPDATE))) {
         return Operation.ALL;
      }
      if (operations.size() == 1) {
         return operations.iterator().next();
      }
      // mixed sets such as create + delete; the builder rejects the first unsupported one
      for (Operation op : operations) {
         if (op != Operation.CREATE && op != Operation.UPDATE) {
            return op;
         }
      }
      return operations.iterator().next();
   }

   private static Map<String, Object> details(String table, String name) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("table", table);
      if (name != null) {
         details.put("policy", name);
      }
      return details;
   }
}
