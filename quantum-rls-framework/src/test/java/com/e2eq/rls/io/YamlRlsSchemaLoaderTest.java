package com.e2eq.rls.io;

import com.e2eq.rls.exceptions.RlsPolicyEvaluationException;
import com.e2eq.rls.exceptions.RlsSchemaException;
import com.e2eq.rls.model.context.AuthContext;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.context.RlsContextManager;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.RlsSchema;
import com.e2eq.rls.model.policy.TableRlsConfig;
import com.e2eq.rls.policy.AppliedFilter;
import com.e2eq.rls.policy.PolicyEvaluator;
import com.e2eq.rls.policy.PolicyRegistry;
import com.e2eq.rls.rebac.ReBAcTransformer;
import com.e2eq.rls.sql.PostgresDialect;
import com.e2eq.rls.sql.SelectQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class YamlRlsSchemaLoaderTest {

   private YamlRlsSchemaLoader loader;

   @BeforeEach
   void setUp() {
      loader = new YamlRlsSchemaLoader();
   }

   private static RlsContext user(String userId, String... roles) {
      return RlsContextManager.createContext(AuthContext.builder()
            .userId(userId)
            .tenantId("t1")
            .roles(List.of(roles))
            .organizationId("o1")
            .organizationId("o2")
            .build(),
         null, Map.of("region", "eu"));
   }

   @Test
   void testLoadFromClasspath() throws IOException {
      RlsSchema schema = loader.loadFromClasspath("rls-schema.yaml");

      assertEquals(List.of("posts", "org_documents", "products", "audit_log"), List.copyOf(schema.getTables().keySet()));
      assertEquals(1, schema.getRelationships().size());
      assertEquals("shop_org_membership", schema.getRelationships().get(0).getName());

      TableRlsConfig posts = schema.getTable("posts");
      assertEquals(5, posts.getPolicies().size());
      assertEquals(Set.of("admin"), posts.getSkipFor());
      assertFalse(posts.isDefaultDeny());
      assertTrue(schema.getTable("org_documents").isDefaultDeny());
      assertEquals(1, schema.getTable("products").getRebacPolicies().size());
   }

   @Test
   void testLoadFromLocation() throws IOException {
      RlsSchema schema = loader.loadFromLocation(YamlRlsSchemaLoader.CLASSPATH_PREFIX + "rls-schema.yaml");
      assertEquals(4, schema.getTables().size());

      assertThrows(IOException.class, () -> loader.loadFromLocation("/does/not/exist.yaml"));
      assertThrows(IOException.class, () -> loader.loadFromClasspath("missing.yaml"));
      assertThrows(IOException.class, () -> loader.load(Path.of("/does/not/exist.yaml")));
   }

   @Test
   void testEmptyInputsGiveEmptySchema() throws IOException {
      assertTrue(loader.loadFromString("").isEmpty());
      assertTrue(loader.load(new ByteArrayInputStream(new byte[0])).isEmpty());
   }

   @Test
   void testPlaceholdersResolvePerEvaluation() throws IOException {
      PolicyEvaluator evaluator = new PolicyEvaluator(new PolicyRegistry(loader.loadFromClasspath("rls-schema.yaml")));

      List<AppliedFilter> posts = evaluator.evaluateFilters("posts", user("u1"));
      assertEquals(1, posts.size());
      assertEquals("tenant_isolation", posts.get(0).policyName());
      assertEquals(Map.of("tenant_id", "t1"), posts.get(0).conditions());

      List<AppliedFilter> docs = evaluator.evaluateFilters("org_documents", user("u1"));
      assertEquals(List.of("o1", "o2"), docs.get(0).conditions().get("organization_id"));
   }

   @Test
   void testDeclarativeConditions() throws IOException {
      PolicyEvaluator staging = new PolicyEvaluator(new PolicyRegistry(loader.loadFromClasspath("rls-schema.yaml")),
         "staging", Set.of());
      PolicyEvaluator production = new PolicyEvaluator(new PolicyRegistry(loader.loadFromClasspath("rls-schema.yaml")),
         "production", Set.of());
      Map<String, Object> ownPost = Map.of("id", 1, "author_id", "u1");

      assertTrue(staging.evaluate("posts", Operation.UPDATE, user("u1"), ownPost, Map.of("title", "x")).allowed());
      assertFalse(staging.evaluate("posts", Operation.UPDATE, user("u2"), ownPost, Map.of("title", "x")).allowed());
      assertTrue(staging.evaluate("posts", Operation.DELETE, user("u1"), ownPost, null).allowed());
      assertFalse(production.evaluate("posts", Operation.DELETE, user("u1"), ownPost, null).allowed());

      assertTrue(staging.evaluate("posts", Operation.CREATE, user("u1"), null, Map.of("tenant_id", "t1")).allowed());
      assertEquals("tenant_on_create",
         staging.evaluate("posts", Operation.CREATE, user("u1"), null, Map.of("tenant_id", "t9")).policyName());

      assertTrue(staging.evaluate("org_documents", Operation.READ, user("u1", "member"), Map.of(), null).allowed());
      assertFalse(staging.evaluate("org_documents", Operation.READ, user("u1"), Map.of(), null).allowed());
      assertFalse(staging.evaluate("org_documents", Operation.DELETE, user("u1", "editor"), Map.of(), null).allowed());
      assertTrue(staging.evaluate("org_documents", Operation.UPDATE, user("u1", "editor"),
         Map.of("region", "eu"), null).allowed());
      assertFalse(staging.evaluate("org_documents", Operation.UPDATE, user("u1", "editor"),
         Map.of("region", "us"), null).allowed());

      assertFalse(staging.evaluate("audit_log", Operation.READ, user("u1"), Map.of(), null).allowed());
   }

   @Test
   void testFeatureScopedFilter() throws IOException {
      PolicyEvaluator evaluator = new PolicyEvaluator(new PolicyRegistry(loader.loadFromClasspath("rls-schema.yaml")),
         null, Set.of("drafts_hidden"));

      List<AppliedFilter> filters = evaluator.evaluateFilters("posts", user("u1"));
      assertEquals(2, filters.size());
      assertEquals(Map.of("draft", false), filters.get(1).conditions());
   }

   @Test
   void testRelationshipPolicyFromYaml() throws IOException {
      PolicyRegistry registry = new PolicyRegistry(loader.loadFromClasspath("rls-schema.yaml"));
      ReBAcTransformer transformer = new ReBAcTransformer(registry.getReBAcRegistry());

      SelectQuery query = RlsContextManager.run(user("u1"),
         () -> transformer.transform(SelectQuery.from(PostgresDialect.INSTANCE, "products"), "products"));

      assertEquals("SELECT * FROM \"products\" WHERE EXISTS (SELECT 1 FROM \"shops\""
         + " JOIN \"organizations\" ON \"shops\".\"organization_id\" = \"organizations\".\"id\""
         + " JOIN \"employees\" ON \"organizations\".\"id\" = \"employees\".\"organization_id\""
         + " WHERE \"shops\".\"id\" = \"products\".\"shop_id\""
         + " AND \"employees\".\"user_id\" = $1 AND \"employees\".\"status\" = $2)", query.getSql());
      assertEquals(List.of("u1", "active"), query.getParameters());
   }

   @Test
   void testEmbeddedPlaceholder() throws IOException {
      RlsSchema schema = loader.loadFromString(String.join("\n",
         "tables:",
         "  files:",
         "    policies:",
         "      - type: filter",
         "        operation: read",
         "        filter: { bucket: \"tenant-${tenantId}\" }"));
      PolicyEvaluator evaluator = new PolicyEvaluator(new PolicyRegistry(schema));

      assertEquals(Map.of("bucket", "tenant-t1"), evaluator.evaluateFilters("files", user("u1")).get(0).conditions());
   }

   @Test
   void testUnknownPlaceholderFailsEvaluation() throws IOException {
      RlsSchema schema = loader.loadFromString(String.join("\n",
         "tables:",
         "  files:",
         "    policies:",
         "      - name: broken",
         "        type: filter",
         "        operation: read",
         "        filter: { owner: \"${nobody}\" }"));
      PolicyEvaluator evaluator = new PolicyEvaluator(new PolicyRegistry(schema));

      RlsPolicyEvaluationException ex = assertThrows(RlsPolicyEvaluationException.class,
         () -> evaluator.evaluateFilters("files", user("u1")));
      assertEquals("broken", ex.getPolicyName());
   }

   @Test
   void testInvalidDocumentsRejected() {
      assertThrows(RlsSchemaException.class, () -> loader.loadFromString(String.join("\n",
         "tables:",
         "  posts:",
         "    policies:",
         "      - { type: grant, operation: read }")));
      assertThrows(RlsSchemaException.class, () -> loader.loadFromString(String.join("\n",
         "tables:",
         "  posts:",
         "    policies:",
         "      - { type: filter, operation: update, filter: { a: 1 } }")));
      assertThrows(RlsSchemaException.class, () -> loader.loadFromString(String.join("\n",
         "tables:",
         "  posts:",
         "    policies:",
         "      - { type: allow }")));
      assertThrows(RlsSchemaException.class, () -> loader.loadFromString(String.join("\n",
         "tables:",
         "  posts:",
         "    rebacPolicies:",
         "      - { relationshipPath: p, operation: read }")));
      assertThrows(IOException.class, () -> loader.loadFromString("tables: [unclosed"));
   }
}
