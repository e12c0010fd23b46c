package com.e2eq.rls.enforcement;

import com.e2eq.rls.config.RlsConfigLoader;
import com.e2eq.rls.config.RlsOptions;
import com.e2eq.rls.exceptions.RlsContextException;
import com.e2eq.rls.exceptions.RlsPolicyViolation;
import com.e2eq.rls.exceptions.RlsSchemaException;
import com.e2eq.rls.model.context.AuthContext;
import com.e2eq.rls.model.context.RlsContext;
import com.e2eq.rls.model.context.RlsContextManager;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.Policies;
import com.e2eq.rls.model.policy.PolicyOptions;
import com.e2eq.rls.model.policy.RlsSchema;
import com.e2eq.rls.model.policy.TableRlsConfig;
import com.e2eq.rls.model.rebac.ReBAcPolicies;
import com.e2eq.rls.model.rebac.RelationshipPaths;
import com.e2eq.rls.sql.PostgresDialect;
import com.e2eq.rls.sql.SelectQuery;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RlsEnforcerTest {
   private static final PostgresDialect PG = PostgresDialect.INSTANCE;

   private static RlsSchema schema() {
      return RlsSchema.create()
         .table("posts", TableRlsConfig.builder()
            .policy(Policies.filter(Operation.READ, ctx -> Map.of("tenant_id", ctx.getAuth().getTenantId()),
               PolicyOptions.named("tenant_isolation")))
            .policy(Policies.validate(Operation.CREATE,
               ctx -> ctx.getAuth().getTenantId().equals(ctx.dataValue("tenant_id")),
               PolicyOptions.named("tenant_on_create")))
            .policy(Policies.allow(Set.of(Operation.UPDATE, Operation.DELETE),
               ctx -> ctx.getAuth().getUserId().equals(ctx.rowValue("author_id")),
               PolicyOptions.named("author_writes")))
            .skipForRole("moderator")
            .relationship(RelationshipPaths.orgMembershipPath("posts"))
            .rebacPolicy(ReBAcPolicies.allowRelation(Operation.READ, "posts_org_membership",
               ctx -> Map.of("user_id", ctx.getAuth().getUserId())))
            .build())
         .table("audit_log", TableRlsConfig.builder()
            .policy(Policies.deny(Operation.ALL))
            .build());
   }

   private static RlsContext user(String userId, String... roles) {
      return RlsContextManager.createContext(AuthContext.builder()
         .userId(userId)
         .tenantId("t1")
         .roles(List.of(roles))
         .build());
   }

   private static RlsEnforcer enforcer(RlsOptions options) {
      return new RlsEnforcer(schema(), options);
   }

   // --------------------
   // reads
   // --------------------

   @Test
   void testSelectGetsFilterThenRelationship() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());

      SelectQuery query = RlsContextManager.run(user("u1"),
         () -> enforcer.interceptQuery(SelectQuery.from(PG, "posts"), QueryContext.select("posts")));

      assertEquals("SELECT * FROM \"posts\" WHERE \"posts\".\"tenant_id\" = $1"
         + " AND EXISTS (SELECT 1 FROM \"organizations\""
         + " JOIN \"employees\" ON \"organizations\".\"id\" = \"employees\".\"organization_id\""
         + " WHERE \"organizations\".\"id\" = \"posts\".\"organization_id\""
         + " AND \"employees\".\"user_id\" = $2)", query.getSql());
      assertEquals(List.of("t1", "u1"), query.getParameters());
   }

   @Test
   void testSelectUsesAlias() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());

      SelectQuery query = RlsContextManager.run(user("u1"),
         () -> enforcer.interceptQuery(SelectQuery.from(PG, "posts", "p"), QueryContext.select("posts", "p")));

      assertTrue(query.getSql().startsWith("SELECT * FROM \"posts\" AS \"p\" WHERE \"p\".\"tenant_id\" = $1"));
      assertTrue(query.getSql().contains("\"organizations\".\"id\" = \"p\".\"organization_id\""));
   }

   @Test
   void testExcludedTablesAndSkipFlagPassThrough() {
      RlsEnforcer enforcer = enforcer(RlsOptions.builder().excludeTable("audit_log").build());
      SelectQuery audit = SelectQuery.from(PG, "audit_log");
      SelectQuery posts = SelectQuery.from(PG, "posts");
      QueryContext skipped = QueryContext.select("posts");
      skipped.getMetadata().put(QueryContext.SKIP_RLS, true);

      assertSame(audit, enforcer.interceptQuery(audit, QueryContext.select("audit_log")));
      assertSame(posts, enforcer.interceptQuery(posts, skipped));
   }

   @Test
   void testMissingContextFailsByDefault() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());
      assertThrows(RlsContextException.class,
         () -> enforcer.interceptQuery(SelectQuery.from(PG, "posts"), QueryContext.select("posts")));
   }

   @Test
   void testMissingContextClosesReads() {
      RlsEnforcer enforcer = enforcer(RlsOptions.builder().requireContext(false).build());
      SelectQuery base = SelectQuery.from(PG, "posts");

      SelectQuery closed = enforcer.interceptQuery(base, QueryContext.select("posts"));
      assertEquals("SELECT * FROM \"posts\" WHERE FALSE", closed.getSql());
      assertSame(base, enforcer.interceptQuery(base, QueryContext.mutation(QueryContext.Kind.DELETE, "posts")));
   }

   @Test
   void testMissingContextUnfilteredWhenAllowed() {
      RlsEnforcer enforcer = enforcer(RlsOptions.builder()
         .requireContext(false)
         .allowUnfilteredQueries(true)
         .build());
      SelectQuery base = SelectQuery.from(PG, "posts");

      assertSame(base, enforcer.interceptQuery(base, QueryContext.select("posts")));
   }

   @Test
   void testBypassingContexts() {
      RlsEnforcer enforcer = enforcer(RlsOptions.builder().bypassRole("superuser").build());
      SelectQuery base = SelectQuery.from(PG, "posts");

      assertSame(base, RlsContextManager.run(user("u1", "superuser"),
         () -> enforcer.interceptQuery(base, QueryContext.select("posts"))));
      assertSame(base, RlsContextManager.run(user("u1", "moderator"),
         () -> enforcer.interceptQuery(base, QueryContext.select("posts"))));
      assertSame(base, RlsContextManager.run(RlsContextManager.systemContext("job", "t1"),
         () -> enforcer.interceptQuery(base, QueryContext.select("posts"))));
   }

   @Test
   void testMutationsAreFlagged() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());
      SelectQuery base = SelectQuery.from(PG, "posts");
      QueryContext update = QueryContext.mutation(QueryContext.Kind.UPDATE, "posts");

      assertSame(base, RlsContextManager.run(user("u1"), () -> enforcer.interceptQuery(base, update)));
      assertEquals(Boolean.TRUE, update.getMetadata().get(QueryContext.RLS_REQUIRED));
      assertEquals("posts", update.getMetadata().get(QueryContext.RLS_TABLE));
   }

   // --------------------
   // writes
   // --------------------

   @Test
   void testGuardedCreate() {
      List<RlsPolicyViolation> violations = new ArrayList<>();
      RlsEnforcer enforcer = enforcer(RlsOptions.builder().onViolation(violations::add).auditDecisions(true).build());
      InMemoryRowStore store = new InMemoryRowStore("posts");
      RowStore guarded = enforcer.guard(store);

      RlsContextManager.run(user("u1"), () -> {
         guarded.create(Map.of("id", 1, "tenant_id", "t1", "author_id", "u1"));
         RlsPolicyViolation ex = assertThrows(RlsPolicyViolation.class,
            () -> guarded.create(Map.of("id", 2, "tenant_id", "t2", "author_id", "u1")));
         assertEquals("tenant_on_create", ex.getPolicyName());
      });

      assertEquals(1, store.rows.size());
      assertEquals(1, violations.size());
      assertEquals("posts", violations.get(0).getTable());
   }

   @Test
   void testGuardedUpdateAndDelete() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());
      InMemoryRowStore store = new InMemoryRowStore("posts");
      store.rows.put(1, new LinkedHashMap<>(Map.of("id", 1, "tenant_id", "t1", "author_id", "u1")));
      RowStore guarded = enforcer.guard(store);

      RlsContextManager.run(user("u2"), () -> {
         assertThrows(RlsPolicyViolation.class, () -> guarded.update(1, Map.of("title", "mine now")));
         assertThrows(RlsPolicyViolation.class, () -> guarded.delete(1));
         // missing rows are reported by the store itself
         assertFalse(guarded.delete(42));
      });
      assertFalse(store.rows.get(1).containsKey("title"));

      RlsContextManager.run(user("u1"), () -> {
         assertEquals("edited", guarded.update(1, Map.of("title", "edited")).get("title"));
         assertTrue(guarded.delete(1));
      });
      assertTrue(store.rows.isEmpty());
   }

   @Test
   void testGuardSkipsBypassedContexts() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());
      InMemoryRowStore store = new InMemoryRowStore("posts");
      store.rows.put(1, new LinkedHashMap<>(Map.of("id", 1, "tenant_id", "t1", "author_id", "u1")));
      RowStore guarded = enforcer.guard(store);

      RlsContextManager.run(user("u2"), () -> assertTrue(enforcer.withoutRls(() -> guarded.delete(1))));
      assertTrue(store.rows.isEmpty());
   }

   @Test
   void testGuardReturnsStoreForUnprotectedTables() {
      RlsEnforcer enforcer = enforcer(RlsOptions.builder().excludeTable("audit_log").build());
      InMemoryRowStore audit = new InMemoryRowStore("audit_log");
      InMemoryRowStore sessions = new InMemoryRowStore("sessions");

      assertSame(audit, enforcer.guard(audit));
      assertSame(sessions, enforcer.guard(sessions));
      assertInstanceOf(GuardedRowStore.class, enforcer.guard(new InMemoryRowStore("posts")));
   }

   @Test
   void testCustomPrimaryKeyColumn() {
      RlsEnforcer enforcer = enforcer(RlsOptions.builder().primaryKeyColumn("uuid").build());
      InMemoryRowStore store = new InMemoryRowStore("posts", "uuid");
      store.rows.put("a-1", new LinkedHashMap<>(Map.of("uuid", "a-1", "tenant_id", "t1", "author_id", "u1")));
      RowStore guarded = enforcer.guard(store);

      RlsContextManager.run(user("u2"), () -> assertThrows(RlsPolicyViolation.class, () -> guarded.delete("a-1")));
      assertEquals(1, store.rows.size());
   }

   // --------------------
   // helpers
   // --------------------

   @Test
   void testCanAccess() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());
      Map<String, Object> row = Map.of("id", 1, "tenant_id", "t1", "author_id", "u1");

      assertFalse(enforcer.canAccess("posts", Operation.READ, row));
      RlsContextManager.run(user("u1"), () -> {
         assertTrue(enforcer.canAccess("posts", Operation.READ, row));
         assertTrue(enforcer.canAccess("posts", Operation.UPDATE, row));
         assertTrue(enforcer.canAccess("posts", Operation.CREATE, row));
         assertFalse(enforcer.canAccess("posts", Operation.CREATE, Map.of("tenant_id", "t2")));
         assertFalse(enforcer.canAccess("audit_log", Operation.READ, Map.of()));
      });
      RlsContextManager.run(user("u2"), () -> {
         assertFalse(enforcer.canAccess("posts", Operation.DELETE, row));
         assertTrue(enforcer.withoutRls(() -> enforcer.canAccess("posts", Operation.DELETE, row)));
      });
   }

   @Test
   void testWithoutRlsNeedsContext() {
      RlsEnforcer enforcer = new RlsEnforcer(schema());
      assertThrows(RlsContextException.class, () -> enforcer.withoutRls(() -> "never"));
   }

   @Test
   void testFromConfig() {
      RlsEnforcer enforcer = RlsEnforcer.fromConfig(RlsConfigLoader.load(Map.of(
         "quantum.rls.schema-location", "classpath:rls-schema.yaml",
         "quantum.rls.exclude-tables", "audit_log")));

      assertTrue(enforcer.getRegistry().hasTable("posts"));
      assertTrue(enforcer.getOptions().isExcluded("audit_log"));

      assertThrows(RlsSchemaException.class, () -> RlsEnforcer.fromConfig(RlsConfigLoader.load()));
      assertThrows(RlsSchemaException.class, () -> RlsEnforcer.fromConfig(RlsConfigLoader.load(
         Map.of("quantum.rls.schema-location", "classpath:missing.yaml"))));
   }

   static class InMemoryRowStore implements RowStore {
      final Map<Object, Map<String, Object>> rows = new LinkedHashMap<>();
      private final String table;
      private final String keyColumn;

      InMemoryRowStore(String table) {
         this(table, "id");
      }

      InMemoryRowStore(String table, String keyColumn) {
         this.table = table;
         this.keyColumn = keyColumn;
      }

      @Override
      public String getTableName() {
         return table;
      }

      @Override
      public Map<String, Object> create(Map<String, Object> data) {
         Map<String, Object> row = new LinkedHashMap<>(data);
         rows.put(row.get(keyColumn), row);
         return row;
      }

      @Override
      public Optional<Map<String, Object>> findBy(String column, Object value) {
         return rows.values().stream()
            .filter(r -> value.equals(r.get(column)))
            .findFirst();
      }

      @Override
      public Map<String, Object> update(Object id, Map<String, Object> data) {
         Map<String, Object> row = rows.get(id);
         if (row == null) {
            throw new IllegalStateException("No row " + id + " in " + table);
         }
         row.putAll(data);
         return row;
      }

      @Override
      public boolean delete(Object id) {
         return rows.remove(id) != null;
      }
   }
}
