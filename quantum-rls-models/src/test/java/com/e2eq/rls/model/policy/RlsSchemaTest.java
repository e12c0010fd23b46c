package com.e2eq.rls.model.policy;

import com.e2eq.rls.model.rebac.RelationshipPaths;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RlsSchemaTest {

   @Test
   void testMergeCombinesTables() {
      RlsSchema base = RlsSchema.create()
         .table("posts", TableRlsConfig.builder()
            .policy(Policies.allow(Operation.READ, ctx -> true))
            .skipForRole("admin")
            .build());
      RlsSchema extra = RlsSchema.create()
         .relationship(RelationshipPaths.orgMembershipPath("projects"))
         .table("posts", TableRlsConfig.builder()
            .policy(Policies.deny(Operation.DELETE))
            .skipForRole("auditor")
            .defaultDeny(true)
            .build())
         .table("comments", TableRlsConfig.builder().build());

      RlsSchema merged = RlsSchema.merge(base, null, extra);

      TableRlsConfig posts = merged.getTable("posts");
      assertEquals(2, posts.getPolicies().size());
      assertEquals(PolicyType.ALLOW, posts.getPolicies().get(0).type());
      assertEquals(PolicyType.DENY, posts.getPolicies().get(1).type());
      assertEquals(Set.of("admin", "auditor"), posts.getSkipFor());
      assertTrue(posts.isDefaultDeny());
      assertNotNull(merged.getTable("comments"));
      assertEquals(1, merged.getRelationships().size());
   }
}
