package com.e2eq.rls.rebac;

import com.e2eq.rls.exceptions.RlsSchemaException;
import com.e2eq.rls.model.policy.Operation;
import com.e2eq.rls.model.policy.PolicyType;
import com.e2eq.rls.model.rebac.CompiledReBAcPolicy;
import com.e2eq.rls.model.rebac.CompiledRelationshipPath;
import com.e2eq.rls.model.rebac.CompiledRelationshipStep;
import com.e2eq.rls.model.rebac.JoinType;
import com.e2eq.rls.model.rebac.ReBAcPolicies;
import com.e2eq.rls.model.rebac.ReBAcPolicyDefinition;
import com.e2eq.rls.model.rebac.RelationshipCondition;
import com.e2eq.rls.model.rebac.RelationshipPath;
import com.e2eq.rls.model.rebac.RelationshipPaths;
import com.e2eq.rls.model.rebac.RelationshipStep;
import com.e2eq.rls.model.rebac.TableReBAcConfig;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReBAcRegistryTest {

   @Test
   void testStepDefaults() {
      ReBAcRegistry registry = new ReBAcRegistry();
      registry.registerRelationship(RelationshipPath.builder()
         .name("project_org")
         .step(RelationshipStep.builder().from("projects").to("organizations").build())
         .build());

      CompiledRelationshipPath path = registry.getRelationship("project_org").orElseThrow();
      CompiledRelationshipStep step = path.firstStep();
      assertEquals("organizations_id", step.fromColumn());
      assertEquals("id", step.toColumn());
      assertEquals("organizations", step.alias());
      assertEquals(JoinType.INNER, step.joinType());
      assertEquals(Map.of(), step.additionalConditions());
      assertEquals("projects", path.sourceTable());
      assertEquals("organizations", path.targetTable());
   }

   @Test
   void testEmptyPathIsRejected() {
      ReBAcRegistry registry = new ReBAcRegistry();
      RlsSchemaException ex = assertThrows(RlsSchemaException.class,
         () -> registry.compileRelationshipPath(RelationshipPath.builder().name("empty").build(), "posts"));
      assertTrue(ex.getMessage().contains("at least one step"));
   }

   @Test
   void testBrokenChainIsRejected() {
      RelationshipPath broken = RelationshipPath.builder()
         .name("broken")
         .step(RelationshipStep.of("products", "shops", "shop_id", "id"))
         .step(RelationshipStep.of("organizations", "employees", "id", "organization_id"))
         .build();
      RlsSchemaException ex = assertThrows(RlsSchemaException.class,
         () -> new ReBAcRegistry().registerRelationship(broken));
      assertTrue(ex.getMessage().contains("broken chain at step 1"), ex.getMessage());
      assertEquals("broken", ex.getDetails().get("path"));
   }

   @Test
   void testChainMayContinueFromAlias() {
      RelationshipPath aliased = RelationshipPath.builder()
         .name("aliased")
         .step(RelationshipStep.builder().from("tasks").to("teams").alias("t").fromColumn("team_id").build())
         .step(RelationshipStep.builder().from("t").to("team_members").fromColumn("id").toColumn("team_id").build())
         .build();
      assertDoesNotThrow(() -> new ReBAcRegistry().registerRelationship(aliased));
   }

   @Test
   void testUnknownPathIsRejected() {
      ReBAcRegistry registry = new ReBAcRegistry();
      TableReBAcConfig config = TableReBAcConfig.builder()
         .policy(ReBAcPolicies.allowRelation(Operation.READ, "nowhere", Map.of("user_id", "1")))
         .build();
      RlsSchemaException ex = assertThrows(RlsSchemaException.class, () -> registry.registerTable("posts", config));
      assertEquals("nowhere", ex.getDetails().get("relationshipPath"));
      assertFalse(registry.hasTable("posts"));
   }

   @Test
   void testPoliciesAreOrderedAndNamed() {
      ReBAcRegistry registry = new ReBAcRegistry();
      registry.registerTable("products", TableReBAcConfig.builder()
         .relationship(RelationshipPaths.shopOrgMembershipPath("products"))
         .policy(ReBAcPolicies.allowRelation(Operation.READ, "products_shop_org_membership", Map.of("user_id", "1")))
         .policy(ReBAcPolicies.denyRelation(Operation.READ, "products_shop_org_membership", Map.of("is_banned", true)))
         .policy(ReBAcPolicies.allowRelation(EnumSet.of(Operation.UPDATE), "products_shop_org_membership",
            RelationshipCondition.literal(Map.of("role", "owner")), "owners", 5))
         .build());

      List<CompiledReBAcPolicy> reads = registry.getPolicies("products", Operation.READ);
      assertEquals(2, reads.size());
      assertEquals(PolicyType.DENY, reads.get(0).type());
      assertTrue(reads.get(0).isNegated());
      assertEquals("products_rebac_policy_1", reads.get(0).name());
      assertEquals("products_rebac_policy_0", reads.get(1).name());

      assertEquals(List.of("owners"), registry.getPolicies("products", Operation.UPDATE).stream()
         .map(CompiledReBAcPolicy::name).toList());
      assertEquals(3, registry.getPolicies("products", Operation.ALL).size());
      assertTrue(registry.getPolicies("unknown", Operation.READ).isEmpty());
   }

   @Test
   void testTablePathIsPublishedGlobally() {
      ReBAcRegistry registry = new ReBAcRegistry();
      registry.registerTable("products", TableReBAcConfig.builder()
         .relationship(RelationshipPaths.shopOrgMembershipPath("products"))
         .build());
      assertTrue(registry.getRelationship("products_shop_org_membership").isPresent());
      assertEquals("products", registry.getRelationship("products_shop_org_membership", "products")
         .orElseThrow().sourceTable());
   }

   @Test
   void testDuplicateTableIsRejected() {
      ReBAcRegistry registry = new ReBAcRegistry();
      registry.registerTable("posts", TableReBAcConfig.builder().build());
      assertThrows(RlsSchemaException.class, () -> registry.registerTable("posts", TableReBAcConfig.builder().build()));
   }

   @Test
   void testFilterTypeIsRejected() {
      ReBAcRegistry registry = new ReBAcRegistry();
      registry.registerRelationship(RelationshipPaths.orgMembershipPath("projects"));
      ReBAcPolicyDefinition filter = ReBAcPolicyDefinition.builder()
         .operations(EnumSet.of(Operation.READ))
         .relationshipPath("projects_org_membership")
         .endCondition(RelationshipCondition.literal(Map.of("user_id", "1")))
         .policyType(PolicyType.FILTER)
         .build();
      assertThrows(RlsSchemaException.class,
         () -> registry.registerTable("projects", TableReBAcConfig.builder().policy(filter).build()));
   }

   @Test
   void testUnsupportedAdditionalConditionIsRejected() {
      RelationshipPath path = RelationshipPath.builder()
         .name("odd")
         .step(RelationshipStep.builder().from("a").to("b").additionalCondition("meta", Map.of("x", 1)).build())
         .build();
      assertThrows(RlsSchemaException.class, () -> new ReBAcRegistry().registerRelationship(path));
   }
}
