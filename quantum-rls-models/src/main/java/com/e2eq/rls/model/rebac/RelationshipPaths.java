package com.e2eq.rls.model.rebac;

/**
 * Common relationship paths. Each one only fills in a step list.
 */
public final class RelationshipPaths {
   private RelationshipPaths() {}

   /** resource -&gt; organizations -&gt; employees, named {@code {resource}_org_membership}. */
   public static RelationshipPath orgMembershipPath(String resourceTable) {
      return orgMembershipPath(resourceTable, "organization_id");
   }

   public static RelationshipPath orgMembershipPath(String resourceTable, String organizationColumn) {
      return RelationshipPath.builder()
         .name(resourceTable + "_org_membership")
         .description("Access " + resourceTable + " through organization membership")
         .step(RelationshipStep.of(resourceTable, "organizations", organizationColumn, "id"))
         .step(RelationshipStep.of("organizations", "employees", "id", "organization_id"))
         .build();
   }

   /** resource -&gt; shops -&gt; organizations -&gt; employees, named {@code {resource}_shop_org_membership}. */
   public static RelationshipPath shopOrgMembershipPath(String resourceTable) {
      return shopOrgMembershipPath(resourceTable, "shop_id");
   }

   public static RelationshipPath shopOrgMembershipPath(String resourceTable, String shopColumn) {
      return RelationshipPath.builder()
         .name(resourceTable + "_shop_org_membership")
         .description("Access " + resourceTable + " through shop's organization membership")
         .step(RelationshipStep.of(resourceTable, "shops", shopColumn, "id"))
         .step(RelationshipStep.of("shops", "organizations", "organization_id", "id"))
         .step(RelationshipStep.of("organizations", "employees", "id", "organization_id"))
         .build();
   }

   /** resource -&gt; teams -&gt; team_members, named {@code {resource}_team_access}. */
   public static RelationshipPath teamHierarchyPath(String resourceTable) {
      return teamHierarchyPath(resourceTable, "team_id");
   }

   public static RelationshipPath teamHierarchyPath(String resourceTable, String teamColumn) {
      return RelationshipPath.builder()
         .name(resourceTable + "_team_access")
         .description("Access " + resourceTable + " through team membership")
         .step(RelationshipStep.of(resourceTable, "teams", teamColumn, "id"))
         .step(RelationshipStep.of("teams", "team_members", "id", "team_id"))
         .build();
   }
}
