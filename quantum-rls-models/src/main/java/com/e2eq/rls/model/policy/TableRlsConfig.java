package com.e2eq.rls.model.policy;

import com.e2eq.rls.model.rebac.ReBAcPolicyDefinition;
import com.e2eq.rls.model.rebac.RelationshipPath;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Row level security configuration of one table.
 *
 * {@code skipFor} lists roles that bypass every policy of this table. With {@code defaultDeny} set, an
 * operation that no allow policy grants is denied; left false, the table is open unless a deny or
 * validate policy rejects the operation.
 */
@Value
@Builder(toBuilder = true)
public class TableRlsConfig {
   @Singular
   List<PolicyDefinition> policies;
   @Singular("skipForRole")
   Set<String> skipFor;
   boolean defaultDeny;
   @Singular
   List<RelationshipPath> relationships;
   @Singular
   List<ReBAcPolicyDefinition> rebacPolicies;

   public boolean hasReBAc() {
      return !relationships.isEmpty() || !rebacPolicies.isEmpty();
   }
}
