package com.e2eq.rls.config;

import com.e2eq.rls.exceptions.RlsPolicyViolation;
import com.e2eq.rls.sql.PostgresDialect;
import com.e2eq.rls.sql.SqlDialect;
import com.e2eq.rls.sql.SqlDialects;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Programmatic form of {@link RlsConfig}, plus the callbacks that can not come from properties.
 */
@Value
@Builder(toBuilder = true)
public class RlsOptions {
   @Builder.Default
   boolean requireContext = true;
   boolean allowUnfilteredQueries;
   boolean auditDecisions;
   @Builder.Default
   String primaryKeyColumn = "id";
   @Builder.Default
   SqlDialect dialect = PostgresDialect.INSTANCE;
   @Singular
   Set<String> excludeTables;
   @Singular
   Set<String> bypassRoles;
   String environment;
   @Singular
   Set<String> features;
   Consumer<RlsPolicyViolation> onViolation;

   public static RlsOptions defaults() {
      return RlsOptions.builder().build();
   }

   /**
    * @throws com.e2eq.rls.exceptions.RlsSchemaException if the configured dialect is not supported
    */
   public static RlsOptions from(RlsConfig config) {
      return RlsOptions.builder()
         .requireContext(config.requireContext())
         .allowUnfilteredQueries(config.allowUnfilteredQueries())
         .auditDecisions(config.auditDecisions())
         .primaryKeyColumn(config.primaryKeyColumn())
         .dialect(SqlDialects.forName(config.dialect()))
         .excludeTables(config.excludeTables().orElse(List.of()))
         .bypassRoles(config.bypassRoles().orElse(List.of()))
         .environment(config.environment().orElse(null))
         .features(config.features().orElse(List.of()))
         .build();
   }

   public boolean isExcluded(String table) {
      return excludeTables.contains(table);
   }
}
