package com.e2eq.rls.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Maps the {@code quantum.rls.*} properties.
 */
@ConfigMapping(prefix = "quantum.rls")
public interface RlsConfig {
   /**
    * Fail queries that run without an RLS context.
    * @return true unless explicitly disabled
    */
   @WithDefault("true")
   boolean requireContext();

   /**
    * Let queries without context through unfiltered. Only consulted when requireContext is false.
    * @return the flag
    */
   @WithDefault("false")
   boolean allowUnfilteredQueries();

   /**
    * Log every allow / deny decision of the enforcer.
    * @return the flag
    */
   @WithDefault("false")
   boolean auditDecisions();

   /**
    * Column used to fetch the existing row before update and delete checks.
    * @return the column name
    */
   @WithDefault("id")
   String primaryKeyColumn();

   /**
    * One of postgres, mysql, sqlite.
    * @return the dialect name
    */
   @WithDefault("postgres")
   String dialect();

   Optional<List<String>> excludeTables();

   Optional<List<String>> bypassRoles();

   /**
    * Deployment environment seen by environment scoped policies.
    * @return the environment
    */
   Optional<String> environment();

   Optional<List<String>> features();

   /**
    * YAML schema, as a file path or a {@code classpath:} resource.
    * @return the location
    */
   Optional<String> schemaLocation();
}
