package com.e2eq.rls.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Map;

/**
 * Builds an {@link RlsConfig} outside of a container: system properties, environment variables and
 * {@code META-INF/microprofile-config.properties}, with optional overrides on top.
 */
public final class RlsConfigLoader {
   private static final String OVERRIDES_SOURCE = "rls-overrides";
   private static final int OVERRIDES_ORDINAL = 500;

   private RlsConfigLoader() {}

   public static RlsConfig load() {
      return load(Map.of());
   }

   public static RlsConfig load(Map<String, String> overrides) {
      SmallRyeConfig config = new SmallRyeConfigBuilder()
         .addDefaultSources()
         .withSources(new PropertiesConfigSource(overrides, OVERRIDES_SOURCE, OVERRIDES_ORDINAL))
         .withMapping(RlsConfig.class)
         .build();
      return config.getConfigMapping(RlsConfig.class);
   }
}
