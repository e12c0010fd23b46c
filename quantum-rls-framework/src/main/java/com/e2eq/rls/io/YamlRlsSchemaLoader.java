package com.e2eq.rls.io;

import com.e2eq.rls.model.policy.RlsSchema;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads an {@link RlsSchema} from YAML.
 * <pre>
 * relationships:
 *   - name: shop_org_membership
 *     steps:
 *       - { from: products, to: shops, fromColumn: shop_id }
 *       - { from: shops, to: organizations, fromColumn: organization_id }
 *       - { from: organizations, to: employees, fromColumn: id, toColumn: organization_id }
 * tables:
 *   posts:
 *     defaultDeny: true
 *     skipFor: [admin]
 *     policies:
 *       - { type: filter, operation: read, filter: { tenant_id: "${tenantId}" } }
 *       - { type: allow, operations: [update, delete], match: { author_id: "${userId}" } }
 *   products:
 *     rebacPolicies:
 *       - relationshipPath: shop_org_membership
 *         operation: read
 *         endCondition: { user_id: "${userId}", status: active }
 * </pre>
 */
public final class YamlRlsSchemaLoader {
   private static final Logger LOG = Logger.getLogger(YamlRlsSchemaLoader.class);
   public static final String CLASSPATH_PREFIX = "classpath:";

   private final ObjectMapper mapper;

   public YamlRlsSchemaLoader() {
      this.mapper = new ObjectMapper(new YAMLFactory())
         .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
   }

   public RlsSchema load(Path yamlPath) throws IOException {
      if (yamlPath == null || !Files.exists(yamlPath)) {
         throw new IOException("RLS schema file not found: " + yamlPath);
      }
      try (InputStream is = Files.newInputStream(yamlPath)) {
         return load(is);
      }
   }

   public RlsSchema load(InputStream yamlStream) throws IOException {
      if (yamlStream == null) {
         return RlsSchema.create();
      }
      byte[] data = yamlStream.readAllBytes();
      if (data.length == 0) {
         return RlsSchema.create();
      }
      YamlRlsFile file = mapper.readValue(data, YamlRlsFile.class);
      RlsSchema schema = YamlRlsMapper.toSchema(file);
      LOG.debugf("[RLS] Parsed schema: %d tables, %d global relationships", schema.getTables().size(),
         schema.getRelationships().size());
      return schema;
   }

   public RlsSchema loadFromString(String yaml) throws IOException {
      if (yaml == null || yaml.isBlank()) {
         return RlsSchema.create();
      }
      return YamlRlsMapper.toSchema(mapper.readValue(yaml, YamlRlsFile.class));
   }

   public RlsSchema loadFromClasspath(String resourcePath) throws IOException {
      String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
      ClassLoader cl = Thread.currentThread().getContextClassLoader();
      if (cl == null) {
         cl = YamlRlsSchemaLoader.class.getClassLoader();
      }
      try (InputStream in = cl.getResourceAsStream(path)) {
         if (in == null) {
            throw new IOException("Resource not found: " + resourcePath);
         }
         return load(in);
      }
   }

   /**
    * Accepts {@code classpath:some/schema.yaml} or a file system path.
    */
   public RlsSchema loadFromLocation(String location) throws IOException {
      if (location.startsWith(CLASSPATH_PREFIX)) {
         return loadFromClasspath(location.substring(CLASSPATH_PREFIX.length()));
      }
      return load(Path.of(location));
   }
}
