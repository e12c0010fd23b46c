package com.e2eq.rls.model.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Ambient, immutable security context for one logical operation. Installed with
 * {@link RlsContextManager#run(RlsContext, java.util.function.Supplier)} and visible to every policy
 * evaluated while it is active.
 */
@Value
@Builder(toBuilder = true)
public class RlsContext {
   AuthContext auth;
   RequestContext request;
   @Singular("metaValue")
   Map<String, Object> meta;
   @Builder.Default
   Instant timestamp = Instant.now();

   public Optional<Object> getMetaValue(String key) {
      return Optional.ofNullable(meta.get(key));
   }

   public boolean isSystem() {
      return auth != null && auth.isSystem();
   }
}
