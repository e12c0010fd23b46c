package com.e2eq.rls.model.policy;

import com.e2eq.rls.model.context.AuthContext;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * What an activation condition may look at: the caller, the deployment environment, enabled feature
 * flags and the evaluation time.
 */
@Value
@Builder
public class PolicyActivationContext {
   AuthContext auth;
   String environment;
   @Singular
   Set<String> features;
   @Builder.Default
   Instant timestamp = Instant.now();
   @Singular("metaValue")
   Map<String, Object> meta;

   public boolean hasFeature(String feature) {
      return features.contains(feature);
   }
}
