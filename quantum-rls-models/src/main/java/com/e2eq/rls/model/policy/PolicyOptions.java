package com.e2eq.rls.model.policy;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PolicyOptions {
   private static final PolicyOptions NONE = PolicyOptions.builder().build();

   String name;
   Integer priority;
   PolicyActivationCondition activation;

   public static PolicyOptions none() {
      return NONE;
   }

   public static PolicyOptions named(String name) {
      return PolicyOptions.builder().name(name).build();
   }

   public int priorityOr(int defaultPriority) {
      return priority != null ? priority : defaultPriority;
   }
}
