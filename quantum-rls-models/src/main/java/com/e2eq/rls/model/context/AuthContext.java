package com.e2eq.rls.model.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Authenticated identity of the caller. A system context skips every row level check, so it must only
 * be created on trusted internal code paths.
 */
@Value
@Builder(toBuilder = true)
public class AuthContext {
   String userId;
   String tenantId;
   @Singular
   Set<String> roles;
   @Singular
   Set<String> organizationIds;
   @Singular
   Set<String> permissions;
   @Singular
   Map<String, Object> attributes;
   boolean system;

   public boolean hasRole(String role) {
      return roles.contains(role);
   }

   public boolean hasAnyRole(Set<String> candidates) {
      if (candidates == null) {
         return false;
      }
      for (String role : candidates) {
         if (roles.contains(role)) {
            return true;
         }
      }
      return false;
   }

   public boolean hasPermission(String permission) {
      return permissions.contains(permission);
   }

   /**
    * Copy of this identity flagged as system.
    */
   public AuthContext asSystem() {
      return toBuilder().system(true).build();
   }
}
