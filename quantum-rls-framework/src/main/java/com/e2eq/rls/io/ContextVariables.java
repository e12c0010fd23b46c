package com.e2eq.rls.io;

import com.e2eq.rls.model.context.AuthContext;
import com.e2eq.rls.model.context.PolicyEvaluationContext;
import org.apache.commons.text.StringSubstitutor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${...}} placeholders in declarative policy values against an evaluation context.
 *
 * A value that is exactly one placeholder resolves to the typed value (a list stays a list, a number
 * stays a number). Anything else goes through {@link StringSubstitutor}; unknown variables fail.
 */
final class ContextVariables {
   private static final Pattern SINGLE = Pattern.compile("^\\$\\{([^}]+)}$");

   final Map<String, String> strings;
   final Map<String, Object> objects;

   private ContextVariables(Map<String, String> strings, Map<String, Object> objects) {
      this.strings = strings;
      this.objects = objects;
   }

   static ContextVariables of(PolicyEvaluationContext ctx) {
      Map<String, Object> objects = new HashMap<>();
      AuthContext auth = ctx.getAuth();
      if (auth != null) {
         putIfPresent(objects, "userId", auth.getUserId());
         putIfPresent(objects, "tenantId", auth.getTenantId());
         objects.put("roles", new ArrayList<>(auth.getRoles()));
         objects.put("organizationIds", new ArrayList<>(auth.getOrganizationIds()));
      }
      if (ctx.getMeta() != null) {
         for (Map.Entry<String, Object> e : ctx.getMeta().entrySet()) {
            putIfPresent(objects, "meta." + e.getKey(), e.getValue());
         }
      }
      Map<String, String> strings = new HashMap<>();
      for (Map.Entry<String, Object> e : objects.entrySet()) {
         strings.put(e.getKey(), asString(e.getValue()));
      }
      return new ContextVariables(strings, objects);
   }

   static boolean hasPlaceholders(Object value) {
      if (value instanceof String s) {
         return s.contains("${");
      }
      if (value instanceof Collection<?> c) {
         for (Object item : c) {
            if (hasPlaceholders(item)) {
               return true;
            }
         }
      }
      return false;
   }

   static boolean hasPlaceholders(Map<String, Object> mapping) {
      if (mapping == null) {
         return false;
      }
      for (Object value : mapping.values()) {
         if (hasPlaceholders(value)) {
            return true;
         }
      }
      return false;
   }

   Map<String, Object> resolve(Map<String, Object> mapping) {
      Map<String, Object> resolved = new LinkedHashMap<>();
      for (Map.Entry<String, Object> e : mapping.entrySet()) {
         resolved.put(e.getKey(), resolve(e.getValue()));
      }
      return resolved;
   }

   /**
    * @throws IllegalArgumentException when a placeholder names an unknown variable
    */
   Object resolve(Object value) {
      if (value instanceof String s) {
         Matcher m = SINGLE.matcher(s);
         if (m.matches()) {
            String key = m.group(1);
            if (!objects.containsKey(key)) {
               throw new IllegalArgumentException("Unknown variable ${" + key + "}");
            }
            return objects.get(key);
         }
         if (s.contains("${")) {
            StringSubstitutor sub = new StringSubstitutor(strings);
            sub.setEnableUndefinedVariableException(true);
            return sub.replace(s);
         }
         return s;
      }
      if (value instanceof Collection<?> c) {
         List<Object> out = new ArrayList<>(c.size());
         for (Object item : c) {
            out.add(resolve(item));
         }
         return out;
      }
      return value;
   }

   private static void putIfPresent(Map<String, Object> map, String key, Object value) {
      if (value != null) {
         map.put(key, value);
      }
   }

   private static String asString(Object value) {
      if (value instanceof Collection<?> c) {
         List<String> parts = new ArrayList<>(c.size());
         for (Object item : c) {
            parts.add(String.valueOf(item));
         }
         return String.join(",", parts);
      }
      return String.valueOf(value);
   }
}
