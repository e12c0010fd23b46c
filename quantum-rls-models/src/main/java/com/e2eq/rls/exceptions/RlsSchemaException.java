package com.e2eq.rls.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration error raised while registering tables, relationships or policies, or while compiling
 * a fragment from a policy whose values have an unsupported shape. The {@code details} map names the
 * offending table, path or policy.
 */
public class RlsSchemaException extends RlsException {
   private static final long serialVersionUID = 1L;

   private final Map<String, Object> details;

   public RlsSchemaException(String message) {
      this(message, Map.of());
   }

   public RlsSchemaException(String message, Map<String, ?> details) {
      super(message, RlsErrorCode.RLS_SCHEMA_INVALID);
      this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
   }

   public RlsSchemaException(String message, Map<String, ?> details, Throwable cause) {
      super(message, RlsErrorCode.RLS_SCHEMA_INVALID, cause);
      this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
   }

   public Map<String, Object> getDetails() {
      return details;
   }
}
