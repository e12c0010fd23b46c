package com.e2eq.rls.model.rebac;

import com.e2eq.rls.exceptions.RlsSchemaException;

import java.util.Locale;
import java.util.Map;

public enum JoinType {
   INNER("JOIN"),
   LEFT("LEFT JOIN"),
   RIGHT("RIGHT JOIN");

   private final String keyword;

   JoinType(String keyword) {
      this.keyword = keyword;
   }

   public String keyword() {
      return keyword;
   }

   public static JoinType fromValue(String value) {
      if (value == null) {
         return INNER;
      }
      try {
         return JoinType.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
         throw new RlsSchemaException("Unknown join type '" + value + "'", Map.of("joinType", value), e);
      }
   }
}
