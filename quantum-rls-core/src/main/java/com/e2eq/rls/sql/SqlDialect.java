package com.e2eq.rls.sql;

/**
 * Identifier quoting and placeholder syntax of one SQL dialect. Every identifier and every value
 * placeholder emitted by the engine goes through an implementation of this interface.
 */
public interface SqlDialect {

   String name();

   char identifierQuote();

   /**
    * @param index 1-based position of the parameter in the final statement
    */
   String placeholder(int index);

   /** Predicate that never matches a row. */
   default String alwaysFalse() {
      return "FALSE";
   }

   default String quote(String identifier) {
      if (identifier == null || identifier.isEmpty()) {
         throw new IllegalArgumentException("identifier can not be null or empty");
      }
      String q = String.valueOf(identifierQuote());
      return q + identifier.replace(q, q + q) + q;
   }

   default String qualify(String alias, String column) {
      return quote(alias) + "." + quote(column);
   }
}
