package com.e2eq.rls.sql;

import com.e2eq.rls.exceptions.RlsSchemaException;

import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutable builder for {@link SqlFragment}. Identifiers are quoted and values become placeholders
 * through the dialect, never by concatenating caller supplied text.
 *
 * Column conditions follow one rule set everywhere: {@code null} renders {@code IS NULL}, a collection
 * or array renders {@code IN (...)} with one placeholder per element and the always-false predicate
 * when empty, anything else scalar renders an equality. {@code Optional.empty()} marks a value as absent
 * and the condition is skipped. Maps and other nested objects are rejected.
 */
public final class SqlFragmentBuilder {
   private final SqlDialect dialect;
   private final List<String> segments = new ArrayList<>();
   private final List<Object> parameters = new ArrayList<>();
   private StringBuilder current = new StringBuilder();

   public SqlFragmentBuilder(SqlDialect dialect) {
      this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
   }

   public SqlDialect getDialect() {
      return dialect;
   }

   public SqlFragmentBuilder append(String sql) {
      current.append(sql);
      return this;
   }

   public SqlFragmentBuilder identifier(String identifier) {
      current.append(dialect.quote(identifier));
      return this;
   }

   public SqlFragmentBuilder qualified(String alias, String column) {
      current.append(dialect.qualify(alias, column));
      return this;
   }

   public SqlFragmentBuilder param(Object value) {
      segments.add(current.toString());
      current = new StringBuilder();
      parameters.add(value);
      return this;
   }

   /** Splices another fragment in, keeping its parameters in place. */
   public SqlFragmentBuilder append(SqlFragment fragment) {
      if (!fragment.getDialect().name().equals(dialect.name())) {
         throw new IllegalArgumentException("Cannot splice a " + fragment.getDialect().name()
            + " fragment into a " + dialect.name() + " statement");
      }
      List<String> other = fragment.segments();
      current.append(other.get(0));
      List<Object> otherParams = fragment.getParameters();
      for (int i = 0; i < otherParams.size(); i++) {
         param(otherParams.get(i));
         current.append(other.get(i + 1));
      }
      return this;
   }

   /**
    * Appends the predicate for one column of {@code alias}. The caller must have checked
    * {@link #isAbsent(Object)} first.
    */
   public SqlFragmentBuilder condition(String alias, String column, Object value) {
      if (column == null || column.isBlank()) {
         Map<String, Object> details = new LinkedHashMap<>();
         details.put("alias", alias);
         details.put("column", column);
         throw new RlsSchemaException("Condition on '" + alias + "' has a blank column name", details);
      }
      Object normalized = unwrap(value);
      if (normalized == null) {
         qualified(alias, column).append(" IS NULL");
         return this;
      }
      List<Object> values = asList(normalized);
      if (values != null) {
         if (values.isEmpty()) {
            return append(dialect.alwaysFalse());
         }
         qualified(alias, column).append(" IN (");
         for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
               append(", ");
            }
            param(requireScalar(column, values.get(i)));
         }
         return append(")");
      }
      qualified(alias, column).append(" = ");
      return param(requireScalar(column, normalized));
   }

   /**
    * Appends {@code " AND <predicate>"} for every present entry of the mapping, in iteration order.
    */
   public SqlFragmentBuilder andConditions(String alias, Map<String, ?> conditions) {
      if (conditions == null) {
         return this;
      }
      for (Map.Entry<String, ?> e : conditions.entrySet()) {
         if (isAbsent(e.getValue())) {
            continue;
         }
         append(" AND ");
         condition(alias, e.getKey(), e.getValue());
      }
      return this;
   }

   public SqlFragment build() {
      List<String> finalSegments = new ArrayList<>(segments);
      finalSegments.add(current.toString());
      return new SqlFragment(dialect, finalSegments, parameters);
   }

   // --------------------
   // value shapes
   // --------------------

   public static boolean isAbsent(Object value) {
      return value instanceof Optional<?> opt && opt.isEmpty();
   }

   /**
    * Checks that every value in a condition mapping has a supported shape.
    *
    * @throws RlsSchemaException naming the offending column
    */
   public static void validateConditions(Map<String, ?> conditions, String owner) {
      if (conditions == null) {
         return;
      }
      for (Map.Entry<String, ?> e : conditions.entrySet()) {
         if (e.getKey() == null || e.getKey().isBlank()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("owner", owner);
            details.put("column", e.getKey());
            throw new RlsSchemaException("Condition of " + owner + " has a blank column name", details);
         }
         if (isAbsent(e.getValue())) {
            continue;
         }
         Object value = unwrap(e.getValue());
         if (value == null) {
            continue;
         }
         List<Object> values = asList(value);
         if (values != null) {
            values.forEach(v -> requireScalar(e.getKey(), v));
         } else {
            requireScalar(e.getKey(), value);
         }
      }
   }

   private static Object unwrap(Object value) {
      if (value instanceof Optional<?> opt) {
         return opt.orElse(null);
      }
      return value;
   }

   private static List<Object> asList(Object value) {
      if (value instanceof Collection<?> c) {
         return new ArrayList<>(c);
      }
      if (value.getClass().isArray() && !(value instanceof byte[])) {
         int len = Array.getLength(value);
         List<Object> list = new ArrayList<>(len);
         for (int i = 0; i < len; i++) {
            list.add(Array.get(value, i));
         }
         return list;
      }
      return null;
   }

   private static Object requireScalar(String column, Object value) {
      if (value == null
         || value instanceof CharSequence
         || value instanceof Number
         || value instanceof Boolean
         || value instanceof Character
         || value instanceof Enum<?>
         || value instanceof UUID
         || value instanceof TemporalAccessor
         || value instanceof Date
         || value instanceof byte[]) {
         return value instanceof CharSequence cs ? cs.toString() : value;
      }
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("column", column);
      details.put("valueType", value.getClass().getName());
      throw new RlsSchemaException("Unsupported value for column '" + column + "': "
         + value.getClass().getSimpleName() + " is not a scalar, null or a list of scalars", details);
   }
}
