package com.e2eq.rls.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable piece of SQL with positional parameters.
 *
 * Text and parameters are kept apart: {@code segments} always holds one more entry than
 * {@code parameters} and a placeholder sits between each pair of segments. That lets fragments be
 * spliced into a larger statement and renumbered without parsing the SQL again. Parameters are ordered
 * exactly as their placeholders appear in the text.
 */
public final class SqlFragment {
   private final SqlDialect dialect;
   private final List<String> segments;
   private final List<Object> parameters;

   SqlFragment(SqlDialect dialect, List<String> segments, List<Object> parameters) {
      if (segments.size() != parameters.size() + 1) {
         throw new IllegalArgumentException("expected " + (parameters.size() + 1) + " segments but got " + segments.size());
      }
      this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
      this.segments = List.copyOf(segments);
      this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
   }

   public static SqlFragment raw(SqlDialect dialect, String sql) {
      return new SqlFragment(dialect, List.of(sql), List.of());
   }

   public static SqlFragment alwaysFalse(SqlDialect dialect) {
      return raw(dialect, dialect.alwaysFalse());
   }

   /**
    * Joins fragments of the same dialect with a separator, e.g. {@code " AND "}.
    */
   public static SqlFragment join(SqlDialect dialect, String separator, List<SqlFragment> fragments) {
      SqlFragmentBuilder builder = new SqlFragmentBuilder(dialect);
      boolean first = true;
      for (SqlFragment fragment : fragments) {
         if (!first) {
            builder.append(separator);
         }
         builder.append(fragment);
         first = false;
      }
      return builder.build();
   }

   public SqlFragment wrap(String prefix, String suffix) {
      return new SqlFragmentBuilder(dialect)
         .append(prefix)
         .append(this)
         .append(suffix)
         .build();
   }

   /** SQL text with placeholders numbered from 1. */
   public String getSql() {
      return render(1);
   }

   /**
    * SQL text with placeholders numbered from {@code firstIndex}; only dialects with numbered
    * placeholders are affected.
    */
   public String render(int firstIndex) {
      StringBuilder sb = new StringBuilder(segments.get(0));
      for (int i = 0; i < parameters.size(); i++) {
         sb.append(dialect.placeholder(firstIndex + i));
         sb.append(segments.get(i + 1));
      }
      return sb.toString();
   }

   public List<Object> getParameters() {
      return parameters;
   }

   public int getParameterCount() {
      return parameters.size();
   }

   public SqlDialect getDialect() {
      return dialect;
   }

   List<String> segments() {
      return segments;
   }

   @Override
   public String toString() {
      return "SqlFragment{" +
              "sql='" + getSql() + '\'' +
              ", parameters=" + parameters +
              '}';
   }
}
