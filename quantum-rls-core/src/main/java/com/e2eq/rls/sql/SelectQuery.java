package com.e2eq.rls.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable SELECT used as the reference {@link RewritableQuery}:
 * {@code SELECT cols FROM table [AS alias] [WHERE p1 AND p2 ...]}.
 */
public final class SelectQuery implements RewritableQuery<SelectQuery> {
   private final SqlDialect dialect;
   private final String table;
   private final String alias;
   private final List<String> columns;
   private final List<SqlFragment> predicates;

   private SelectQuery(SqlDialect dialect, String table, String alias, List<String> columns, List<SqlFragment> predicates) {
      this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
      this.table = Objects.requireNonNull(table, "table cannot be null");
      this.alias = alias;
      this.columns = List.copyOf(columns);
      this.predicates = List.copyOf(predicates);
   }

   public static SelectQuery from(SqlDialect dialect, String table) {
      return new SelectQuery(dialect, table, null, List.of(), List.of());
   }

   public static SelectQuery from(SqlDialect dialect, String table, String alias) {
      return new SelectQuery(dialect, table, alias, List.of(), List.of());
   }

   /** Empty means {@code *}. */
   public SelectQuery select(String... cols) {
      return new SelectQuery(dialect, table, alias, List.of(cols), predicates);
   }

   /** Adds a column condition on the main table, using the shared null / list / scalar rules. */
   public SelectQuery where(String column, Object value) {
      SqlFragment predicate = new SqlFragmentBuilder(dialect)
         .condition(getReference(), column, value)
         .build();
      return withPredicate(predicate);
   }

   @Override
   public SelectQuery withPredicate(SqlFragment predicate) {
      List<SqlFragment> next = new ArrayList<>(predicates);
      next.add(predicate);
      return new SelectQuery(dialect, table, alias, columns, next);
   }

   public SqlFragment toFragment() {
      SqlFragmentBuilder builder = new SqlFragmentBuilder(dialect).append("SELECT ");
      if (columns.isEmpty()) {
         builder.append("*");
      } else {
         for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
               builder.append(", ");
            }
            builder.qualified(getReference(), columns.get(i));
         }
      }
      builder.append(" FROM ").identifier(table);
      if (alias != null && !alias.equals(table)) {
         builder.append(" AS ").identifier(alias);
      }
      if (!predicates.isEmpty()) {
         builder.append(" WHERE ").append(SqlFragment.join(dialect, " AND ", predicates));
      }
      return builder.build();
   }

   /** Full statement, placeholders numbered across all predicates. */
   public String getSql() {
      return toFragment().getSql();
   }

   public List<Object> getParameters() {
      return toFragment().getParameters();
   }

   public String getTable() {
      return table;
   }

   public String getAlias() {
      return alias;
   }

   /** Alias if set, otherwise the table name. */
   public String getReference() {
      return alias != null ? alias : table;
   }

   public List<SqlFragment> getPredicates() {
      return predicates;
   }

   public SqlDialect getDialect() {
      return dialect;
   }

   @Override
   public String toString() {
      return getSql();
   }
}
