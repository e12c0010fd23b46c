package com.e2eq.rls.sql;

/**
 * Boundary to the query builder that owns the statement. Row level security only ever adds predicates
 * to it and never inspects the rest of the query.
 *
 * @param <Q> the concrete query type returned after rewriting
 */
public interface RewritableQuery<Q extends RewritableQuery<Q>> {

   /**
    * Returns a query with {@code predicate} ANDed to its filter. Implementations renumber the
    * predicate's placeholders to fit the statement.
    */
   Q withPredicate(SqlFragment predicate);
}
