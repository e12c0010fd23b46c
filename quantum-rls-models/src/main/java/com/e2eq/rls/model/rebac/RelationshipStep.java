package com.e2eq.rls.model.rebac;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One join hop of a relationship path. Unset columns are defaulted on compilation: {@code fromColumn}
 * becomes {@code {to}_id}, {@code toColumn} becomes {@code id}, {@code alias} becomes {@code to} and the
 * join type becomes inner.
 */
@Value
@Builder
public class RelationshipStep {
   String from;
   String to;
   String fromColumn;
   String toColumn;
   String alias;
   JoinType joinType;
   @Singular
   Map<String, Object> additionalConditions;

   public static RelationshipStep of(String from, String to, String fromColumn, String toColumn) {
      return RelationshipStep.builder()
         .from(from)
         .to(to)
         .fromColumn(fromColumn)
         .toColumn(toColumn)
         .build();
   }
}
