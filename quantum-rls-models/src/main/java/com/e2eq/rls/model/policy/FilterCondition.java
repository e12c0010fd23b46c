package com.e2eq.rls.model.policy;

import com.e2eq.rls.model.context.PolicyEvaluationContext;

import java.util.Map;

/**
 * Produces the column to value mapping a filter policy adds to a read. Values may be null
 * ({@code IS NULL}), a collection ({@code IN}, empty means no rows) or a scalar (equality).
 */
@FunctionalInterface
public interface FilterCondition {

   Map<String, Object> apply(PolicyEvaluationContext ctx);

   static FilterCondition literal(Map<String, Object> mapping) {
      return new Literal(mapping);
   }

   record Literal(Map<String, Object> mapping) implements FilterCondition {
      @Override
      public Map<String, Object> apply(PolicyEvaluationContext ctx) {
         return mapping;
      }
   }
}
