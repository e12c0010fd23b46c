package com.e2eq.rls.model.rebac;

import com.e2eq.rls.model.context.PolicyEvaluationContext;

import java.util.Map;

/**
 * End condition of a relationship policy: the column mapping applied to the last table of the path.
 * A null value renders {@code IS NULL}, a collection renders {@code IN} (empty means no match) and a
 * missing key applies no restriction.
 */
@FunctionalInterface
public interface RelationshipCondition {

   Map<String, Object> apply(PolicyEvaluationContext ctx);

   static RelationshipCondition literal(Map<String, Object> mapping) {
      return new Literal(mapping);
   }

   /** Fixed mapping, validated once when the owning policy is registered. */
   record Literal(Map<String, Object> mapping) implements RelationshipCondition {
      @Override
      public Map<String, Object> apply(PolicyEvaluationContext ctx) {
         return mapping;
      }
   }
}
