package com.e2eq.rls.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class YamlRelationshipPath {
   public String name;
   public String description;
   public List<Step> steps;

   @JsonIgnoreProperties(ignoreUnknown = true)
   public static class Step {
      public String from;
      public String to;
      public String fromColumn;
      public String toColumn;
      public String alias;
      public String joinType;
      public Map<String, Object> additionalConditions;
   }
}
