package com.e2eq.rls.io;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class YamlReBAcPolicy {
   public String name;
   @JsonAlias("type")
   public String policyType;
   @JsonAlias("operation")
   public List<String> operations;
   public String relationshipPath;
   public Map<String, Object> endCondition;
   public Integer priority;
}
