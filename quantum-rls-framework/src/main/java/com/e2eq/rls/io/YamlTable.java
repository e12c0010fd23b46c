package com.e2eq.rls.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class YamlTable {
   public List<YamlPolicy> policies;
   public List<String> skipFor;
   public Boolean defaultDeny;
   public List<YamlRelationshipPath> relationships;
   public List<YamlReBAcPolicy> rebacPolicies;
}
