package com.e2eq.rls.io;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * One declarative policy. The condition is built from {@code filter} (filter policies), {@code roles}
 * (any of) and {@code match} (column equality against the row, or the payload for validate). Values
 * may use {@code ${userId}}, {@code ${tenantId}}, {@code ${organizationIds}}, {@code ${roles}} and
 * {@code ${meta.<key>}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class YamlPolicy {
   public String name;
   public String type;
   @JsonAlias("operation")
   public List<String> operations;
   public Integer priority;
   public Map<String, Object> filter;
   public List<String> roles;
   public Map<String, Object> match;
   public List<String> environments;
   public String feature;
}
