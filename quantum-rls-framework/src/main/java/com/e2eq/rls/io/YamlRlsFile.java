package com.e2eq.rls.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class YamlRlsFile {
   /** Paths visible to every table. */
   @JsonProperty("relationships")
   public List<YamlRelationshipPath> relationships;

   @JsonProperty("tables")
   public Map<String, YamlTable> tables = new LinkedHashMap<>();
}
