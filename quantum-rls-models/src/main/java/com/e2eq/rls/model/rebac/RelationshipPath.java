package com.e2eq.rls.model.rebac;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RelationshipPath {
   String name;
   String description;
   @Singular
   List<RelationshipStep> steps;
}
