package com.e2eq.rls.model.rebac;

import java.util.List;

public record CompiledRelationshipPath(String name,
                                       List<CompiledRelationshipStep> steps,
                                       String sourceTable,
                                       String targetTable) {

   public CompiledRelationshipPath {
      steps = List.copyOf(steps);
   }

   public CompiledRelationshipStep firstStep() {
      return steps.get(0);
   }

   public CompiledRelationshipStep lastStep() {
      return steps.get(steps.size() - 1);
   }
}
