package com.e2eq.rls.model.policy;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum PolicyType {
   FILTER,
   ALLOW,
   DENY,
   VALIDATE;

   public String value() {
      return name().toLowerCase(Locale.ROOT);
   }

   Set<Operation> expandAll() {
      return switch (this) {
         case FILTER -> EnumSet.of(Operation.READ);
         case VALIDATE -> EnumSet.of(Operation.CREATE, Operation.UPDATE);
         case ALLOW, DENY -> Operation.concrete();
      };
   }
}
