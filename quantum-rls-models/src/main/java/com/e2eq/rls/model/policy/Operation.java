package com.e2eq.rls.model.policy;

import com.e2eq.rls.exceptions.RlsSchemaException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public enum Operation {
   CREATE,
   READ,
   UPDATE,
   DELETE,
   /** Expands to every concrete operation the owning policy type supports. */
   ALL;

   private static final Set<Operation> CONCRETE = Collections.unmodifiableSet(EnumSet.of(CREATE, READ, UPDATE, DELETE));

   public String value() {
      return name().toLowerCase(Locale.ROOT);
   }

   public boolean isConcrete() {
      return this != ALL;
   }

   public static Set<Operation> concrete() {
      return CONCRETE;
   }

   public static Operation fromValue(String value) {
      if (value == null) {
         throw new RlsSchemaException("Operation can not be null");
      }
      try {
         return Operation.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
         throw new RlsSchemaException("Unknown operation '" + value + "'", Map.of("operation", value), e);
      }
   }

   /**
    * Normalizes a set of operations for a policy of the given type. The result never contains
    * {@link #ALL}: for validate policies it expands to create and update, for filter policies to read,
    * otherwise to every concrete operation.
    */
   public static Set<Operation> normalize(Collection<Operation> operations, PolicyType type) {
      EnumSet<Operation> result = EnumSet.noneOf(Operation.class);
      if (operations == null) {
         return Collections.unmodifiableSet(result);
      }
      for (Operation op : operations) {
         if (op == ALL) {
            result.addAll(type.expandAll());
         } else if (op != null) {
            result.add(op);
         }
      }
      return Collections.unmodifiableSet(result);
   }
}
