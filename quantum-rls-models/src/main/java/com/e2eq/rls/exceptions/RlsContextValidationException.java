package com.e2eq.rls.exceptions;

public class RlsContextValidationException extends RlsException {
   private static final long serialVersionUID = 1L;

   private final String field;

   public RlsContextValidationException(String message, String field) {
      super(message, RlsErrorCode.RLS_CONTEXT_INVALID);
      this.field = field;
   }

   public String getField() {
      return field;
   }
}
