package com.e2eq.rls.exceptions;

/**
 * Raised when an operation touches a protected table without an ambient RLS context.
 */
public class RlsContextException extends RlsException {
   private static final long serialVersionUID = 1L;

   public RlsContextException() {
      this("No RLS context found. Ensure code runs within RlsContextManager.run()");
   }

   public RlsContextException(String message) {
      super(message, RlsErrorCode.RLS_CONTEXT_MISSING);
   }
}
