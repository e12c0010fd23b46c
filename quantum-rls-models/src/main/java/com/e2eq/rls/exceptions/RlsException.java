package com.e2eq.rls.exceptions;

/**
 * Base class for all row level security failures. Unchecked so that policy conditions and query
 * builders can raise it without polluting every signature in between.
 */
public class RlsException extends RuntimeException {
   private static final long serialVersionUID = 1L;

   private final RlsErrorCode code;

   public RlsException(String message, RlsErrorCode code) {
      super(message);
      this.code = code;
   }

   public RlsException(String message, RlsErrorCode code, Throwable cause) {
      super(message, cause);
      this.code = code;
   }

   public RlsErrorCode getCode() {
      return code;
   }

   @Override
   public String toString() {
      return getClass().getSimpleName() + "{" +
              "code=" + code +
              ", message='" + getMessage() + '\'' +
              '}';
   }
}
