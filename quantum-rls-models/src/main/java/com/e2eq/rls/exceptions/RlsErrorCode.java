package com.e2eq.rls.exceptions;

/**
 * Stable error codes carried by every {@link RlsException}.
 */
public enum RlsErrorCode {
   RLS_CONTEXT_MISSING,
   RLS_CONTEXT_INVALID,
   RLS_POLICY_VIOLATION,
   RLS_POLICY_INVALID,
   RLS_SCHEMA_INVALID,
   RLS_POLICY_EVALUATION_ERROR
}
