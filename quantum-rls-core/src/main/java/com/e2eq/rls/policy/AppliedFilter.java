package com.e2eq.rls.policy;

import java.util.Map;

/** Column mapping produced by one active filter policy. */
public record AppliedFilter(String policyName, Map<String, Object> conditions) {
}
