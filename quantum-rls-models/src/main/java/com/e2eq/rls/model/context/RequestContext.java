package com.e2eq.rls.model.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class RequestContext {
   String requestId;
   String ipAddress;
   String userAgent;
   Instant timestamp;
   @Singular
   Map<String, String> headers;
}
