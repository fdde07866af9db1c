package com.storyscene.backend.generation.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ProviderTelemetry {

    public void ok(String provider, String modelId, String requestId, long latencyMs, Integer bytes) {
        log.info("provider_call status=OK provider={} modelId={} requestId={} latencyMs={} bytes={}",
                safe(provider), safe(modelId), safe(requestId), latencyMs, n(bytes));
    }

    public void fail(String provider, String modelId, String requestId, long latencyMs,
                     String errorCode, Integer httpStatus) {
        log.warn("provider_call status=FAIL provider={} modelId={} requestId={} latencyMs={} errorCode={} httpStatus={}",
                safe(provider), safe(modelId), safe(requestId), latencyMs, safe(errorCode), n(httpStatus));
    }

    static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
    private static Object n(Integer v) { return v == null ? "NA" : v; }
}
