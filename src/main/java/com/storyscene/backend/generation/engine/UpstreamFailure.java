package com.storyscene.backend.generation.engine;

import java.util.List;

/**
 * Classified provider failure.
 *
 * @param httpStatus status the caller receives, not the upstream one
 * @param userMessage safe to show to end users
 * @param reasons short diagnostic phrases for the scene debug record
 */
public record UpstreamFailure(
        String code,
        int httpStatus,
        String userMessage,
        List<String> reasons,
        Integer retryAfterSec
) {
    public UpstreamFailure {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
