package com.storyscene.backend.generation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storyscene.backend.credits.dto.CreditBalanceResponse;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SceneImageErrorResponse(
        String errorCode,
        String error,
        String requestId,
        String stage,
        Map<String, Object> details,
        CreditBalanceResponse credits,
        Integer retryAfterSec
) {
    public static SceneImageErrorResponse of(String errorCode, String error, String requestId) {
        return new SceneImageErrorResponse(errorCode, error, requestId, null, null, null, null);
    }
}
