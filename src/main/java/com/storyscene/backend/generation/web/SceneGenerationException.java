package com.storyscene.backend.generation.web;

import com.storyscene.backend.credits.dto.CreditBalanceResponse;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A pipeline failure as the caller sees it: status, stage, a user-facing message and,
 * after a refund attempt, the credit snapshot.
 */
@Getter
public class SceneGenerationException extends RuntimeException {

    private final int httpStatus;
    private final String errorCode;
    private final String stage;
    private final String requestId;
    private final Map<String, Object> details;
    private final CreditBalanceResponse credits;
    private final Integer retryAfterSec;

    public SceneGenerationException(int httpStatus, String errorCode, String stage, String message, String requestId,
                                    Map<String, Object> details, CreditBalanceResponse credits, Integer retryAfterSec) {
        super(message);
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
        this.stage = stage;
        this.requestId = requestId;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.credits = credits;
        this.retryAfterSec = retryAfterSec;
    }

    public SceneGenerationException withCredits(CreditBalanceResponse snapshot) {
        return new SceneGenerationException(httpStatus, errorCode, stage, getMessage(), requestId, details, snapshot, retryAfterSec);
    }
}
