package com.storyscene.backend.generation.engine;

import lombok.Getter;

import java.util.Map;

/**
 * Terminal engine failure with enough context to persist a reproducible debug record.
 */
@Getter
public class ImageGenerationException extends RuntimeException {

    public static final String STAGE_UPSTREAM = "upstream_generation";
    public static final String STAGE_PARSE = "image_parse";
    public static final String STAGE_BLANK = "blank_image";

    private final String stage;
    private final UpstreamFailure failure;
    private final Integer upstreamStatus;
    private final String upstreamStatusText;
    private final Map<String, String> headers;
    private final String upstreamError;
    private final String model;
    private final String prompt;

    public ImageGenerationException(String stage, UpstreamFailure failure, Integer upstreamStatus, String upstreamStatusText,
                                    Map<String, String> headers, String upstreamError, String model, String prompt,
                                    Throwable cause) {
        super(failure.code(), cause);
        this.stage = stage;
        this.failure = failure;
        this.upstreamStatus = upstreamStatus;
        this.upstreamStatusText = upstreamStatusText;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.upstreamError = upstreamError;
        this.model = model;
        this.prompt = prompt;
    }
}
