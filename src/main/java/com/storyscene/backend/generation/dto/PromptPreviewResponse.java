package com.storyscene.backend.generation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * {@code promptOnly=true} answer: what would be sent, nothing charged, no provider call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromptPreviewResponse(
        boolean success,
        boolean promptOnly,
        String prompt,
        String negativePrompt,
        String promptHash,
        String model,
        String styleId,
        boolean truncated,
        List<String> missingSubjects,
        List<String> styleIssues,
        List<String> warnings,
        int width,
        int height,
        int steps,
        double cfgScale
) {}
