package com.storyscene.backend.generation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storyscene.backend.credits.dto.CreditBalanceResponse;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SceneImageResponse(
        boolean success,
        String imageUrl,
        String requestId,
        String model,
        String prompt,
        String promptHash,
        List<String> warnings,
        CreditBalanceResponse credits,
        Boolean replayed
) {
    public SceneImageResponse {
        warnings = (warnings == null || warnings.isEmpty()) ? null : List.copyOf(warnings);
    }
}
