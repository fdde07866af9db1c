package com.storyscene.backend.generation.dto;

import java.util.List;

/**
 * Raw request body. {@code styleIntensity} and {@code strictStyle} stay untyped here because
 * clients send numbers, strings and booleans for them; {@link GenerationOptions} normalizes.
 */
public record GenerateSceneImageRequest(
        String sceneId,
        String artStyle,
        String model,
        Integer width,
        Integer height,
        Object styleIntensity,
        Object strictStyle,
        List<String> disabledStyleElements,
        String forcePrompt,
        String forceFullPrompt,
        Boolean promptOnly,
        Boolean characterImageReferenceEnabled,
        String clientRequestId,
        String storyId,
        Boolean reset
) {}
