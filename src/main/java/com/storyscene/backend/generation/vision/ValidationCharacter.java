package com.storyscene.backend.generation.vision;

/**
 * What the validator expects one character to look like in the generated image.
 */
public record ValidationCharacter(
        String name,
        String referenceImageUrl,
        String referenceText,
        String expectedOutfit,
        String expectedState
) {}
