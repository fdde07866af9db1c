package com.storyscene.backend.generation.service;

import com.storyscene.backend.generation.appearance.AppearanceResolution;
import com.storyscene.backend.generation.appearance.ContinuityIssue;
import com.storyscene.backend.generation.engine.ModelSelector;
import com.storyscene.backend.generation.prompt.AssembledPrompt;
import com.storyscene.backend.generation.style.GenerationTuning;
import com.storyscene.backend.generation.style.ResolutionCoercer;
import com.storyscene.backend.generation.style.StyleCatalog;
import com.storyscene.backend.generation.style.StyleGuidance;
import com.storyscene.backend.generation.vision.ValidationCharacter;

import java.util.List;

/**
 * Everything decided before any credit moves: model, prompt, parameters and the warnings
 * collected on the way.
 */
public record PromptPlan(
        String styleId,
        int intensity,
        boolean strictStyle,
        ModelSelector.Selection selection,
        StyleGuidance guidance,
        AssembledPrompt assembled,
        String negativePrompt,
        ResolutionCoercer.Resolution resolution,
        GenerationTuning tuning,
        AppearanceResolution appearance,
        List<ContinuityIssue> continuityIssues,
        List<String> styleIssues,
        List<ValidationCharacter> validationCharacters,
        List<String> referenceImageUrls,
        String promptHash,
        String characterStatesHash,
        List<String> warnings
) {
    public PromptPlan {
        continuityIssues = List.copyOf(continuityIssues);
        styleIssues = List.copyOf(styleIssues);
        validationCharacters = List.copyOf(validationCharacters);
        referenceImageUrls = List.copyOf(referenceImageUrls);
        warnings = List.copyOf(warnings);
    }

    public String prompt() {
        return assembled.fullPrompt();
    }

    /** Display name for style-aware checks, null when no style applies. */
    public String styleName() {
        return StyleCatalog.NONE.equals(guidance.styleId()) ? null : guidance.styleName();
    }
}
