package com.storyscene.backend.generation.engine;

import com.storyscene.backend.generation.model.ImageModel;
import com.storyscene.backend.generation.provider.ImageGenerationCall;
import com.storyscene.backend.generation.style.GenerationTuning;
import com.storyscene.backend.generation.style.ResolutionCoercer;
import com.storyscene.backend.generation.vision.ValidationCharacter;

import java.util.List;

/**
 * Everything the engine needs for one scene image, already validated and assembled.
 *
 * @param explicitModel the caller named the model; disables the fallback retry
 * @param styleName display name used by the vision check and the retry prompt, null for no style
 */
public record EngineRequest(
        String requestId,
        ImageModel model,
        boolean explicitModel,
        String prompt,
        String negativePrompt,
        ResolutionCoercer.Resolution resolution,
        GenerationTuning tuning,
        List<ImageGenerationCall.ReferenceImage> referenceImages,
        List<ValidationCharacter> validationCharacters,
        String styleName,
        boolean strictStyle
) {
    public EngineRequest {
        referenceImages = referenceImages == null ? List.of() : List.copyOf(referenceImages);
        validationCharacters = validationCharacters == null ? List.of() : List.copyOf(validationCharacters);
    }

    ImageGenerationCall toCall() {
        return new ImageGenerationCall(requestId, model, prompt, negativePrompt,
                resolution.width(), resolution.height(), resolution.aspectRatio(),
                tuning.steps(), tuning.cfgScale(), model.multimodal() ? referenceImages : List.of());
    }
}
