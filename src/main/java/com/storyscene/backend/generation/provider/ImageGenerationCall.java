package com.storyscene.backend.generation.provider;

import com.storyscene.backend.generation.model.ImageModel;

import java.util.List;

public record ImageGenerationCall(
        String requestId,
        ImageModel model,
        String prompt,
        String negativePrompt,
        int width,
        int height,
        String aspectRatio,
        int steps,
        double cfgScale,
        List<ReferenceImage> referenceImages
) {
    public record ReferenceImage(byte[] bytes, String contentType) {}

    public ImageGenerationCall {
        referenceImages = referenceImages == null ? List.of() : List.copyOf(referenceImages);
    }

    public ImageGenerationCall withPrompt(String newPrompt, double newCfgScale) {
        return new ImageGenerationCall(requestId, model, newPrompt, negativePrompt, width, height, aspectRatio,
                steps, newCfgScale, referenceImages);
    }

    public ImageGenerationCall withModel(ImageModel newModel, String newPrompt) {
        return new ImageGenerationCall(requestId, newModel, newPrompt, negativePrompt, width, height, aspectRatio,
                steps, cfgScale, referenceImages);
    }
}
