package com.storyscene.backend.generation.engine;

import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.image.BlankImageDetector;
import com.storyscene.backend.generation.image.ImageSniffer;
import com.storyscene.backend.generation.model.ImageModel;
import com.storyscene.backend.generation.model.ModelCatalog;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import com.storyscene.backend.generation.provider.ImageGenerationCall;
import com.storyscene.backend.generation.provider.ImageProviderClient;
import com.storyscene.backend.generation.provider.ImageProviderResult;
import com.storyscene.backend.generation.provider.ImageProviderRouter;
import com.storyscene.backend.generation.provider.ResponseHeaders;
import com.storyscene.backend.generation.vision.VisionValidation;
import com.storyscene.backend.generation.vision.VisionValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Provider call, one fallback on a rejected model, image checks, and the time-gated
 * vision validation with at most one stricter regeneration.
 *
 * <p>Every terminal failure is an {@link ImageGenerationException}; billing is the caller's concern.</p>
 */
@Slf4j
@Service
public class GenerationEngine {

    static final int UPSTREAM_ERROR_MAX = 4000;

    private final ImageProviderRouter router;
    private final VisionValidationService validator;
    private final GenerationProperties props;

    public GenerationEngine(ImageProviderRouter router, VisionValidationService validator, GenerationProperties props) {
        this.router = router;
        this.validator = validator;
        this.props = props;
    }

    public EngineResult generate(EngineRequest req, TimeBudget budget) {
        List<String> warnings = new ArrayList<>();

        ImageGenerationCall call = req.toCall();
        boolean usedFallback = false;
        ImageProviderResult result;
        try {
            result = callProvider(call, budget);
        } catch (ImageGenerationException e) {
            if (!canFallback(req, e)) throw e;

            ImageModel fallback = ModelCatalog.require(props.getFallbackModel());
            log.warn("scene_generation_fallback requestId={} from={} to={} status={}",
                    req.requestId(), call.model().id(), fallback.id(), e.getUpstreamStatus());
            call = call.withModel(fallback, PromptSanitizer.truncate(call.prompt(), fallback.promptLimit()));
            usedFallback = true;
            warnings.add("model_fallback:" + req.model().id() + "->" + fallback.id());
            result = callProvider(call, budget);
        }

        CheckedImage image = check(result, call);

        VisionValidation validation = null;
        boolean retried = false;
        if (shouldValidate(req, budget)) {
            validation = validator.validate(req.requestId(), image.bytes(), image.detection().contentType(),
                    req.validationCharacters(), req.styleName(), req.strictStyle(),
                    props.getVisionTimeout()).orElse(null);

            if (validation != null && validation.failed()) {
                if (budget.hasAtLeast(props.getRetryMinRemaining())) {
                    Optional<CheckedImage> second = stricterRetry(req, call, validation, budget);
                    if (second.isPresent()) {
                        image = second.get();
                        retried = true;
                    }
                } else {
                    warnings.add("validation_retry_skipped_time_budget");
                }
            }
        } else if (props.isVisionValidationEnabled() && validator.available()) {
            warnings.add("validation_skipped_time_budget");
        }

        return new EngineResult(image.bytes(), image.detection(), image.model(), image.prompt(), usedFallback,
                image.verdict(), validation, retried, warnings);
    }

    private boolean canFallback(EngineRequest req, ImageGenerationException e) {
        if (req.explicitModel()) return false;
        if (props.getFallbackModel() == null || props.getFallbackModel().equals(req.model().id())) return false;
        // a policy rejection is terminal whatever model it names
        if (UpstreamFailureClassifier.reportsViolation(e.getUpstreamError(), e.getHeaders())) return false;
        Integer status = e.getUpstreamStatus();
        return status != null && UpstreamFailureClassifier.isModelRejection(status, e.getUpstreamError());
    }

    private boolean shouldValidate(EngineRequest req, TimeBudget budget) {
        if (!props.isVisionValidationEnabled() || !validator.available()) return false;
        if (req.validationCharacters().isEmpty() && PromptSanitizer.isBlank(req.styleName())) return false;
        return budget.hasAtLeast(props.getVisionMinRemaining());
    }

    private Optional<CheckedImage> stricterRetry(EngineRequest req, ImageGenerationCall first,
                                                 VisionValidation validation, TimeBudget budget) {
        String prompt = PromptSanitizer.truncate(
                VisionValidationService.retryPrefix(validation, req.styleName()) + first.prompt(),
                Math.min(first.model().promptLimit(), ModelCatalog.LIMITED_PROMPT_LENGTH));
        ImageGenerationCall retry = first.withPrompt(prompt, req.tuning().stricter().cfgScale());

        log.info("scene_generation_retry requestId={} model={} score={} cfg={}",
                req.requestId(), retry.model().id(), validation.score(), retry.cfgScale());
        try {
            return Optional.of(check(callProvider(retry, budget), retry));
        } catch (ImageGenerationException e) {
            // the first image stays; a failed retry is not a failed request
            log.warn("scene_generation_retry_failed requestId={} code={} stage={}",
                    req.requestId(), e.getFailure().code(), e.getStage());
            return Optional.empty();
        }
    }

    private ImageProviderResult callProvider(ImageGenerationCall call, TimeBudget budget) {
        String modelId = call.model().id();
        try {
            ImageProviderClient client = router.pick(call.model());
            return client.generate(call, budget.callTimeout(props.getMinImageCallTimeout()));
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String body = e.getResponseBodyAsString();
            var headers = ResponseHeaders.collect(e.getResponseHeaders());
            UpstreamFailure f = UpstreamFailureClassifier.classifyHttp(status, e.getStatusText(), body, headers);
            throw new ImageGenerationException(ImageGenerationException.STAGE_UPSTREAM, f, status, e.getStatusText(),
                    headers, PromptSanitizer.truncate(body, UPSTREAM_ERROR_MAX), modelId, call.prompt(), e);
        } catch (RuntimeException e) {
            UpstreamFailure f = UpstreamFailureClassifier.classifyThrowable(e);
            throw new ImageGenerationException(ImageGenerationException.STAGE_UPSTREAM, f, null, null,
                    null, PromptSanitizer.truncate(String.valueOf(e.getMessage()), UPSTREAM_ERROR_MAX),
                    modelId, call.prompt(), e);
        }
    }

    /** Byte, content-flag, format and blank checks on a 2xx answer. */
    CheckedImage check(ImageProviderResult r, ImageGenerationCall call) {
        byte[] bytes = r.imageBytes();
        String modelId = call.model().id();

        if (bytes == null) {
            throw new ImageGenerationException(ImageGenerationException.STAGE_PARSE,
                    UpstreamFailureClassifier.parseFailure(r.bodyKeys()), r.httpStatus(), null,
                    r.headers(), null, modelId, call.prompt(), null);
        }
        if (r.contentViolation() || r.containsMinor()) {
            throw invalid("IMAGE_CONTENT_FLAGGED", bytes.length, r, call, null);
        }
        if (bytes.length < props.getMinImageBytes()) {
            throw invalid("IMAGE_TOO_SMALL", bytes.length, r, call, null);
        }

        ImageSniffer.Detection detection = ImageSniffer.detect(bytes);
        if (detection == null) {
            throw invalid("IMAGE_FORMAT_UNKNOWN", bytes.length, r, call, "Unrecognized image signature");
        }

        BlankImageDetector.Verdict verdict = null;
        if (props.isBlankDetectionEnabled()) {
            verdict = BlankImageDetector.inspect(bytes);
            if (verdict.blank()) {
                log.warn("blank_image_detected requestId={} model={} reason={} mean={} std={} colors={}",
                        call.requestId(), modelId, verdict.reason(), verdict.mean(), verdict.std(), verdict.uniqueColors());
                throw invalid("IMAGE_BLANK", bytes.length, r, call, "Blank image (" + verdict.reason() + ")");
            }
        }
        return new CheckedImage(bytes, detection, modelId, call.prompt(), verdict);
    }

    private static ImageGenerationException invalid(String code, int size, ImageProviderResult r,
                                                    ImageGenerationCall call, String detail) {
        UpstreamFailure f = UpstreamFailureClassifier.invalidImage(code, size, r.headers(), detail);
        return new ImageGenerationException(ImageGenerationException.STAGE_BLANK, f, r.httpStatus(), null,
                r.headers(), null, call.model().id(), call.prompt(), null);
    }

    record CheckedImage(byte[] bytes, ImageSniffer.Detection detection, String model, String prompt,
                        BlankImageDetector.Verdict verdict) {}
}
