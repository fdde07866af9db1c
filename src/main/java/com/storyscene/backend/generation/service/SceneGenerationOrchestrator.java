package com.storyscene.backend.generation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyscene.backend.credits.dto.CreditBalanceResponse;
import com.storyscene.backend.credits.model.LedgerResult;
import com.storyscene.backend.credits.service.CreditLedgerService;
import com.storyscene.backend.generation.appearance.CharacterStatesHasher;
import com.storyscene.backend.generation.appearance.ContinuityIssue;
import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.dto.GenerationOptions;
import com.storyscene.backend.generation.dto.PromptPreviewResponse;
import com.storyscene.backend.generation.dto.SceneImageResponse;
import com.storyscene.backend.generation.engine.EngineRequest;
import com.storyscene.backend.generation.engine.EngineResult;
import com.storyscene.backend.generation.engine.GenerationEngine;
import com.storyscene.backend.generation.engine.ImageGenerationException;
import com.storyscene.backend.generation.engine.TimeBudget;
import com.storyscene.backend.generation.engine.UpstreamFailure;
import com.storyscene.backend.generation.entity.GenerationAttemptEntity;
import com.storyscene.backend.generation.model.LedgerMode;
import com.storyscene.backend.generation.provider.ImageGenerationCall;
import com.storyscene.backend.generation.storage.BlobStore;
import com.storyscene.backend.generation.vision.CharacterTraitDescriber;
import com.storyscene.backend.generation.vision.ReferenceImageLoader;
import com.storyscene.backend.generation.vision.VisionValidation;
import com.storyscene.backend.generation.web.RequestInProgressException;
import com.storyscene.backend.generation.web.SceneGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One scene image request from idempotency check to a terminal state.
 *
 * <p>Order of effects: validate and plan (no side effects), reserve, record the attempt,
 * generate, upload, update the scene, commit. Once a reservation exists every failure ends
 * in {@link CreditLedgerService#forceRefund}, a scene in {@code error} with a debug record,
 * and a FAILED attempt.</p>
 */
@Slf4j
@Service
public class SceneGenerationOrchestrator {

    public static final String FEATURE = "scene_image";

    public static final String STAGE_RESERVATION = "credits_reservation";
    public static final String STAGE_STORAGE = "storage_upload";
    public static final String STAGE_SCENE_UPDATE = "scene_update";
    public static final String STAGE_COMMIT = "credit_commit";
    public static final String STAGE_IDEMPOTENCY = "idempotency";
    public static final String STAGE_UNEXPECTED = "unexpected_exception";

    static final int IN_PROGRESS_RETRY_AFTER_SEC = 5;

    private final SceneContextLoader contextLoader;
    private final ScenePromptPlanner planner;
    private final CharacterTraitDescriber traitDescriber;
    private final ReferenceImageLoader referenceLoader;
    private final GenerationEngine engine;
    private final BlobStore blobs;
    private final CreditLedgerService ledger;
    private final GenerationAuditService audit;
    private final GenerationProperties props;
    private final ObjectMapper om;

    public SceneGenerationOrchestrator(
            SceneContextLoader contextLoader,
            ScenePromptPlanner planner,
            CharacterTraitDescriber traitDescriber,
            ReferenceImageLoader referenceLoader,
            GenerationEngine engine,
            BlobStore blobs,
            CreditLedgerService ledger,
            GenerationAuditService audit,
            GenerationProperties props,
            ObjectMapper om
    ) {
        this.contextLoader = contextLoader;
        this.planner = planner;
        this.traitDescriber = traitDescriber;
        this.referenceLoader = referenceLoader;
        this.engine = engine;
        this.blobs = blobs;
        this.ledger = ledger;
        this.audit = audit;
        this.props = props;
        this.om = om;
    }

    /** {@code promptOnly}: the plan a real request would use. No credits, no provider call, no writes. */
    public PromptPreviewResponse preview(Long userId, GenerationOptions opts, String rid) {
        SceneContext ctx = contextLoader.load(userId, opts.sceneId(), opts.storyId());
        PromptPlan plan = planner.plan(ctx, opts, Map.of(), rid);
        return new PromptPreviewResponse(
                true,
                true,
                plan.prompt(),
                plan.negativePrompt(),
                plan.promptHash(),
                plan.selection().model().id(),
                plan.styleId(),
                plan.assembled().truncated(),
                plan.assembled().missingSubjects(),
                plan.styleIssues(),
                plan.warnings(),
                plan.resolution().width(),
                plan.resolution().height(),
                plan.tuning().steps(),
                plan.tuning().cfgScale()
        );
    }

    /**
     * @param rid tracing id of the HTTP request, used as the idempotency key when the client sent none
     * @throws SceneGenerationException for every failure after validation, with the credit snapshot when one exists
     */
    public SceneImageResponse generate(Long userId, GenerationOptions opts, String rid) {
        TimeBudget budget = TimeBudget.start(props.getHardLimit(), props.getSafetyBuffer());
        String requestId = opts.clientRequestId() != null ? opts.clientRequestId() : rid;

        Optional<GenerationAttemptEntity> prior = audit.findAttempt(userId, requestId);
        if (prior.isPresent()) return replay(userId, prior.get(), opts.sceneId(), requestId);

        SceneContext ctx = contextLoader.load(userId, opts.sceneId(), opts.storyId());
        PromptPlan draft = planner.plan(ctx, opts, Map.of(), requestId);
        timing(requestId, "prompt", budget);

        int cost = props.getCreditCost();
        LedgerMode mode = reserve(userId, requestId, cost, ctx, draft);
        timing(requestId, "reserve", budget);

        Run run = new Run(userId, requestId, ctx, mode, budget, draft);
        try {
            run.attemptId = audit.startAttempt(userId, requestId, ctx.scene(), cost, mode, draft).getId();
        } catch (DataIntegrityViolationException e) {
            // the other request owns the reservation for this id
            log.warn("scene_generation_duplicate requestId={} userId={}", requestId, userId);
            throw new RequestInProgressException("Generation for this request is already running.", IN_PROGRESS_RETRY_AFTER_SEC);
        } catch (RuntimeException e) {
            log.error("scene_generation_attempt_insert_failed requestId={} err={}", requestId, e.toString(), e);
            throw fail(run, unexpected(requestId, e));
        }

        try {
            return execute(run, opts);
        } catch (SceneGenerationException e) {
            throw fail(run, e);
        } catch (ImageGenerationException e) {
            throw fail(run, fromEngine(run, e));
        } catch (RuntimeException e) {
            log.error("scene_generation_unexpected requestId={} err={}", requestId, e.toString(), e);
            throw fail(run, unexpected(requestId, e));
        }
    }

    private SceneImageResponse execute(Run run, GenerationOptions opts) {
        SceneContext ctx = run.ctx;
        String sceneId = ctx.scene().getId();
        String storyId = ctx.story().getId();

        audit.markSceneGenerating(sceneId);

        if (opts.characterImageReferenceEnabled() && !ctx.profilesByName().isEmpty()) {
            Map<String, String> traits = traitDescriber.describe(run.requestId, ctx.profilesByName().values(), run.budget);
            if (!traits.isEmpty()) {
                try {
                    run.plan = planner.plan(ctx, opts, traits, run.requestId);
                } catch (SceneGenerationException e) {
                    log.warn("scene_generation_traits_dropped requestId={} code={}", run.requestId, e.getErrorCode());
                }
            }
        }
        PromptPlan plan = run.plan;

        audit.logQuietly(sceneId, storyId, run.userId, GenerationAuditService.CHECK_PROMPT, "pass", promptLogDetails(plan));
        String continuityStatus = continuityStatus(ctx, plan);
        if (!plan.continuityIssues().isEmpty()) {
            for (ContinuityIssue i : plan.continuityIssues()) {
                log.warn("continuity_issue requestId={} sceneId={} type={} character={}", run.requestId, sceneId, i.type(), i.character());
            }
        }
        audit.logQuietly(sceneId, storyId, run.userId, GenerationAuditService.CHECK_CONTINUITY, continuityStatus,
                Map.of("issues", plan.continuityIssues(), "characterStatesHash", plan.characterStatesHash()));

        List<ImageGenerationCall.ReferenceImage> refs = List.of();
        if (plan.selection().model().multimodal() && opts.characterImageReferenceEnabled()) {
            refs = referenceLoader.load(plan.referenceImageUrls());
        }

        EngineResult result = engine.generate(new EngineRequest(
                run.requestId,
                plan.selection().model(),
                plan.selection().explicit(),
                plan.prompt(),
                plan.negativePrompt(),
                plan.resolution(),
                plan.tuning(),
                refs,
                plan.validationCharacters(),
                plan.styleName(),
                plan.strictStyle()
        ), run.budget);
        timing(run.requestId, "generate", run.budget);

        String objectKey = "scenes/%s/%s/%s%s".formatted(storyId, sceneId, run.requestId, result.detection().ext());
        String imageUrl;
        try {
            blobs.upload(objectKey, result.imageBytes(), result.detection().contentType());
            imageUrl = blobs.publicUrl(objectKey);
        } catch (IOException | RuntimeException e) {
            log.error("scene_generation_upload_failed requestId={} key={} err={}", run.requestId, objectKey, e.toString());
            throw new SceneGenerationException(500, "STORAGE_UPLOAD_FAILED", STAGE_STORAGE,
                    "Failed to store the generated image.", run.requestId, null, null, null);
        }
        run.objectKey = objectKey;
        timing(run.requestId, "upload", run.budget);

        String promptHash = CharacterStatesHasher.sha256Hex(result.prompt());
        VisionValidation v = result.validation();
        Double score = (v == null || v.score() == null) ? null : v.score().doubleValue();
        String status = v != null ? v.status() : continuityStatus;
        try {
            audit.markSceneCompleted(sceneId, imageUrl, promptHash, plan.characterStatesHash(), score, status,
                    consistencyDetails(plan, result));
        } catch (RuntimeException e) {
            log.error("scene_generation_scene_update_failed requestId={} err={}", run.requestId, e.toString());
            removeQuietly(run);
            throw new SceneGenerationException(500, "SCENE_UPDATE_FAILED", STAGE_SCENE_UPDATE,
                    "Failed to save the generated image.", run.requestId, null, null, null);
        }

        LedgerResult charged = charge(run, plan, result);
        timing(run.requestId, "commit", run.budget);

        try {
            audit.markSucceeded(run.attemptId, result.model(), imageUrl, result.prompt(), promptHash);
        } catch (RuntimeException e) {
            // credits and scene are settled; a stale STARTED row is left for reconciliation
            log.error("scene_generation_attempt_update_failed requestId={} err={}", run.requestId, e.toString());
        }
        audit.logQuietly(sceneId, storyId, run.userId, GenerationAuditService.CHECK_VALIDATION,
                v == null ? "skipped" : v.status(), validationLogDetails(result));

        String previousHash = ctx.scene().getCharacterStatesHash();
        if (previousHash != null && !previousHash.equals(plan.characterStatesHash())) {
            log.info("character_states_changed requestId={} sceneId={} before={} after={}",
                    run.requestId, sceneId, previousHash, plan.characterStatesHash());
        }

        List<String> warnings = new ArrayList<>(plan.warnings());
        warnings.addAll(result.warnings());
        log.info("scene_generation_done requestId={} sceneId={} model={} retried={} elapsedMs={}",
                run.requestId, sceneId, result.model(), result.retried(), run.budget.elapsedMs());

        return new SceneImageResponse(
                true,
                imageUrl,
                run.requestId,
                result.model(),
                result.prompt(),
                promptHash,
                warnings,
                CreditBalanceResponse.from(charged),
                null
        );
    }

    // ===== ledger =====

    private LedgerMode reserve(Long userId, String requestId, int cost, SceneContext ctx, PromptPlan plan) {
        LedgerResult r;
        try {
            r = ledger.reserve(userId, requestId, cost, FEATURE, ledgerMeta(ctx, plan));
        } catch (RuntimeException e) {
            log.warn("credits_reserve_unavailable requestId={} userId={} err={}", requestId, userId, e.toString());
            return unreserved(userId, requestId, cost);
        }
        if (r.ok()) return LedgerMode.RESERVED;

        if (LedgerResult.INSUFFICIENT_CREDITS.equals(r.reason())) throw insufficient(requestId, cost, r);
        if (LedgerResult.INVALID_RESERVATION_STATE.equals(r.reason())) {
            throw new SceneGenerationException(409, "REQUEST_ALREADY_SETTLED", STAGE_RESERVATION,
                    "This request id was already settled.", requestId, null, CreditBalanceResponse.from(r), null);
        }
        log.warn("credits_reserve_failed requestId={} userId={} reason={}", requestId, userId, r.reason());
        return unreserved(userId, requestId, cost);
    }

    /** Charge-on-success mode; still refuses up front when the balance visibly cannot cover the cost. */
    private LedgerMode unreserved(Long userId, String requestId, int cost) {
        LedgerResult b = balanceQuietly(userId);
        if (b != null && b.remaining() < cost) throw insufficient(requestId, cost, b);
        log.warn("scene_generation_unreserved requestId={} userId={}", requestId, userId);
        return LedgerMode.UNRESERVED;
    }

    private LedgerResult charge(Run run, PromptPlan plan, EngineResult result) {
        Map<String, Object> meta = ledgerMeta(run.ctx, plan);
        meta.put("model", result.model());

        LedgerResult r;
        try {
            r = run.mode == LedgerMode.RESERVED
                    ? ledger.commit(run.userId, run.requestId, meta)
                    : ledger.consume(run.userId, run.requestId, props.getCreditCost(), FEATURE, meta);
        } catch (RuntimeException e) {
            log.error("credits_commit_error requestId={} err={}", run.requestId, e.toString());
            r = null;
        }
        if (r != null && r.ok()) return r;

        removeQuietly(run);
        boolean insufficient = r != null && LedgerResult.INSUFFICIENT_CREDITS.equals(r.reason());
        throw new SceneGenerationException(
                insufficient ? 402 : 500,
                insufficient ? "INSUFFICIENT_CREDITS" : "CREDIT_COMMIT_FAILED",
                STAGE_COMMIT,
                insufficient ? "Not enough credits." : "Failed to finalize credits for this image.",
                run.requestId,
                r == null ? null : Map.of("reason", String.valueOf(r.reason())),
                null,
                null
        );
    }

    private SceneGenerationException insufficient(String requestId, int cost, LedgerResult r) {
        return new SceneGenerationException(402, "INSUFFICIENT_CREDITS", STAGE_RESERVATION, "Not enough credits.",
                requestId, Map.of("required", cost, "remaining", r.remaining()), CreditBalanceResponse.from(r), null);
    }

    private LedgerResult balanceQuietly(Long userId) {
        try {
            return ledger.balance(userId);
        } catch (RuntimeException e) {
            log.warn("credits_balance_unavailable userId={} err={}", userId, e.toString());
            return null;
        }
    }

    // ===== failure path =====

    /**
     * Refund, scene error with debug record, failure log row, FAILED attempt. Each step is
     * attempted even when an earlier one fails.
     */
    private SceneGenerationException fail(Run run, SceneGenerationException e) {
        String sceneId = run.ctx.scene().getId();
        log.warn("scene_generation_failed requestId={} sceneId={} stage={} code={} status={}",
                run.requestId, sceneId, e.getStage(), e.getErrorCode(), e.getHttpStatus());

        LedgerResult refund = null;
        try {
            refund = ledger.forceRefund(run.userId, run.requestId, e.getErrorCode(),
                    Map.of("stage", String.valueOf(e.getStage()), "scene_id", sceneId));
        } catch (RuntimeException ex) {
            log.error("credits_refund_failed requestId={} err={}", run.requestId, ex.toString(), ex);
        }

        Map<String, Object> debug = debugRecord(run, e);
        try {
            audit.markSceneError(sceneId, debug);
        } catch (RuntimeException ex) {
            log.error("scene_error_update_failed requestId={} err={}", run.requestId, ex.toString());
        }
        audit.logQuietly(sceneId, run.ctx.story().getId(), run.userId,
                GenerationAuditService.CHECK_IMAGE_FAILURE, "fail", debug);
        try {
            audit.markFailed(run.attemptId, e.getStage(), e.getErrorCode(), e.getMessage());
        } catch (RuntimeException ex) {
            log.error("attempt_fail_update_failed requestId={} err={}", run.requestId, ex.toString());
        }

        LedgerResult snapshot = (refund != null && refund.ok()) ? refund : balanceQuietly(run.userId);
        return snapshot == null ? e : e.withCredits(CreditBalanceResponse.from(snapshot));
    }

    private SceneGenerationException fromEngine(Run run, ImageGenerationException e) {
        UpstreamFailure f = e.getFailure();
        run.upstream.put("upstreamStatus", e.getUpstreamStatus());
        run.upstream.put("upstreamStatusText", e.getUpstreamStatusText());
        run.upstream.put("headers", e.getHeaders());
        run.upstream.put("upstreamError", e.getUpstreamError());
        run.upstream.put("model", e.getModel());
        run.upstream.put("prompt", e.getPrompt());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reasons", f.reasons());
        if (e.getUpstreamStatus() != null) details.put("upstreamStatus", e.getUpstreamStatus());
        if (e.getModel() != null) details.put("model", e.getModel());
        return new SceneGenerationException(f.httpStatus(), f.code(), e.getStage(), f.userMessage(),
                run.requestId, details, null, f.retryAfterSec());
    }

    private static SceneGenerationException unexpected(String requestId, RuntimeException e) {
        return new SceneGenerationException(500, "INTERNAL_ERROR", STAGE_UNEXPECTED,
                "Unexpected error while generating the image.", requestId,
                Map.of("exception", e.getClass().getSimpleName()), null, null);
    }

    private void removeQuietly(Run run) {
        if (run.objectKey == null) return;
        try {
            blobs.remove(List.of(run.objectKey));
            log.info("scene_generation_blob_removed requestId={} key={}", run.requestId, run.objectKey);
        } catch (IOException | RuntimeException e) {
            log.warn("scene_generation_blob_remove_failed requestId={} key={} err={}", run.requestId, run.objectKey, e.toString());
        }
        run.objectKey = null;
    }

    // ===== idempotent replay =====

    private SceneImageResponse replay(Long userId, GenerationAttemptEntity a, String sceneId, String requestId) {
        if (!Objects.equals(a.getSceneId(), sceneId)) {
            throw new SceneGenerationException(409, "REQUEST_ID_REUSED", STAGE_IDEMPOTENCY,
                    "This request id was used for a different scene.", requestId, null, null, null);
        }
        LedgerResult b = balanceQuietly(userId);
        CreditBalanceResponse credits = b == null ? null : CreditBalanceResponse.from(b);

        return switch (a.getStatus()) {
            case STARTED -> throw new RequestInProgressException(
                    "Generation for this request is already running.", IN_PROGRESS_RETRY_AFTER_SEC);
            case FAILED -> throw new SceneGenerationException(409, "REQUEST_ALREADY_FAILED",
                    a.getFailureStage() != null ? a.getFailureStage() : STAGE_IDEMPOTENCY,
                    "This request already failed. Retry with a new request id.", requestId,
                    a.getFailureCode() == null ? null : Map.of("failureCode", a.getFailureCode()), credits, null);
            case SUCCEEDED -> {
                log.info("scene_generation_replayed requestId={} sceneId={}", requestId, sceneId);
                yield new SceneImageResponse(true, a.getImageUrl(), requestId, a.getModel(), a.getPrompt(),
                        a.getPromptHash(), null, credits, true);
            }
        };
    }

    // ===== records =====

    static String continuityStatus(SceneContext ctx, PromptPlan plan) {
        if (plan.continuityIssues().isEmpty()) return "pass";
        String mode = ctx.story().getConsistencyMode();
        boolean relaxed = mode != null && mode.trim().toLowerCase(Locale.ROOT).equals("relaxed");
        return relaxed ? "warn" : "fail";
    }

    private Map<String, Object> debugRecord(Run run, SceneGenerationException e) {
        PromptPlan plan = run.plan;
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("requestId", run.requestId);
        d.put("stage", e.getStage());
        d.put("errorCode", e.getErrorCode());
        d.put("error", e.getMessage());
        d.put("httpStatus", e.getHttpStatus());
        d.put("ledgerMode", run.mode.name());
        d.put("model", plan.selection().model().id());
        d.put("prompt", plan.prompt());
        d.put("promptHash", plan.promptHash());
        d.put("negativePrompt", plan.negativePrompt());
        d.put("styleId", plan.styleId());
        d.put("intensity", plan.intensity());
        d.put("strictStyle", plan.strictStyle());
        d.put("width", plan.resolution().width());
        d.put("height", plan.resolution().height());
        d.put("steps", plan.tuning().steps());
        d.put("cfgScale", plan.tuning().cfgScale());
        d.put("truncated", plan.assembled().truncated());
        d.put("warnings", plan.warnings());
        d.put("characterStatesHash", plan.characterStatesHash());
        d.putAll(e.getDetails());
        d.putAll(run.upstream);
        d.put("elapsedMs", run.budget.elapsedMs());
        d.put("failedAt", Instant.now().toString());
        return d;
    }

    private ObjectNode consistencyDetails(PromptPlan plan, EngineResult result) {
        ObjectNode n = om.createObjectNode();
        n.set("continuity_issues", om.valueToTree(plan.continuityIssues()));
        n.set("warnings", om.valueToTree(result.warnings()));
        n.put("model", result.model());
        n.put("used_fallback", result.usedFallback());
        n.put("retried", result.retried());
        n.put("character_states_hash", plan.characterStatesHash());
        if (result.validation() != null && result.validation().raw() != null) {
            n.set("validation", result.validation().raw());
        }
        if (result.blankVerdict() != null) n.set("blank_check", om.valueToTree(result.blankVerdict()));
        return n;
    }

    private static Map<String, Object> promptLogDetails(PromptPlan plan) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("promptHash", plan.promptHash());
        d.put("styleId", plan.styleId());
        d.put("model", plan.selection().model().id());
        d.put("truncated", plan.assembled().truncated());
        d.put("missingSubjects", plan.assembled().missingSubjects());
        d.put("warnings", plan.warnings());
        return d;
    }

    private static Map<String, Object> validationLogDetails(EngineResult result) {
        Map<String, Object> d = new LinkedHashMap<>();
        VisionValidation v = result.validation();
        d.put("score", v == null ? null : v.score());
        d.put("characterScore", v == null ? null : v.characterScore());
        d.put("styleScore", v == null ? null : v.styleScore());
        d.put("retried", result.retried());
        d.put("model", result.model());
        return d;
    }

    private static Map<String, Object> ledgerMeta(SceneContext ctx, PromptPlan plan) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("scene_id", ctx.scene().getId());
        m.put("story_id", ctx.story().getId());
        m.put("model", plan.selection().model().id());
        return m;
    }

    private static void timing(String requestId, String stage, TimeBudget budget) {
        log.info("scene_generation_timing requestId={} stage={} elapsedMs={}", requestId, stage, budget.elapsedMs());
    }

    /** Mutable per-request state shared by the success and failure paths. */
    private static final class Run {
        final Long userId;
        final String requestId;
        final SceneContext ctx;
        final LedgerMode mode;
        final TimeBudget budget;
        final Map<String, Object> upstream = new LinkedHashMap<>();
        PromptPlan plan;
        Long attemptId;
        String objectKey;

        Run(Long userId, String requestId, SceneContext ctx, LedgerMode mode, TimeBudget budget, PromptPlan plan) {
            this.userId = userId;
            this.requestId = requestId;
            this.ctx = ctx;
            this.mode = mode;
            this.budget = budget;
            this.plan = plan;
        }
    }
}
