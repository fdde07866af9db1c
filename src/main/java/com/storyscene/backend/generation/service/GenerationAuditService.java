package com.storyscene.backend.generation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storyscene.backend.generation.entity.ConsistencyLogEntity;
import com.storyscene.backend.generation.entity.GenerationAttemptEntity;
import com.storyscene.backend.generation.entity.SceneEntity;
import com.storyscene.backend.generation.model.AttemptStatus;
import com.storyscene.backend.generation.model.GenerationStatus;
import com.storyscene.backend.generation.model.LedgerMode;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import com.storyscene.backend.generation.repo.ConsistencyLogRepository;
import com.storyscene.backend.generation.repo.GenerationAttemptRepository;
import com.storyscene.backend.generation.repo.SceneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * Small, separately committed writes around one generation: the attempt row, scene status
 * transitions and consistency log rows. Nothing here touches credits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationAuditService {

    public static final String CHECK_PROMPT = "prompt_generation";
    public static final String CHECK_CONTINUITY = "continuity_check";
    public static final String CHECK_IMAGE_FAILURE = "image_generation_failure";
    public static final String CHECK_VALIDATION = "image_validation";

    static final int FAILURE_MESSAGE_MAX = 2000;

    private final GenerationAttemptRepository attempts;
    private final SceneRepository scenes;
    private final ConsistencyLogRepository logs;
    private final ObjectMapper om;

    @Transactional(readOnly = true)
    public Optional<GenerationAttemptEntity> findAttempt(Long userId, String requestId) {
        return attempts.findByUserIdAndRequestId(userId, requestId);
    }

    /**
     * Inserts the STARTED row. The (user, request) unique key makes this the point where two
     * concurrent requests with the same id are told apart.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when the row already exists
     */
    @Transactional
    public GenerationAttemptEntity startAttempt(Long userId, String requestId, SceneEntity scene,
                                                int credits, LedgerMode mode, PromptPlan plan) {
        GenerationAttemptEntity a = new GenerationAttemptEntity();
        a.setUserId(userId);
        a.setRequestId(requestId);
        a.setSceneId(scene.getId());
        a.setStoryId(scene.getStoryId());
        a.setStatus(AttemptStatus.STARTED);
        a.setCreditsAmount(credits);
        a.setLedgerMode(mode);
        a.setModel(plan.selection().model().id());
        a.setPromptHash(plan.promptHash());
        a.setPrompt(plan.prompt());
        return attempts.saveAndFlush(a);
    }

    @Transactional
    public void markSucceeded(Long attemptId, String model, String imageUrl, String prompt, String promptHash) {
        attempts.findById(attemptId).ifPresent(a -> {
            a.setStatus(AttemptStatus.SUCCEEDED);
            a.setModel(model);
            a.setImageUrl(imageUrl);
            // the prompt actually sent, so a replay hashes to promptHash
            a.setPrompt(prompt);
            a.setPromptHash(promptHash);
            attempts.save(a);
        });
    }

    @Transactional
    public void markFailed(Long attemptId, String stage, String code, String message) {
        if (attemptId == null) return;
        attempts.findById(attemptId).ifPresent(a -> {
            a.setStatus(AttemptStatus.FAILED);
            a.setFailureStage(stage);
            a.setFailureCode(code);
            a.setFailureMessage(PromptSanitizer.truncate(message, FAILURE_MESSAGE_MAX));
            attempts.save(a);
        });
    }

    @Transactional
    public void markSceneGenerating(String sceneId) {
        scenes.findById(sceneId).ifPresent(s -> {
            s.setGenerationStatus(GenerationStatus.GENERATING);
            scenes.save(s);
        });
    }

    @Transactional
    public void markSceneCompleted(String sceneId, String imageUrl, String promptHash, String characterStatesHash,
                                   Double consistencyScore, String consistencyStatus, JsonNode consistencyDetails) {
        SceneEntity s = scenes.findById(sceneId).orElseThrow(() -> new IllegalStateException("SCENE_NOT_FOUND"));
        s.setGenerationStatus(GenerationStatus.COMPLETED);
        s.setImageUrl(imageUrl);
        s.setPromptHash(promptHash);
        s.setCharacterStatesHash(characterStatesHash);
        s.setConsistencyScore(consistencyScore);
        s.setConsistencyStatus(consistencyStatus);
        s.setConsistencyDetails(consistencyDetails);
        scenes.save(s);
    }

    /**
     * Sets the scene to {@code error} and stores the debug record under
     * {@code consistency_details.generation_debug}, keeping any other keys.
     */
    @Transactional
    public void markSceneError(String sceneId, Map<String, Object> debug) {
        scenes.findById(sceneId).ifPresent(s -> {
            ObjectNode details = s.getConsistencyDetails() instanceof ObjectNode o ? o.deepCopy() : om.createObjectNode();
            details.set("generation_debug", om.valueToTree(debug));
            s.setGenerationStatus(GenerationStatus.ERROR);
            s.setConsistencyDetails(details);
            scenes.save(s);
        });
    }

    /** Returns the scene to {@code error} only if it is still {@code generating}. */
    @Transactional
    public boolean markSceneErrorIfGenerating(String sceneId, Map<String, Object> debug) {
        Optional<SceneEntity> s = scenes.findById(sceneId);
        if (s.isEmpty() || s.get().getGenerationStatus() != GenerationStatus.GENERATING) return false;
        markSceneError(sceneId, debug);
        return true;
    }

    @Transactional
    public void log(String sceneId, String storyId, Long userId, String checkType, String status, Map<String, Object> details) {
        ConsistencyLogEntity e = new ConsistencyLogEntity();
        e.setSceneId(sceneId);
        e.setStoryId(storyId);
        e.setUserId(userId);
        e.setCheckType(checkType);
        e.setStatus(status);
        e.setDetails(details == null ? null : om.valueToTree(details));
        logs.save(e);
    }

    /** Logging rows are best effort; a failure here never changes the request outcome. */
    public void logQuietly(String sceneId, String storyId, Long userId, String checkType, String status, Map<String, Object> details) {
        try {
            log(sceneId, storyId, userId, checkType, status, details);
        } catch (RuntimeException e) {
            log.warn("consistency_log_failed sceneId={} checkType={} err={}", sceneId, checkType, e.toString());
        }
    }
}
