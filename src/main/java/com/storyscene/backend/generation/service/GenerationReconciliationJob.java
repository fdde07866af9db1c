package com.storyscene.backend.generation.service;

import com.storyscene.backend.credits.service.CreditLedgerService;
import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.entity.GenerationAttemptEntity;
import com.storyscene.backend.generation.model.AttemptStatus;
import com.storyscene.backend.generation.repo.GenerationAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settles attempts left in STARTED by a crashed or killed request: refund, FAILED attempt,
 * scene back to {@code error} if it is still {@code generating}.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.generation.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GenerationReconciliationJob {

    public static final String STAGE = "reconciliation";
    public static final String CODE = "ATTEMPT_STALE";

    private final GenerationAttemptRepository attempts;
    private final CreditLedgerService ledger;
    private final GenerationAuditService audit;
    private final GenerationProperties props;

    @Scheduled(fixedDelayString = "${app.generation.reconciliation.interval:PT2M}")
    public void runScheduled() {
        reconcile(Instant.now());
    }

    /** @return number of attempts settled */
    public int reconcile(Instant now) {
        Instant staleBefore = now.minus(props.getReconciliation().getStaleAfter());
        List<GenerationAttemptEntity> stale =
                attempts.findTop50ByStatusAndCreatedAtUtcBeforeOrderByCreatedAtUtcAsc(AttemptStatus.STARTED, staleBefore);

        int settled = 0;
        for (GenerationAttemptEntity a : stale) {
            try {
                settle(a);
                settled++;
            } catch (RuntimeException e) {
                // next run picks it up again
                log.error("reconcile_attempt_failed requestId={} userId={} err={}", a.getRequestId(), a.getUserId(), e.toString(), e);
            }
        }
        if (settled > 0) log.warn("reconciled stale STARTED attempts: count={}", settled);
        return settled;
    }

    private void settle(GenerationAttemptEntity a) {
        ledger.forceRefund(a.getUserId(), a.getRequestId(), CODE, Map.of("stage", STAGE, "scene_id", a.getSceneId()));
        audit.markFailed(a.getId(), STAGE, CODE, "Attempt did not finish in time");

        Map<String, Object> debug = new LinkedHashMap<>();
        debug.put("requestId", a.getRequestId());
        debug.put("stage", STAGE);
        debug.put("errorCode", CODE);
        debug.put("model", a.getModel());
        debug.put("promptHash", a.getPromptHash());
        debug.put("ledgerMode", a.getLedgerMode().name());
        debug.put("startedAt", String.valueOf(a.getCreatedAtUtc()));
        if (audit.markSceneErrorIfGenerating(a.getSceneId(), debug)) {
            audit.logQuietly(a.getSceneId(), a.getStoryId(), a.getUserId(),
                    GenerationAuditService.CHECK_IMAGE_FAILURE, "fail", debug);
        }
        log.info("reconciled_attempt requestId={} userId={} sceneId={}", a.getRequestId(), a.getUserId(), a.getSceneId());
    }
}
