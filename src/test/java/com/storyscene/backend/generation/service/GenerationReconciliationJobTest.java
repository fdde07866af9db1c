package com.storyscene.backend.generation.service;

import com.storyscene.backend.credits.service.CreditLedgerService;
import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.entity.GenerationAttemptEntity;
import com.storyscene.backend.generation.model.AttemptStatus;
import com.storyscene.backend.generation.model.LedgerMode;
import com.storyscene.backend.generation.repo.GenerationAttemptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerationReconciliationJobTest {

    private GenerationAttemptRepository attempts;
    private CreditLedgerService ledger;
    private GenerationAuditService audit;
    private GenerationReconciliationJob job;

    @BeforeEach
    void setUp() {
        attempts = mock(GenerationAttemptRepository.class);
        ledger = mock(CreditLedgerService.class);
        audit = mock(GenerationAuditService.class);
        GenerationProperties props = new GenerationProperties();
        props.getReconciliation().setStaleAfter(Duration.ofMinutes(5));
        job = new GenerationReconciliationJob(attempts, ledger, audit, props);
    }

    private static GenerationAttemptEntity attempt(long id, String requestId) {
        GenerationAttemptEntity a = new GenerationAttemptEntity();
        a.setId(id);
        a.setUserId(7L);
        a.setRequestId(requestId);
        a.setSceneId("scene-" + id);
        a.setStoryId("story-1");
        a.setLedgerMode(LedgerMode.RESERVED);
        a.setCreatedAtUtc(Instant.parse("2026-01-01T00:00:00Z"));
        return a;
    }

    @Test
    void stale_attempts_are_refunded_and_failed() {
        Instant now = Instant.parse("2026-01-01T00:10:00Z");
        when(attempts.findTop50ByStatusAndCreatedAtUtcBeforeOrderByCreatedAtUtcAsc(
                AttemptStatus.STARTED, Instant.parse("2026-01-01T00:05:00Z")))
                .thenReturn(List.of(attempt(1, "r-1")));
        when(audit.markSceneErrorIfGenerating(eq("scene-1"), anyMap())).thenReturn(true);

        int settled = job.reconcile(now);

        assertThat(settled).isEqualTo(1);
        verify(ledger).forceRefund(eq(7L), eq("r-1"), eq(GenerationReconciliationJob.CODE), anyMap());
        verify(audit).markFailed(1L, GenerationReconciliationJob.STAGE, GenerationReconciliationJob.CODE,
                "Attempt did not finish in time");
        verify(audit).logQuietly(eq("scene-1"), eq("story-1"), eq(7L),
                eq(GenerationAuditService.CHECK_IMAGE_FAILURE), eq("fail"), anyMap());
    }

    @Test
    void finished_scene_is_left_alone() {
        when(attempts.findTop50ByStatusAndCreatedAtUtcBeforeOrderByCreatedAtUtcAsc(any(), any()))
                .thenReturn(List.of(attempt(2, "r-2")));
        when(audit.markSceneErrorIfGenerating(eq("scene-2"), anyMap())).thenReturn(false);

        job.reconcile(Instant.now());

        verify(audit, never()).logQuietly(anyString(), anyString(), any(), anyString(), anyString(), anyMap());
    }

    @Test
    void one_broken_attempt_does_not_stop_the_sweep() {
        when(attempts.findTop50ByStatusAndCreatedAtUtcBeforeOrderByCreatedAtUtcAsc(any(), any()))
                .thenReturn(List.of(attempt(3, "r-3"), attempt(4, "r-4")));
        when(ledger.forceRefund(eq(7L), eq("r-3"), anyString(), anyMap())).thenThrow(new IllegalStateException("db down"));

        int settled = job.reconcile(Instant.now());

        assertThat(settled).isEqualTo(1);
        verify(audit).markFailed(eq(4L), anyString(), anyString(), anyString());
        verify(audit, never()).markFailed(eq(3L), anyString(), anyString(), anyString());
    }
}
