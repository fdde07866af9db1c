package com.storyscene.backend.generation.entity;

import com.storyscene.backend.generation.model.AttemptStatus;
import com.storyscene.backend.generation.model.LedgerMode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "generation_attempts",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_generation_attempts_user_req",
                columnNames = {"user_id", "request_id"}
        ),
        indexes = @Index(name = "idx_generation_attempts_status", columnList = "status,created_at_utc")
)
public class GenerationAttemptEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "request_id", length = 64, nullable = false)
    private String requestId;

    @Column(name = "scene_id", length = 36, nullable = false)
    private String sceneId;

    @Column(name = "story_id", length = 36)
    private String storyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AttemptStatus status = AttemptStatus.STARTED;

    @Column(name = "credits_amount", nullable = false)
    private int creditsAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger_mode", nullable = false, length = 16)
    private LedgerMode ledgerMode = LedgerMode.RESERVED;

    @Column(name = "failure_stage", length = 32)
    private String failureStage;

    @Column(name = "failure_code", length = 64)
    private String failureCode;

    @Column(name = "failure_message", columnDefinition = "TEXT")
    private String failureMessage;

    @Column(length = 64)
    private String model;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "prompt_hash", length = 64)
    private String promptHash;

    @Column(columnDefinition = "TEXT")
    private String prompt;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
        if (status == null) status = AttemptStatus.STARTED;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
