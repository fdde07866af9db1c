package com.storyscene.backend.generation.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "stories", indexes = @Index(name = "idx_stories_user", columnList = "user_id"))
public class StoryEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(length = 255)
    private String title;

    @Column(name = "art_style", length = 64)
    private String artStyle;

    /** Stored style strength used when a request does not carry a usable one. */
    @Column(name = "style_intensity")
    private Integer styleIntensity;

    /** {@code strict} (default) or {@code relaxed}; decides whether continuity issues log as fail or warn. */
    @Column(name = "consistency_mode", length = 16)
    private String consistencyMode;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
