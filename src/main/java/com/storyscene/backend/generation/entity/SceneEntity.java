package com.storyscene.backend.generation.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.storyscene.backend.generation.model.GenerationStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(
        name = "scenes",
        indexes = @Index(name = "idx_scenes_story_number", columnList = "story_id,scene_number")
)
public class SceneEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "story_id", length = 36, nullable = false)
    private String storyId;

    @Column(name = "scene_number", nullable = false)
    private int sceneNumber;

    @Column(length = 255)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "original_text", columnDefinition = "TEXT")
    private String originalText;

    @Column(length = 255)
    private String setting;

    @Column(name = "emotional_tone", length = 128)
    private String emotionalTone;

    @Column(name = "image_prompt", columnDefinition = "TEXT")
    private String imagePrompt;

    /** JSON array of character names. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "characters", columnDefinition = "JSON")
    private JsonNode characters;

    /** JSON object: character name -> appearance snapshot. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "character_states", columnDefinition = "JSON")
    private JsonNode characterStates;

    @Enumerated(EnumType.STRING)
    @Column(name = "generation_status", nullable = false, length = 16)
    private GenerationStatus generationStatus = GenerationStatus.PENDING;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "consistency_score")
    private Double consistencyScore;

    @Column(name = "consistency_status", length = 16)
    private String consistencyStatus;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "consistency_details", columnDefinition = "JSON")
    private JsonNode consistencyDetails;

    @Column(name = "character_states_hash", length = 64)
    private String characterStatesHash;

    @Column(name = "prompt_hash", length = 64)
    private String promptHash;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (generationStatus == null) generationStatus = GenerationStatus.PENDING;
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
