package com.storyscene.backend.generation.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "consistency_logs", indexes = @Index(name = "idx_consistency_logs_scene", columnList = "scene_id"))
public class ConsistencyLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scene_id", length = 36, nullable = false)
    private String sceneId;

    @Column(name = "story_id", length = 36)
    private String storyId;

    @Column(name = "user_id")
    private Long userId;

    /** prompt_generation, continuity_check, image_generation_failure, image_validation */
    @Column(name = "check_type", nullable = false, length = 48)
    private String checkType;

    @Column(nullable = false, length = 16)
    private String status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSON")
    private JsonNode details;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
