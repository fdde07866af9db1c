package com.storyscene.backend.generation.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Approved canonical look of a character: a prompt snippet, an optional reference image
 * and an outfit timeline ({@code [{"scene_range":{"start":1,"end":3},"clothing":"..."}]}).
 */
@Getter
@Setter
@Entity
@Table(
        name = "character_reference_sheets",
        indexes = @Index(name = "idx_ref_sheets_character", columnList = "character_id")
)
public class CharacterReferenceSheetEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "character_id", length = 36, nullable = false)
    private String characterId;

    @Column(nullable = false)
    private boolean approved;

    @Column(name = "prompt_snippet", columnDefinition = "TEXT")
    private String promptSnippet;

    @Column(name = "reference_image_url", length = 1024)
    private String referenceImageUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "outfit_variations", columnDefinition = "JSON")
    private JsonNode outfitVariations;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
