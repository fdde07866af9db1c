package com.storyscene.backend.generation.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "characters", indexes = @Index(name = "idx_characters_story", columnList = "story_id"))
public class CharacterEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "story_id", length = 36, nullable = false)
    private String storyId;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "default_clothing", columnDefinition = "TEXT")
    private String defaultClothing;

    @Column(columnDefinition = "TEXT")
    private String accessories;

    @Column(name = "physical_attributes", columnDefinition = "TEXT")
    private String physicalAttributes;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "active_reference_sheet_id", length = 36)
    private String activeReferenceSheetId;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
