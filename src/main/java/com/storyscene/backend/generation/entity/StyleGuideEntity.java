package com.storyscene.backend.generation.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "style_guides", indexes = @Index(name = "idx_style_guides_story", columnList = "story_id"))
public class StyleGuideEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "story_id", length = 36, nullable = false)
    private String storyId;

    @Column(name = "rendering_techniques", columnDefinition = "TEXT")
    private String renderingTechniques;

    @Column(name = "lighting_and_shading", columnDefinition = "TEXT")
    private String lightingAndShading;

    @Column(name = "color_palette", columnDefinition = "TEXT")
    private String colorPalette;

    @Column(name = "perspective_and_composition", columnDefinition = "TEXT")
    private String perspectiveAndComposition;

    @Column(name = "positive_prompt", columnDefinition = "TEXT")
    private String positivePrompt;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
