package com.storyscene.backend.generation.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Per-character appearance row of one scene. Written once, read by later scenes.
 */
@Getter
@Setter
@Entity
@Table(
        name = "scene_character_states",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_scene_character_states",
                columnNames = {"scene_id", "character_id"}
        )
)
public class SceneCharacterStateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scene_id", length = 36, nullable = false)
    private String sceneId;

    @Column(name = "character_id", length = 36, nullable = false)
    private String characterId;

    @Column(columnDefinition = "TEXT")
    private String clothing;

    @Column(columnDefinition = "TEXT")
    private String state;

    @Column(name = "physical_attributes", columnDefinition = "TEXT")
    private String physicalAttributes;

    @Column(columnDefinition = "TEXT")
    private String accessories;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extra", columnDefinition = "JSON")
    private JsonNode extra;
}
