package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.SceneEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface SceneRepository extends JpaRepository<SceneEntity, String> {

    /** Scenes before the given one, ascending by scene number. */
    List<SceneEntity> findByStoryIdAndSceneNumberLessThanOrderBySceneNumberAsc(String storyId, int sceneNumber);

    List<SceneEntity> findByStoryIdOrderBySceneNumberAsc(String storyId);

    @Modifying
    @Query("""
            update SceneEntity s
            set s.generationStatus = com.storyscene.backend.generation.model.GenerationStatus.PENDING,
                s.imageUrl = null,
                s.consistencyScore = null,
                s.consistencyStatus = null,
                s.consistencyDetails = null,
                s.promptHash = null,
                s.updatedAtUtc = :now
            where s.storyId = :storyId
            """)
    int resetAllForStory(@Param("storyId") String storyId, @Param("now") Instant now);
}
