package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.StyleGuideEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface StyleGuideRepository extends JpaRepository<StyleGuideEntity, Long> {
    Optional<StyleGuideEntity> findFirstByStoryIdOrderByCreatedAtUtcDesc(String storyId);
}
