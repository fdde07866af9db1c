package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.StoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StoryRepository extends JpaRepository<StoryEntity, String> {
}
