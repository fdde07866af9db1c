package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.CharacterEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CharacterRepository extends JpaRepository<CharacterEntity, String> {
    List<CharacterEntity> findByStoryIdOrderByNameAsc(String storyId);
}
