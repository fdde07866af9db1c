package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.SceneCharacterStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface SceneCharacterStateRepository extends JpaRepository<SceneCharacterStateEntity, Long> {
    List<SceneCharacterStateEntity> findBySceneIdIn(Collection<String> sceneIds);
}
