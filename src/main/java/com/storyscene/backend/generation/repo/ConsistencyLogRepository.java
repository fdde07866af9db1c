package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.ConsistencyLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConsistencyLogRepository extends JpaRepository<ConsistencyLogEntity, Long> {
    List<ConsistencyLogEntity> findBySceneIdOrderByIdAsc(String sceneId);
}
