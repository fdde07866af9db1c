package com.storyscene.backend.generation.repo;

import com.storyscene.backend.generation.entity.GenerationAttemptEntity;
import com.storyscene.backend.generation.model.AttemptStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface GenerationAttemptRepository extends JpaRepository<GenerationAttemptEntity, Long> {

    Optional<GenerationAttemptEntity> findByUserIdAndRequestId(Long userId, String requestId);

    List<GenerationAttemptEntity> findTop50ByStatusAndCreatedAtUtcBeforeOrderByCreatedAtUtcAsc(AttemptStatus status, Instant before);
}
