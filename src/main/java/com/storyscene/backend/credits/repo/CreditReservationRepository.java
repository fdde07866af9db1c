package com.storyscene.backend.credits.repo;

import com.storyscene.backend.credits.entity.CreditReservationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CreditReservationRepository extends JpaRepository<CreditReservationEntity, Long> {

    Optional<CreditReservationEntity> findByUserIdAndRequestId(Long userId, String requestId);
}
