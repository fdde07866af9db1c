package com.storyscene.backend.credits.repo;

import com.storyscene.backend.credits.entity.CreditTransactionEntity;
import com.storyscene.backend.credits.model.TransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CreditTransactionRepository extends JpaRepository<CreditTransactionEntity, Long> {

    Optional<CreditTransactionEntity> findByUserIdAndRequestIdAndType(Long userId, String requestId, TransactionType type);

    List<CreditTransactionEntity> findByUserIdAndRequestIdOrderByIdAsc(Long userId, String requestId);

    /** Settled net of one request: USAGE + REFUND rows only. */
    @Query("""
            select coalesce(sum(t.amount), 0)
            from CreditTransactionEntity t
            where t.userId = :userId
              and t.requestId = :requestId
              and t.type in (com.storyscene.backend.credits.model.TransactionType.USAGE,
                             com.storyscene.backend.credits.model.TransactionType.REFUND)
            """)
    long settledNet(@Param("userId") Long userId, @Param("requestId") String requestId);
}
