package com.storyscene.backend.credits.repo;

import com.storyscene.backend.credits.entity.CreditAccountEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface CreditAccountRepository extends JpaRepository<CreditAccountEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from CreditAccountEntity a where a.userId = :userId")
    Optional<CreditAccountEntity> findForUpdate(@Param("userId") Long userId);

    /** First touch of the ledger creates the account; concurrent first touches collapse into one row. */
    @Modifying
    @Query(
            value = """
            INSERT IGNORE INTO credit_accounts(user_id, monthly_allowance, monthly_used, bonus_total, bonus_used,
                                               reserved_monthly, reserved_bonus, updated_at_utc)
            VALUES (:userId, :monthly, 0, :bonus, 0, 0, 0, :now)
            """,
            nativeQuery = true
    )
    int insertIfAbsent(@Param("userId") Long userId,
                       @Param("monthly") int monthlyAllowance,
                       @Param("bonus") int bonusTotal,
                       @Param("now") Instant now);
}
