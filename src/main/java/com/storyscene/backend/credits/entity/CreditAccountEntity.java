package com.storyscene.backend.credits.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "credit_accounts")
public class CreditAccountEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "monthly_allowance", nullable = false)
    private int monthlyAllowance;

    @Column(name = "monthly_used", nullable = false)
    private int monthlyUsed;

    @Column(name = "bonus_total", nullable = false)
    private int bonusTotal;

    @Column(name = "bonus_used", nullable = false)
    private int bonusUsed;

    @Column(name = "reserved_monthly", nullable = false)
    private int reservedMonthly;

    @Column(name = "reserved_bonus", nullable = false)
    private int reservedBonus;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        if (updatedAtUtc == null) updatedAtUtc = Instant.now();
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }

    /** Monthly credits still spendable after outstanding holds. */
    public int remainingMonthly() {
        return Math.max(monthlyAllowance - monthlyUsed - reservedMonthly, 0);
    }

    public int remainingBonus() {
        return Math.max(bonusTotal - bonusUsed - reservedBonus, 0);
    }

    /** Settled balance, holds not subtracted. */
    public int settledBalance() {
        return Math.max(0, monthlyAllowance - monthlyUsed + bonusTotal - bonusUsed);
    }
}
