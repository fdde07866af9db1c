package com.storyscene.backend.credits.entity;

import com.storyscene.backend.credits.model.TransactionType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Append-only ledger row. One row per (user, request, type).
 */
@Getter
@Setter
@Entity
@Table(
        name = "credit_transactions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_credit_tx_user_req_type",
                columnNames = {"user_id", "request_id", "transaction_type"}
        ),
        indexes = @Index(name = "idx_credit_tx_user_created", columnList = "user_id,created_at_utc")
)
public class CreditTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "request_id", length = 64, nullable = false)
    private String requestId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 16)
    private TransactionType type;

    /** USAGE is negative, REFUND positive, holds record the held quantity. */
    @Column(nullable = false)
    private int amount;

    @Column(name = "monthly_portion", nullable = false)
    private int monthlyPortion;

    @Column(name = "bonus_portion", nullable = false)
    private int bonusPortion;

    @Column(length = 255)
    private String description;

    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private String metadataJson;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
