package com.storyscene.backend.credits.entity;

import com.storyscene.backend.credits.model.ReservationStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "credit_reservations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_credit_reservations_user_req",
                columnNames = {"user_id", "request_id"}
        )
)
public class CreditReservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "request_id", length = 64, nullable = false)
    private String requestId;

    @Column(nullable = false)
    private int amount;

    @Column(name = "monthly_amount", nullable = false)
    private int monthlyAmount;

    @Column(name = "bonus_amount", nullable = false)
    private int bonusAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ReservationStatus status = ReservationStatus.RESERVED;

    @Column(length = 64)
    private String feature;

    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private String metadataJson;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
        if (status == null) status = ReservationStatus.RESERVED;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
