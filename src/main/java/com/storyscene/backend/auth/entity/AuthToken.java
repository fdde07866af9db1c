package com.storyscene.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Access token issued by the account service. This backend only reads it.
 */
@Getter
@Setter
@Entity
@Table(name = "auth_tokens")
public class AuthToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TokenType type = TokenType.ACCESS;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean revoked = false;

    public enum TokenType { ACCESS, REFRESH }

    public boolean isActiveAt(Instant now) {
        return !revoked
                && type == TokenType.ACCESS
                && expiresAt != null
                && expiresAt.isAfter(now);
    }
}
