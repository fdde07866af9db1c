package com.storyscene.backend.credits.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyscene.backend.credits.entity.CreditAccountEntity;
import com.storyscene.backend.credits.entity.CreditReservationEntity;
import com.storyscene.backend.credits.entity.CreditTransactionEntity;
import com.storyscene.backend.credits.model.LedgerResult;
import com.storyscene.backend.credits.model.ReservationStatus;
import com.storyscene.backend.credits.model.TransactionType;
import com.storyscene.backend.credits.repo.CreditAccountRepository;
import com.storyscene.backend.credits.repo.CreditReservationRepository;
import com.storyscene.backend.credits.repo.CreditTransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Credit ledger: reserve, commit, release, forceRefund and the unreserved consume fallback.
 *
 * <p>Every public operation runs in its own transaction and starts by locking the user's
 * account row (SELECT ... FOR UPDATE). Reservation rows and ledger rows are only read and
 * written under that lock, so two requests of the same user are serialized here and
 * nowhere else.</p>
 *
 * <p>For one request id the settled net (sum of USAGE and REFUND rows) ends at either
 * {@code -amount} or {@code 0}.</p>
 */
@Slf4j
@Service
public class CreditLedgerService {

    private final CreditAccountRepository accounts;
    private final CreditReservationRepository reservations;
    private final CreditTransactionRepository transactions;
    private final ObjectMapper om;
    private final int defaultMonthlyAllowance;
    private final int defaultBonus;

    public CreditLedgerService(
            CreditAccountRepository accounts,
            CreditReservationRepository reservations,
            CreditTransactionRepository transactions,
            ObjectMapper om,
            @Value("${app.credits.default-monthly-allowance:5}") int defaultMonthlyAllowance,
            @Value("${app.credits.default-bonus:0}") int defaultBonus
    ) {
        this.accounts = accounts;
        this.reservations = reservations;
        this.transactions = transactions;
        this.om = om;
        this.defaultMonthlyAllowance = Math.max(0, defaultMonthlyAllowance);
        this.defaultBonus = Math.max(0, defaultBonus);
    }

    @Transactional
    public LedgerResult reserve(Long userId, String requestId, int amount, String feature, Map<String, Object> metadata) {
        if (isBlank(requestId)) return LedgerResult.fail(LedgerResult.MISSING_REQUEST_ID, 0, 0, 0);
        if (amount <= 0) return LedgerResult.fail(LedgerResult.INVALID_AMOUNT, 0, 0, 0);

        CreditAccountEntity acc = lockAccount(userId);

        Optional<CreditReservationEntity> existing = reservations.findByUserIdAndRequestId(userId, requestId);
        if (existing.isPresent()) {
            ReservationStatus st = existing.get().getStatus();
            if (st == ReservationStatus.RESERVED || st == ReservationStatus.COMMITTED) {
                log.info("credits_reserve_idempotent userId={} requestId={} status={}", userId, requestId, st);
                return snapshot(acc);
            }
            return fail(LedgerResult.INVALID_RESERVATION_STATE, acc);
        }
        // an audit-only refund already settled this id
        if (transactions.findByUserIdAndRequestIdAndType(userId, requestId, TransactionType.REFUND).isPresent()) {
            log.warn("credits_reserve_after_refund userId={} requestId={}", userId, requestId);
            return fail(LedgerResult.INVALID_RESERVATION_STATE, acc);
        }

        int remM = acc.remainingMonthly();
        int remB = acc.remainingBonus();
        if (remM + remB < amount) {
            log.info("credits_reserve_insufficient userId={} requestId={} amount={} remainingMonthly={} remainingBonus={}",
                    userId, requestId, amount, remM, remB);
            return fail(LedgerResult.INSUFFICIENT_CREDITS, acc);
        }

        // monthly pool first, bonus for the remainder
        int useMonthly = Math.min(remM, amount);
        int useBonus = amount - useMonthly;

        acc.setReservedMonthly(acc.getReservedMonthly() + useMonthly);
        acc.setReservedBonus(acc.getReservedBonus() + useBonus);
        accounts.save(acc);

        Map<String, Object> meta = merge(metadata, "feature", feature);

        CreditReservationEntity r = new CreditReservationEntity();
        r.setUserId(userId);
        r.setRequestId(requestId);
        r.setAmount(amount);
        r.setMonthlyAmount(useMonthly);
        r.setBonusAmount(useBonus);
        r.setStatus(ReservationStatus.RESERVED);
        r.setFeature(feature);
        r.setMetadataJson(toJson(meta));
        reservations.save(r);

        appendTx(userId, requestId, TransactionType.RESERVATION, amount, useMonthly, useBonus,
                "Credit reservation", meta);

        log.info("credits_reserved userId={} requestId={} amount={} monthly={} bonus={}",
                userId, requestId, amount, useMonthly, useBonus);
        return snapshot(acc);
    }

    @Transactional
    public LedgerResult commit(Long userId, String requestId, Map<String, Object> metadata) {
        if (isBlank(requestId)) return LedgerResult.fail(LedgerResult.MISSING_REQUEST_ID, 0, 0, 0);

        CreditAccountEntity acc = lockAccount(userId);
        Optional<CreditReservationEntity> found = reservations.findByUserIdAndRequestId(userId, requestId);
        if (found.isEmpty()) return fail(LedgerResult.MISSING_RESERVATION, acc);

        return commitLocked(acc, found.get(), metadata);
    }

    @Transactional
    public LedgerResult release(Long userId, String requestId, String reason, Map<String, Object> metadata) {
        if (isBlank(requestId)) return LedgerResult.fail(LedgerResult.MISSING_REQUEST_ID, 0, 0, 0);

        CreditAccountEntity acc = lockAccount(userId);
        Optional<CreditReservationEntity> found = reservations.findByUserIdAndRequestId(userId, requestId);
        if (found.isEmpty()) return fail(LedgerResult.MISSING_RESERVATION, acc);

        CreditReservationEntity r = found.get();
        return switch (r.getStatus()) {
            case RESERVED -> releaseLocked(acc, r, reason, metadata);
            case RELEASED -> snapshot(acc).withAlreadyReleased();
            case REFUNDED -> snapshot(acc).withAlreadyRefunded();
            case COMMITTED -> fail(LedgerResult.INVALID_RESERVATION_STATE, acc);
        };
    }

    /**
     * Unconditional recovery path. Looks up whatever state exists for the request id and
     * makes the account whole exactly once. Safe to call any number of times.
     */
    @Transactional
    public LedgerResult forceRefund(Long userId, String requestId, String reason, Map<String, Object> metadata) {
        if (isBlank(requestId)) return LedgerResult.fail(LedgerResult.MISSING_REQUEST_ID, 0, 0, 0);

        CreditAccountEntity acc = lockAccount(userId);
        Optional<CreditReservationEntity> found = reservations.findByUserIdAndRequestId(userId, requestId);

        if (found.isPresent()) {
            CreditReservationEntity r = found.get();
            return switch (r.getStatus()) {
                case RESERVED -> releaseLocked(acc, r, reason, metadata);
                case COMMITTED -> refundCommittedLocked(acc, r, reason, metadata);
                case RELEASED -> snapshot(acc).withAlreadyReleased();
                case REFUNDED -> snapshot(acc).withAlreadyRefunded();
            };
        }

        if (transactions.findByUserIdAndRequestIdAndType(userId, requestId, TransactionType.REFUND).isPresent()) {
            return snapshot(acc).withAlreadyRefunded();
        }

        Optional<CreditTransactionEntity> usage =
                transactions.findByUserIdAndRequestIdAndType(userId, requestId, TransactionType.USAGE);

        if (usage.isPresent()) {
            // unreserved charge: reverse it with the pools it was drawn from
            CreditTransactionEntity u = usage.get();
            restoreUsed(acc, u.getMonthlyPortion(), u.getBonusPortion());
            accounts.save(acc);
            appendTx(userId, requestId, TransactionType.REFUND, -u.getAmount(), u.getMonthlyPortion(), u.getBonusPortion(),
                    "Refund for failed generation", merge(metadata, "reason", reason));
            log.info("credits_refunded_unreserved userId={} requestId={} amount={}", userId, requestId, -u.getAmount());
            return snapshot(acc);
        }

        // nothing was held or charged; keep the audit trail complete
        Map<String, Object> meta = merge(metadata, "reason", reason);
        meta.put("no_reservation", true);
        appendTx(userId, requestId, TransactionType.REFUND, 0, 0, 0, "Failed generation (no charge)", meta);
        log.info("credits_refund_audit_only userId={} requestId={} reason={}", userId, requestId, reason);
        return snapshot(acc);
    }

    /**
     * Charge-on-success path used when no reservation could be made for the request.
     * Idempotent per request id.
     */
    @Transactional
    public LedgerResult consume(Long userId, String requestId, int amount, String feature, Map<String, Object> metadata) {
        if (isBlank(requestId)) return LedgerResult.fail(LedgerResult.MISSING_REQUEST_ID, 0, 0, 0);
        if (amount <= 0) return LedgerResult.fail(LedgerResult.INVALID_AMOUNT, 0, 0, 0);

        CreditAccountEntity acc = lockAccount(userId);

        Optional<CreditReservationEntity> reserved = reservations.findByUserIdAndRequestId(userId, requestId);
        if (reserved.isPresent()) {
            return commitLocked(acc, reserved.get(), metadata);
        }

        if (transactions.findByUserIdAndRequestIdAndType(userId, requestId, TransactionType.USAGE).isPresent()) {
            return snapshot(acc).withAlreadyCommitted();
        }
        if (transactions.findByUserIdAndRequestIdAndType(userId, requestId, TransactionType.REFUND).isPresent()) {
            return fail(LedgerResult.INVALID_RESERVATION_STATE, acc);
        }

        int remM = acc.remainingMonthly();
        int remB = acc.remainingBonus();
        if (remM + remB < amount) {
            return fail(LedgerResult.INSUFFICIENT_CREDITS, acc);
        }

        int useMonthly = Math.min(remM, amount);
        int useBonus = amount - useMonthly;
        acc.setMonthlyUsed(acc.getMonthlyUsed() + useMonthly);
        acc.setBonusUsed(acc.getBonusUsed() + useBonus);
        accounts.save(acc);

        Map<String, Object> meta = merge(metadata, "feature", feature);
        meta.put("reservation_bypassed", true);
        appendTx(userId, requestId, TransactionType.USAGE, -amount, useMonthly, useBonus, "Image generation", meta);

        log.warn("credits_consumed_unreserved userId={} requestId={} amount={}", userId, requestId, amount);
        return snapshot(acc);
    }

    @Transactional
    public LedgerResult balance(Long userId) {
        return snapshot(lockAccount(userId));
    }

    /** Sum of USAGE and REFUND rows for one request. */
    @Transactional(readOnly = true)
    public long settledNet(Long userId, String requestId) {
        return transactions.settledNet(userId, requestId);
    }

    // ===== locked helpers =====

    private LedgerResult commitLocked(CreditAccountEntity acc, CreditReservationEntity r, Map<String, Object> metadata) {
        if (r.getStatus() == ReservationStatus.COMMITTED) {
            return snapshot(acc).withAlreadyCommitted();
        }
        if (r.getStatus() != ReservationStatus.RESERVED) {
            log.warn("credits_commit_rejected userId={} requestId={} status={}", r.getUserId(), r.getRequestId(), r.getStatus());
            return fail(LedgerResult.INVALID_RESERVATION_STATE, acc);
        }

        acc.setMonthlyUsed(acc.getMonthlyUsed() + r.getMonthlyAmount());
        acc.setBonusUsed(acc.getBonusUsed() + r.getBonusAmount());
        acc.setReservedMonthly(Math.max(0, acc.getReservedMonthly() - r.getMonthlyAmount()));
        acc.setReservedBonus(Math.max(0, acc.getReservedBonus() - r.getBonusAmount()));
        accounts.save(acc);

        r.setStatus(ReservationStatus.COMMITTED);
        reservations.save(r);

        appendTx(r.getUserId(), r.getRequestId(), TransactionType.USAGE, -r.getAmount(),
                r.getMonthlyAmount(), r.getBonusAmount(), "Image generation", merge(metadata, "feature", r.getFeature()));

        log.info("credits_committed userId={} requestId={} amount={}", r.getUserId(), r.getRequestId(), r.getAmount());
        return snapshot(acc);
    }

    private LedgerResult releaseLocked(CreditAccountEntity acc, CreditReservationEntity r, String reason, Map<String, Object> metadata) {
        acc.setReservedMonthly(Math.max(0, acc.getReservedMonthly() - r.getMonthlyAmount()));
        acc.setReservedBonus(Math.max(0, acc.getReservedBonus() - r.getBonusAmount()));
        accounts.save(acc);

        r.setStatus(ReservationStatus.RELEASED);
        reservations.save(r);

        appendTx(r.getUserId(), r.getRequestId(), TransactionType.RELEASE, r.getAmount(),
                r.getMonthlyAmount(), r.getBonusAmount(), "Credit reservation released", merge(metadata, "reason", reason));

        log.info("credits_released userId={} requestId={} amount={} reason={}", r.getUserId(), r.getRequestId(), r.getAmount(), reason);
        return snapshot(acc);
    }

    private LedgerResult refundCommittedLocked(CreditAccountEntity acc, CreditReservationEntity r, String reason, Map<String, Object> metadata) {
        restoreUsed(acc, r.getMonthlyAmount(), r.getBonusAmount());
        accounts.save(acc);

        r.setStatus(ReservationStatus.REFUNDED);
        reservations.save(r);

        appendTx(r.getUserId(), r.getRequestId(), TransactionType.REFUND, r.getAmount(),
                r.getMonthlyAmount(), r.getBonusAmount(), "Refund for failed generation", merge(metadata, "reason", reason));

        log.info("credits_refunded userId={} requestId={} amount={} reason={}", r.getUserId(), r.getRequestId(), r.getAmount(), reason);
        return snapshot(acc);
    }

    private static void restoreUsed(CreditAccountEntity acc, int monthly, int bonus) {
        acc.setMonthlyUsed(Math.max(0, acc.getMonthlyUsed() - monthly));
        acc.setBonusUsed(Math.max(0, acc.getBonusUsed() - bonus));
    }

    private CreditAccountEntity lockAccount(Long userId) {
        if (userId == null) throw new IllegalArgumentException("USER_ID_REQUIRED");

        Optional<CreditAccountEntity> acc = accounts.findForUpdate(userId);
        if (acc.isPresent()) return acc.get();

        accounts.insertIfAbsent(userId, defaultMonthlyAllowance, defaultBonus, Instant.now());
        return accounts.findForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("CREDIT_ACCOUNT_MISSING"));
    }

    private void appendTx(Long userId, String requestId, TransactionType type, int amount,
                          int monthlyPortion, int bonusPortion, String description, Map<String, Object> meta) {
        if (transactions.findByUserIdAndRequestIdAndType(userId, requestId, type).isPresent()) {
            log.warn("credits_tx_exists userId={} requestId={} type={}", userId, requestId, type);
            return;
        }
        CreditTransactionEntity t = new CreditTransactionEntity();
        t.setUserId(userId);
        t.setRequestId(requestId);
        t.setType(type);
        t.setAmount(amount);
        t.setMonthlyPortion(monthlyPortion);
        t.setBonusPortion(bonusPortion);
        t.setDescription(description);
        t.setMetadataJson(toJson(meta));
        transactions.save(t);
    }

    private static LedgerResult snapshot(CreditAccountEntity acc) {
        return LedgerResult.ok(acc.remainingMonthly(), acc.remainingBonus(), acc.settledBalance());
    }

    private static LedgerResult fail(String reason, CreditAccountEntity acc) {
        return LedgerResult.fail(reason, acc.remainingMonthly(), acc.remainingBonus(), acc.settledBalance());
    }

    private static Map<String, Object> merge(Map<String, Object> base, String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>();
        if (base != null) m.putAll(base);
        if (value != null) m.put(key, value);
        return m;
    }

    private String toJson(Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) return null;
        try {
            return om.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            log.warn("credits_metadata_not_serializable keys={} err={}", meta.keySet(), e.getOriginalMessage());
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
