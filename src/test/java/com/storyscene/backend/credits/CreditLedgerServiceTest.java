package com.storyscene.backend.credits;

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
import com.storyscene.backend.credits.service.CreditLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CreditLedgerServiceTest {

    private CreditAccountRepository accounts;
    private CreditReservationRepository reservations;
    private CreditTransactionRepository transactions;
    private CreditLedgerService ledger;
    private CreditAccountEntity acc;

    @BeforeEach
    void setUp() {
        accounts = mock(CreditAccountRepository.class);
        reservations = mock(CreditReservationRepository.class);
        transactions = mock(CreditTransactionRepository.class);
        ledger = new CreditLedgerService(accounts, reservations, transactions, new ObjectMapper(), 5, 0);

        acc = new CreditAccountEntity();
        acc.setUserId(1L);
        acc.setMonthlyAllowance(5);
        acc.setMonthlyUsed(4);
        acc.setBonusTotal(3);

        when(accounts.findForUpdate(1L)).thenReturn(Optional.of(acc));
        when(reservations.findByUserIdAndRequestId(anyLong(), anyString())).thenReturn(Optional.empty());
        when(transactions.findByUserIdAndRequestIdAndType(anyLong(), anyString(), any())).thenReturn(Optional.empty());
    }

    private CreditReservationEntity reservation(ReservationStatus status, int monthly, int bonus) {
        CreditReservationEntity r = new CreditReservationEntity();
        r.setUserId(1L);
        r.setRequestId("req-1");
        r.setAmount(monthly + bonus);
        r.setMonthlyAmount(monthly);
        r.setBonusAmount(bonus);
        r.setStatus(status);
        r.setFeature("scene_image");
        when(reservations.findByUserIdAndRequestId(1L, "req-1")).thenReturn(Optional.of(r));
        return r;
    }

    private CreditTransactionEntity lastTx() {
        ArgumentCaptor<CreditTransactionEntity> tx = ArgumentCaptor.forClass(CreditTransactionEntity.class);
        verify(transactions).save(tx.capture());
        return tx.getValue();
    }

    @Test
    void reserve_draws_monthly_first_then_bonus() {
        LedgerResult r = ledger.reserve(1L, "req-1", 3, "scene_image", Map.of("sceneId", "s1"));

        assertThat(r.ok()).isTrue();
        assertThat(acc.getReservedMonthly()).isEqualTo(1);
        assertThat(acc.getReservedBonus()).isEqualTo(2);
        assertThat(r.remaining()).isZero();
        // holds do not change the settled balance
        assertThat(r.balance()).isEqualTo(4);

        ArgumentCaptor<CreditReservationEntity> saved = ArgumentCaptor.forClass(CreditReservationEntity.class);
        verify(reservations).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(ReservationStatus.RESERVED);
        assertThat(saved.getValue().getMetadataJson()).contains("\"feature\":\"scene_image\"", "\"sceneId\":\"s1\"");

        CreditTransactionEntity tx = lastTx();
        assertThat(tx.getType()).isEqualTo(TransactionType.RESERVATION);
        assertThat(tx.getAmount()).isEqualTo(3);
    }

    @Test
    void reserve_refuses_when_credits_are_short() {
        LedgerResult r = ledger.reserve(1L, "req-1", 5, "scene_image", null);

        assertThat(r.ok()).isFalse();
        assertThat(r.reason()).isEqualTo(LedgerResult.INSUFFICIENT_CREDITS);
        assertThat(r.remaining()).isEqualTo(4);
        verify(reservations, never()).save(any());
        verify(transactions, never()).save(any());
    }

    @Test
    void reserve_is_idempotent_per_request_id() {
        reservation(ReservationStatus.RESERVED, 1, 0);

        LedgerResult r = ledger.reserve(1L, "req-1", 1, "scene_image", null);

        assertThat(r.ok()).isTrue();
        verify(reservations, never()).save(any());
    }

    @Test
    void reserve_after_release_is_an_invalid_state() {
        reservation(ReservationStatus.RELEASED, 1, 0);

        LedgerResult r = ledger.reserve(1L, "req-1", 1, "scene_image", null);

        assertThat(r.reason()).isEqualTo(LedgerResult.INVALID_RESERVATION_STATE);
    }

    @Test
    void reserve_after_an_audit_refund_is_an_invalid_state() {
        when(transactions.findByUserIdAndRequestIdAndType(1L, "req-1", TransactionType.REFUND))
                .thenReturn(Optional.of(new CreditTransactionEntity()));

        LedgerResult r = ledger.reserve(1L, "req-1", 1, "scene_image", null);

        assertThat(r.ok()).isFalse();
        assertThat(r.reason()).isEqualTo(LedgerResult.INVALID_RESERVATION_STATE);
        assertThat(acc.getReservedMonthly()).isZero();
        verify(reservations, never()).save(any());
    }

    @Test
    void commit_moves_the_hold_to_used() {
        acc.setReservedMonthly(1);
        CreditReservationEntity res = reservation(ReservationStatus.RESERVED, 1, 0);

        LedgerResult r = ledger.commit(1L, "req-1", null);

        assertThat(r.ok()).isTrue();
        assertThat(acc.getMonthlyUsed()).isEqualTo(5);
        assertThat(acc.getReservedMonthly()).isZero();
        assertThat(res.getStatus()).isEqualTo(ReservationStatus.COMMITTED);
        CreditTransactionEntity tx = lastTx();
        assertThat(tx.getType()).isEqualTo(TransactionType.USAGE);
        assertThat(tx.getAmount()).isEqualTo(-1);
    }

    @Test
    void second_commit_reports_already_committed() {
        reservation(ReservationStatus.COMMITTED, 1, 0);

        LedgerResult r = ledger.commit(1L, "req-1", null);

        assertThat(r.ok()).isTrue();
        assertThat(r.alreadyCommitted()).isTrue();
        verify(transactions, never()).save(any());
    }

    @Test
    void commit_without_reservation_fails() {
        assertThat(ledger.commit(1L, "req-9", null).reason()).isEqualTo(LedgerResult.MISSING_RESERVATION);
    }

    @Test
    void release_of_a_committed_reservation_is_refused() {
        reservation(ReservationStatus.COMMITTED, 1, 0);

        assertThat(ledger.release(1L, "req-1", "x", null).reason()).isEqualTo(LedgerResult.INVALID_RESERVATION_STATE);
    }

    @Test
    void force_refund_reverses_a_committed_charge_once() {
        CreditReservationEntity res = reservation(ReservationStatus.COMMITTED, 1, 0);

        LedgerResult r = ledger.forceRefund(1L, "req-1", "storage_upload", null);

        assertThat(r.ok()).isTrue();
        assertThat(acc.getMonthlyUsed()).isEqualTo(3);
        assertThat(res.getStatus()).isEqualTo(ReservationStatus.REFUNDED);
        CreditTransactionEntity tx = lastTx();
        assertThat(tx.getType()).isEqualTo(TransactionType.REFUND);
        assertThat(tx.getAmount()).isEqualTo(1);
        assertThat(tx.getMetadataJson()).contains("\"reason\":\"storage_upload\"");

        assertThat(ledger.forceRefund(1L, "req-1", "again", null).alreadyRefunded()).isTrue();
    }

    @Test
    void force_refund_releases_an_open_hold() {
        acc.setReservedBonus(1);
        CreditReservationEntity res = reservation(ReservationStatus.RESERVED, 0, 1);

        ledger.forceRefund(1L, "req-1", "upstream_generation", null);

        assertThat(acc.getReservedBonus()).isZero();
        assertThat(res.getStatus()).isEqualTo(ReservationStatus.RELEASED);
        assertThat(lastTx().getType()).isEqualTo(TransactionType.RELEASE);
    }

    @Test
    void force_refund_reverses_an_unreserved_usage() {
        CreditTransactionEntity usage = new CreditTransactionEntity();
        usage.setType(TransactionType.USAGE);
        usage.setAmount(-1);
        usage.setMonthlyPortion(1);
        usage.setBonusPortion(0);
        when(transactions.findByUserIdAndRequestIdAndType(1L, "req-1", TransactionType.USAGE)).thenReturn(Optional.of(usage));

        ledger.forceRefund(1L, "req-1", "scene_update", null);

        assertThat(acc.getMonthlyUsed()).isEqualTo(3);
        CreditTransactionEntity tx = lastTx();
        assertThat(tx.getType()).isEqualTo(TransactionType.REFUND);
        assertThat(tx.getAmount()).isEqualTo(1);
    }

    @Test
    void force_refund_without_any_charge_writes_an_audit_row() {
        ledger.forceRefund(1L, "req-1", "upstream_generation", null);

        CreditTransactionEntity tx = lastTx();
        assertThat(tx.getType()).isEqualTo(TransactionType.REFUND);
        assertThat(tx.getAmount()).isZero();
        assertThat(tx.getMetadataJson()).contains("\"no_reservation\":true");
        assertThat(acc.getMonthlyUsed()).isEqualTo(4);
    }

    @Test
    void consume_charges_directly_and_is_idempotent() {
        LedgerResult r = ledger.consume(1L, "req-1", 1, "scene_image", null);

        assertThat(r.ok()).isTrue();
        assertThat(acc.getMonthlyUsed()).isEqualTo(5);
        CreditTransactionEntity tx = lastTx();
        assertThat(tx.getAmount()).isEqualTo(-1);
        assertThat(tx.getMetadataJson()).contains("\"reservation_bypassed\":true");

        when(transactions.findByUserIdAndRequestIdAndType(1L, "req-1", TransactionType.USAGE)).thenReturn(Optional.of(tx));
        assertThat(ledger.consume(1L, "req-1", 1, "scene_image", null).alreadyCommitted()).isTrue();
    }

    @Test
    void first_touch_creates_the_account() {
        CreditAccountEntity fresh = new CreditAccountEntity();
        fresh.setUserId(2L);
        fresh.setMonthlyAllowance(5);
        when(accounts.findForUpdate(2L)).thenReturn(Optional.empty(), Optional.of(fresh));

        LedgerResult r = ledger.balance(2L);

        assertThat(r.remaining()).isEqualTo(5);
        verify(accounts).insertIfAbsent(eq(2L), eq(5), eq(0), any());
    }

    @Test
    void blank_request_id_and_bad_amount_are_rejected_without_locking() {
        assertThat(ledger.reserve(1L, " ", 1, "scene_image", null).reason()).isEqualTo(LedgerResult.MISSING_REQUEST_ID);
        assertThat(ledger.reserve(1L, "req-1", 0, "scene_image", null).reason()).isEqualTo(LedgerResult.INVALID_AMOUNT);
        verify(accounts, never()).findForUpdate(anyLong());
    }
}
