package com.storyscene.backend.credits;

import com.storyscene.backend.credits.entity.CreditTransactionEntity;
import com.storyscene.backend.credits.model.LedgerResult;
import com.storyscene.backend.credits.model.TransactionType;
import com.storyscene.backend.credits.repo.CreditTransactionRepository;
import com.storyscene.backend.credits.service.CreditLedgerService;
import com.storyscene.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Ledger against a real database: row locks, unique keys and the settled-net rule.
 */
@SpringBootTest
class CreditLedgerConcurrencyTest extends BaseSpringTest {

    @Autowired CreditLedgerService ledger;
    @Autowired CreditTransactionRepository transactions;

    @Test
    void concurrent_reservations_never_overdraw() throws Exception {
        long userId = 9001L;
        assertThat(ledger.balance(userId).remaining()).isEqualTo(5);

        int threads = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LedgerResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String requestId = "race-" + i;
                Callable<LedgerResult> task = () -> {
                    start.await();
                    return ledger.reserve(userId, requestId, 1, "scene_image", null);
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int ok = 0;
            int insufficient = 0;
            for (Future<LedgerResult> f : results) {
                LedgerResult r = f.get(30, TimeUnit.SECONDS);
                if (r.ok()) ok++;
                else if (LedgerResult.INSUFFICIENT_CREDITS.equals(r.reason())) insufficient++;
            }
            assertThat(ok).isEqualTo(5);
            assertThat(insufficient).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }

        assertThat(ledger.balance(userId).remaining()).isZero();
    }

    @Test
    void refunded_request_settles_to_zero_and_committed_to_minus_amount() {
        long userId = 9002L;

        ledger.reserve(userId, "ok-1", 1, "scene_image", null);
        ledger.commit(userId, "ok-1", null);

        ledger.reserve(userId, "fail-1", 1, "scene_image", null);
        ledger.commit(userId, "fail-1", null);
        ledger.forceRefund(userId, "fail-1", "storage_upload", null);
        ledger.forceRefund(userId, "fail-1", "storage_upload", null);

        ledger.reserve(userId, "fail-2", 1, "scene_image", null);
        ledger.forceRefund(userId, "fail-2", "upstream_generation", null);

        assertThat(ledger.settledNet(userId, "ok-1")).isEqualTo(-1);
        assertThat(ledger.settledNet(userId, "fail-1")).isZero();
        assertThat(ledger.settledNet(userId, "fail-2")).isZero();

        LedgerResult balance = ledger.balance(userId);
        assertThat(balance.remaining()).isEqualTo(4);
        assertThat(balance.balance()).isEqualTo(4);

        List<TransactionType> fail1 = transactions.findByUserIdAndRequestIdOrderByIdAsc(userId, "fail-1").stream()
                .map(CreditTransactionEntity::getType)
                .toList();
        assertThat(fail1).containsExactly(TransactionType.RESERVATION, TransactionType.USAGE, TransactionType.REFUND);
    }

    @Test
    void unreserved_consume_and_refund_balance_out() {
        long userId = 9003L;

        assertThat(ledger.consume(userId, "direct-1", 2, "scene_image", null).ok()).isTrue();
        assertThat(ledger.consume(userId, "direct-1", 2, "scene_image", null).alreadyCommitted()).isTrue();
        assertThat(ledger.balance(userId).remaining()).isEqualTo(3);

        ledger.forceRefund(userId, "direct-1", "scene_update", null);

        assertThat(ledger.settledNet(userId, "direct-1")).isZero();
        assertThat(ledger.balance(userId).remaining()).isEqualTo(5);
    }

    @Test
    void refunded_id_cannot_be_charged_again() {
        long userId = 9004L;

        ledger.forceRefund(userId, "late-1", "upstream_generation", null);

        LedgerResult reserve = ledger.reserve(userId, "late-1", 1, "scene_image", null);
        LedgerResult consume = ledger.consume(userId, "late-1", 1, "scene_image", null);

        assertThat(reserve.reason()).isEqualTo(LedgerResult.INVALID_RESERVATION_STATE);
        assertThat(consume.reason()).isEqualTo(LedgerResult.INVALID_RESERVATION_STATE);
        assertThat(ledger.settledNet(userId, "late-1")).isZero();
        assertThat(ledger.balance(userId).remaining()).isEqualTo(5);
    }
}
