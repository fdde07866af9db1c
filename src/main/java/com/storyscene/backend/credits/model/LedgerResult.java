package com.storyscene.backend.credits.model;

/**
 * Outcome of one ledger operation.
 * remainingMonthly/remainingBonus are spendable amounts after holds.
 */
public record LedgerResult(
        boolean ok,
        String reason,
        int remainingMonthly,
        int remainingBonus,
        int balance,
        boolean alreadyCommitted,
        boolean alreadyReleased,
        boolean alreadyRefunded
) {
    public static final String INSUFFICIENT_CREDITS = "insufficient_credits";
    public static final String INVALID_AMOUNT = "invalid_amount";
    public static final String MISSING_REQUEST_ID = "missing_request_id";
    public static final String MISSING_RESERVATION = "missing_reservation";
    public static final String INVALID_RESERVATION_STATE = "invalid_reservation_state";

    public static LedgerResult ok(int remainingMonthly, int remainingBonus, int balance) {
        return new LedgerResult(true, null, remainingMonthly, remainingBonus, balance, false, false, false);
    }

    public static LedgerResult fail(String reason, int remainingMonthly, int remainingBonus, int balance) {
        return new LedgerResult(false, reason, remainingMonthly, remainingBonus, balance, false, false, false);
    }

    public int remaining() {
        return remainingMonthly + remainingBonus;
    }

    public LedgerResult withAlreadyCommitted() {
        return new LedgerResult(ok, reason, remainingMonthly, remainingBonus, balance, true, alreadyReleased, alreadyRefunded);
    }

    public LedgerResult withAlreadyReleased() {
        return new LedgerResult(ok, reason, remainingMonthly, remainingBonus, balance, alreadyCommitted, true, alreadyRefunded);
    }

    public LedgerResult withAlreadyRefunded() {
        return new LedgerResult(ok, reason, remainingMonthly, remainingBonus, balance, alreadyCommitted, alreadyReleased, true);
    }
}
