package com.storyscene.backend.credits.dto;

import com.storyscene.backend.credits.model.LedgerResult;

public record CreditBalanceResponse(
        int remainingMonthly,
        int remainingBonus,
        int remaining,
        int balance
) {
    public static CreditBalanceResponse from(LedgerResult r) {
        return new CreditBalanceResponse(r.remainingMonthly(), r.remainingBonus(), r.remaining(), r.balance());
    }
}
