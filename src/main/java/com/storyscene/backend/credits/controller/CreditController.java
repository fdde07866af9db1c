package com.storyscene.backend.credits.controller;

import com.storyscene.backend.auth.security.AuthContext;
import com.storyscene.backend.credits.dto.CreditBalanceResponse;
import com.storyscene.backend.credits.service.CreditLedgerService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Credits", description = "Credit balance")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/credits")
public class CreditController {

    private final AuthContext auth;
    private final CreditLedgerService ledger;

    @GetMapping("/balance")
    public CreditBalanceResponse balance() {
        Long uid = auth.requireUserId();
        return CreditBalanceResponse.from(ledger.balance(uid));
    }
}
