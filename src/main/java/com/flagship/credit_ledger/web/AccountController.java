package com.flagship.credit_ledger.web;

import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.LedgerService;
import com.flagship.credit_ledger.web.dto.AccountResponse;
import com.flagship.credit_ledger.web.dto.LedgerEventResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private static final int MAX_HISTORY = 500;

    private final AccountService accountService;
    private final LedgerService ledgerService;

    @GetMapping("/{userKey}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("userKey") String userKey) {
        return ResponseEntity.ok(AccountResponse.from(accountService.require(userKey)));
    }

    /**
     * Newest events first.
     */
    @GetMapping("/{userKey}/events")
    public ResponseEntity<List<LedgerEventResponse>> getEvents(@PathVariable("userKey") String userKey,
                                                               @RequestParam(name = "limit", defaultValue = "50") int limit) {
        Account account = accountService.require(userKey);
        List<LedgerEventResponse> events = ledgerService.history(account.getId(), Math.min(limit, MAX_HISTORY))
            .stream()
            .map(LedgerEventResponse::from)
            .toList();
        return ResponseEntity.ok(events);
    }
}
