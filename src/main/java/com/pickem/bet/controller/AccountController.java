package com.pickem.bet.controller;

import com.pickem.bet.entity.LedgerEntry;
import com.pickem.bet.entity.UserAccount;
import com.pickem.bet.finance.LedgerService;
import com.pickem.bet.interfaces.CurrentUserProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/account")
public class AccountController {

    private final LedgerService ledgerService;
    private final CurrentUserProvider currentUserProvider;

    /**
     * Account of the caller. The first call opens it with the starting balance.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getAccount() {
        String userId = currentUserProvider.currentUserId();
        UserAccount account = ledgerService.openAccount(userId, currentUserProvider.currentDisplayName().orElse(null));

        Map<String, Object> response = new HashMap<>();
        response.put("userId", account.getUserId());
        response.put("displayName", account.getDisplayName());
        response.put("balance", account.getBalance());
        response.put("createdAt", account.getCreatedAt());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/ledger")
    public ResponseEntity<Map<String, Object>> getLedger(@RequestParam(defaultValue = "0") int page) {
        String userId = currentUserProvider.currentUserId();
        Page<LedgerEntry> entries = ledgerService.history(userId, page);

        Map<String, Object> response = new HashMap<>();
        response.put("entries", entries.getContent());
        response.put("page", entries.getNumber());
        response.put("totalPages", entries.getTotalPages());
        return ResponseEntity.ok(response);
    }
}
