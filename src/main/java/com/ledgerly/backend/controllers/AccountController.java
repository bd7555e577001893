package com.ledgerly.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerly.backend.dto.ApiResponse;
import com.ledgerly.backend.dto.transaction.AccountBalanceResponseDTO;
import com.ledgerly.backend.services.TransactionService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final TransactionService transactionService;

    @PostMapping("/{accountId}/recalculate-balance")
    public ResponseEntity<ApiResponse<AccountBalanceResponseDTO>> recalculateBalance(@PathVariable String accountId) {
        AccountBalanceResponseDTO balance = transactionService.recalculateBalance(accountId);
        return ResponseEntity.ok(ApiResponse.success(balance, "Balance recalculated"));
    }
}
