package com.ledgerly.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerly.backend.dto.ApiResponse;
import com.ledgerly.backend.dto.ledger.BalanceSummaryDTO;
import com.ledgerly.backend.dto.ledger.MonthlyPointDTO;
import com.ledgerly.backend.dto.ledger.SpendingBreakdownDTO;
import com.ledgerly.backend.exceptions.BadRequestException;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/ledger/{userId}")
@RequiredArgsConstructor
public class LedgerController {

    private static final int MAX_DAYS = 366;
    private static final int MAX_MONTHS = 24;

    private final LedgerAggregator ledgerAggregator;

    @GetMapping("/balances")
    public ResponseEntity<ApiResponse<BalanceSummaryDTO>> balances(@PathVariable UUID userId) {
        return ResponseEntity.ok(ApiResponse.success(ledgerAggregator.accountBalances(userId), "Balances loaded"));
    }

    @GetMapping("/breakdown")
    public ResponseEntity<ApiResponse<SpendingBreakdownDTO>> breakdown(
            @PathVariable UUID userId,
            @RequestParam(defaultValue = "30") int days
    ) {
        if (days < 1 || days > MAX_DAYS) {
            throw new BadRequestException("days must be between 1 and " + MAX_DAYS);
        }
        SpendingBreakdownDTO breakdown = ledgerAggregator.categoryBreakdown(userId, ledgerAggregator.lastDays(days));
        return ResponseEntity.ok(ApiResponse.success(breakdown, "Spending breakdown loaded"));
    }

    @GetMapping("/trend")
    public ResponseEntity<ApiResponse<List<MonthlyPointDTO>>> trend(
            @PathVariable UUID userId,
            @RequestParam(required = false) Integer months
    ) {
        if (months == null) {
            return ResponseEntity.ok(ApiResponse.success(ledgerAggregator.monthlyTrend(userId), "Monthly trend loaded"));
        }
        if (months < 1 || months > MAX_MONTHS) {
            throw new BadRequestException("months must be between 1 and " + MAX_MONTHS);
        }
        return ResponseEntity.ok(ApiResponse.success(ledgerAggregator.monthlyTrend(userId, months), "Monthly trend loaded"));
    }
}
