package com.ledgerly.backend.controllers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerly.backend.dto.ApiResponse;
import com.ledgerly.backend.dto.ledger.TransactionSummaryDTO;
import com.ledgerly.backend.dto.transaction.TransactionFilterDTO;
import com.ledgerly.backend.dto.transaction.TransactionRequestDTO;
import com.ledgerly.backend.dto.transaction.TransactionResponseDTO;
import com.ledgerly.backend.enums.TransactionCategory;
import com.ledgerly.backend.enums.TransactionType;
import com.ledgerly.backend.exceptions.BadRequestException;
import com.ledgerly.backend.services.TransactionService;
import com.ledgerly.backend.services.ledger.LedgerAggregator;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionService transactionService;
    private final LedgerAggregator ledgerAggregator;

    @PostMapping
    public ResponseEntity<ApiResponse<TransactionResponseDTO>> create(
            @Valid @RequestBody TransactionRequestDTO request
    ) {
        TransactionResponseDTO created = transactionService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Transaction created"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Page<TransactionResponseDTO>>> list(
            @RequestParam UUID userId,
            @RequestParam(required = false) UUID accountId,
            @RequestParam(required = false) TransactionType type,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) String merchant,
            @RequestParam(required = false) Boolean pending,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        TransactionFilterDTO filter = new TransactionFilterDTO(userId, accountId, type, parseCategory(category),
                minAmount, maxAmount, startDate, endDate, merchant, pending);
        Page<TransactionResponseDTO> result = transactionService.search(filter, page, size);
        return ResponseEntity.ok(ApiResponse.success(result, "Transactions loaded"));
    }

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<TransactionSummaryDTO>> summary(
            @RequestParam UUID userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        TransactionSummaryDTO summary = ledgerAggregator.transactionSummary(userId, startDate, endDate);
        return ResponseEntity.ok(ApiResponse.success(summary, "Transaction summary loaded"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<TransactionResponseDTO>> findById(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(transactionService.findById(id), "Transaction found"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<TransactionResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody TransactionRequestDTO request
    ) {
        TransactionResponseDTO updated = transactionService.update(id, request);
        return ResponseEntity.ok(ApiResponse.success(updated, "Transaction updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        transactionService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Transaction deleted"));
    }

    private static TransactionCategory parseCategory(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return TransactionCategory.fromValue(raw)
                .orElseThrow(() -> new BadRequestException("Unknown transaction category: " + raw));
    }
}
