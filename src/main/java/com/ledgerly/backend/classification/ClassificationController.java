package com.ledgerly.backend.classification;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ledgerly.backend.classification.dto.CategorizeTransactionRequestDTO;
import com.ledgerly.backend.classification.dto.CategorizeTransactionResponseDTO;
import com.ledgerly.backend.dto.ApiResponse;
import com.ledgerly.backend.exceptions.ConflictException;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/classification")
@RequiredArgsConstructor
@Slf4j
public class ClassificationController {

    private final TransactionCategorizer categorizer;
    private final CategoryModelTrainingService trainingService;

    @PostMapping("/categorize")
    public ResponseEntity<ApiResponse<CategorizeTransactionResponseDTO>> categorize(
            @Valid @RequestBody CategorizeTransactionRequestDTO request
    ) {
        CategorizationResult result = categorizer.categorize(
                request.description(), request.amount(), request.merchantName());
        var body = new CategorizeTransactionResponseDTO(result.category(), result.subcategory(), result.confidence());
        return ResponseEntity.ok(ApiResponse.success(body, "Category suggested"));
    }

    @PostMapping("/model/retrain")
    public ResponseEntity<ApiResponse<Void>> retrain() {
        log.info("[ClassificationController] Retrain requested");
        try {
            trainingService.retrainFromLedger();
        } catch (TaskRejectedException e) {
            log.warn("[ClassificationController] Retrain rejected, training queue is full");
            throw new ConflictException("A retrain is already in progress, try again later");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(null, "Retraining started"));
    }
}
