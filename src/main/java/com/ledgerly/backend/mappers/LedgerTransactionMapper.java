package com.ledgerly.backend.mappers;

import com.ledgerly.backend.dto.transaction.TransactionRequestDTO;
import com.ledgerly.backend.dto.transaction.TransactionResponseDTO;
import com.ledgerly.backend.entities.Account;
import com.ledgerly.backend.entities.LedgerTransaction;

public class LedgerTransactionMapper {

    private LedgerTransactionMapper() {}

    public static LedgerTransaction toEntity(TransactionRequestDTO dto, Account account) {
        return LedgerTransaction.builder()
                .account(account)
                .description(dto.description())
                .merchantName(dto.merchantName())
                .amount(dto.amount())
                .type(dto.type())
                .category(dto.category())
                .subcategory(dto.subcategory())
                .transactionDate(dto.transactionDate())
                .recurring(Boolean.TRUE.equals(dto.recurring()))
                .pending(Boolean.TRUE.equals(dto.pending()))
                .build();
    }

    /**
     * Copies everything but the category fields, which the service resolves separately.
     */
    public static void updateEntity(LedgerTransaction entity, TransactionRequestDTO dto, Account account) {
        entity.setAccount(account);
        entity.setDescription(dto.description());
        entity.setMerchantName(dto.merchantName());
        entity.setAmount(dto.amount());
        entity.setType(dto.type());
        entity.setTransactionDate(dto.transactionDate());
        if (dto.recurring() != null) {
            entity.setRecurring(dto.recurring());
        }
        if (dto.pending() != null) {
            entity.setPending(dto.pending());
        }
    }

    public static TransactionResponseDTO toResponseDTO(LedgerTransaction entity) {
        return new TransactionResponseDTO(
                entity.getId() != null ? entity.getId().toString() : null,
                entity.getAccount() != null && entity.getAccount().getId() != null
                        ? entity.getAccount().getId().toString()
                        : null,
                entity.getDescription(),
                entity.getMerchantName(),
                entity.getAmount(),
                entity.getType(),
                entity.getCategory(),
                entity.getSubcategory(),
                entity.getConfidenceScore(),
                entity.isRecurring(),
                entity.isPending(),
                entity.getTransactionDate(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
