package com.ledgerly.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerly.backend.classification.CategorizationResult;
import com.ledgerly.backend.classification.TransactionCategorizer;
import com.ledgerly.backend.dto.transaction.AccountBalanceResponseDTO;
import com.ledgerly.backend.dto.transaction.TransactionFilterDTO;
import com.ledgerly.backend.dto.transaction.TransactionRequestDTO;
import com.ledgerly.backend.dto.transaction.TransactionResponseDTO;
import com.ledgerly.backend.entities.Account;
import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.enums.TransactionType;
import com.ledgerly.backend.exceptions.BadRequestException;
import com.ledgerly.backend.exceptions.ResourceNotFoundException;
import com.ledgerly.backend.mappers.LedgerTransactionMapper;
import com.ledgerly.backend.repositories.AccountRepository;
import com.ledgerly.backend.repositories.LedgerTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger reads and writes. Keeps {@code Account.currentBalance} equal to income minus expenses over the
 * account's transactions; transfers do not move the balance.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    static final int MAX_PAGE_SIZE = 100;
    static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("transactionDate"), Sort.Order.desc("createdAt"));

    private final LedgerTransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final TransactionCategorizer categorizer;

    @Transactional(readOnly = true)
    public TransactionResponseDTO findById(String id) {
        return LedgerTransactionMapper.toResponseDTO(findTransaction(id));
    }

    /**
     * One page of the user's transactions matching {@code filter}, newest first. The page size is
     * clamped to 1..100.
     */
    @Transactional(readOnly = true)
    public Page<TransactionResponseDTO> search(TransactionFilterDTO filter, int page, int size) {
        if (filter == null || filter.userId() == null) {
            throw new BadRequestException("userId is required");
        }
        if (filter.minAmount() != null && filter.maxAmount() != null
                && filter.minAmount().compareTo(filter.maxAmount()) > 0) {
            throw new BadRequestException("minAmount must not exceed maxAmount");
        }
        if (filter.startDate() != null && filter.endDate() != null && filter.startDate().isAfter(filter.endDate())) {
            throw new BadRequestException("startDate must not be after endDate");
        }

        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        String merchant = filter.merchant() == null || filter.merchant().isBlank() ? null : filter.merchant().trim();

        Page<LedgerTransaction> result = transactionRepository.search(
                filter.userId(),
                filter.accountId(),
                filter.type(),
                filter.category(),
                filter.minAmount(),
                filter.maxAmount(),
                filter.startDate(),
                filter.endDate(),
                merchant,
                filter.pending(),
                PageRequest.of(safePage, safeSize, NEWEST_FIRST)
        );
        return result.map(LedgerTransactionMapper::toResponseDTO);
    }

    public TransactionResponseDTO create(TransactionRequestDTO dto) {
        Account account = findAccount(dto.accountId());

        LedgerTransaction entity = LedgerTransactionMapper.toEntity(dto, account);
        if (dto.category() == null) {
            applySuggestedCategory(entity);
        }
        LedgerTransaction saved = transactionRepository.save(entity);

        account.setCurrentBalance(account.getCurrentBalance().add(balanceDelta(saved)));
        accountRepository.save(account);

        log.info("[TransactionService] Created transaction id={} account={} type={} amount={} category={}",
                saved.getId(), account.getId(), saved.getType(), saved.getAmount(), saved.getCategory());
        return LedgerTransactionMapper.toResponseDTO(saved);
    }

    /**
     * Without an explicit category the stored one is kept, unless the description or merchant
     * changed, in which case the transaction is categorized again.
     */
    public TransactionResponseDTO update(String id, TransactionRequestDTO dto) {
        LedgerTransaction entity = findTransaction(id);
        Account previousAccount = entity.getAccount();
        Account account = findAccount(dto.accountId());

        boolean balanceAffected = !sameAmount(entity.getAmount(), dto.amount())
                || entity.getType() != dto.type()
                || !Objects.equals(previousAccount.getId(), account.getId());
        boolean textChanged = !Objects.equals(entity.getDescription(), dto.description())
                || !Objects.equals(entity.getMerchantName(), dto.merchantName());

        LedgerTransactionMapper.updateEntity(entity, dto, account);
        if (dto.category() != null) {
            entity.setCategory(dto.category());
            entity.setSubcategory(dto.subcategory());
            entity.setConfidenceScore(null);
        } else if (textChanged || entity.getCategory() == null) {
            applySuggestedCategory(entity);
        }
        LedgerTransaction updated = transactionRepository.save(entity);

        if (balanceAffected) {
            recalculate(account);
            if (!Objects.equals(previousAccount.getId(), account.getId())) {
                recalculate(previousAccount);
            }
        }
        return LedgerTransactionMapper.toResponseDTO(updated);
    }

    public void delete(String id) {
        LedgerTransaction entity = findTransaction(id);
        Account account = entity.getAccount();
        transactionRepository.delete(entity);
        transactionRepository.flush();
        recalculate(account);
        log.info("[TransactionService] Deleted transaction id={} account={}", id, account.getId());
    }

    public AccountBalanceResponseDTO recalculateBalance(String accountId) {
        Account account = findAccount(accountId);
        BigDecimal balance = recalculate(account);
        return new AccountBalanceResponseDTO(account.getId().toString(), balance);
    }

    private BigDecimal recalculate(Account account) {
        BigDecimal balance = BigDecimal.ZERO.setScale(2);
        for (LedgerTransaction tx : transactionRepository.findByAccountId(account.getId())) {
            balance = balance.add(balanceDelta(tx));
        }
        account.setCurrentBalance(balance);
        accountRepository.save(account);
        log.debug("[TransactionService] Recalculated balance account={} balance={}", account.getId(), balance);
        return balance;
    }

    private void applySuggestedCategory(LedgerTransaction entity) {
        CategorizationResult result = categorizer.categorize(
                entity.getDescription(), entity.getAmount(), entity.getMerchantName());
        entity.setCategory(result.category());
        entity.setSubcategory(result.subcategory());
        entity.setConfidenceScore(BigDecimal.valueOf(result.confidence()).setScale(2, RoundingMode.HALF_UP));
    }

    static BigDecimal balanceDelta(LedgerTransaction tx) {
        if (tx.getAmount() == null) {
            return BigDecimal.ZERO;
        }
        if (tx.getType() == TransactionType.INCOME) {
            return tx.getAmount();
        }
        if (tx.getType() == TransactionType.EXPENSE) {
            return tx.getAmount().negate();
        }
        return BigDecimal.ZERO;
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    private Account findAccount(String accountId) {
        UUID uuid = UUID.fromString(accountId);
        return accountRepository.findById(uuid)
                .orElseThrow(() -> new ResourceNotFoundException("Account not found"));
    }

    private LedgerTransaction findTransaction(String id) {
        UUID uuid = UUID.fromString(id);
        return transactionRepository.findById(uuid)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction not found"));
    }
}
