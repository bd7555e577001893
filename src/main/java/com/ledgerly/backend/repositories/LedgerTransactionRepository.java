package com.ledgerly.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.ledgerly.backend.entities.LedgerTransaction;
import com.ledgerly.backend.enums.TransactionCategory;
import com.ledgerly.backend.enums.TransactionType;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, UUID> {

    List<LedgerTransaction> findByAccountId(UUID accountId);

    List<LedgerTransaction> findByAccountUserIdAndTransactionDateBetween(
            UUID userId,
            LocalDate startDate,
            LocalDate endDate
    );

    List<LedgerTransaction> findByAccountUserIdAndTypeAndTransactionDateBetween(
            UUID userId,
            TransactionType type,
            LocalDate startDate,
            LocalDate endDate
    );

    List<LedgerTransaction> findByAccountUserIdOrderByTransactionDateDescCreatedAtDesc(
            UUID userId,
            Pageable pageable
    );

    List<LedgerTransaction> findByAccountUserIdAndAmountBetweenOrderByTransactionDateDescCreatedAtDesc(
            UUID userId,
            BigDecimal minAmount,
            BigDecimal maxAmount,
            Pageable pageable
    );

    List<LedgerTransaction> findByAccountUserIdAndTypeAndRecurringTrueAndTransactionDateBetween(
            UUID userId,
            TransactionType type,
            LocalDate startDate,
            LocalDate endDate
    );

    /**
     * A user's transactions; every null criterion is ignored. Merchant matches case-insensitively
     * anywhere in the name.
     */
    @Query("""
            select t from LedgerTransaction t
            where t.account.userId = :userId
            and (:accountId is null or t.account.id = :accountId)
            and (:type is null or t.type = :type)
            and (:category is null or t.category = :category)
            and (:minAmount is null or t.amount >= :minAmount)
            and (:maxAmount is null or t.amount <= :maxAmount)
            and (:startDate is null or t.transactionDate >= :startDate)
            and (:endDate is null or t.transactionDate <= :endDate)
            and (:merchant is null
                or lower(t.merchantName) like lower(concat('%', cast(:merchant as string), '%')))
            and (:pending is null or t.pending = :pending)
            """)
    Page<LedgerTransaction> search(
            @Param("userId") UUID userId,
            @Param("accountId") UUID accountId,
            @Param("type") TransactionType type,
            @Param("category") TransactionCategory category,
            @Param("minAmount") BigDecimal minAmount,
            @Param("maxAmount") BigDecimal maxAmount,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("merchant") String merchant,
            @Param("pending") Boolean pending,
            Pageable pageable
    );
}
