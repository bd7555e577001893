package com.ledgerly.backend.dto.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.ledgerly.backend.enums.TransactionCategory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpcomingBillDTO {

    private String description;
    private String merchantName;
    private TransactionCategory category;
    private BigDecimal amount;
    private LocalDate lastPaidOn;
    private LocalDate dueDate;
    private long daysUntilDue;
}
