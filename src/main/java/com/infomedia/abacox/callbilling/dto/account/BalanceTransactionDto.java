package com.infomedia.abacox.callbilling.dto.account;

import com.infomedia.abacox.callbilling.db.entity.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceTransactionDto {
    private Long id;
    private Long accountId;
    private BigDecimal amount;
    private BigDecimal previousBalance;
    private BigDecimal newBalance;
    private TransactionType transactionType;
    private String reason;
    private String callId;
    private Instant createdDate;
}
