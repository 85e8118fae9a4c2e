package com.infomedia.abacox.callbilling.dto.account;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationDto {
    private Long accountId;
    private BigDecimal initialBalance;
    private BigDecimal balance;
    @Schema(description = "signed sum of every balance transaction of the account")
    private BigDecimal transactionSum;
    private long transactionCount;
    @Schema(description = "true when balance equals initial balance plus the transaction sum")
    private boolean consistent;
}
