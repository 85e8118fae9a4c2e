package com.infomedia.abacox.callbilling.dto.account;

import com.infomedia.abacox.callbilling.db.entity.AccountStatus;
import com.infomedia.abacox.callbilling.db.entity.AccountType;
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
public class AccountDto {
    private Long id;
    private String accountNumber;
    private String customerPhone;
    private AccountType accountType;
    private BigDecimal balance;
    private BigDecimal creditLimit;
    @Schema(description = "balance plus credit limit minus live call holds")
    private BigDecimal availableBalance;
    private String currency;
    private AccountStatus status;
    private Integer maxConcurrentCalls;
}
