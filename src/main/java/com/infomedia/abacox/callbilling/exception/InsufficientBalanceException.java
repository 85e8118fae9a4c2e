package com.infomedia.abacox.callbilling.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientBalanceException extends LedgerException {

    private final Long accountId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientBalanceException(Long accountId, BigDecimal available, BigDecimal requested) {
        super(String.format("Insufficient balance on account %d: available %s, requested %s",
                accountId, available.toPlainString(), requested.toPlainString()));
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
    }
}
