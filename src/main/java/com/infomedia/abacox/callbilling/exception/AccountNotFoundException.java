package com.infomedia.abacox.callbilling.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends LedgerException {

    private final Long accountId;

    public AccountNotFoundException(Long accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }
}
