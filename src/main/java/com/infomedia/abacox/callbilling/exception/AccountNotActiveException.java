package com.infomedia.abacox.callbilling.exception;

import com.infomedia.abacox.callbilling.db.entity.AccountStatus;
import lombok.Getter;

@Getter
public class AccountNotActiveException extends LedgerException {

    private final Long accountId;
    private final AccountStatus status;

    public AccountNotActiveException(Long accountId, AccountStatus status) {
        super(String.format("Account %d is %s", accountId, status));
        this.accountId = accountId;
        this.status = status;
    }
}
