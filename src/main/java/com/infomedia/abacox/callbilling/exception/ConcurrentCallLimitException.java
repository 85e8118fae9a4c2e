package com.infomedia.abacox.callbilling.exception;

import lombok.Getter;

@Getter
public class ConcurrentCallLimitException extends LedgerException {

    private final Long accountId;
    private final int limit;

    public ConcurrentCallLimitException(Long accountId, int limit) {
        super(String.format("Account %d already has %d concurrent call(s)", accountId, limit));
        this.accountId = accountId;
        this.limit = limit;
    }
}
