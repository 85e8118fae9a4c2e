package com.infomedia.abacox.callbilling.db.entity;

public enum TransactionType {
    CONSUMPTION,
    RECHARGE,
    REFUND
}
