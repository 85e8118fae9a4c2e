package com.infomedia.abacox.callbilling.db.entity;

public enum AccountType {
    PREPAID,
    POSTPAID
}
