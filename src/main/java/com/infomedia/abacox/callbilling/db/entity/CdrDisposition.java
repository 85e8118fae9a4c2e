package com.infomedia.abacox.callbilling.db.entity;

public enum CdrDisposition {
    /** Rated and settled against an account. */
    BILLED,
    /** No tariff matched the destination. */
    UNRATED,
    /** Reservation denied at call start; zero cost. */
    REJECTED,
    /** Not billed to any account (no account, or direction not billable). */
    UNBILLED
}
