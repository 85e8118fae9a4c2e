package com.infomedia.abacox.callbilling.component.configmanager;

/**
 * What to do with a call whose destination matches no tariff.
 */
public enum UnratedPolicy {
    /** Let the call through and bill it at zero cost. */
    ALLOW_ZERO,
    /** Refuse to reserve; the call ends up with a REJECTED record. */
    REJECT
}
