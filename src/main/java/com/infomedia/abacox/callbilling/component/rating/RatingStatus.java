package com.infomedia.abacox.callbilling.component.rating;

public enum RatingStatus {
    RATED,
    /** No tariff row matched the destination at the requested instant. */
    UNRATED,
    /** Destination had no digits at all. */
    INVALID_NUMBER
}
