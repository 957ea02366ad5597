package com.stocktracker.core.diagnostics;

/**
 * Reason codes attached to rejected engine operations and per-item cycle outcomes.
 */
public enum CauseCode {
    NONE,
    INVALID_CANDIDATE,
    CAPACITY_EXCEEDED,
    DUPLICATE_POSITION,
    UNKNOWN_POSITION,
    DUPLICATE_DECISION,
    MALFORMED_JUDGMENT,
    INVALID_SCENARIO,
    PRICE_MISSING,
    JUDGMENT_UNAVAILABLE,
    STORE_ERROR,
    RUNTIME_ERROR
}
