package com.orderflow.core;

/**
 * Outcome of checking an order at the book boundary. Anything but
 * {@link #VALID} means the order was discarded without touching the book.
 */
public enum ValidationResult {
    VALID,
    INVALID_ORDER_ID,
    INVALID_PRICE,
    INVALID_QUANTITY,
    UNKNOWN_SIDE,
    DUPLICATE_ORDER_ID,
    WOULD_CROSS,
    SESSION_CLOSED;

    public boolean isValid() {
        return this == VALID;
    }
}
