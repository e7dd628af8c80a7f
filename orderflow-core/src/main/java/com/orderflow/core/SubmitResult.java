package com.orderflow.core;

import java.util.Collections;
import java.util.List;

/**
 * What happened to one submitted order: rejected outright, or accepted with
 * zero or more trades and possibly a resting remainder.
 */
public final class SubmitResult {

    private final ValidationResult status;
    private final List<Trade> trades;
    private final long filledQuantity;
    private final long restingQuantity;

    private SubmitResult(ValidationResult status, List<Trade> trades, long filledQuantity, long restingQuantity) {
        this.status = status;
        this.trades = trades;
        this.filledQuantity = filledQuantity;
        this.restingQuantity = restingQuantity;
    }

    public static SubmitResult rejected(ValidationResult reason) {
        if (reason == ValidationResult.VALID) {
            throw new IllegalArgumentException("A rejection needs a failure reason");
        }
        return new SubmitResult(reason, Collections.emptyList(), 0, 0);
    }

    static SubmitResult accepted(List<Trade> trades, long filledQuantity, long restingQuantity) {
        return new SubmitResult(ValidationResult.VALID, Collections.unmodifiableList(trades), filledQuantity,
                restingQuantity);
    }

    public boolean isAccepted() {
        return status == ValidationResult.VALID;
    }

    /** {@link ValidationResult#VALID} when accepted, otherwise the reject reason. */
    public ValidationResult status() {
        return status;
    }

    public List<Trade> trades() {
        return trades;
    }

    public long filledQuantity() {
        return filledQuantity;
    }

    public long restingQuantity() {
        return restingQuantity;
    }

    @Override
    public String toString() {
        return "SubmitResult{" + status + ", trades=" + trades.size() + ", filled=" + filledQuantity
                + ", resting=" + restingQuantity + '}';
    }
}
