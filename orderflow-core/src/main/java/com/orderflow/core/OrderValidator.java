package com.orderflow.core;

/**
 * Static checks every order passes before it may match or rest.
 */
public final class OrderValidator {

    private OrderValidator() {
    }

    public static ValidationResult validate(Order order) {
        // ids start at 1; 0 marks "no order" in the session's live-order map
        if (order.id() <= 0) {
            return ValidationResult.INVALID_ORDER_ID;
        }
        if (!Side.isKnown(order.side())) {
            return ValidationResult.UNKNOWN_SIDE;
        }
        if (order.price() <= 0) {
            return ValidationResult.INVALID_PRICE;
        }
        if (order.quantity() <= 0) {
            return ValidationResult.INVALID_QUANTITY;
        }
        return ValidationResult.VALID;
    }
}
