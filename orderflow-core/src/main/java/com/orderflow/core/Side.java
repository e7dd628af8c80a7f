package com.orderflow.core;

/**
 * <b>Side: The Direction of the Order.</b>
 * <p>
 * Represents whether an order is a BUY (Bid) or a SELL (Ask). Sides travel as
 * primitive bytes through the book and the tape; any other value is an unknown
 * side and is refused by {@link OrderValidator}.
 * </p>
 */
public final class Side {
    /** Buy Side (Bid) */
    public static final byte BUY = 0;

    /** Sell Side (Ask) */
    public static final byte SELL = 1;

    private Side() {
        // Prevent instantiation
    }

    public static boolean isKnown(byte side) {
        return side == BUY || side == SELL;
    }

    public static byte opposite(byte side) {
        return side == BUY ? SELL : BUY;
    }

    public static String name(byte side) {
        switch (side) {
            case BUY:
                return "BUY";
            case SELL:
                return "SELL";
            default:
                return "UNKNOWN(" + side + ")";
        }
    }
}
