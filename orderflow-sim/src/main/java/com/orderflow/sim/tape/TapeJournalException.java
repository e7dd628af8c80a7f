package com.orderflow.sim.tape;

/**
 * Writing the tape or the balances file failed.
 */
public class TapeJournalException extends RuntimeException {

    public TapeJournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
