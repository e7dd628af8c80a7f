package com.orderflow.core.logging;

/**
 * Discards everything. Used by tests and by quiet batch runs.
 */
public final class NullLogger implements Logger {

    public static final NullLogger INSTANCE = new NullLogger();

    private NullLogger() {
    }

    @Override
    public void log(CharSequence message) {
    }

    @Override
    public void log(CharSequence message, long value) {
    }

    @Override
    public void warn(CharSequence message) {
    }

    @Override
    public void warn(CharSequence message, long value) {
    }

    @Override
    public void error(CharSequence message, Throwable cause) {
    }
}
