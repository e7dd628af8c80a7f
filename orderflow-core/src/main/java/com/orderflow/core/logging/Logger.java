package com.orderflow.core.logging;

/**
 * <b>Event Logger Interface.</b>
 * <p>
 * Components log events (a message, optionally with the one number that
 * matters) instead of formatting strings on the matching path. The backend
 * decides what, if anything, gets rendered.
 * </p>
 */
public interface Logger {
    void log(CharSequence message);

    void log(CharSequence message, long value);

    void warn(CharSequence message);

    void warn(CharSequence message, long value);

    void error(CharSequence message, Throwable cause);
}
