package com.orderflow.core.logging;

import org.slf4j.LoggerFactory;

/**
 * {@link Logger} backed by SLF4J. Values are passed as placeholders so nothing
 * is formatted unless the level is enabled.
 */
public final class Slf4jLogger implements Logger {

    private final org.slf4j.Logger delegate;

    public Slf4jLogger(Class<?> owner) {
        this.delegate = LoggerFactory.getLogger(owner);
    }

    public Slf4jLogger(String name) {
        this.delegate = LoggerFactory.getLogger(name);
    }

    @Override
    public void log(CharSequence message) {
        if (delegate.isDebugEnabled()) {
            delegate.debug(message.toString());
        }
    }

    @Override
    public void log(CharSequence message, long value) {
        if (delegate.isDebugEnabled()) {
            delegate.debug("{}: {}", message, value);
        }
    }

    @Override
    public void warn(CharSequence message) {
        delegate.warn(message.toString());
    }

    @Override
    public void warn(CharSequence message, long value) {
        delegate.warn("{}: {}", message, value);
    }

    @Override
    public void error(CharSequence message, Throwable cause) {
        delegate.error(message.toString(), cause);
    }
}
