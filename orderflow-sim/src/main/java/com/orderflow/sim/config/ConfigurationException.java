package com.orderflow.sim.config;

/**
 * The configuration cannot describe a runnable experiment. Raised before any
 * session starts; nothing else in the simulator is fatal.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
