package com.z254.butterfly.coordination.exception;

/**
 * Raised when a component is constructed with configuration it cannot run with.
 * <p>
 * Always thrown at construction time, never mid-run.
 */
public class ButterflyConfigurationException extends RuntimeException {

    private final String property;

    public ButterflyConfigurationException(String property, String reason) {
        super("Invalid configuration '" + property + "': " + reason);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }

    /**
     * Reject unless the condition holds.
     */
    public static void require(boolean condition, String property, String reason) {
        if (!condition) {
            throw new ButterflyConfigurationException(property, reason);
        }
    }
}
