package io.healthexporter.health;

/**
 * Base exception for a failed cluster health fetch.
 * The concrete subtype tells the caller which stage failed.
 */
public abstract class HealthFetchException extends Exception {

    protected HealthFetchException(String message) {
        super(message);
    }

    protected HealthFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
