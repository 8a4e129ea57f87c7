package io.healthexporter.health;

/**
 * Thrown when the health request cannot be sent or the connection fails.
 */
public class TransportException extends HealthFetchException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
