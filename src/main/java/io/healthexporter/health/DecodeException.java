package io.healthexporter.health;

/**
 * Thrown when the health response body cannot be read or is not the expected JSON document.
 */
public class DecodeException extends HealthFetchException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
