package io.healthexporter.health;

import lombok.Getter;

/**
 * Thrown when the health endpoint answers with anything other than 200 OK.
 */
@Getter
public class UnexpectedStatusException extends HealthFetchException {

    private final int statusCode;

    public UnexpectedStatusException(int statusCode) {
        super("HTTP request failed with code " + statusCode);
        this.statusCode = statusCode;
    }
}
