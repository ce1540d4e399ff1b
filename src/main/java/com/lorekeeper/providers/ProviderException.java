package com.lorekeeper.providers;

/**
 * A capability call failed: missing key, transport error or a non-2xx answer.
 * {@code statusCode} is 0 when no HTTP status was received.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final int statusCode;

    public ProviderException(String providerId, String message) {
        this(providerId, 0, message, null);
    }

    public ProviderException(String providerId, int statusCode, String message) {
        this(providerId, statusCode, message, null);
    }

    public ProviderException(String providerId, int statusCode, String message, Throwable cause) {
        super(providerId + ": " + message, cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public String providerId() { return providerId; }

    public int statusCode() { return statusCode; }
}
