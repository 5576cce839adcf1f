package com.priceradar.source;

/**
 * Raised inside an adapter when its upstream cannot deliver usable data (HTTP error, malformed body,
 * non-success status, exhausted request budget). Never escapes the adapter.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
