package com.skillbridge.rootbot.connector;

/**
 * Thrown when the channel's connector service rejects a reply or is unreachable.
 */
public class ConnectorException extends RuntimeException {

    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
