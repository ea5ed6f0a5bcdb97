package com.skillbridge.rootbot.bot;

/**
 * A turn ended with an unhandled error. The user has already been told and
 * the conversation's state has been reset by the time this is thrown.
 */
public class TurnFailedException extends RuntimeException {

    public TurnFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
