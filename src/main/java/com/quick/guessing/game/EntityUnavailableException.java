package com.quick.guessing.game;

/**
 * Raised when a player or game can no longer serve calls: it was unregistered, or its
 * request lock could not be acquired within the configured call timeout.
 */
public class EntityUnavailableException extends RuntimeException {

    public EntityUnavailableException(String message) {
        super(message);
    }

    public EntityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
