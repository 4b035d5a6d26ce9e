package com.geojoin.joiner.client;

/**
 * A register could not be prepared for use; the run cannot start.
 */
public class InitialisationException extends JoinerException {

    public InitialisationException(String message) {
        super(message);
    }

    public InitialisationException(String message, Throwable cause) {
        super(message, cause);
    }
}
