package com.geojoin.joiner.client;

/**
 * The polygon service call failed or its response could not be parsed.
 */
public class PipException extends JoinerException {

    public PipException(String message) {
        super(message);
    }

    public PipException(String message, Throwable cause) {
        super(message, cause);
    }
}
