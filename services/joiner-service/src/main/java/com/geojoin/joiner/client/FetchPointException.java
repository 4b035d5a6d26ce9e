package com.geojoin.joiner.client;

/**
 * The point for a single identifier could not be retrieved.
 */
public class FetchPointException extends JoinerException {

    public FetchPointException(String message) {
        super(message);
    }

    public FetchPointException(String message, Throwable cause) {
        super(message, cause);
    }
}
