package com.geojoin.joiner.client;

/**
 * Base type of the failures raised by the register, polygon and output collaborators.
 */
public class JoinerException extends RuntimeException {

    public JoinerException(String message) {
        super(message);
    }

    public JoinerException(String message, Throwable cause) {
        super(message, cause);
    }
}
