package com.geojoin.joiner.client;

/**
 * A page of identifiers could not be retrieved. The whole page is discarded.
 */
public class FetchIdBatchException extends JoinerException {

    public FetchIdBatchException(String message) {
        super(message);
    }

    public FetchIdBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
