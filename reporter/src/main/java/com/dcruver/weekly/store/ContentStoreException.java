package com.dcruver.weekly.store;

import lombok.Getter;

/**
 * A content store call failed at the network or protocol layer.
 * Status code is 0 when no HTTP response was received.
 */
@Getter
public class ContentStoreException extends RuntimeException {

    private final int statusCode;

    public ContentStoreException(int statusCode, String message) {
        super(String.format("Content store error %d: %s", statusCode, message));
        this.statusCode = statusCode;
    }

    public ContentStoreException(int statusCode, String message, Throwable cause) {
        super(String.format("Content store error %d: %s", statusCode, message), cause);
        this.statusCode = statusCode;
    }

    public static ContentStoreException protocol(String message) {
        return new ContentStoreException(0, message);
    }
}
