package org.simplegraph.common;

public class DecodeException extends GraphException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable throwable) {
        super(message, throwable);
    }
}
