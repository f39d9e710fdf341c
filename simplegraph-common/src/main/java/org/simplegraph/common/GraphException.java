package org.simplegraph.common;

public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable throwable) {
        super(message, throwable);
    }
}
