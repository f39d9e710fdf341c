package org.simplegraph.common;

/**
 * Raised by a cost lookup on an arc that is not stored. Callers assume the arc exists,
 * so there is no default weight to fall back on.
 */
public class NoSuchArcException extends GraphException {
    private final int source;
    private final int destination;

    public NoSuchArcException(int source, int destination) {
        super("No arc from " + source + " to " + destination);
        this.source = source;
        this.destination = destination;
    }

    public int getSource() {
        return source;
    }

    public int getDestination() {
        return destination;
    }
}
