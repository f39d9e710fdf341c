package org.simplegraph.common;

/**
 * Fixed at construction. In an undirected graph every inserted arc is stored in both directions.
 */
public enum GraphType {
    DIRECT("Direct"),
    UNDIRECT("Undirect");

    private final String encodedName;

    GraphType(String encodedName) {
        this.encodedName = encodedName;
    }

    public String encodedName() {
        return encodedName;
    }

    public boolean isDirected() {
        return this == DIRECT;
    }

    public static GraphType decode(String encodedName) {
        for (GraphType graphType : values()) {
            if (graphType.encodedName.equals(encodedName)) return graphType;
        }
        throw new DecodeException("Unknown graph type '" + encodedName + "'");
    }
}
