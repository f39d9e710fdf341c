package org.simplegraph.graph;

import org.simplegraph.common.NoSuchArcException;

/**
 * Direct lookup of the weight of a single arc.
 *
 * @param <N> the weight type
 */
@FunctionalInterface
public interface ArcCost<N> {

    /**
     * @throws NoSuchArcException when there is no arc from source to destination
     * @throws IndexOutOfBoundsException when an index is not a node of the graph
     */
    N cost(int source, int destination);
}
