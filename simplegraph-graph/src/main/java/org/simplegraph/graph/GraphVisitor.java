package org.simplegraph.graph;

import org.simplegraph.common.GraphType;

/**
 * Read-only access to the topology of a graph, through callbacks.
 *
 * @param <N> the weight type
 */
public interface GraphVisitor<N> {

    @FunctionalInterface
    interface NodeConsumer<N> {
        void accept(int index, N weight);
    }

    @FunctionalInterface
    interface ArcConsumer<N> {
        void accept(int source, int destination, N weight);
    }

    GraphType graphType();

    /**
     * Calls the consumer once for each node, in ascending index order.
     */
    void visitNodes(NodeConsumer<N> consumer);

    /**
     * Calls the consumer once for each stored arc entry. In an undirected graph both directions of
     * an edge are stored, and are therefore both visited.
     */
    void visitArcs(ArcConsumer<N> consumer);

    int nodeCount();

    /**
     * @return the number of stored arc entries; see the backends for how duplicates and mirrored arcs count.
     */
    int arcCount();

    default int totalEntries() {
        return nodeCount() + arcCount();
    }
}
