package org.simplegraph.graph;

import org.simplegraph.common.numeric.Numeric;

import java.util.List;

/**
 * Common interface to create and update a graph with weighted nodes and arcs.
 * The number of nodes is fixed at construction; all node weights start at {@link Numeric#zero()}.
 * Every method taking a node index throws {@link IndexOutOfBoundsException} when the index is
 * not in <code>[0, nodeCount())</code>.
 * <p>
 * Implementations are not thread-safe. Mutating methods need exclusive access to the graph; callbacks
 * must not call back into the graph they are updating.
 *
 * @param <N> the weight type
 */
public interface WeightedGraph<N> extends GraphVisitor<N>, ArcCost<N> {

    @FunctionalInterface
    interface NodeUpdater<N> {
        N apply(int index, N weight);
    }

    @FunctionalInterface
    interface ArcUpdater<N> {
        N apply(int source, int destination, N weight);
    }

    Numeric<N> numeric();

    N nodeWeight(int index);

    boolean hasArc(int source, int destination);

    /**
     * Adds an arc with weight {@link Numeric#zero()}.
     */
    default void addDefaultArc(int source, int destination) {
        addArc(source, destination, numeric().zero());
    }

    /**
     * Adds an arc from source to destination; in an undirected graph, also from destination to source.
     */
    void addArc(int source, int destination, N weight);

    /**
     * Replaces the weight of every stored arc entry by the result of the updater. In an undirected graph, the
     * updater is called for both directions of an edge.
     */
    void updateAllArcsWeight(ArcUpdater<N> updater);

    void updateAllNodesWeight(NodeUpdater<N> updater);

    /**
     * Assigns the weights by index.
     *
     * @throws IllegalArgumentException when the size of the list differs from the number of nodes
     */
    void setNodeWeights(List<N> weights);

    void setNodeWeight(int index, N weight);
}
