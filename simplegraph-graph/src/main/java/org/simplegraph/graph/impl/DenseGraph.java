package org.simplegraph.graph.impl;

import org.simplegraph.common.GraphType;
import org.simplegraph.common.NoSuchArcException;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.GraphFactory;
import org.simplegraph.graph.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Matrix backend: a square presence matrix, and a square weight matrix of the same size.
 * <p>
 * Unlike {@link SparseGraph}, this backend stores at most one arc per (source, destination) pair. Adding an
 * arc that is already present changes nothing: the weight keeps its earlier value, and {@link #arcCount()}
 * stays the same. Memory is quadratic in the number of nodes.
 *
 * @param <N> the weight type
 */
public class DenseGraph<N> implements WeightedGraph<N> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DenseGraph.class);

    private final GraphType graphType;
    private final Numeric<N> numeric;
    private final NodeWeights<N> nodes;
    private final int n;
    // row-major, cell (i, j) at i * n + j
    private final boolean[] present;
    private final List<N> weights;
    private int arcCount;

    public DenseGraph(int nodeCount, GraphType graphType, Numeric<N> numeric) {
        this.graphType = Objects.requireNonNull(graphType);
        this.numeric = Objects.requireNonNull(numeric);
        this.nodes = new NodeWeights<>(nodeCount, numeric.zero());
        this.n = nodeCount;
        int cells = Math.multiplyExact(nodeCount, nodeCount);
        present = new boolean[cells];
        weights = new ArrayList<>(Collections.nCopies(cells, numeric.zero()));
        LOGGER.debug("Created dense {} graph of {} nodes", graphType, nodeCount);
    }

    public static <N> DenseGraph<N> direct(int nodeCount, Numeric<N> numeric) {
        return new DenseGraph<>(nodeCount, GraphType.DIRECT, numeric);
    }

    public static <N> DenseGraph<N> undirect(int nodeCount, Numeric<N> numeric) {
        return new DenseGraph<>(nodeCount, GraphType.UNDIRECT, numeric);
    }

    /**
     * Typed constructor reference. Use it where a generic method has to infer both the weight type and the
     * graph type from a {@link GraphFactory} argument; a plain <code>DenseGraph::new</code> cannot fix the latter.
     */
    public static <N> GraphFactory<N, DenseGraph<N>> factory() {
        return DenseGraph::new;
    }

    private int cell(int source, int destination) {
        return Objects.checkIndex(source, n) * n + Objects.checkIndex(destination, n);
    }

    @Override
    public GraphType graphType() {
        return graphType;
    }

    @Override
    public Numeric<N> numeric() {
        return numeric;
    }

    @Override
    public int nodeCount() {
        return n;
    }

    @Override
    public int arcCount() {
        return arcCount;
    }

    @Override
    public N nodeWeight(int index) {
        return nodes.get(index);
    }

    @Override
    public void addArc(int source, int destination, N weight) {
        int cell = cell(source, destination);
        int mirror = cell(destination, source);
        Objects.requireNonNull(weight);
        makeArc(cell, weight);
        if (graphType == GraphType.UNDIRECT) {
            makeArc(mirror, weight);
        }
    }

    private void makeArc(int cell, N weight) {
        if (present[cell]) return;
        present[cell] = true;
        weights.set(cell, weight);
        ++arcCount;
    }

    @Override
    public boolean hasArc(int source, int destination) {
        return present[cell(source, destination)];
    }

    @Override
    public N cost(int source, int destination) {
        int cell = cell(source, destination);
        if (!present[cell]) throw new NoSuchArcException(source, destination);
        return weights.get(cell);
    }

    @Override
    public void updateAllArcsWeight(ArcUpdater<N> updater) {
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int cell = i * n + j;
                if (present[cell]) {
                    N updated = updater.apply(i, j, weights.get(cell));
                    weights.set(cell, Objects.requireNonNull(updated, "Arc updater returned null"));
                }
            }
        }
    }

    @Override
    public void updateAllNodesWeight(NodeUpdater<N> updater) {
        nodes.update(updater);
    }

    @Override
    public void setNodeWeights(List<N> weights) {
        nodes.setAll(weights);
    }

    @Override
    public void setNodeWeight(int index, N weight) {
        nodes.set(index, weight);
    }

    @Override
    public void visitNodes(NodeConsumer<N> consumer) {
        nodes.visit(consumer);
    }

    @Override
    public void visitArcs(ArcConsumer<N> consumer) {
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int cell = i * n + j;
                if (present[cell]) consumer.accept(i, j, weights.get(cell));
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DenseGraph ").append(graphType).append(" ").append(nodes).append('\n');
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int cell = i * n + j;
                sb.append(present[cell] ? String.valueOf(weights.get(cell)) : ".");
                sb.append(j == n - 1 ? "\n" : " ");
            }
        }
        return sb.toString();
    }
}
