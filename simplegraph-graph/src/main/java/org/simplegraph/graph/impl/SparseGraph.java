package org.simplegraph.graph.impl;

import org.simplegraph.common.GraphType;
import org.simplegraph.common.NoSuchArcException;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.Arc;
import org.simplegraph.graph.GraphFactory;
import org.simplegraph.graph.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Adjacency-list backend: one insertion-ordered list of (destination, weight) entries per source node.
 * <p>
 * Arcs are appended without checking for an existing arc between the same nodes. Adding the same arc twice
 * stores two entries, and both count in {@link #arcCount()}; a cost lookup returns the weight of the first
 * entry. An undirected insertion stores two entries, also for a self-loop.
 *
 * @param <N> the weight type
 */
public class SparseGraph<N> implements WeightedGraph<N> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SparseGraph.class);

    private final GraphType graphType;
    private final Numeric<N> numeric;
    private final NodeWeights<N> nodes;
    private final List<List<Entry<N>>> lists;
    private int arcCount;

    private static class Entry<N> {
        final int destination;
        N weight;

        private Entry(int destination, N weight) {
            this.destination = destination;
            this.weight = weight;
        }
    }

    public SparseGraph(int nodeCount, GraphType graphType, Numeric<N> numeric) {
        this.graphType = Objects.requireNonNull(graphType);
        this.numeric = Objects.requireNonNull(numeric);
        this.nodes = new NodeWeights<>(nodeCount, numeric.zero());
        this.lists = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            lists.add(new ArrayList<>());
        }
        LOGGER.debug("Created sparse {} graph of {} nodes", graphType, nodeCount);
    }

    public static <N> SparseGraph<N> direct(int nodeCount, Numeric<N> numeric) {
        return new SparseGraph<>(nodeCount, GraphType.DIRECT, numeric);
    }

    public static <N> SparseGraph<N> undirect(int nodeCount, Numeric<N> numeric) {
        return new SparseGraph<>(nodeCount, GraphType.UNDIRECT, numeric);
    }

    /**
     * Typed constructor reference. Use it where a generic method has to infer both the weight type and the
     * graph type from a {@link GraphFactory} argument; a plain <code>SparseGraph::new</code> cannot fix the latter.
     */
    public static <N> GraphFactory<N, SparseGraph<N>> factory() {
        return SparseGraph::new;
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
        return nodes.size();
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
        Objects.checkIndex(source, nodes.size());
        Objects.checkIndex(destination, nodes.size());
        Objects.requireNonNull(weight);
        makeArc(source, destination, weight);
        if (graphType == GraphType.UNDIRECT) {
            makeArc(destination, source, weight);
        }
    }

    private void makeArc(int source, int destination, N weight) {
        lists.get(source).add(new Entry<>(destination, weight));
        ++arcCount;
    }

    @Override
    public boolean hasArc(int source, int destination) {
        Objects.checkIndex(destination, nodes.size());
        return find(source, destination) != null;
    }

    @Override
    public N cost(int source, int destination) {
        Objects.checkIndex(destination, nodes.size());
        Entry<N> entry = find(source, destination);
        if (entry == null) throw new NoSuchArcException(source, destination);
        return entry.weight;
    }

    // first match wins
    private Entry<N> find(int source, int destination) {
        for (Entry<N> entry : lists.get(Objects.checkIndex(source, nodes.size()))) {
            if (entry.destination == destination) return entry;
        }
        return null;
    }

    /**
     * @return the entries leaving the node, in insertion order, duplicates included
     */
    public List<Arc<N>> successors(int node) {
        return lists.get(Objects.checkIndex(node, nodes.size())).stream()
                .map(e -> new Arc<>(node, e.destination, e.weight))
                .toList();
    }

    @Override
    public void updateAllArcsWeight(ArcUpdater<N> updater) {
        for (int i = 0; i < lists.size(); i++) {
            for (Entry<N> entry : lists.get(i)) {
                N updated = updater.apply(i, entry.destination, entry.weight);
                entry.weight = Objects.requireNonNull(updated, "Arc updater returned null");
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
        for (int i = 0; i < lists.size(); i++) {
            for (Entry<N> entry : lists.get(i)) {
                consumer.accept(i, entry.destination, entry.weight);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SparseGraph ").append(graphType).append(" ").append(nodes).append('\n');
        for (int i = 0; i < lists.size(); i++) {
            List<Entry<N>> list = lists.get(i);
            sb.append(i).append(" --> ");
            if (list.isEmpty()) sb.append("<none>\n");
            else sb.append(list.stream().map(e -> e.destination + ":" + e.weight)
                    .collect(Collectors.joining(", "))).append('\n');
        }
        return sb.toString();
    }
}
