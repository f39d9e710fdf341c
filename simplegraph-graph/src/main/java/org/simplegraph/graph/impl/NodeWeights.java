package org.simplegraph.graph.impl;

import org.simplegraph.graph.GraphVisitor;
import org.simplegraph.graph.WeightedGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/*
node storage, shared by composition between the two backends
 */
class NodeWeights<N> {
    private final List<N> weights;

    NodeWeights(int nodeCount, N zero) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("Negative node count: " + nodeCount);
        }
        weights = new ArrayList<>(Collections.nCopies(nodeCount, zero));
    }

    int size() {
        return weights.size();
    }

    N get(int index) {
        return weights.get(Objects.checkIndex(index, weights.size()));
    }

    void set(int index, N weight) {
        Objects.checkIndex(index, weights.size());
        weights.set(index, Objects.requireNonNull(weight));
    }

    void setAll(List<N> newWeights) {
        if (newWeights.size() != weights.size()) {
            throw new IllegalArgumentException("Expected " + weights.size() + " node weights, got "
                                               + newWeights.size());
        }
        for (N weight : newWeights) {
            Objects.requireNonNull(weight);
        }
        for (int i = 0; i < newWeights.size(); i++) {
            weights.set(i, newWeights.get(i));
        }
    }

    void update(WeightedGraph.NodeUpdater<N> updater) {
        for (int i = 0; i < weights.size(); i++) {
            N updated = updater.apply(i, weights.get(i));
            weights.set(i, Objects.requireNonNull(updated, "Node updater returned null"));
        }
    }

    void visit(GraphVisitor.NodeConsumer<N> consumer) {
        for (int i = 0; i < weights.size(); i++) {
            consumer.accept(i, weights.get(i));
        }
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
