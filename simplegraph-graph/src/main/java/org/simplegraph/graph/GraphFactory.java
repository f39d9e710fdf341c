package org.simplegraph.graph;

import org.simplegraph.common.GraphType;
import org.simplegraph.common.numeric.Numeric;

/*
matches the constructors of both backends: SparseGraph::new, DenseGraph::new
 */
@FunctionalInterface
public interface GraphFactory<N, G extends WeightedGraph<N>> {

    G create(int nodeCount, GraphType graphType, Numeric<N> numeric);
}
