package org.simplegraph.graph.path;

/**
 * Cumulative cost of the contiguous part of a walk that starts in node <code>source</code> and ends
 * in node <code>destination</code>.
 */
public record SubPathCost<N>(int source, int destination, N cost) {
}
