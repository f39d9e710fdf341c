package org.simplegraph.graph;

public record Arc<N>(int source, int destination, N weight) {
}
