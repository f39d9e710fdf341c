package org.simplegraph.io;

public record ArcPair(int source, int destination) {
}
