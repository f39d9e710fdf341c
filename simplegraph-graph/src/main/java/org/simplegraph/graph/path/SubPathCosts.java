package org.simplegraph.graph.path;

import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.ArcCost;
import org.simplegraph.graph.WeightedGraph;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public class SubPathCosts {

    private SubPathCosts() {
    }

    public static <N> SubPathCostIterator<N> iterator(WeightedGraph<N> graph, int... walk) {
        return new SubPathCostIterator<>(graph, graph.numeric(), walk);
    }

    /**
     * Sequential and lazy; same order as {@link SubPathCostIterator}.
     */
    public static <N> Stream<SubPathCost<N>> stream(ArcCost<N> arcCost, Numeric<N> numeric, int... walk) {
        long size = walk.length < 2 ? 0L : (long) walk.length * (walk.length - 1) / 2;
        Spliterator<SubPathCost<N>> spliterator = Spliterators.spliterator(
                new SubPathCostIterator<>(arcCost, numeric, walk), size,
                Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    public static <N> Stream<SubPathCost<N>> stream(WeightedGraph<N> graph, int... walk) {
        return stream(graph, graph.numeric(), walk);
    }
}
