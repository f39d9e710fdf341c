package org.simplegraph.graph.path;

import org.simplegraph.common.NoSuchArcException;
import org.simplegraph.graph.ArcCost;
import org.simplegraph.graph.WeightedGraph;
import org.simplegraph.graph.impl.DenseGraph;
import org.simplegraph.graph.impl.SparseGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.simplegraph.common.numeric.NumericImpl.DOUBLE;
import static org.simplegraph.common.numeric.NumericImpl.LONG;
import static org.junit.jupiter.api.Assertions.*;

public class TestSubPathCostIterator {

    private static <G extends WeightedGraph<Double>> G cycle(G graph) {
        graph.addArc(0, 1, 1.0);
        graph.addArc(1, 2, 2.0);
        graph.addArc(2, 3, 3.0);
        graph.addArc(3, 0, 4.0);
        return graph;
    }

    private static void assertFourNodeWalk(WeightedGraph<Double> graph) {
        Iterator<SubPathCost<Double>> it = SubPathCosts.iterator(graph, 0, 1, 2, 3);
        assertEquals(new SubPathCost<>(0, 1, 1.0), it.next());
        assertEquals(new SubPathCost<>(0, 2, 3.0), it.next());
        assertEquals(new SubPathCost<>(0, 3, 6.0), it.next());
        assertEquals(new SubPathCost<>(1, 2, 2.0), it.next());
        assertEquals(new SubPathCost<>(1, 3, 5.0), it.next());
        assertEquals(new SubPathCost<>(2, 3, 3.0), it.next());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    public void testDense() {
        assertFourNodeWalk(cycle(DenseGraph.direct(4, DOUBLE)));
    }

    @Test
    public void testSparse() {
        assertFourNodeWalk(cycle(SparseGraph.direct(4, DOUBLE)));
    }

    @Test
    @DisplayName("elements carry node indices, not offsets in the walk")
    public void testNodeIndices() {
        DenseGraph<Double> graph = cycle(DenseGraph.direct(4, DOUBLE));
        List<SubPathCost<Double>> list = SubPathCosts.stream(graph, 3, 0, 1).toList();
        assertEquals(List.of(new SubPathCost<>(3, 0, 4.0), new SubPathCost<>(3, 1, 5.0),
                new SubPathCost<>(0, 1, 1.0)), list);
    }

    @Test
    public void testShortWalks() {
        DenseGraph<Double> graph = cycle(DenseGraph.direct(4, DOUBLE));
        assertFalse(SubPathCosts.iterator(graph).hasNext());
        assertFalse(SubPathCosts.iterator(graph, 2).hasNext());
        assertEquals(0, SubPathCosts.stream(graph, 2).count());
        assertEquals(List.of(new SubPathCost<>(2, 3, 3.0)), SubPathCosts.stream(graph, 2, 3).toList());
    }

    @Test
    public void testRepeatedNodes() {
        SparseGraph<Long> graph = SparseGraph.undirect(2, LONG);
        graph.addArc(0, 1, 2L);
        List<SubPathCost<Long>> list = SubPathCosts.stream(graph, 0, 1, 0, 1).toList();
        assertEquals(List.of(new SubPathCost<>(0, 1, 2L), new SubPathCost<>(0, 0, 4L), new SubPathCost<>(0, 1, 6L),
                new SubPathCost<>(1, 0, 2L), new SubPathCost<>(1, 1, 4L), new SubPathCost<>(0, 1, 2L)), list);
    }

    @Test
    public void testLazy() {
        int[] calls = new int[1];
        ArcCost<Long> arcCost = (source, destination) -> {
            calls[0]++;
            return 1L;
        };
        SubPathCostIterator<Long> it = new SubPathCostIterator<>(arcCost, LONG, new int[]{0, 1, 2, 3, 4});
        assertEquals(0, calls[0]);
        assertEquals(new SubPathCost<>(0, 1, 1L), it.next());
        assertEquals(1, calls[0]);
        int count = 1;
        while (it.hasNext()) {
            it.next();
            count++;
        }
        assertEquals(10, count);
        assertEquals(10, calls[0]);
        assertEquals(10, SubPathCosts.stream(arcCost, LONG, 0, 1, 2, 3, 4).count());
    }

    @Test
    public void testMissingArcEndsIteration() {
        DenseGraph<Double> graph = cycle(DenseGraph.direct(4, DOUBLE));
        SubPathCostIterator<Double> it = SubPathCosts.iterator(graph, 0, 1, 3);
        assertEquals(new SubPathCost<>(0, 1, 1.0), it.next());
        assertTrue(it.hasNext());
        NoSuchArcException e = assertThrows(NoSuchArcException.class, it::next);
        assertEquals(1, e.getSource());
        assertEquals(3, e.getDestination());
        assertFalse(it.hasNext());
    }

    @Test
    public void testMissingArcInStream() {
        SparseGraph<Double> graph = cycle(SparseGraph.direct(4, DOUBLE));
        assertThrows(NoSuchArcException.class, () -> SubPathCosts.stream(graph, 0, 2).toList());
    }
}
