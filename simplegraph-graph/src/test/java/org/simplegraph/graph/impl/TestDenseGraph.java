package org.simplegraph.graph.impl;

import org.simplegraph.common.GraphType;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.Arc;
import org.simplegraph.graph.GraphFactory;
import org.simplegraph.graph.WeightedGraph;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.simplegraph.common.numeric.NumericImpl.DOUBLE;
import static org.simplegraph.common.numeric.NumericImpl.INTEGER;
import static org.simplegraph.common.numeric.NumericImpl.LONG;
import static org.junit.jupiter.api.Assertions.*;

public class TestDenseGraph extends CommonGraphTest {

    @Override
    protected <N> WeightedGraph<N> create(int nodeCount, GraphType graphType, Numeric<N> numeric) {
        return new DenseGraph<>(nodeCount, graphType, numeric);
    }

    @Test
    public void testReinsertionIsIgnored() {
        DenseGraph<Double> graph = DenseGraph.direct(3, DOUBLE);
        graph.addArc(0, 1, 1.0);
        graph.addArc(0, 1, 2.0);
        assertEquals(1, graph.arcCount());
        assertEquals(1.0, graph.cost(0, 1));
        assertEquals(List.of(new Arc<>(0, 1, 1.0)), arcs(graph));
    }

    @Test
    public void testReverseReinsertionUndirected() {
        DenseGraph<Double> graph = DenseGraph.undirect(3, DOUBLE);
        graph.addArc(0, 1, 1.0);
        graph.addArc(1, 0, 3.0);
        assertEquals(2, graph.arcCount());
        assertEquals(1.0, graph.cost(1, 0));
        assertEquals(1.0, graph.cost(0, 1));

        graph.addArc(2, 2, 5.0);
        assertEquals(3, graph.arcCount());
    }

    @Test
    public void testMatrixCells() {
        DenseGraph<Double> graph = (DenseGraph<Double>) cycle(GraphType.DIRECT);
        for (int i = 0; i < 4; i++) {
            int local = 0;
            for (int j = 0; j < 4; j++) {
                if (graph.hasArc(i, j)) local++;
            }
            assertEquals(1, local);
        }
        assertFalse(graph.hasArc(1, 0));
        assertFalse(graph.hasArc(0, 3));
    }

    @Test
    public void testUpdateRowMajor() {
        DenseGraph<Double> graph = (DenseGraph<Double>) cycle(GraphType.UNDIRECT);
        List<String> order = new ArrayList<>();
        graph.updateAllArcsWeight((i, j, w) -> {
            order.add(i + "" + j);
            return 2.0 * w;
        });
        assertEquals(List.of("01", "03", "10", "12", "21", "23", "30", "32"), order);
        assertEquals(2.0, graph.cost(0, 1));
        assertEquals(4.0, graph.cost(2, 1));
        assertEquals(6.0, graph.cost(3, 2));
        assertEquals(8.0, graph.cost(0, 3));
    }

    @Test
    public void testEmptyGraph() {
        DenseGraph<Integer> graph = DenseGraph.undirect(0, INTEGER);
        assertEquals(0, graph.totalEntries());
        assertThrows(IndexOutOfBoundsException.class, () -> graph.addArc(0, 0, 1));
    }

    @Test
    public void testToString() {
        DenseGraph<Integer> graph = DenseGraph.direct(2, INTEGER);
        graph.addArc(1, 0, 3);
        assertEquals("DenseGraph DIRECT [0, 0]\n. .\n3 .\n", graph.toString());
    }

    @Test
    public void testFactory() {
        GraphFactory<Long, DenseGraph<Long>> factory = DenseGraph.factory();
        DenseGraph<Long> graph = factory.create(2, GraphType.UNDIRECT, LONG);
        graph.addArc(0, 1, 6L);
        assertEquals(2, graph.arcCount());
        assertEquals(6L, graph.cost(1, 0));
    }
}
