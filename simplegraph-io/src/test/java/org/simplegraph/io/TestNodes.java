package org.simplegraph.io;

import org.simplegraph.common.DecodeException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.simplegraph.common.numeric.NumericImpl.DOUBLE;
import static org.simplegraph.common.numeric.NumericImpl.INTEGER;
import static org.junit.jupiter.api.Assertions.*;

public class TestNodes {

    @Test
    public void testAllZeros() {
        Nodes<Integer> nodes = Nodes.of(Collections.nCopies(10, 0), INTEGER);
        assertEquals(new Nodes.Compact<>(10, List.of()), nodes);
        assertEquals(10, nodes.nodeCount());
    }

    @Test
    public void testNoZeros() {
        Nodes<Integer> nodes = Nodes.of(Collections.nCopies(10, 1), INTEGER);
        assertEquals(new Nodes.Extended<>(Collections.nCopies(10, 1)), nodes);
    }

    @Test
    public void testMixed() {
        Nodes<Integer> nodes = Nodes.of(List.of(0, 1, 0, 1, 0, 1, 0, 1, 0, 0), INTEGER);
        assertEquals(new Nodes.Compact<>(10, List.of(new IndexedWeight<>(1, 1), new IndexedWeight<>(3, 1),
                new IndexedWeight<>(5, 1), new IndexedWeight<>(7, 1))), nodes);
    }

    @Test
    public void testBoundary() {
        // five zeros out of ten: 10 > 11 is false
        Nodes<Integer> five = Nodes.of(List.of(0, 0, 0, 0, 0, 1, 2, 3, 4, 5), INTEGER);
        assertInstanceOf(Nodes.Extended.class, five);
        // six zeros out of ten: 12 > 11
        Nodes<Integer> six = Nodes.of(List.of(0, 0, 0, 0, 0, 0, 2, 3, 4, 5), INTEGER);
        assertInstanceOf(Nodes.Compact.class, six);

        assertFalse(Nodes.chooseCompact(10, 5));
        assertTrue(Nodes.chooseCompact(10, 6));
        assertFalse(Nodes.chooseCompact(0, 0));
        assertFalse(Nodes.chooseCompact(1, 1));
        assertTrue(Nodes.chooseCompact(2, 2));
        assertFalse(Nodes.chooseCompact(3, 2));
    }

    @Test
    public void testNegativeZero() {
        Nodes<Double> nodes = Nodes.of(List.of(-0.0, 0.0, 0.0, 2.5), DOUBLE);
        assertEquals(new Nodes.Compact<>(4, List.of(new IndexedWeight<>(3, 2.5))), nodes);
    }

    @Test
    public void testValidate() {
        new Nodes.Compact<>(3, List.of(new IndexedWeight<>(0, 1), new IndexedWeight<>(2, 1))).validate();
        new Nodes.Extended<>(List.<Integer>of()).validate();

        Nodes<Integer> outOfRange = new Nodes.Compact<>(3, List.of(new IndexedWeight<>(3, 1)));
        assertThrows(DecodeException.class, outOfRange::validate);
        Nodes<Integer> unordered = new Nodes.Compact<>(3, List.of(new IndexedWeight<>(2, 1), new IndexedWeight<>(1, 1)));
        assertThrows(DecodeException.class, unordered::validate);
        Nodes<Integer> twice = new Nodes.Compact<>(3, List.of(new IndexedWeight<>(1, 1), new IndexedWeight<>(1, 2)));
        assertThrows(DecodeException.class, twice::validate);
        Nodes<Integer> negative = new Nodes.Compact<>(-1, List.of());
        assertThrows(DecodeException.class, negative::validate);
    }
}
