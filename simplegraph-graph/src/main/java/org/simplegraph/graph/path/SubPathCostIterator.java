package org.simplegraph.graph.path;

import org.simplegraph.common.NoSuchArcException;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.ArcCost;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazily computes the cost of every contiguous sub-walk of a walk, in one direction only.
 * <p>
 * For each start offset <code>s</code>, in ascending order, and each end offset <code>e &gt; s</code>,
 * also ascending, the iterator returns the sum of the arc costs from <code>walk[s]</code> to
 * <code>walk[e]</code>, one arc at a time. The sum restarts from zero at every new start offset.
 * Given the walk <code>[0, 1, 2, 3]</code> and arcs 0→1 (1.0), 1→2 (2.0), 2→3 (3.0), the sequence is
 * <pre>
 * (0, 1, 1.0) (0, 2, 3.0) (0, 3, 6.0) (1, 2, 2.0) (1, 3, 5.0) (2, 3, 3.0)
 * </pre>
 * A walk of length <code>L</code> produces <code>L(L-1)/2</code> elements; walks of length 0 and 1 produce
 * none. The walk array is not copied, and must not change during iteration.
 * <p>
 * When two consecutive nodes of the walk are not connected, {@link NoSuchArcException} leaves
 * {@link #next()} and the iteration ends.
 *
 * @param <N> the weight type
 */
public class SubPathCostIterator<N> implements Iterator<SubPathCost<N>> {
    private final ArcCost<N> arcCost;
    private final Numeric<N> numeric;
    private final int[] walk;

    private int start;
    private int end;
    private N cost;
    private boolean failed;

    public SubPathCostIterator(ArcCost<N> arcCost, Numeric<N> numeric, int[] walk) {
        this.arcCost = Objects.requireNonNull(arcCost);
        this.numeric = Objects.requireNonNull(numeric);
        this.walk = Objects.requireNonNull(walk);
        this.start = 0;
        this.end = 1;
        this.cost = numeric.zero();
    }

    @Override
    public boolean hasNext() {
        return !failed && start < walk.length - 1;
    }

    @Override
    public SubPathCost<N> next() {
        if (!hasNext()) throw new NoSuchElementException();
        N arc;
        try {
            arc = arcCost.cost(walk[end - 1], walk[end]);
        } catch (RuntimeException re) {
            failed = true;
            throw re;
        }
        cost = numeric.add(cost, arc);
        SubPathCost<N> result = new SubPathCost<>(walk[start], walk[end], cost);
        if (++end == walk.length) {
            ++start;
            end = start + 1;
            cost = numeric.zero();
        }
        return result;
    }
}
