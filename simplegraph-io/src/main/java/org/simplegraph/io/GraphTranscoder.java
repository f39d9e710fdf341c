package org.simplegraph.io;

import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.GraphFactory;
import org.simplegraph.graph.WeightedGraph;

/**
 * Moves graphs between backends, through their {@link CanonicalForm}.
 */
public interface GraphTranscoder {

    enum ArcEncoding {
        WEIGHTED,
        SIMPLE,
        // simple when all arc weights are zero, weighted otherwise
        AUTO
    }

    interface Configuration {
        // when false, node weights are always stored one per index
        boolean compactNodes();

        ArcEncoding arcEncoding();
    }

    Configuration configuration();

    <N> CanonicalForm<N> toCanonicalForm(WeightedGraph<N> graph);

    <N, G extends WeightedGraph<N>> G fromCanonicalForm(CanonicalForm<N> canonicalForm,
                                                        GraphFactory<N, G> factory,
                                                        Numeric<N> numeric);

    default <N, G extends WeightedGraph<N>> G transcode(WeightedGraph<N> graph, GraphFactory<N, G> factory) {
        return fromCanonicalForm(toCanonicalForm(graph), factory, graph.numeric());
    }
}
