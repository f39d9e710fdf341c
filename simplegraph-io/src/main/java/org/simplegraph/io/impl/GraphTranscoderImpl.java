package org.simplegraph.io.impl;

import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.GraphFactory;
import org.simplegraph.graph.WeightedGraph;
import org.simplegraph.io.CanonicalForm;
import org.simplegraph.io.GraphTranscoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GraphTranscoderImpl implements GraphTranscoder {
    private static final Logger LOGGER = LoggerFactory.getLogger("graph-transcoding");

    private final Configuration configuration;

    public GraphTranscoderImpl() {
        this(new ConfigurationBuilder().build());
    }

    public GraphTranscoderImpl(Configuration configuration) {
        this.configuration = configuration;
    }

    public record ConfigurationImpl(boolean compactNodes, ArcEncoding arcEncoding) implements Configuration {
    }

    public static class ConfigurationBuilder {
        private boolean compactNodes = true;
        private ArcEncoding arcEncoding = ArcEncoding.WEIGHTED;

        public ConfigurationBuilder setCompactNodes(boolean compactNodes) {
            this.compactNodes = compactNodes;
            return this;
        }

        public ConfigurationBuilder setArcEncoding(ArcEncoding arcEncoding) {
            this.arcEncoding = arcEncoding;
            return this;
        }

        public Configuration build() {
            return new ConfigurationImpl(compactNodes, arcEncoding);
        }
    }

    @Override
    public Configuration configuration() {
        return configuration;
    }

    @Override
    public <N> CanonicalForm<N> toCanonicalForm(WeightedGraph<N> graph) {
        CanonicalForm<N> canonicalForm = CanonicalForm.of(graph, configuration);
        LOGGER.debug("Canonical form of {} graph: {} nodes as {}, {} arcs as {}", graph.graphType(),
                canonicalForm.nodeCount(), canonicalForm.nodes().getClass().getSimpleName(),
                canonicalForm.arcs().size(), canonicalForm.arcs().getClass().getSimpleName());
        return canonicalForm;
    }

    @Override
    public <N, G extends WeightedGraph<N>> G fromCanonicalForm(CanonicalForm<N> canonicalForm,
                                                               GraphFactory<N, G> factory,
                                                               Numeric<N> numeric) {
        G graph = canonicalForm.toGraph(factory, numeric);
        LOGGER.debug("Built {} from canonical form: {} nodes, {} arcs", graph.getClass().getSimpleName(),
                graph.nodeCount(), graph.arcCount());
        return graph;
    }
}
