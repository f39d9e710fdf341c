package org.simplegraph.io;

import org.simplegraph.common.Codec;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.GraphFactory;
import org.simplegraph.graph.WeightedGraph;
import org.simplegraph.io.impl.GraphTranscoderImpl;
import org.simplegraph.io.impl.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON serialization of graphs, through their canonical form. Tagged unions are written with the tag as the
 * single key of an object:
 * <pre>
 * {"gtype":"Undirect","nodes":{"Extended":[0,1,2]},"arcs":{"Weighted":[[0,1,5],[1,0,5]]}}
 * {"gtype":"Direct","nodes":{"Compact":{"count":10,"weights":[[3,7]]}},"arcs":{"Simple":[[0,1]]}}
 * </pre>
 * Decoding fails with {@link org.simplegraph.common.DecodeException} on malformed input.
 *
 * @param <N> the weight type
 */
public class CanonicalFormCodec<N> {
    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalFormCodec.class);

    private final Numeric<N> numeric;
    private final JsonCodec codec;
    private final GraphTranscoder transcoder;

    public record Options(boolean prettyPrint) {
        public static final Options DEFAULT = new Options(false);
    }

    public CanonicalFormCodec(Numeric<N> numeric) {
        this(numeric, Options.DEFAULT, new GraphTranscoderImpl());
    }

    public CanonicalFormCodec(Numeric<N> numeric, Options options, GraphTranscoder transcoder) {
        this.numeric = numeric;
        this.codec = new JsonCodec(options.prettyPrint());
        this.transcoder = transcoder;
    }

    public Codec codec() {
        return codec;
    }

    public String encode(CanonicalForm<N> canonicalForm) {
        return codec.write(canonicalForm.encode(codec, numeric));
    }

    public CanonicalForm<N> decode(String json) {
        CanonicalForm<N> canonicalForm = CanonicalForm.decode(codec, codec.read(json), numeric);
        LOGGER.debug("Decoded canonical form of {} nodes, {} arcs", canonicalForm.nodeCount(),
                canonicalForm.arcs().size());
        return canonicalForm;
    }

    public String encodeGraph(WeightedGraph<N> graph) {
        return encode(transcoder.toCanonicalForm(graph));
    }

    public <G extends WeightedGraph<N>> G decodeGraph(String json, GraphFactory<N, G> factory) {
        return transcoder.fromCanonicalForm(decode(json), factory, numeric);
    }
}
