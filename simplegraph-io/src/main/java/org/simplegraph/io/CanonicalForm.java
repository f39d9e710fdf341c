package org.simplegraph.io;

import org.simplegraph.common.Codec;
import org.simplegraph.common.DecodeException;
import org.simplegraph.common.GraphType;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.Arc;
import org.simplegraph.graph.GraphFactory;
import org.simplegraph.graph.WeightedGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Backend-neutral representation of a graph, used to move a graph from one backend to another, or across a
 * serialization boundary.
 * <p>
 * The arcs are recorded exactly as the source graph stores them: an undirected graph contributes both
 * directions of each edge, and a {@link org.simplegraph.graph.impl.SparseGraph} its duplicates as well.
 * When building a graph, an undirected form only replays the arcs with <code>source &lt;= destination</code>.
 *
 * @param <N> the weight type
 */
public record CanonicalForm<N>(GraphType graphType, Nodes<N> nodes, Arcs<N> arcs) {
    public static final String GTYPE = "gtype";
    public static final String NODES = "nodes";
    public static final String ARCS = "arcs";

    public CanonicalForm {
        Objects.requireNonNull(graphType);
        Objects.requireNonNull(nodes);
        Objects.requireNonNull(arcs);
    }

    public static <N> CanonicalForm<N> of(WeightedGraph<N> graph, GraphTranscoder.Configuration configuration) {
        Numeric<N> numeric = graph.numeric();
        List<N> weights = new ArrayList<>(graph.nodeCount());
        graph.visitNodes((i, w) -> weights.add(w));
        Nodes<N> nodes = configuration.compactNodes() ? Nodes.of(weights, numeric) : new Nodes.Extended<>(weights);

        List<Arc<N>> list = new ArrayList<>(graph.arcCount());
        graph.visitArcs((i, j, w) -> list.add(new Arc<>(i, j, w)));
        Arcs<N> arcs = switch (configuration.arcEncoding()) {
            case WEIGHTED -> new Arcs.Weighted<>(list);
            case SIMPLE -> Arcs.simple(list);
            case AUTO -> list.stream().allMatch(a -> numeric.isZero(a.weight()))
                    ? Arcs.simple(list) : new Arcs.Weighted<>(list);
        };
        return new CanonicalForm<>(graph.graphType(), nodes, arcs);
    }

    public int nodeCount() {
        return nodes.nodeCount();
    }

    /**
     * @throws DecodeException when the node or arc indices are inconsistent with the node count
     */
    public void validate() {
        nodes.validate();
        arcs.validate(nodes.nodeCount());
    }

    /**
     * Validates this form, then builds a new graph. No graph is created when validation fails.
     */
    public <G extends WeightedGraph<N>> G toGraph(GraphFactory<N, G> factory, Numeric<N> numeric) {
        validate();
        G graph = factory.create(nodeCount(), graphType, numeric);
        nodes.applyTo(graph);
        arcs.applyTo(graph);
        return graph;
    }

    public Codec.EncodedValue encode(Codec codec, Numeric<N> numeric) {
        Map<String, Codec.EncodedValue> map = new LinkedHashMap<>();
        map.put(GTYPE, codec.encodeString(graphType.encodedName()));
        map.put(NODES, nodes.encode(codec, numeric));
        map.put(ARCS, arcs.encode(codec, numeric));
        return codec.encodeMap(map);
    }

    public static <N> CanonicalForm<N> decode(Codec codec, Codec.EncodedValue encodedValue, Numeric<N> numeric) {
        Map<String, Codec.EncodedValue> map = codec.decodeMap(encodedValue);
        GraphType graphType = GraphType.decode(codec.decodeString(required(map, GTYPE)));
        Nodes<N> nodes = Nodes.decode(codec, required(map, NODES), numeric);
        Arcs<N> arcs = Arcs.decode(codec, required(map, ARCS), numeric);
        CanonicalForm<N> canonicalForm = new CanonicalForm<>(graphType, nodes, arcs);
        canonicalForm.validate();
        return canonicalForm;
    }

    static Codec.EncodedValue required(Map<String, Codec.EncodedValue> map, String key) {
        Codec.EncodedValue value = map.get(key);
        if (value == null) throw new DecodeException("Missing field '" + key + "'");
        return value;
    }

    // tagged unions are encoded as a map with exactly one entry, the tag
    static Map.Entry<String, Codec.EncodedValue> singleEntry(Codec codec, Codec.EncodedValue encodedValue,
                                                             String what) {
        Map<String, Codec.EncodedValue> map = codec.decodeMap(encodedValue);
        if (map.size() != 1) {
            throw new DecodeException("Expected exactly one variant for '" + what + "', got " + map.keySet());
        }
        return map.entrySet().iterator().next();
    }
}
