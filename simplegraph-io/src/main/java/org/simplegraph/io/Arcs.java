package org.simplegraph.io;

import org.simplegraph.common.Codec;
import org.simplegraph.common.DecodeException;
import org.simplegraph.common.GraphType;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.Arc;
import org.simplegraph.graph.WeightedGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Arcs of a {@link CanonicalForm}, with or without their weights. Simple arcs are replayed with weight zero.
 *
 * @param <N> the weight type
 */
public interface Arcs<N> {
    String SIMPLE = "Simple";
    String WEIGHTED = "Weighted";

    int size();

    record Simple<N>(List<ArcPair> pairs) implements Arcs<N> {
        public Simple {
            pairs = List.copyOf(pairs);
        }

        @Override
        public int size() {
            return pairs.size();
        }
    }

    record Weighted<N>(List<Arc<N>> arcs) implements Arcs<N> {
        public Weighted {
            arcs = List.copyOf(arcs);
        }

        @Override
        public int size() {
            return arcs.size();
        }
    }

    static <N> Simple<N> simple(List<Arc<N>> arcs) {
        return new Simple<>(arcs.stream().map(a -> new ArcPair(a.source(), a.destination())).toList());
    }

    default void validate(int nodeCount) {
        if (this instanceof Simple<N> simple) {
            simple.pairs().forEach(p -> checkArc(p.source(), p.destination(), nodeCount));
        } else if (this instanceof Weighted<N> weighted) {
            weighted.arcs().forEach(a -> checkArc(a.source(), a.destination(), nodeCount));
        } else throw new UnsupportedOperationException();
    }

    private static void checkArc(int source, int destination, int nodeCount) {
        if (source < 0 || source >= nodeCount || destination < 0 || destination >= nodeCount) {
            throw new DecodeException("Arc (" + source + ", " + destination + ") not in a graph of "
                                      + nodeCount + " nodes");
        }
    }

    /*
    An undirected canonical form holds both directions of every edge. Only the direction with source <= destination
    is replayed; the graph adds the mirror itself.
     */
    default void applyTo(WeightedGraph<N> graph) {
        if (this instanceof Simple<N> simple) {
            N zero = graph.numeric().zero();
            simple.pairs().forEach(p -> conditionalInsert(graph, p.source(), p.destination(), zero));
        } else if (this instanceof Weighted<N> weighted) {
            weighted.arcs().forEach(a -> conditionalInsert(graph, a.source(), a.destination(), a.weight()));
        } else throw new UnsupportedOperationException();
    }

    private static <N> void conditionalInsert(WeightedGraph<N> graph, int source, int destination, N weight) {
        if (graph.graphType() == GraphType.DIRECT || source <= destination) {
            graph.addArc(source, destination, weight);
        }
    }

    default Codec.EncodedValue encode(Codec codec, Numeric<N> numeric) {
        if (this instanceof Simple<N> simple) {
            List<Codec.EncodedValue> list = simple.pairs().stream()
                    .map(p -> codec.encodeList(List.of(codec.encodeInt(p.source()), codec.encodeInt(p.destination()))))
                    .toList();
            return codec.encodeMap(Map.of(SIMPLE, codec.encodeList(list)));
        }
        if (this instanceof Weighted<N> weighted) {
            List<Codec.EncodedValue> list = weighted.arcs().stream()
                    .map(a -> codec.encodeList(List.of(codec.encodeInt(a.source()), codec.encodeInt(a.destination()),
                            numeric.encode(codec, a.weight()))))
                    .toList();
            return codec.encodeMap(Map.of(WEIGHTED, codec.encodeList(list)));
        }
        throw new UnsupportedOperationException();
    }

    static <N> Arcs<N> decode(Codec codec, Codec.EncodedValue encodedValue, Numeric<N> numeric) {
        Map.Entry<String, Codec.EncodedValue> variant = CanonicalForm.singleEntry(codec, encodedValue, "arcs");
        List<Codec.EncodedValue> elements = codec.decodeList(variant.getValue());
        if (SIMPLE.equals(variant.getKey())) {
            List<ArcPair> pairs = new ArrayList<>(elements.size());
            for (Codec.EncodedValue element : elements) {
                List<Codec.EncodedValue> list = codec.decodeList(element);
                if (list.size() != 2) throw new DecodeException("Expected [source, destination], got " + element);
                pairs.add(new ArcPair(codec.decodeInt(list.get(0)), codec.decodeInt(list.get(1))));
            }
            return new Simple<>(pairs);
        }
        if (WEIGHTED.equals(variant.getKey())) {
            List<Arc<N>> arcs = new ArrayList<>(elements.size());
            for (Codec.EncodedValue element : elements) {
                List<Codec.EncodedValue> list = codec.decodeList(element);
                if (list.size() != 3) {
                    throw new DecodeException("Expected [source, destination, weight], got " + element);
                }
                arcs.add(new Arc<>(codec.decodeInt(list.get(0)), codec.decodeInt(list.get(1)),
                        numeric.decode(codec, list.get(2))));
            }
            return new Weighted<>(arcs);
        }
        throw new DecodeException("Unknown arc representation '" + variant.getKey() + "'");
    }
}
