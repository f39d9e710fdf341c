package org.simplegraph.io;

import org.simplegraph.common.Codec;
import org.simplegraph.common.DecodeException;
import org.simplegraph.common.numeric.Numeric;
import org.simplegraph.graph.WeightedGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node weights of a {@link CanonicalForm}: either one weight per index, or the number of nodes together with
 * the non-zero weights only.
 *
 * @param <N> the weight type
 */
public interface Nodes<N> {
    String EXTENDED = "Extended";
    String COMPACT = "Compact";

    int nodeCount();

    record Extended<N>(List<N> weights) implements Nodes<N> {
        public Extended {
            weights = List.copyOf(weights);
        }

        @Override
        public int nodeCount() {
            return weights.size();
        }
    }

    /**
     * Indices not listed have weight zero. Listed indices are strictly ascending, and smaller than the count.
     */
    record Compact<N>(int count, List<IndexedWeight<N>> weights) implements Nodes<N> {
        public Compact {
            weights = List.copyOf(weights);
        }

        @Override
        public int nodeCount() {
            return count;
        }
    }

    /**
     * The compact form is chosen when more than about half of the weights is zero.
     */
    static boolean chooseCompact(int total, int zeros) {
        return 2L * zeros > total + 1L;
    }

    static <N> Nodes<N> of(List<N> weights, Numeric<N> numeric) {
        int zeros = (int) weights.stream().filter(numeric::isZero).count();
        if (chooseCompact(weights.size(), zeros)) {
            return compact(weights, numeric);
        }
        return new Extended<>(weights);
    }

    static <N> Compact<N> compact(List<N> weights, Numeric<N> numeric) {
        List<IndexedWeight<N>> nonZero = new ArrayList<>(weights.size());
        for (int i = 0; i < weights.size(); i++) {
            N weight = weights.get(i);
            if (!numeric.isZero(weight)) nonZero.add(new IndexedWeight<>(i, weight));
        }
        return new Compact<>(weights.size(), nonZero);
    }

    default void validate() {
        if (this instanceof Compact<N> compact) {
            if (compact.count() < 0) {
                throw new DecodeException("Negative node count " + compact.count());
            }
            int previous = -1;
            for (IndexedWeight<N> iw : compact.weights()) {
                if (iw.index() <= previous || iw.index() >= compact.count()) {
                    throw new DecodeException("Compact node index " + iw.index() + " out of order or not in [0, "
                                              + compact.count() + ")");
                }
                previous = iw.index();
            }
        }
    }

    default void applyTo(WeightedGraph<N> graph) {
        assert graph.nodeCount() == nodeCount();
        if (this instanceof Extended<N> extended) {
            graph.setNodeWeights(extended.weights());
        } else if (this instanceof Compact<N> compact) {
            compact.weights().forEach(iw -> graph.setNodeWeight(iw.index(), iw.weight()));
        } else throw new UnsupportedOperationException();
    }

    default Codec.EncodedValue encode(Codec codec, Numeric<N> numeric) {
        if (this instanceof Extended<N> extended) {
            List<Codec.EncodedValue> list = extended.weights().stream().map(w -> numeric.encode(codec, w)).toList();
            return codec.encodeMap(Map.of(EXTENDED, codec.encodeList(list)));
        }
        if (this instanceof Compact<N> compact) {
            List<Codec.EncodedValue> pairs = compact.weights().stream()
                    .map(iw -> codec.encodeList(List.of(codec.encodeInt(iw.index()), numeric.encode(codec, iw.weight()))))
                    .toList();
            Map<String, Codec.EncodedValue> map = new LinkedHashMap<>();
            map.put("count", codec.encodeInt(compact.count()));
            map.put("weights", codec.encodeList(pairs));
            return codec.encodeMap(Map.of(COMPACT, codec.encodeMap(map)));
        }
        throw new UnsupportedOperationException();
    }

    static <N> Nodes<N> decode(Codec codec, Codec.EncodedValue encodedValue, Numeric<N> numeric) {
        Map.Entry<String, Codec.EncodedValue> variant = CanonicalForm.singleEntry(codec, encodedValue, "nodes");
        if (EXTENDED.equals(variant.getKey())) {
            List<N> weights = codec.decodeList(variant.getValue()).stream()
                    .map(ev -> numeric.decode(codec, ev)).toList();
            return new Extended<>(weights);
        }
        if (COMPACT.equals(variant.getKey())) {
            Map<String, Codec.EncodedValue> map = codec.decodeMap(variant.getValue());
            int count = codec.decodeInt(CanonicalForm.required(map, "count"));
            List<IndexedWeight<N>> weights = new ArrayList<>();
            for (Codec.EncodedValue pair : codec.decodeList(CanonicalForm.required(map, "weights"))) {
                List<Codec.EncodedValue> list = codec.decodeList(pair);
                if (list.size() != 2) throw new DecodeException("Expected [index, weight], got " + pair);
                weights.add(new IndexedWeight<>(codec.decodeInt(list.get(0)), numeric.decode(codec, list.get(1))));
            }
            Compact<N> compact = new Compact<>(count, weights);
            compact.validate();
            return compact;
        }
        throw new DecodeException("Unknown node representation '" + variant.getKey() + "'");
    }
}
