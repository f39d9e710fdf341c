package org.simplegraph.common.numeric;

import org.simplegraph.common.Codec;

/**
 * Arithmetic needed for node and arc weights: an additive identity and addition.
 * Weight values are immutable; equality is {@link Object#equals(Object)}.
 *
 * @param <N> the weight type
 */
public interface Numeric<N> {

    N zero();

    N add(N n1, N n2);

    default boolean isZero(N n) {
        return zero().equals(n);
    }

    Class<N> type();

    /*
    used in labels of rendered graphs
     */
    default String print(N n) {
        return String.valueOf(n);
    }

    Codec.EncodedValue encode(Codec codec, N n);

    N decode(Codec codec, Codec.EncodedValue encodedValue);
}
