package org.simplegraph.common.numeric;

import org.simplegraph.common.Codec;

import java.util.Objects;
import java.util.function.BinaryOperator;

public abstract class NumericImpl<N> implements Numeric<N> {

    public static final Numeric<Integer> INTEGER = new NumericImpl<>(Integer.class, 0, Integer::sum) {
        @Override
        public Codec.EncodedValue encode(Codec codec, Integer i) {
            return codec.encodeInt(i);
        }

        @Override
        public Integer decode(Codec codec, Codec.EncodedValue encodedValue) {
            return codec.decodeInt(encodedValue);
        }
    };

    public static final Numeric<Long> LONG = new NumericImpl<>(Long.class, 0L, Long::sum) {
        @Override
        public Codec.EncodedValue encode(Codec codec, Long l) {
            return codec.encodeLong(l);
        }

        @Override
        public Long decode(Codec codec, Codec.EncodedValue encodedValue) {
            return codec.decodeLong(encodedValue);
        }
    };

    public static final Numeric<Double> DOUBLE = new NumericImpl<>(Double.class, 0.0, Double::sum) {
        @Override
        public boolean isZero(Double d) {
            // -0.0 is an additive identity as well
            return d == 0.0;
        }

        @Override
        public String print(Double d) {
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString(d.longValue());
            }
            return d.toString();
        }

        @Override
        public Codec.EncodedValue encode(Codec codec, Double d) {
            return codec.encodeDouble(d);
        }

        @Override
        public Double decode(Codec codec, Codec.EncodedValue encodedValue) {
            return codec.decodeDouble(encodedValue);
        }
    };

    private final Class<N> type;
    private final N zero;
    private final BinaryOperator<N> sum;

    private NumericImpl(Class<N> type, N zero, BinaryOperator<N> sum) {
        this.type = type;
        this.zero = zero;
        this.sum = sum;
    }

    @Override
    public N zero() {
        return zero;
    }

    @Override
    public N add(N n1, N n2) {
        return sum.apply(Objects.requireNonNull(n1), Objects.requireNonNull(n2));
    }

    @Override
    public Class<N> type() {
        return type;
    }

    @Override
    public String toString() {
        return "Numeric[" + type.getSimpleName() + "]";
    }
}
