package org.simplegraph.io;

import java.util.Objects;

public record IndexedWeight<N>(int index, N weight) {
    public IndexedWeight {
        Objects.requireNonNull(weight);
    }
}
