package com.residualcarbon.cache;

import java.io.IOException;

/** Produces an artifact on a cache miss. */
@FunctionalInterface
public interface Computation<T> {
    T compute () throws IOException;
}
