package com.residualcarbon.cache;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Binary form of one kind of cached artifact. The streams handed over are little-endian and already compressed.
 */
public interface ArtifactCodec<T> {

    void write (T artifact, DataOutput out) throws IOException;

    T read (DataInput in) throws IOException;
}
