package com.residualcarbon.cache;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.residualcarbon.file.FileStorageKey;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything a cached artifact depends on: the operation, the source files with their modification times, and the
 * parameters. Sources and parameters are kept sorted so the digest does not depend on the order they were added.
 *
 * Two digests are derived. The slot leaves out modification times and names where the entry is stored, so a stale
 * entry is overwritten in place rather than left behind. The fingerprint includes them and decides whether a stored
 * entry is still valid.
 */
public class CacheKey {

    public static final String AOI_PARAM = "aoi";

    public final CacheFamily family;
    public final String operation;

    /** Canonical source path to its modification time in milliseconds when the key was built. */
    public final SortedMap<String, Long> sources;

    public final SortedMap<String, String> params;

    private CacheKey (CacheFamily family, String operation, SortedMap<String, Long> sources,
                      SortedMap<String, String> params) {
        this.family = family;
        this.operation = operation;
        this.sources = ImmutableSortedMap.copyOfSorted(sources);
        this.params = ImmutableSortedMap.copyOfSorted(params);
    }

    public static Builder builder (CacheFamily family, String operation) {
        return new Builder(family, operation);
    }

    public String slot () {
        Hasher hasher = Hashing.sha256().newHasher();
        putCommon(hasher);
        for (String path : sources.keySet()) putString(hasher, path);
        return hasher.hash().toString();
    }

    public String fingerprint () {
        Hasher hasher = Hashing.sha256().newHasher();
        putCommon(hasher);
        for (Map.Entry<String, Long> source : sources.entrySet()) {
            putString(hasher, source.getKey());
            hasher.putLong(source.getValue());
        }
        return hasher.hash().toString();
    }

    public FileStorageKey storageKey () {
        return new FileStorageKey(family.directory, slot(), "entry");
    }

    public String aoiDescriptor () {
        return params.get(AOI_PARAM);
    }

    private void putCommon (Hasher hasher) {
        putString(hasher, family.name());
        putString(hasher, operation);
        hasher.putInt(params.size());
        for (Map.Entry<String, String> param : params.entrySet()) {
            putString(hasher, param.getKey());
            putString(hasher, param.getValue());
        }
        hasher.putInt(sources.size());
    }

    /** Length-prefixed, so that ("ab", "c") and ("a", "bc") hash differently. */
    private static void putString (Hasher hasher, String value) {
        hasher.putInt(value.length());
        hasher.putString(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString () {
        return String.format("[%s %s %s %s]", family, operation, sources.keySet(), params);
    }

    public static class Builder {
        private final CacheFamily family;
        private final String operation;
        private final SortedMap<String, Long> sources = new TreeMap<>();
        private final SortedMap<String, String> params = new TreeMap<>();

        private Builder (CacheFamily family, String operation) {
            this.family = family;
            this.operation = operation;
        }

        /** Adds a source file, recording its modification time as of now. */
        public Builder source (File file) {
            try {
                sources.put(file.getCanonicalPath(), file.lastModified());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot resolve cache source " + file, e);
            }
            return this;
        }

        public Builder param (String name, Object value) {
            params.put(name, String.valueOf(value));
            return this;
        }

        public CacheKey build () {
            return new CacheKey(family, operation, sources, params);
        }
    }
}
