package com.residualcarbon.cache;

import java.io.File;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metadata stored at the head of every cache file, as JSON. Enough to decide whether the entry is still valid and
 * which area of interest it belongs to without reading the artifact itself.
 */
public class CacheEntry {

    public String family;
    public String operation;
    public String slot;
    public String fingerprint;

    /** Where the artifact lives, relative to the cache root. */
    public String artifact;

    public Map<String, Long> sources = new TreeMap<>();
    public Map<String, String> params = new TreeMap<>();

    public long createdAt;
    public long payloadLength;
    public String payloadChecksum;

    public static CacheEntry forKey (CacheKey key) {
        CacheEntry entry = new CacheEntry();
        entry.family = key.family.name();
        entry.operation = key.operation;
        entry.slot = key.slot();
        entry.fingerprint = key.fingerprint();
        entry.artifact = key.storageKey().getFullPath();
        entry.sources.putAll(key.sources);
        entry.params.putAll(key.params);
        entry.createdAt = System.currentTimeMillis();
        return entry;
    }

    /**
     * @return null if this entry can be trusted for the given key, otherwise the reason it cannot. Source files are
     * checked on disk every time; the file being present says nothing about it being current.
     */
    public String invalidReason (CacheKey key) {
        if (!key.fingerprint().equals(fingerprint)) return "inputs changed since the entry was written";
        for (Map.Entry<String, Long> source : sources.entrySet()) {
            File file = new File(source.getKey());
            if (!file.exists()) return "source " + source.getKey() + " no longer exists";
            if (file.lastModified() != source.getValue()) return "source " + source.getKey() + " was modified";
        }
        return null;
    }

    public String aoi () {
        return params.get(CacheKey.AOI_PARAM);
    }
}
