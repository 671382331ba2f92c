package com.residualcarbon.cache;

/** The three independently invalidated kinds of cached artifact, each kept in its own directory. */
public enum CacheFamily {
    CLIP("clipped-rasters"),
    TABLE("tables"),
    HEX_INDEX("hex-index");

    public final String directory;

    CacheFamily (String directory) {
        this.directory = directory;
    }
}
