package com.residualcarbon.tables;

/** What the table converter does with pixels that hold no usable measurement. */
public enum NodataPolicy {
    /** Leave the pixel out of the table. */
    SKIP,
    /** Keep the pixel with a NaN value, so the table has one row per pixel. */
    NAN
}
