package com.residualcarbon.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single exception type surfaced by the soil pipeline. The type says what went wrong and the stage says where,
 * so a failed run can always report which step failed and why.
 */
public class PipelineException extends RuntimeException {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineException.class);

    public final TYPE type;
    public final Stage stage;

    public enum TYPE {
        INVALID_COORDINATE,
        OUT_OF_REGION,
        EMPTY_CLIP,
        MISSING_REQUIRED_PROPERTY,
        CACHE_CORRUPTION,
        RASTER_FORMAT,
        CONFIGURATION,
        UNKNOWN;
    }

    public enum Stage {
        CONFIGURE,
        RESOLVE_AOI,
        DISCOVER,
        CLIP,
        CONVERT,
        INDEX,
        AGGREGATE,
        SCORE,
        CACHE,
        OUTPUT;
    }

    public static PipelineException invalidCoordinate (String message) {
        return new PipelineException(TYPE.INVALID_COORDINATE, Stage.RESOLVE_AOI, message);
    }

    public static PipelineException outOfRegion (String message) {
        return new PipelineException(TYPE.OUT_OF_REGION, Stage.RESOLVE_AOI, message);
    }

    public static PipelineException emptyClip (String message) {
        return new PipelineException(TYPE.EMPTY_CLIP, Stage.CLIP, message);
    }

    public static PipelineException missingRequiredProperty (String message) {
        return new PipelineException(TYPE.MISSING_REQUIRED_PROPERTY, Stage.SCORE, message);
    }

    public static PipelineException cacheCorruption (String message) {
        return new PipelineException(TYPE.CACHE_CORRUPTION, Stage.CACHE, message);
    }

    public static PipelineException rasterFormat (String message) {
        return new PipelineException(TYPE.RASTER_FORMAT, Stage.CLIP, message);
    }

    public static PipelineException configuration (String message) {
        return new PipelineException(TYPE.CONFIGURATION, Stage.CONFIGURE, message);
    }

    public static PipelineException unknown (Stage stage, String message, Throwable cause) {
        return new PipelineException(TYPE.UNKNOWN, stage, message, cause);
    }

    public PipelineException (TYPE type, Stage stage, String message) {
        super(message);
        this.type = type;
        this.stage = stage;
    }

    public PipelineException (TYPE type, Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.stage = stage;
    }

    /** Human readable one-line summary of the failure, for logs and front ends. */
    public String describe () {
        return String.format("Stage %s failed (%s): %s", stage, type, getMessage());
    }

    public void log () {
        LOG.error(describe(), this);
    }
}
