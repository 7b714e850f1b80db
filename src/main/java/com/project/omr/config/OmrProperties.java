package com.project.omr.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.omr")
public record OmrProperties(
        @DefaultValue("40.0") @DecimalMin("0.0") @DecimalMax("100.0") double fillThreshold,
        @DefaultValue @Valid @NotNull AreaRange bubbleAreaRange,
        @DefaultValue @Valid @NotNull RatioRange aspectRatioRange,
        @DefaultValue("15.0") @DecimalMin("0.0") double rowThreshold,
        @DefaultValue("4") @Min(1) @Max(26) int expectedOptions,
        @DefaultValue("false") boolean debug,
        @DefaultValue("java") @NotNull PreprocessorType preprocessor,
        @DefaultValue("otsu") @NotNull ThresholdMode thresholdMode,
        @DefaultValue("51") @Min(3) int adaptiveBlockSize,
        @DefaultValue("10.0") double adaptiveC,
        @DefaultValue("20") @Min(0) int noiseMinArea,
        @DefaultValue @Valid @NotNull Batch batch
) {

    public enum PreprocessorType { JAVA, OPENCV }

    public enum ThresholdMode { OTSU, ADAPTIVE_MEAN }

    // inclusive, in pixels
    public record AreaRange(@DefaultValue("200") @Min(1) int min,
                            @DefaultValue("8000") @Min(1) int max) {
        public AreaRange {
            if (min < 1 || min > max) {
                throw new IllegalArgumentException("Invalid bubble area range: [" + min + ", " + max + "]");
            }
        }

        public boolean contains(int area) {
            return area >= min && area <= max;
        }
    }

    public record RatioRange(@DefaultValue("0.7") double min,
                             @DefaultValue("1.3") double max) {
        public RatioRange {
            if (!(min > 0.0) || min > max) {
                throw new IllegalArgumentException("Invalid aspect ratio range: [" + min + ", " + max + "]");
            }
        }

        public boolean contains(double ratio) {
            return ratio >= min && ratio <= max;
        }
    }

    /** Worker pool for batch evaluation; 0 means one worker per available processor. */
    public record Batch(@DefaultValue("0") @Min(0) int workers) {
        public Batch {
            if (workers < 0) {
                throw new IllegalArgumentException("batch.workers must be >= 0, got " + workers);
            }
        }

        public int effectiveWorkers() {
            return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors());
        }
    }

    public OmrProperties {
        if (Double.isNaN(fillThreshold) || fillThreshold < 0.0 || fillThreshold > 100.0) {
            throw new IllegalArgumentException("fillThreshold must be within [0, 100], got " + fillThreshold);
        }
        if (Double.isNaN(rowThreshold) || rowThreshold < 0.0) {
            throw new IllegalArgumentException("rowThreshold must be >= 0, got " + rowThreshold);
        }
        if (expectedOptions < 1 || expectedOptions > 26) {
            throw new IllegalArgumentException("expectedOptions must be within [1, 26], got " + expectedOptions);
        }
        if (adaptiveBlockSize < 3 || adaptiveBlockSize % 2 == 0) {
            throw new IllegalArgumentException("adaptiveBlockSize must be odd and >= 3, got " + adaptiveBlockSize);
        }
        if (noiseMinArea < 0) {
            throw new IllegalArgumentException("noiseMinArea must be >= 0, got " + noiseMinArea);
        }
        if (bubbleAreaRange == null || aspectRatioRange == null) {
            throw new IllegalArgumentException("Bubble area and aspect ratio ranges are required");
        }
        if (preprocessor == null) preprocessor = PreprocessorType.JAVA;
        if (thresholdMode == null) thresholdMode = ThresholdMode.OTSU;
        if (batch == null) batch = new Batch(0);
    }

    public static OmrProperties defaults() {
        return new OmrProperties(40.0, new AreaRange(200, 8000), new RatioRange(0.7, 1.3), 15.0, 4, false,
                PreprocessorType.JAVA, ThresholdMode.OTSU, 51, 10.0, 20, new Batch(0));
    }

    public OmrProperties withFillThreshold(double value) {
        return new OmrProperties(value, bubbleAreaRange, aspectRatioRange, rowThreshold, expectedOptions, debug,
                preprocessor, thresholdMode, adaptiveBlockSize, adaptiveC, noiseMinArea, batch);
    }

    public OmrProperties withBubbleAreaRange(int min, int max) {
        return new OmrProperties(fillThreshold, new AreaRange(min, max), aspectRatioRange, rowThreshold,
                expectedOptions, debug, preprocessor, thresholdMode, adaptiveBlockSize, adaptiveC, noiseMinArea, batch);
    }

    public OmrProperties withAspectRatioRange(double min, double max) {
        return new OmrProperties(fillThreshold, bubbleAreaRange, new RatioRange(min, max), rowThreshold,
                expectedOptions, debug, preprocessor, thresholdMode, adaptiveBlockSize, adaptiveC, noiseMinArea, batch);
    }

    public OmrProperties withRowThreshold(double value) {
        return new OmrProperties(fillThreshold, bubbleAreaRange, aspectRatioRange, value, expectedOptions, debug,
                preprocessor, thresholdMode, adaptiveBlockSize, adaptiveC, noiseMinArea, batch);
    }

    public OmrProperties withExpectedOptions(int value) {
        return new OmrProperties(fillThreshold, bubbleAreaRange, aspectRatioRange, rowThreshold, value, debug,
                preprocessor, thresholdMode, adaptiveBlockSize, adaptiveC, noiseMinArea, batch);
    }

    public OmrProperties withDebug(boolean value) {
        return new OmrProperties(fillThreshold, bubbleAreaRange, aspectRatioRange, rowThreshold, expectedOptions,
                value, preprocessor, thresholdMode, adaptiveBlockSize, adaptiveC, noiseMinArea, batch);
    }

    public OmrProperties withThresholdMode(ThresholdMode mode) {
        return new OmrProperties(fillThreshold, bubbleAreaRange, aspectRatioRange, rowThreshold, expectedOptions,
                debug, preprocessor, mode, adaptiveBlockSize, adaptiveC, noiseMinArea, batch);
    }

    public OmrProperties withNoiseMinArea(int value) {
        return new OmrProperties(fillThreshold, bubbleAreaRange, aspectRatioRange, rowThreshold, expectedOptions,
                debug, preprocessor, thresholdMode, adaptiveBlockSize, adaptiveC, value, batch);
    }
}
