package com.challenges.mxql.validation;

import com.challenges.mxql.category.CategoryMetadataSource;

import java.util.Objects;

/**
 * Tunables of one validator instance.
 *
 * @param granularityRatio maximum number of time buckets a grouping may create over the query's time range
 * @param metadataSource   category field catalog used to check field names
 */
public record ValidatorSettings(double granularityRatio, CategoryMetadataSource metadataSource) {
    public static final double DEFAULT_GRANULARITY_RATIO = 500;

    public ValidatorSettings {
        Objects.requireNonNull(metadataSource, "metadataSource");
        if (granularityRatio <= 0) {
            throw new IllegalArgumentException("granularityRatio must be positive: " + granularityRatio);
        }
    }

    public static ValidatorSettings defaults() {
        return new ValidatorSettings(DEFAULT_GRANULARITY_RATIO, CategoryMetadataSource.unavailable());
    }

    public ValidatorSettings withMetadataSource(CategoryMetadataSource source) {
        return new ValidatorSettings(granularityRatio, source);
    }

    public ValidatorSettings withGranularityRatio(double ratio) {
        return new ValidatorSettings(ratio, metadataSource);
    }
}
