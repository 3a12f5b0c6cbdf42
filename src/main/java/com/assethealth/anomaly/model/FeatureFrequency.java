package com.assethealth.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "How many rows list a feature among their top contributors")
public record FeatureFrequency(
        @Schema(description = "Feature column name", example = "Sensor_12") String feature,
        @Schema(description = "Number of top-feature slots naming it", example = "112") long count) {}
