package com.assethealth.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Non-fatal condition detected during a scoring run")
public class PipelineWarning {

    @Schema(description = "Warning category", example = "DEGENERATE_FEATURE")
    private WarningType type;

    @Schema(description = "Human-readable description",
            example = "Dropped 1 constant feature(s) from modeling: [Sensor_7]")
    private String message;

    @Schema(description = "Columns the warning refers to, if any", example = "[\"Sensor_7\"]")
    private List<String> columns;

    public static PipelineWarning of(WarningType type, String message) {
        return new PipelineWarning(type, message, List.of());
    }

    public static PipelineWarning of(WarningType type, String message, List<String> columns) {
        return new PipelineWarning(type, message, List.copyOf(columns));
    }
}
