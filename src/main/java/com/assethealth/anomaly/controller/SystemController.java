package com.assethealth.anomaly.controller;

import com.assethealth.anomaly.config.ScoringProperties;
import com.assethealth.anomaly.model.AnomalyRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/system")
@Tag(name = "System", description = "Service information and scoring defaults")
public class SystemController {

    private final ScoringProperties properties;

    public SystemController(ScoringProperties properties) {
        this.properties = properties;
    }

    @Operation(summary = "Service info",
            description = "Returns the model type, accepted formats and the defaults applied when a request leaves a parameter out.")
    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("timestampColumn", properties.getTimestampColumn());
        defaults.put("contamination", properties.getContamination());
        defaults.put("randomState", properties.getRandomState());
        defaults.put("numTrees", properties.getNumTrees());
        defaults.put("sampleSize", properties.getSampleSize());
        defaults.put("defaultTrainingHours", properties.getDefaultTrainingHours());
        defaults.put("minTrainingHours", properties.getMinTrainingHours());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "Abnormality Scoring");
        body.put("model", "Isolation Forest");
        body.put("supportedFormats", List.of("csv"));
        body.put("topFeatureCount", AnomalyRecord.TOP_FEATURE_COUNT);
        body.put("trainingMeanThreshold", properties.getTrainingMeanThreshold());
        body.put("trainingMaxThreshold", properties.getTrainingMaxThreshold());
        body.put("defaults", defaults);
        return ResponseEntity.ok(body);
    }
}
