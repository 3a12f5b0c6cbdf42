package com.assethealth.anomaly.service;

import com.assethealth.anomaly.model.AnalysisResult;
import com.assethealth.anomaly.model.AnalysisSummary;
import com.assethealth.anomaly.model.AnomalyRecord;
import com.assethealth.anomaly.model.FeatureFrequency;
import com.assethealth.anomaly.model.ScoreBand;
import com.assethealth.anomaly.model.ValidationReport;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Aggregates a finished run into the statistics shown alongside its results.
 */
@Service
public class AnalysisSummaryService {

    static final int FEATURE_RANKING_SIZE = 10;

    public AnalysisSummary summarize(AnalysisResult result, double processingSeconds) {
        List<AnomalyRecord> records = result.getRecords();
        ValidationReport report = result.getReport();

        double min = records.stream().mapToDouble(AnomalyRecord::getScore).min().orElse(0.0);
        double max = records.stream().mapToDouble(AnomalyRecord::getScore).max().orElse(0.0);
        double mean = records.stream().mapToDouble(AnomalyRecord::getScore).average().orElse(0.0);

        return AnalysisSummary.builder()
                .totalRows(records.size())
                .scoreMin(AnomalyPipelineService.round(min))
                .scoreMax(AnomalyPipelineService.round(max))
                .scoreMean(AnomalyPipelineService.round(mean))
                .scoreDistribution(scoreDistribution(records))
                .trainingPeriodMean(report.getTrainingMeanScore())
                .trainingPeriodMax(report.getTrainingMaxScore())
                .topFeatures(featureFrequencies(records))
                .processingTime(AnomalyPipelineService.round(processingSeconds))
                .build();
    }

    Map<String, Long> scoreDistribution(List<AnomalyRecord> records) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (ScoreBand band : ScoreBand.values()) {
            distribution.put(band.name().toLowerCase(Locale.ROOT), 0L);
        }
        for (AnomalyRecord record : records) {
            distribution.merge(ScoreBand.fromScore(record.getScore()).name().toLowerCase(Locale.ROOT), 1L, Long::sum);
        }
        return distribution;
    }

    /**
     * Features ranked by how many rows name them in any top-feature slot; ties by name.
     */
    List<FeatureFrequency> featureFrequencies(List<AnomalyRecord> records) {
        Map<String, Long> counts = records.stream()
                .flatMap(r -> r.getTopFeatures().stream())
                .filter(name -> !name.isEmpty())
                .collect(Collectors.groupingBy(name -> name, TreeMap::new, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(FEATURE_RANKING_SIZE)
                .map(e -> new FeatureFrequency(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }
}
