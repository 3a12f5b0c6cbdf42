package com.assethealth.anomaly.engine;

import com.assethealth.anomaly.config.ScoringProperties;
import com.assethealth.anomaly.engine.isolationforest.IsolationForest;
import com.assethealth.anomaly.exception.SchemaValidationException;
import com.assethealth.anomaly.model.PipelineStage;
import com.assethealth.anomaly.model.PreparedData;
import com.assethealth.anomaly.model.ScoringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.stream.IntStream;

/**
 * Fits an isolation forest on the scaled training window, scores both windows and
 * attributes every analysis-row score to the modeled features by perturbation.
 *
 * The forest is created per call and handed back inside the result; nothing is cached
 * between runs.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final ScoringProperties properties;

    public AnomalyDetector(ScoringProperties properties) {
        this.properties = properties;
    }

    public ScoringResult fitAndScore(PreparedData data, double contamination, long seed) {
        validateContamination(contamination);
        IsolationForest forest = fit(data, seed);
        double[] trainingScores = score(forest, data.getScaledTraining());
        double[] analysisScores = score(forest, data.getScaledAnalysis());
        double[][] contributions = attribute(forest, data.getScaledAnalysis(), analysisScores, data.trainingMeans());

        return ScoringResult.builder()
                .model(forest)
                .trainingScores(trainingScores)
                .analysisScores(analysisScores)
                .contributions(contributions)
                .build();
    }

    public IsolationForest fit(PreparedData data, long seed) {
        log.info("Training isolation forest: {} trees, sample size {}, {} rows x {} features, seed {}",
                properties.getNumTrees(), properties.getSampleSize(),
                data.getScaledTraining().length, data.getModeledFeatures().size(), seed);

        IsolationForest forest = IsolationForest.fit(data.getScaledTraining(),
                properties.getNumTrees(), properties.getSampleSize(), seed, properties.isParallel());

        log.info("Model training completed");
        return forest;
    }

    /** Raw scores, larger = more anomalous. */
    public double[] score(IsolationForest forest, double[][] scaledRows) {
        return forest.anomalyScores(scaledRows, properties.isParallel());
    }

    /**
     * For each row and feature: replace the feature with its training mean, rescore, and take
     * the drop in score. Increases are clipped to zero.
     */
    public double[][] attribute(IsolationForest forest, double[][] scaledRows, double[] rawScores, double[] trainingMeans) {
        log.info("Attributing {} rows over {} features", scaledRows.length, trainingMeans.length);
        IntStream rows = IntStream.range(0, scaledRows.length);
        if (properties.isParallel()) {
            rows = rows.parallel();
        }
        return rows.mapToObj(i -> forest.featureContributions(scaledRows[i], rawScores[i], trainingMeans))
                .toArray(double[][]::new);
    }

    public void validateContamination(double contamination) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new SchemaValidationException(PipelineStage.VALIDATE,
                    "contamination must be in (0, 0.5], got " + contamination);
        }
    }
}
