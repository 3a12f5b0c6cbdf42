package com.assethealth.anomaly.engine;

import com.assethealth.anomaly.config.ScoringProperties;
import com.assethealth.anomaly.model.TransformedScores;
import com.assethealth.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoreTransformerTest {

    private static final double[] TRAINING = {0.40, 0.42, 0.44, 0.46, 0.48, 0.50, 0.52, 0.54, 0.56, 0.58};

    private ScoringProperties properties;
    private ScoreTransformer transformer;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.properties();
        transformer = new ScoreTransformer(properties);
    }

    @Test
    void percentileRank_countsHalfOfTies() {
        double[] sorted = {1.0, 2.0, 2.0, 3.0};

        assertThat(ScoreTransformer.percentileRank(sorted, 2.0)).isEqualTo(50.0);
        assertThat(ScoreTransformer.percentileRank(sorted, 0.5)).isEqualTo(0.0);
        assertThat(ScoreTransformer.percentileRank(sorted, 3.5)).isEqualTo(100.0);
        assertThat(ScoreTransformer.percentileRank(sorted, 3.0)).isEqualTo(87.5);
    }

    @Test
    void normalize_withinReference_isCompressedBelowCeiling() {
        for (double raw : TRAINING) {
            assertThat(transformer.normalize(TRAINING, raw)).isBetween(0.0, 15.0);
        }
        // 0.58 is the max: 9 below, 1 tie -> 95th percentile
        assertThat(transformer.normalize(TRAINING, 0.58)).isCloseTo(95.0 * 0.15, within(1e-9));
    }

    @Test
    void normalize_aboveReference_extendsTowardHundred() {
        double justAbove = transformer.normalize(TRAINING, 0.60);
        double farAbove = transformer.normalize(TRAINING, 0.95);

        assertThat(justAbove).isGreaterThan(15.0);
        assertThat(farAbove).isGreaterThan(justAbove).isLessThanOrEqualTo(100.0);
        assertThat(farAbove).isGreaterThan(99.0);
    }

    @Test
    void normalize_belowReference_isZero() {
        assertThat(transformer.normalize(TRAINING, 0.1)).isEqualTo(0.0);
    }

    @Test
    void normalize_fullCeiling_isPlainPercentileRank() {
        properties.setReferenceCeiling(100.0);

        assertThat(transformer.normalize(TRAINING, 0.49)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void transform_isMonotonicInRawScore() {
        double[] analysis = {0.39, 0.45, 0.51, 0.58, 0.61, 0.7, 0.9};
        double[][] contributions = new double[analysis.length][2];

        TransformedScores scores = transformer.transform(TRAINING, analysis, contributions, List.of("A", "B"), 0.1);

        double[] normalized = scores.getAnalysisScores();
        for (int i = 1; i < normalized.length; i++) {
            assertThat(normalized[i]).isGreaterThanOrEqualTo(normalized[i - 1]);
        }
        for (double s : normalized) {
            assertThat(s).isBetween(0.0, 100.0);
        }
        assertThat(scores.getTrainingScores()).hasSize(TRAINING.length);
    }

    @Test
    void transform_trainingOutliersBeyondFence_scoreAboveCeiling() {
        // body 0.40..0.59; Q1 0.45, Q3 0.56, fence 0.89
        double[] training = new double[22];
        for (int i = 0; i < 20; i++) {
            training[i] = 0.40 + i * 0.01;
        }
        training[20] = 0.95;
        training[21] = 0.97;
        double[][] contributions = new double[1][1];

        TransformedScores scores = transformer.transform(training, new double[]{0.5}, contributions, List.of("A"), 0.1);

        double[] trainingScores = scores.getTrainingScores();
        for (int i = 0; i < 20; i++) {
            assertThat(trainingScores[i]).isLessThanOrEqualTo(15.0);
        }
        assertThat(trainingScores[20]).isGreaterThan(90.0);
        assertThat(trainingScores[21]).isGreaterThanOrEqualTo(trainingScores[20]);
        assertThat(Arrays.stream(trainingScores).max().orElse(0.0)).isGreaterThan(25.0);
    }

    @Test
    void transform_trainingWithoutOutliers_staysBelowCeiling() {
        double[][] contributions = new double[1][1];

        TransformedScores scores = transformer.transform(TRAINING, new double[]{0.5}, contributions, List.of("A"), 0.1);

        assertThat(Arrays.stream(scores.getTrainingScores()).max().orElse(0.0)).isLessThan(15.0);
        assertThat(Arrays.stream(scores.getTrainingScores()).average().orElse(0.0)).isCloseTo(7.5, within(1e-9));
    }

    @Test
    void transform_expectedThresholdFollowsContamination() {
        double[][] contributions = new double[1][1];

        // nearest rank of the 0.9 quantile is the 9th value, 0.56: 8 below, 1 tie -> 85th percentile
        TransformedScores tenPercent = transformer.transform(TRAINING, new double[]{0.5}, contributions, List.of("A"), 0.1);
        TransformedScores halfway = transformer.transform(TRAINING, new double[]{0.5}, contributions, List.of("A"), 0.5);

        assertThat(tenPercent.getExpectedAnomalyThreshold()).isCloseTo(85.0 * 0.15, within(1e-9));
        assertThat(halfway.getExpectedAnomalyThreshold()).isLessThan(tenPercent.getExpectedAnomalyThreshold());
    }

    @Test
    void topFeatures_ordersByContributionThenName() {
        List<String> names = List.of("Zeta", "Alpha", "Mid", "Beta");
        double[] contributions = {0.2, 0.1, 0.3, 0.2};

        assertThat(transformer.topFeatures(contributions, names))
                .containsExactly("Mid", "Beta", "Zeta", "Alpha", "", "", "");
    }

    @Test
    void topFeatures_equalContributions_areAlphabetical() {
        List<String> names = List.of("c", "a", "b");

        assertThat(transformer.topFeatures(new double[]{0.5, 0.5, 0.5}, names))
                .containsExactly("a", "b", "c", "", "", "", "");
    }

    @Test
    void topFeatures_zeroContributionsAreLeftOut() {
        List<String> names = List.of("A", "B", "C");

        assertThat(transformer.topFeatures(new double[]{0.0, 0.4, 0.0}, names))
                .containsExactly("B", "", "", "", "", "", "");
        assertThat(transformer.topFeatures(new double[]{0.0, 0.0, 0.0}, names))
                .containsOnly("")
                .hasSize(7);
    }

    @Test
    void topFeatures_keepsSevenLargest() {
        List<String> names = IntStream.rangeClosed(1, 10).mapToObj(i -> "F" + (char) ('a' + i)).collect(Collectors.toList());
        double[] contributions = IntStream.rangeClosed(1, 10).mapToDouble(i -> i / 10.0).toArray();

        List<String> top = transformer.topFeatures(contributions, names);

        assertThat(top).hasSize(7).doesNotContain("", "Fb", "Fc", "Fd");
        assertThat(top.get(0)).isEqualTo("Fk");
    }

    @Test
    void topFeatures_respectsMinimumContribution() {
        properties.setMinContribution(0.25);

        assertThat(transformer.topFeatures(new double[]{0.2, 0.3}, List.of("A", "B")))
                .containsExactly("B", "", "", "", "", "", "");
    }
}
