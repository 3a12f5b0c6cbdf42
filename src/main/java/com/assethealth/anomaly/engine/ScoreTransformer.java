package com.assethealth.anomaly.engine;

import com.assethealth.anomaly.config.ScoringProperties;
import com.assethealth.anomaly.model.AnomalyRecord;
import com.assethealth.anomaly.model.TransformedScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Maps raw isolation scores onto the 0-100 abnormality scale and ranks contributing features.
 *
 * Scale, anchored on the training-window scores:
 *   inside the reference range  score = percentileRank * referenceCeiling / 100
 *   above the reference maximum score = ceiling + (100 - ceiling) * (1 - exp(-excess / spread))
 * where excess is the distance above the reference maximum and spread the reference
 * standard deviation. The result is clipped to [0, 100].
 *
 * The reference is the body of the training scores: those at or below Tukey's far-out fence
 * {@code Q3 + 3 * IQR}. Training rows beyond the fence are scored like any other outlier, so
 * anomalies inside the training window push the training mean and max up.
 */
@Component
public class ScoreTransformer {

    private static final Logger log = LoggerFactory.getLogger(ScoreTransformer.class);

    private static final double MIN_SPREAD = 1e-9;
    private static final double FAR_OUT_FENCE = 3.0;

    private final ScoringProperties properties;

    public ScoreTransformer(ScoringProperties properties) {
        this.properties = properties;
    }

    public TransformedScores transform(double[] trainingRaw, double[] analysisRaw,
                                       double[][] contributions, List<String> featureNames,
                                       double contamination) {
        Reference reference = new Reference(trainingRaw);

        double[] analysisScores = Arrays.stream(analysisRaw).map(reference::normalize).toArray();
        double[] trainingScores = Arrays.stream(trainingRaw).map(reference::normalize).toArray();
        List<List<String>> topFeatures = Arrays.stream(contributions)
                .map(row -> topFeatures(row, featureNames))
                .collect(Collectors.toList());

        return TransformedScores.builder()
                .analysisScores(analysisScores)
                .trainingScores(trainingScores)
                .topFeatures(topFeatures)
                .expectedAnomalyThreshold(reference.normalize(reference.quantile(1.0 - contamination)))
                .build();
    }

    /**
     * Normalise one raw score against a training reference distribution.
     */
    double normalize(double[] trainingRaw, double raw) {
        return new Reference(trainingRaw).normalize(raw);
    }

    /**
     * Share of the reference strictly below {@code value} plus half the ties, in [0, 100].
     */
    public static double percentileRank(double[] sortedReference, double value) {
        int below = lowerBound(sortedReference, value);
        int notAbove = upperBound(sortedReference, value);
        double ties = notAbove - below;
        return 100.0 * (below + 0.5 * ties) / sortedReference.length;
    }

    /**
     * Up to seven feature names by descending contribution, ties by name. Only contributions
     * strictly above the configured minimum qualify; unused slots are empty strings.
     */
    public List<String> topFeatures(double[] contributions, List<String> featureNames) {
        double threshold = properties.getMinContribution();
        Comparator<Integer> byContribution = Comparator
                .comparingDouble((Integer i) -> contributions[i]).reversed()
                .thenComparing(i -> featureNames.get(i));

        List<String> top = IntStream.range(0, contributions.length)
                .filter(i -> contributions[i] > threshold)
                .boxed()
                .sorted(byContribution)
                .limit(AnomalyRecord.TOP_FEATURE_COUNT)
                .map(featureNames::get)
                .collect(Collectors.toCollection(ArrayList::new));

        while (top.size() < AnomalyRecord.TOP_FEATURE_COUNT) {
            top.add("");
        }
        return top;
    }

    private static int lowerBound(double[] sorted, double value) {
        int lo = 0, hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    private static int upperBound(double[] sorted, double value) {
        int lo = 0, hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= value) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    // nearest-rank quantile
    private static double quantile(double[] sorted, double q) {
        int rank = (int) Math.ceil(q * sorted.length);
        int index = Math.min(sorted.length - 1, Math.max(0, rank - 1));
        return sorted[index];
    }

    private final class Reference {

        private final double[] sorted;
        private final double[] body;
        private final double max;
        private final double spread;
        private final double ceiling;

        Reference(double[] trainingRaw) {
            if (trainingRaw.length == 0) {
                throw new IllegalArgumentException("Reference distribution needs at least one training score");
            }
            this.sorted = trainingRaw.clone();
            Arrays.sort(sorted);

            double q1 = ScoreTransformer.quantile(sorted, 0.25);
            double q3 = ScoreTransformer.quantile(sorted, 0.75);
            double fence = q3 + FAR_OUT_FENCE * (q3 - q1);
            // q3 <= fence, so the body is never empty
            this.body = Arrays.copyOf(sorted, upperBound(sorted, fence));
            if (body.length < sorted.length) {
                log.info("{} training score(s) above the far-out fence {}; scoring them as outliers",
                        sorted.length - body.length, fence);
            }
            this.max = body[body.length - 1];

            double mean = Arrays.stream(body).average().orElse(0.0);
            double m2 = 0.0;
            for (double v : body) m2 += (v - mean) * (v - mean);
            this.spread = Math.max(Math.sqrt(m2 / body.length), MIN_SPREAD);
            this.ceiling = Math.min(100.0, Math.max(0.0, properties.getReferenceCeiling()));
        }

        double normalize(double raw) {
            double score;
            if (raw > max) {
                double excess = (raw - max) / spread;
                score = ceiling + (100.0 - ceiling) * (1.0 - Math.exp(-excess));
            } else {
                score = percentileRank(body, raw) * ceiling / 100.0;
            }
            return Math.min(100.0, Math.max(0.0, score));
        }

        double quantile(double q) {
            return ScoreTransformer.quantile(sorted, q);
        }
    }
}
