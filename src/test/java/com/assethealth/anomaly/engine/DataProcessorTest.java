package com.assethealth.anomaly.engine;

import com.assethealth.anomaly.exception.InsufficientDataException;
import com.assethealth.anomaly.exception.PipelineException;
import com.assethealth.anomaly.exception.SchemaValidationException;
import com.assethealth.anomaly.model.PipelineStage;
import com.assethealth.anomaly.model.PipelineWarning;
import com.assethealth.anomaly.model.PreparedData;
import com.assethealth.anomaly.model.RawTable;
import com.assethealth.anomaly.model.TimeSeriesFrame;
import com.assethealth.anomaly.model.TimeWindow;
import com.assethealth.anomaly.model.WarningType;
import com.assethealth.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.assethealth.anomaly.testutil.TestDataFactory.START;
import static com.assethealth.anomaly.testutil.TestDataFactory.sensor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DataProcessorTest {

    private DataProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new DataProcessor(TestDataFactory.properties());
    }

    // --- validate ---

    @Test
    void validate_missingTimestampColumn_throwsSchemaValidation() {
        RawTable table = TestDataFactory.gaussianTable(10, 2, 1L);

        assertThatThrownBy(() -> processor.validate(table, "Timestamp"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("Timestamp")
                .extracting(e -> ((PipelineException) e).getStage())
                .isEqualTo(PipelineStage.VALIDATE);
    }

    @Test
    void validate_unparseableTimestamp_reportsLine() {
        RawTable table = TestDataFactory.withCell(TestDataFactory.gaussianTable(10, 2, 1L), 4, "Time", "yesterday");

        assertThatThrownBy(() -> processor.validate(table, "Time"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("yesterday")
                .hasMessageContaining("line 6");
    }

    @Test
    void validate_duplicateTimestamp_throwsSchemaValidation() {
        RawTable table = TestDataFactory.withCell(TestDataFactory.gaussianTable(10, 2, 1L), 5,
                "Time", TestDataFactory.timestamp(4));

        assertThatThrownBy(() -> processor.validate(table, "Time"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    void validate_outOfOrderRows_areRejectedNotSorted() {
        RawTable table = TestDataFactory.withCell(TestDataFactory.gaussianTable(10, 2, 1L), 5,
                "Time", TestDataFactory.timestamp(1));

        assertThatThrownBy(() -> processor.validate(table, "Time"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("strictly increasing")
                .hasMessageContaining(TestDataFactory.timestamp(4).substring(0, 10));
    }

    @Test
    void validate_textColumn_isKeptButNotModeled() {
        RawTable table = TestDataFactory.withColumn(TestDataFactory.gaussianTable(10, 2, 1L),
                "Operator", r -> r % 2 == 0 ? "alice" : "bob");

        TimeSeriesFrame frame = processor.validate(table, "Time");

        assertThat(frame.getColumns()).containsExactly("Time", sensor(1), sensor(2), "Operator");
        assertThat(frame.getFeatureNames()).containsExactly(sensor(1), sensor(2));
        assertThat(frame.getWarnings()).extracting(PipelineWarning::getType)
                .containsExactly(WarningType.NON_NUMERIC_COLUMN);
        assertThat(frame.getWarnings().get(0).getColumns()).containsExactly("Operator");
    }

    @Test
    void validate_noNumericColumns_throwsSchemaValidation() {
        List<String[]> rows = new ArrayList<>();
        for (int r = 0; r < 5; r++) {
            rows.add(new String[]{TestDataFactory.timestamp(r), "on"});
        }
        RawTable table = new RawTable(List.of("Time", "State"), rows);

        assertThatThrownBy(() -> processor.validate(table, "Time"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("no numeric feature columns");
    }

    @Test
    void validate_gapInTimestamps_warnsIrregularSpacing() {
        RawTable table = TestDataFactory.withCell(TestDataFactory.gaussianTable(10, 2, 1L), 9,
                "Time", TestDataFactory.timestamp(20));

        TimeSeriesFrame frame = processor.validate(table, "Time");

        assertThat(frame.getWarnings()).extracting(PipelineWarning::getType)
                .containsExactly(WarningType.IRREGULAR_SPACING);
    }

    @Test
    void validate_regularHourlyData_hasNoWarnings() {
        TimeSeriesFrame frame = processor.validate(TestDataFactory.gaussianTable(10, 3, 1L), "Time");

        assertThat(frame.getWarnings()).isEmpty();
        assertThat(frame.rowCount()).isEqualTo(10);
        assertThat(frame.timestampAt(0)).isEqualTo(START);
    }

    // --- fillMissing ---

    @Test
    void fillMissing_forwardFillsThenBackFillsLeadingGaps() {
        RawTable table = TestDataFactory.gaussianTable(6, 1, 1L);
        table = TestDataFactory.withCell(table, 0, sensor(1), "");
        table = TestDataFactory.withCell(table, 1, sensor(1), "2.5");
        table = TestDataFactory.withCell(table, 2, sensor(1), "");
        table = TestDataFactory.withCell(table, 3, sensor(1), "");

        TimeSeriesFrame filled = processor.fillMissing(processor.validate(table, "Time"));

        assertThat(filled.value(0, 0)).isEqualTo(2.5);
        assertThat(filled.value(0, 2)).isEqualTo(2.5);
        assertThat(filled.value(0, 3)).isEqualTo(2.5);
        assertThat(filled.cellsAt(0)[1]).isEqualTo("2.5");
        assertThat(filled.cellsAt(3)[1]).isEqualTo("2.5");
        for (double v : filled.featureValues(0)) {
            assertThat(v).isNotNaN();
        }
        assertThat(filled.rowCount()).isEqualTo(6);
    }

    @Test
    void fillMissing_leavesOriginalFrameUntouched() {
        RawTable table = TestDataFactory.withCell(TestDataFactory.gaussianTable(4, 1, 1L), 2, sensor(1), "");
        TimeSeriesFrame validated = processor.validate(table, "Time");

        processor.fillMissing(validated);

        assertThat(validated.value(0, 2)).isNaN();
        assertThat(validated.cellsAt(2)[1]).isEmpty();
    }

    // --- prepare ---

    @Test
    void prepare_defaults_trainOnFirst120HoursAndAnalyseEverything() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(200, 3, 1L));

        PreparedData data = processor.prepare(frame, null, null);

        assertThat(data.getTrainingRows()).hasSize(120);
        assertThat(data.getAnalysisRows()).hasSize(200);
        assertThat(data.getTrainingDuration().toHours()).isEqualTo(120);
        assertThat(data.getScaledTraining()).hasNumberOfRows(120);
        assertThat(data.getScaledAnalysis()).hasNumberOfRows(200);
        assertThat(data.getModeledFeatures()).containsExactly(sensor(1), sensor(2), sensor(3));
    }

    @Test
    void prepare_scalerIsFitOnTrainingRowsOnly() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(150, 2, 1L));

        PreparedData data = processor.prepare(frame, null, null);

        double mean = Arrays.stream(data.getScaledTraining()).mapToDouble(row -> row[0]).average().orElseThrow();
        double meanSq = Arrays.stream(data.getScaledTraining()).mapToDouble(row -> row[0] * row[0]).average().orElseThrow();
        assertThat(mean).isCloseTo(0.0, within(1e-9));
        assertThat(meanSq).isCloseTo(1.0, within(1e-9));
        assertThat(data.trainingMeans()).hasSize(2);

        double rawMean = Arrays.stream(data.getTrainingRows()).mapToDouble(r -> frame.value(0, r)).average().orElseThrow();
        assertThat(data.getScaler().getFeatureNames()).containsExactly(sensor(1), sensor(2));
        assertThat(data.getScaler().mean(0)).isCloseTo(rawMean, within(1e-12));
        assertThat(data.getScaler().stdDev(0)).isPositive();
    }

    @Test
    void prepare_exactly72Hours_isAccepted() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(72, 2, 1L));

        PreparedData data = processor.prepare(frame, null, null);

        assertThat(data.getTrainingRows()).hasSize(72);
    }

    @Test
    void prepare_lessThan72Hours_throwsInsufficientData() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(60, 2, 1L));

        assertThatThrownBy(() -> processor.prepare(frame, null, null))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageStartingWith("Insufficient training data: 60")
                .hasMessageEndingWith("minimum required: 72");
    }

    @Test
    void prepare_explicitWindows_selectInclusiveBounds() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(200, 2, 1L));
        TimeWindow training = new TimeWindow(START.plusHours(10), START.plusHours(99));
        TimeWindow analysis = new TimeWindow(START.plusHours(150), START.plusHours(159));

        PreparedData data = processor.prepare(frame, training, analysis);

        assertThat(data.getTrainingRows()).hasSize(90).startsWith(10).endsWith(99);
        assertThat(data.getAnalysisRows()).containsExactly(150, 151, 152, 153, 154, 155, 156, 157, 158, 159);
    }

    @Test
    void prepare_trainingStartOnly_coversDefaultHoursFromThere() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(300, 2, 1L));

        PreparedData data = processor.prepare(frame, new TimeWindow(START.plusHours(50), null), null);

        assertThat(data.getTrainingRows()).hasSize(120).startsWith(50).endsWith(169);
    }

    @Test
    void prepare_invertedWindow_throwsSchemaValidation() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(200, 2, 1L));
        TimeWindow inverted = new TimeWindow(START.plusHours(100), START);

        assertThatThrownBy(() -> processor.prepare(frame, inverted, null))
                .isInstanceOf(SchemaValidationException.class)
                .extracting(e -> ((PipelineException) e).getStage())
                .isEqualTo(PipelineStage.SPLIT);
    }

    @Test
    void prepare_emptyAnalysisWindow_throwsInsufficientData() {
        TimeSeriesFrame frame = frame(TestDataFactory.gaussianTable(200, 2, 1L));
        TimeWindow later = new TimeWindow(START.plusYears(1), START.plusYears(2));

        assertThatThrownBy(() -> processor.prepare(frame, null, later))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("Analysis window");
    }

    @Test
    void prepare_constantFeature_isDroppedWithWarning() {
        RawTable table = TestDataFactory.withColumn(TestDataFactory.gaussianTable(130, 2, 1L), "Valve", r -> "1.0");

        PreparedData data = processor.prepare(frame(table), null, null);

        assertThat(data.getModeledFeatures()).containsExactly(sensor(1), sensor(2));
        assertThat(data.getDroppedFeatures()).containsExactly("Valve");
        assertThat(data.getWarnings()).extracting(PipelineWarning::getType)
                .containsExactly(WarningType.DEGENERATE_FEATURE);
        assertThat(data.getFrame().getFeatureNames()).contains("Valve");
    }

    @Test
    void prepare_featureConstantOnlyInTraining_isStillDropped() {
        RawTable table = TestDataFactory.withColumn(TestDataFactory.gaussianTable(130, 2, 1L), "Valve",
                r -> r < 120 ? "0" : "5");

        PreparedData data = processor.prepare(frame(table), null, null);

        assertThat(data.getDroppedFeatures()).containsExactly("Valve");
    }

    @Test
    void prepare_everyFeatureConstant_throwsSchemaValidation() {
        List<String[]> rows = new ArrayList<>();
        for (int r = 0; r < 100; r++) {
            rows.add(new String[]{TestDataFactory.timestamp(r), "3", "4"});
        }
        TimeSeriesFrame frame = frame(new RawTable(List.of("Time", "A", "B"), rows));

        assertThatThrownBy(() -> processor.prepare(frame, null, null))
                .isInstanceOf(SchemaValidationException.class)
                .extracting(e -> ((PipelineException) e).getStage())
                .isEqualTo(PipelineStage.PREPROCESS);
    }

    private TimeSeriesFrame frame(RawTable table) {
        return processor.fillMissing(processor.validate(table, "Time"));
    }
}
