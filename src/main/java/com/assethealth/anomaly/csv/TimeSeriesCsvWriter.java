package com.assethealth.anomaly.csv;

import com.assethealth.anomaly.exception.PipelineException;
import com.assethealth.anomaly.model.AnalysisResult;
import com.assethealth.anomaly.model.PipelineStage;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Writes the augmented table: header line then one line per analysis row.
 */
@Component
public class TimeSeriesCsvWriter {

    private final CsvMapper mapper;

    public TimeSeriesCsvWriter() {
        this.mapper = new CsvMapper();
        // quote only cells holding a separator, quote or line break
        this.mapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    public void write(AnalysisResult result, Writer out) throws IOException {
        try (SequenceWriter writer = mapper.writerFor(String[].class).writeValues(out)) {
            writer.write(result.getColumns().toArray(new String[0]));
            for (String[] row : result.getRows()) {
                writer.write(row);
            }
        }
    }

    public String writeToString(AnalysisResult result) {
        StringWriter out = new StringWriter();
        try {
            write(result, out);
        } catch (IOException e) {
            throw new PipelineException(PipelineStage.EMIT, "Failed to write output CSV: " + e.getMessage(), e);
        }
        return out.toString();
    }
}
