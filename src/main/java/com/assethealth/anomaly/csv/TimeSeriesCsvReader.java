package com.assethealth.anomaly.csv;

import com.assethealth.anomaly.exception.DataLoadException;
import com.assethealth.anomaly.model.RawTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a headed CSV into text cells. Short rows are padded with empty cells; rows longer
 * than the header are rejected.
 */
@Component
public class TimeSeriesCsvReader {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesCsvReader.class);

    private final CsvMapper mapper;

    public TimeSeriesCsvReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public RawTable read(InputStream input) {
        List<String> header = null;
        List<String[]> rows = new ArrayList<>();

        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(input)) {
            while (it.hasNext()) {
                String[] line = it.next();
                if (header == null) {
                    header = List.of(stripBom(line));
                    continue;
                }
                if (line.length > header.size()) {
                    throw new DataLoadException(String.format(
                            "Row %d has %d cells but the header has %d columns",
                            rows.size() + 2, line.length, header.size()));
                }
                rows.add(line.length == header.size() ? line : pad(line, header.size()));
            }
        } catch (DataLoadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DataLoadException("Failed to read CSV input: " + e.getMessage(), e);
        }

        if (header == null) {
            throw new DataLoadException("CSV input is empty");
        }
        log.info("Loaded CSV: {} rows, {} columns", rows.size(), header.size());
        return new RawTable(header, rows);
    }

    private static String[] stripBom(String[] header) {
        String[] cleaned = header.clone();
        if (cleaned.length > 0 && cleaned[0] != null && cleaned[0].startsWith("\uFEFF")) {
            cleaned[0] = cleaned[0].substring(1);
        }
        return cleaned;
    }

    private static String[] pad(String[] line, int width) {
        String[] padded = Arrays.copyOf(line, width);
        Arrays.fill(padded, line.length, width, "");
        return padded;
    }
}
