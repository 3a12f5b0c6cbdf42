package com.assethealth.anomaly.model;

import java.util.List;

/**
 * Text cells of a delimited input file. Every row is padded to the header width.
 */
public record RawTable(List<String> header, List<String[]> rows) {

    public int rowCount() {
        return rows.size();
    }
}
