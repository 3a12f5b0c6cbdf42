package com.assethealth.anomaly.model;

import java.time.LocalDateTime;

/**
 * Inclusive time bounds selecting a contiguous slice of a {@link TimeSeriesFrame}.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + "]";
    }
}
