package com.assethealth.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.assethealth.anomaly.config.AerospikeConfig;
import com.assethealth.anomaly.model.AnalysisRun;
import com.assethealth.anomaly.model.AnalysisSummary;
import com.assethealth.anomaly.model.ValidationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Finished runs, one record per run id in {@link AerospikeConfig#SET_ANALYSIS_RUNS}.
 *
 * Summary and report are stored as JSON bins and the augmented table as CSV text, so a
 * single record must stay under the namespace's write-block size.
 */
@Repository
public class AnalysisRunRepository {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnalysisRunRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(AnalysisRun run, String outputCsv) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_RUNS, run.getRunId());

        client.put(writePolicy, key,
                new Bin("runId", run.getRunId()),
                new Bin("filename", run.getFilename()),
                new Bin("createdAt", run.getCreatedAt()),
                new Bin("rowCount", run.getSummary().getTotalRows()),
                new Bin("summaryJson", toJson(run.getSummary())),
                new Bin("reportJson", toJson(run.getReport())),
                new Bin("outputCsv", outputCsv));

        log.info("Saved run {} ({} rows, {} bytes of CSV)",
                run.getRunId(), run.getSummary().getTotalRows(), outputCsv.length());
    }

    public AnalysisRun findById(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_RUNS, runId);
        Record record = client.get(readPolicy, key, "runId", "filename", "createdAt", "summaryJson", "reportJson");
        if (record == null) return null;

        return AnalysisRun.builder()
                .runId(runId)
                .filename(record.getString("filename"))
                .createdAt(record.getLong("createdAt"))
                .summary(fromJson(record.getString("summaryJson"), AnalysisSummary.class))
                .report(fromJson(record.getString("reportJson"), ValidationReport.class))
                .build();
    }

    public String findOutputCsv(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_RUNS, runId);
        Record record = client.get(readPolicy, key, "outputCsv");
        if (record == null) return null;
        return record.getString("outputCsv");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored " + type.getSimpleName() + " is not readable", e);
        }
    }
}
