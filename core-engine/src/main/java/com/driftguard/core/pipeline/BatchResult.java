package com.driftguard.core.pipeline;

import com.driftguard.core.model.EnrichedRecord;

import java.util.List;

/**
 * Enriched records of one batch, in input order, with their summary and the
 * baseline version they were evaluated against.
 *
 * @since 1.0.0
 */
public final class BatchResult {

    private final List<EnrichedRecord> records;
    private final BatchSummary summary;
    private final long baselineVersion;

    BatchResult(List<EnrichedRecord> records, long baselineVersion) {
        this.records = List.copyOf(records);
        this.summary = BatchSummary.of(this.records);
        this.baselineVersion = baselineVersion;
    }

    public List<EnrichedRecord> getRecords() {
        return records;
    }

    public BatchSummary getSummary() {
        return summary;
    }

    public long getBaselineVersion() {
        return baselineVersion;
    }
}
