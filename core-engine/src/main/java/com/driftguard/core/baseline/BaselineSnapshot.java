package com.driftguard.core.baseline;

import com.driftguard.core.model.BaselineRecord;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, versioned set of per-model {@link BaselineRecord}s.
 *
 * <p>
 * A snapshot is never modified after construction. The {@link BaselineStore}
 * replaces it wholesale, so a reader holding a reference always sees one
 * complete, consistent version.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Key of the record used for models without their own entry. */
    public static final String DEFAULT_MODEL = "default";

    private static final BaselineSnapshot EMPTY = new BaselineSnapshot(0L, Instant.EPOCH, Map.of());

    private final long version;
    private final Instant createdAt;
    private final Map<String, BaselineRecord> records;

    public BaselineSnapshot(long version, Instant createdAt, Map<String, BaselineRecord> records) {
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got: " + version);
        }
        this.version = version;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(records, "records must not be null")));
    }

    public static BaselineSnapshot empty() {
        return EMPTY;
    }

    /**
     * Build a snapshot keyed by each record's model id.
     *
     * @throws IllegalArgumentException if two records share a model id
     */
    public static BaselineSnapshot of(long version, Instant createdAt, Collection<BaselineRecord> records) {
        Map<String, BaselineRecord> byModel = new LinkedHashMap<>();
        for (BaselineRecord record : records) {
            if (byModel.putIfAbsent(record.getModelId(), record) != null) {
                throw new IllegalArgumentException("Duplicate baseline for model: " + record.getModelId());
            }
        }
        return new BaselineSnapshot(version, createdAt, byModel);
    }

    /**
     * Look up the baseline of a model, falling back to the
     * {@value #DEFAULT_MODEL} record.
     *
     * @param modelId model id, may be {@code null}
     * @return the record, or empty if neither the model nor a default exists
     */
    public Optional<BaselineRecord> find(String modelId) {
        BaselineRecord record = modelId != null ? records.get(modelId) : null;
        if (record == null) {
            record = records.get(DEFAULT_MODEL);
        }
        return Optional.ofNullable(record);
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Map<String, BaselineRecord> getRecords() {
        return records;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        return "BaselineSnapshot{version=" + version + ", createdAt=" + createdAt
                + ", models=" + records.keySet() + '}';
    }
}
