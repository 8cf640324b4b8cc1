package com.driftguard.core.baseline;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a successful {@link BaselineCalculator#recompute(Iterable)} run.
 *
 * @since 1.0.0
 */
public final class BaselineCalculationReport {

    private final long version;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final long recordsRead;
    private final long recordsUsed;
    private final long recordsSkipped;
    private final long recordsOutsideWindow;
    private final int modelCount;

    BaselineCalculationReport(long version, Instant windowStart, Instant windowEnd, long recordsRead,
            long recordsUsed, long recordsSkipped, long recordsOutsideWindow, int modelCount) {
        this.version = version;
        this.windowStart = Objects.requireNonNull(windowStart);
        this.windowEnd = Objects.requireNonNull(windowEnd);
        this.recordsRead = recordsRead;
        this.recordsUsed = recordsUsed;
        this.recordsSkipped = recordsSkipped;
        this.recordsOutsideWindow = recordsOutsideWindow;
        this.modelCount = modelCount;
    }

    public long getVersion() {
        return version;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public long getRecordsRead() {
        return recordsRead;
    }

    public long getRecordsUsed() {
        return recordsUsed;
    }

    /** Records rejected as malformed (no model, no timestamp, out-of-domain values). */
    public long getRecordsSkipped() {
        return recordsSkipped;
    }

    public long getRecordsOutsideWindow() {
        return recordsOutsideWindow;
    }

    public int getModelCount() {
        return modelCount;
    }

    @Override
    public String toString() {
        return "BaselineCalculationReport{" +
                "version=" + version +
                ", window=[" + windowStart + ", " + windowEnd + ")" +
                ", read=" + recordsRead +
                ", used=" + recordsUsed +
                ", skipped=" + recordsSkipped +
                ", outsideWindow=" + recordsOutsideWindow +
                ", models=" + modelCount +
                '}';
    }
}
