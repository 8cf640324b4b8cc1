package com.driftguard.core.baseline;

import java.io.IOException;
import java.util.Optional;

/**
 * Persistent home of the baseline table.
 *
 * <p>
 * {@link #save(BaselineSnapshot)} must be all-or-nothing: after a failed save
 * the previously persisted snapshot is still readable unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public interface BaselineRepository {

    /**
     * @return the persisted snapshot, or empty if nothing has been persisted
     * @throws IOException if the table exists but cannot be read
     */
    Optional<BaselineSnapshot> load() throws IOException;

    /**
     * @param snapshot the snapshot to persist, replacing the current one
     * @throws IOException if the snapshot could not be written
     */
    void save(BaselineSnapshot snapshot) throws IOException;

    /**
     * @return a human-readable location, used in log messages
     */
    String describe();
}
