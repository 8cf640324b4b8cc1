package com.driftguard.core.baseline;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Repository that keeps the snapshot on the heap. Used for embedded
 * deployments without a baseline file and in tests.
 *
 * @since 1.0.0
 */
public class InMemoryBaselineRepository implements BaselineRepository {

    private final AtomicReference<BaselineSnapshot> stored = new AtomicReference<>();

    public InMemoryBaselineRepository() {
    }

    public InMemoryBaselineRepository(BaselineSnapshot initial) {
        stored.set(initial);
    }

    @Override
    public Optional<BaselineSnapshot> load() {
        return Optional.ofNullable(stored.get());
    }

    @Override
    public void save(BaselineSnapshot snapshot) {
        stored.set(snapshot);
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
