package com.driftguard.core.baseline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the current {@link BaselineSnapshot}.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Readers call {@link #current()} once per batch and work against that
 * reference; they never block and never observe a partially built snapshot.
 * The only writer is {@link BaselineCalculator}, through the package-private
 * {@link #publish(BaselineSnapshot)}, which persists the new snapshot first and
 * then swaps the reference atomically. If persisting fails the reference is
 * left untouched.
 * </p>
 *
 * <p>
 * Stores in other processes pick up a newly persisted snapshot with
 * {@link #refresh()}, which adopts it only if its version is strictly newer.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineStore {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineStore.class);

    private final BaselineRepository repository;
    private final AtomicReference<BaselineSnapshot> current;

    private BaselineStore(BaselineRepository repository, BaselineSnapshot initial) {
        this.repository = repository;
        this.current = new AtomicReference<>(initial);
    }

    /**
     * Open a store backed by {@code repository}, starting from its persisted
     * snapshot or from an empty one.
     *
     * @throws IllegalStateException if the persisted table cannot be read
     */
    public static BaselineStore open(BaselineRepository repository) {
        Objects.requireNonNull(repository, "repository must not be null");
        try {
            BaselineSnapshot initial = repository.load().orElse(BaselineSnapshot.empty());
            LOG.info("Opened baseline store on {} at version {}", repository.describe(), initial.getVersion());
            return new BaselineStore(repository, initial);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load baseline from " + repository.describe(), e);
        }
    }

    /**
     * @return an in-memory store serving {@code snapshot}
     */
    public static BaselineStore of(BaselineSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return new BaselineStore(new InMemoryBaselineRepository(snapshot), snapshot);
    }

    /**
     * @return the snapshot in effect; never {@code null}
     */
    public BaselineSnapshot current() {
        return current.get();
    }

    /**
     * Persist {@code next} and make it current.
     *
     * @throws BaselinePublishException if {@code next} is not newer than the
     *                                  current snapshot or cannot be persisted;
     *                                  the current snapshot is kept
     */
    synchronized void publish(BaselineSnapshot next) {
        Objects.requireNonNull(next, "snapshot must not be null");
        BaselineSnapshot previous = current.get();
        if (next.getVersion() <= previous.getVersion()) {
            throw new BaselinePublishException("Snapshot version " + next.getVersion()
                    + " is not newer than current version " + previous.getVersion());
        }
        try {
            repository.save(next);
        } catch (IOException | RuntimeException e) {
            throw new BaselinePublishException("Failed to persist baseline version " + next.getVersion()
                    + " to " + repository.describe() + "; keeping version " + previous.getVersion(), e);
        }
        current.accumulateAndGet(next, (cur, n) -> n.getVersion() > cur.getVersion() ? n : cur);
        LOG.info("Published baseline version {} with {} model(s)", next.getVersion(),
                next.getRecords().size());
    }

    /**
     * Re-read the repository and adopt its snapshot if it is strictly newer.
     *
     * @return the adopted snapshot, or empty if the current one was kept
     * @throws IllegalStateException if the repository cannot be read
     */
    public Optional<BaselineSnapshot> refresh() {
        Optional<BaselineSnapshot> loaded;
        try {
            loaded = repository.load();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to refresh baseline from " + repository.describe(), e);
        }
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        BaselineSnapshot candidate = loaded.get();
        BaselineSnapshot previous = current.getAndAccumulate(candidate,
                (cur, next) -> next.getVersion() > cur.getVersion() ? next : cur);
        if (candidate.getVersion() > previous.getVersion()) {
            LOG.info("Refreshed baseline from version {} to {}", previous.getVersion(), candidate.getVersion());
            return Optional.of(candidate);
        }
        LOG.debug("Baseline refresh kept version {}", previous.getVersion());
        return Optional.empty();
    }

    public BaselineRepository getRepository() {
        return repository;
    }
}
