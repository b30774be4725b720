package io.tick4j.store;

import io.tick4j.core.JobAndNextTick;
import io.tick4j.core.JobStoredData;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Process-local store. Useful for tests and for hosts that need no durability.
 */
public class InMemoryMetadataStore extends AbstractMetadataStore {

    private final Map<UUID, JobStoredData> data = new ConcurrentHashMap<>();

    public InMemoryMetadataStore() {
        super();
    }

    public InMemoryMetadataStore(Executor executor) {
        super(executor);
    }

    @Override
    protected void doInit() {
        // nothing to prepare
    }

    @Override
    protected Optional<JobStoredData> doGet(UUID id) {
        return Optional.ofNullable(data.get(id));
    }

    @Override
    protected void doAddOrUpdate(JobStoredData jobData) {
        data.put(jobData.id(), jobData);
    }

    @Override
    protected void doDelete(UUID id) {
        data.remove(id);
    }

    @Override
    protected List<JobAndNextTick> doListNextTicks(Instant now) {
        return data.values().stream()
                .filter(d -> d.nextTick() != null)
                .filter(d -> d.nextTick().isAfter(Instant.EPOCH) && d.nextTick().isBefore(now))
                .map(JobStoredData::toJobAndNextTick)
                .toList();
    }

    @Override
    protected boolean doSetNextAndLastTick(UUID id, Instant nextTick, Instant lastTick) {
        JobStoredData updated = data.computeIfPresent(id, (k, v) -> v.withTicks(nextTick, lastTick));
        return updated != null;
    }

    @Override
    protected Optional<Instant> doFindNextTickAfter(Instant now) {
        return data.values().stream()
                .map(JobStoredData::nextTick)
                .filter(Objects::nonNull)
                .filter(t -> t.isAfter(now))
                .min(Comparator.naturalOrder());
    }

    public int size() {
        return data.size();
    }
}
