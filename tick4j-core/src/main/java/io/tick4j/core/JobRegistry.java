package io.tick4j.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The authoritative in-process set of job handles, keyed by id.
 *
 * <p>Lookups and listings share a read lock and run concurrently; insert and remove take the
 * write lock. The lock only covers the map itself, so an execution holding a handle is never
 * blocked by structural changes.
 */
public class JobRegistry {

    private final Map<UUID, JobHandle> jobs = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @throws JobSchedulerException CANT_ADD when a job with the same id is registered
     */
    public UUID add(JobHandle job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.writeLock().lock();
        try {
            if (jobs.containsKey(job.id())) {
                throw new JobSchedulerException(ErrorKind.CANT_ADD, "Job already registered: " + job.id());
            }
            jobs.put(job.id(), job);
            return job.id();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the job from the registry. An in-flight execution keeps its handle and finishes.
     *
     * @return the removed handle
     * @throws JobSchedulerException CANT_REMOVE when the id is unknown
     */
    public JobHandle remove(UUID id) {
        Objects.requireNonNull(id, "id must not be null");
        lock.writeLock().lock();
        try {
            JobHandle removed = jobs.remove(id);
            if (removed == null) {
                throw new JobSchedulerException(ErrorKind.CANT_REMOVE, "No job registered with id: " + id);
            }
            removed.markRemoved();
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<JobHandle> get(UUID id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Point-in-time copy of the registered ids.
     */
    public Set<UUID> listIds() {
        lock.readLock().lock();
        try {
            return Set.copyOf(jobs.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Point-in-time copy of the registered handles.
     */
    public List<JobHandle> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(jobs.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(UUID id) {
        lock.readLock().lock();
        try {
            return jobs.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return jobs.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
