package com.flavorsnap.backend.common.store;

import com.flavorsnap.backend.common.error.NotFoundException;
import com.flavorsnap.backend.common.error.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;

/**
 * Arena-style store: the map only ever holds private copies, readers get their own copy.
 * Writers take a per-id {@link ReentrantLock}, mutate a working copy and swap it in,
 * so a failing mutator leaves the stored version untouched.
 * <p>
 * There is no transaction across stores: a {@code create} or {@code update} on another store made inside
 * a mutator is visible right away (before this record is swapped in) and is not undone if the mutator
 * throws afterwards. Mutators therefore do nested writes last, after every check that can fail.
 */
@Slf4j
public class InMemoryRecordStore<T extends StoredRecord<T>> implements RecordStore<T> {

    private final RecordKind kind;
    private final long lockTimeoutMs;

    private final ConcurrentHashMap<String, T> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public InMemoryRecordStore(RecordKind kind, Duration lockTimeout) {
        this.kind = kind;
        this.lockTimeoutMs = lockTimeout.toMillis();
    }

    @Override
    public RecordKind kind() {
        return kind;
    }

    @Override
    public T create(T record) {
        T stored = record.copy();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }
        T prev = records.putIfAbsent(stored.getId(), stored);
        if (prev != null) {
            throw new StorageUnavailableException("DUPLICATE_RECORD_ID",
                    new IllegalStateException(kind + " id already exists: " + stored.getId()));
        }
        record.setId(stored.getId());
        return stored.copy();
    }

    @Override
    public Optional<T> find(String id) {
        if (id == null) return Optional.empty();
        T r = records.get(id);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public List<T> findAll(Collection<String> ids) {
        return ids.stream()
                .filter(Objects::nonNull)
                .distinct()
                .map(records::get)
                .filter(Objects::nonNull)
                .map(StoredRecord::copy)
                .toList();
    }

    @Override
    public List<T> scan(StoreFilter<T> filter) {
        return records.values().stream()
                .filter(filter::matches)
                .map(StoredRecord::copy)
                .toList();
    }

    @Override
    public long count(StoreFilter<T> filter) {
        return records.values().stream().filter(filter::matches).count();
    }

    @Override
    public long sum(String column, ToLongFunction<T> getter, StoreFilter<T> filter) {
        return records.values().stream().filter(filter::matches).mapToLong(getter).sum();
    }

    @Override
    public T update(String id, Consumer<T> mutator) {
        if (id == null || !records.containsKey(id)) {
            throw new NotFoundException(kind.notFoundCode(), id);
        }
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        acquire(lock, id);
        try {
            T current = records.get(id);
            if (current == null) throw new NotFoundException(kind.notFoundCode(), id);

            T working = current.copy();
            mutator.accept(working);
            working.setId(id); // id 不可變
            records.put(id, working);
            return working.copy();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return records.size();
    }

    private void acquire(ReentrantLock lock, String id) {
        try {
            if (!lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("store_lock_timeout kind={} id={} timeoutMs={}", kind, id, lockTimeoutMs);
                throw new StorageUnavailableException("LOCK_TIMEOUT");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("LOCK_INTERRUPTED", e);
        }
    }
}
