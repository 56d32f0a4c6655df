package com.flavorsnap.backend.common.store;

import com.flavorsnap.backend.common.error.NotFoundException;
import com.flavorsnap.backend.common.error.StorageUnavailableException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;

/**
 * Durable keyed storage for one {@link RecordKind}.
 * <ul>
 *   <li>{@link #update} is atomic per id: concurrent updates of the same record serialize, different ids don't.</li>
 *   <li>If the mutator throws, the record keeps its previous state. With the JPA engine, store calls made
 *       from inside a mutator join its transaction and roll back with it; see {@link InMemoryRecordStore}
 *       for what the in-memory engine does instead.</li>
 *   <li>Every engine failure surfaces as {@link StorageUnavailableException}.</li>
 * </ul>
 */
public interface RecordStore<T extends StoredRecord<T>> {

    RecordKind kind();

    /** Assigns an id when the record has none. */
    T create(T record);

    Optional<T> find(String id);

    default T get(String id) {
        return find(id).orElseThrow(() -> new NotFoundException(kind().notFoundCode(), id));
    }

    /** Missing ids are skipped; order of the result is undefined. */
    List<T> findAll(Collection<String> ids);

    /** Evaluated by the engine (WHERE clause for JPA). Order of the result is undefined; callers sort. */
    List<T> scan(StoreFilter<T> filter);

    long count(StoreFilter<T> filter);

    /** Sum of an integer column over the matching records; 0 when nothing matches. */
    long sum(String column, ToLongFunction<T> getter, StoreFilter<T> filter);

    /**
     * @throws NotFoundException when {@code id} does not exist
     */
    T update(String id, Consumer<T> mutator);
}
