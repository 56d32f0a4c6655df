package com.flavorsnap.backend.common.store;

/**
 * A record a {@link RecordStore} can hold.
 * {@link #copy()} must return a deep-enough copy that mutating it never touches the original.
 */
public interface StoredRecord<T extends StoredRecord<T>> {

    String getId();

    void setId(String id);

    T copy();
}
