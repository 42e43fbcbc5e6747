package com.shlokmestry.gateway.ratelimit;

import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Shared bucket storage. Implementations must apply {@link #compute} atomically per key;
 * this is what keeps concurrent checks of the same key from losing increments.
 *
 * <p>The in-process implementation is {@link InMemoryBucketStore}. A multi-process
 * deployment would put a key-value store with native TTL behind this interface.
 */
public interface BucketStore {

    Bucket compute(String key, BiFunction<String, Bucket, Bucket> remapping);

    boolean contains(String key);

    boolean remove(String key);

    void clear();

    int size();

    long totalCount();

    int removeIf(Predicate<Bucket> predicate);

    /**
     * Drops up to {@code count} buckets, oldest window first.
     */
    int evictOldest(int count);
}
