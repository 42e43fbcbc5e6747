package com.shlokmestry.gateway.ratelimit;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.Predicate;

public class InMemoryBucketStore implements BucketStore {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Override
    public Bucket compute(String key, BiFunction<String, Bucket, Bucket> remapping) {
        return buckets.compute(key, remapping);
    }

    @Override
    public boolean contains(String key) {
        return buckets.containsKey(key);
    }

    @Override
    public boolean remove(String key) {
        return buckets.remove(key) != null;
    }

    @Override
    public void clear() {
        buckets.clear();
    }

    @Override
    public int size() {
        return buckets.size();
    }

    @Override
    public long totalCount() {
        long total = 0;
        for (Bucket b : buckets.values()) {
            total += b.count();
        }
        return total;
    }

    @Override
    public int removeIf(Predicate<Bucket> predicate) {
        int removed = 0;
        for (Map.Entry<String, Bucket> e : buckets.entrySet()) {
            // remove(key, value) so a bucket refreshed meanwhile is kept
            if (predicate.test(e.getValue()) && buckets.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int evictOldest(int count) {
        if (count <= 0) {
            return 0;
        }
        List<Map.Entry<String, Bucket>> oldest = buckets.entrySet().stream()
                .sorted(Comparator.comparingLong(e -> e.getValue().windowStartMillis()))
                .limit(count)
                .toList();

        int removed = 0;
        for (Map.Entry<String, Bucket> e : oldest) {
            if (buckets.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
