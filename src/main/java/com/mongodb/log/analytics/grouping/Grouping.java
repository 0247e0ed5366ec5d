package com.mongodb.log.analytics.grouping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buckets items by a key function, keeping insertion order inside each bucket and
 * first-insertion order between buckets until {@link #sortBySize()} is called.
 *
 * @param <T> item type, usually a parsed record
 * @param <K> group key type
 */
public class Grouping<T, K> {

    private static final Logger logger = LoggerFactory.getLogger(Grouping.class);

    private Function<? super T, ? extends K> keyFunction;
    private Map<K, List<T>> groups = new LinkedHashMap<>();

    public Grouping(Function<? super T, ? extends K> keyFunction) {
        this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction");
    }

    public void add(T item) {
        K key = keyFunction.apply(item);
        groups.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
    }

    public void addAll(Iterable<? extends T> items) {
        for (T item : items) {
            add(item);
        }
    }

    /**
     * @return the items of a group, empty when there is no such group
     */
    public List<T> get(K key) {
        List<T> items = groups.get(key);
        return items == null ? Collections.emptyList() : Collections.unmodifiableList(items);
    }

    public Set<K> keys() {
        return Collections.unmodifiableSet(groups.keySet());
    }

    public boolean containsKey(K key) {
        return groups.containsKey(key);
    }

    /** Number of groups. */
    public int size() {
        return groups.size();
    }

    /** Number of items over all groups. */
    public int totalItems() {
        int total = 0;
        for (List<T> items : groups.values()) {
            total += items.size();
        }
        return total;
    }

    /**
     * Re-buckets every collected item with a new key function, items keep their
     * current order.
     */
    public void regroup(Function<? super T, ? extends K> newKeyFunction) {
        List<T> all = new ArrayList<>(totalItems());
        for (List<T> items : groups.values()) {
            all.addAll(items);
        }
        keyFunction = Objects.requireNonNull(newKeyFunction, "newKeyFunction");
        groups = new LinkedHashMap<>();
        addAll(all);
    }

    /**
     * Appends the items of {@code fromKey} to {@code toKey} and removes {@code fromKey}.
     */
    public void moveItems(K fromKey, K toKey) {
        if (Objects.equals(fromKey, toKey)) {
            return;
        }
        List<T> items = groups.remove(fromKey);
        if (items == null) {
            logger.debug("No group {} to move", fromKey);
            return;
        }
        groups.computeIfAbsent(toKey, k -> new ArrayList<>()).addAll(items);
    }

    /**
     * Orders groups by descending size. The sort is stable, equal sized groups stay in
     * their current order.
     */
    public void sortBySize() {
        List<Map.Entry<K, List<T>>> entries = new ArrayList<>(groups.entrySet());
        entries.sort(Comparator.comparingInt((Map.Entry<K, List<T>> e) -> e.getValue().size()).reversed());
        Map<K, List<T>> sorted = new LinkedHashMap<>();
        for (Map.Entry<K, List<T>> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        groups = sorted;
    }

    /**
     * Keeps the {@code limit} largest groups and collapses the rest into {@code othersKey}.
     * No others group is created when nothing was collapsed.
     */
    public void limit(int limit, K othersKey) {
        limit(limit, othersKey, false);
    }

    /**
     * Keeps the {@code limit} largest groups and drops the rest.
     */
    public void limitAndDiscard(int limit) {
        limit(limit, null, true);
    }

    private void limit(int limit, K othersKey, boolean discard) {
        if (limit < 0) {
            throw new IllegalArgumentException("Group limit must not be negative: " + limit);
        }
        sortBySize();
        if (groups.size() <= limit) {
            return;
        }
        Map<K, List<T>> kept = new LinkedHashMap<>();
        List<T> others = new ArrayList<>();
        int rank = 0;
        for (Map.Entry<K, List<T>> entry : groups.entrySet()) {
            if (rank++ < limit) {
                kept.put(entry.getKey(), entry.getValue());
            } else if (!discard) {
                others.addAll(entry.getValue());
            }
        }
        if (!others.isEmpty()) {
            kept.computeIfAbsent(othersKey, k -> new ArrayList<>()).addAll(others);
        }
        logger.debug("Limited {} groups to {}", groups.size(), kept.size());
        groups = kept;
    }

    public GroupStatistics statistics(K key, Function<? super T, ? extends Number> field) {
        GroupStatistics stats = new GroupStatistics();
        for (T item : get(key)) {
            stats.addRecord(field.apply(item));
        }
        return stats;
    }

    /**
     * One result per group, in the current group order.
     */
    public List<GroupResult<K, T>> results(Function<? super T, ? extends Number> field) {
        List<GroupResult<K, T>> results = new ArrayList<>(groups.size());
        for (K key : groups.keySet()) {
            results.add(new GroupResult<>(key, get(key), statistics(key, field)));
        }
        return results;
    }
}
