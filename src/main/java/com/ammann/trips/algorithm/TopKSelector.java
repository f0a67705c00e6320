/* (C)2026 */
package com.ammann.trips.algorithm;

import com.ammann.trips.exception.InvariantViolationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exact top-k frequency counter over a stream of category occurrences.
 *
 * <p>All distinct categories are counted in a hash map, since the true top-k is unknown
 * until the whole stream has been seen. In addition, a bounded min-heap of at most
 * {@code capacity} entries tracks the current best candidates. Its root is the weakest one.
 * Ranking is by count descending, then by first-seen order ascending, so results are
 * deterministic for a given input order.
 *
 * <p>Every category outside the heap ranks below the heap root. Counts only grow, and a
 * category is re-checked against the root each time its own count grows, so this holds
 * after every {@link #insert(Object, long)} without a final rescan.
 *
 * <p>Counting costs O(1) per occurrence plus O(log k) heap maintenance. Extra space beyond
 * the counts is O(k). Not thread-safe.
 *
 * @param <K> category type; only {@code equals} and {@code hashCode} are used
 */
public final class TopKSelector<K>
{
    /** Orders from strongest to weakest candidate. */
    private static final Comparator<Frequency<?>> BY_RANK =
            Comparator.<Frequency<?>>comparingLong(f -> f.count).reversed()
                    .thenComparingLong(f -> f.firstSeen);

    /** The candidate heap grows on demand up to {@code capacity}. */
    private static final int INITIAL_HEAP_SLOTS = 16;

    private final int capacity;
    private final Map<K, Frequency<K>> counts = new HashMap<>();
    private Frequency<K>[] heap;
    private int heapSize;
    private long nextOrdinal;
    private long totalCount;

    /**
     * @param capacity maximum number of candidates kept in the bounded heap
     * @throws IllegalArgumentException if capacity is negative
     */
    @SuppressWarnings("unchecked")
    public TopKSelector(int capacity)
    {
        if (capacity < 0) {
            throw new IllegalArgumentException(
                    String.format("Top-k capacity must be non-negative, got %d", capacity));
        }
        this.capacity = capacity;
        this.heap = (Frequency<K>[]) new Frequency<?>[Math.min(capacity, INITIAL_HEAP_SLOTS)];
    }

    /**
     * Records one occurrence of {@code category}.
     */
    public void insert(K category)
    {
        insert(category, 1L);
    }

    /**
     * Records {@code occurrences} occurrences of {@code category} at once, e.g. when the
     * caller already holds pre-aggregated counts.
     *
     * @throws IllegalArgumentException if category is null or occurrences is not positive
     */
    public void insert(K category, long occurrences)
    {
        if (category == null) {
            throw new IllegalArgumentException("Category must not be null");
        }
        if (occurrences <= 0) {
            throw new IllegalArgumentException(
                    String.format("Occurrences must be positive, got %d", occurrences));
        }

        Frequency<K> frequency = counts.get(category);
        if (frequency == null) {
            frequency = new Frequency<>(category, nextOrdinal++);
            counts.put(category, frequency);
        }
        frequency.count = Math.addExact(frequency.count, occurrences);
        totalCount = Math.addExact(totalCount, occurrences);

        offer(frequency);
    }

    /**
     * Returns the {@code k} most frequent categories, by count descending with ties
     * resolved by first-seen order. Reading does not change any state.
     *
     * @param k number of entries wanted; {@code k <= 0} yields an empty list
     * @return at most {@code k} records, fewer when fewer distinct categories were seen
     */
    public List<FrequencyRecord<K>> topK(int k)
    {
        if (k <= 0 || counts.isEmpty()) {
            return List.of();
        }
        if (k > capacity && counts.size() > heapSize) {
            // The heap cannot answer beyond its capacity; rank the full table instead.
            return counts.values().stream()
                    .sorted(BY_RANK)
                    .limit(k)
                    .map(Frequency::toRecord)
                    .toList();
        }

        checkHeapInvariants();
        List<FrequencyRecord<K>> ranked = drainCopyDescending();
        return ranked.size() > k ? List.copyOf(ranked.subList(0, k)) : ranked;
    }

    /**
     * Equivalent to {@code topK(capacity)}.
     */
    public List<FrequencyRecord<K>> topK()
    {
        return topK(capacity);
    }

    /**
     * Returns the number of occurrences seen for {@code category}, 0 if never seen.
     */
    public long count(K category)
    {
        Frequency<K> frequency = counts.get(category);
        return frequency == null ? 0L : frequency.count;
    }

    public int distinctCount()
    {
        return counts.size();
    }

    public long totalCount()
    {
        return totalCount;
    }

    public int capacity()
    {
        return capacity;
    }

    private void offer(Frequency<K> frequency)
    {
        if (capacity == 0) {
            return;
        }
        if (frequency.heapIndex >= 0) {
            // Stronger now; move away from the root.
            siftDown(heap, heapSize, frequency.heapIndex, true);
            return;
        }
        if (heapSize < capacity) {
            if (heapSize == heap.length) {
                grow();
            }
            heap[heapSize] = frequency;
            frequency.heapIndex = heapSize;
            heapSize++;
            siftUp(heap, heapSize - 1, true);
            return;
        }
        if (weaker(heap[0], frequency)) {
            heap[0].heapIndex = -1;
            heap[0] = frequency;
            frequency.heapIndex = 0;
            siftDown(heap, heapSize, 0, true);
        }
    }

    private void grow()
    {
        int doubled = heap.length == 0 ? 1 : heap.length * 2;
        int newLength = doubled < 0 ? capacity : Math.min(doubled, capacity);
        heap = Arrays.copyOf(heap, newLength);
    }

    /**
     * Pops a scratch copy of the heap weakest-first and reverses the result.
     */
    private List<FrequencyRecord<K>> drainCopyDescending()
    {
        Frequency<K>[] scratch = Arrays.copyOf(heap, heapSize);
        int size = heapSize;
        List<FrequencyRecord<K>> ascending = new ArrayList<>(size);
        while (size > 0) {
            ascending.add(scratch[0].toRecord());
            size--;
            scratch[0] = scratch[size];
            siftDown(scratch, size, 0, false);
        }
        Collections.reverse(ascending);
        return Collections.unmodifiableList(ascending);
    }

    private void checkHeapInvariants()
    {
        if (heapSize > capacity) {
            throw new InvariantViolationException("TopKSelector",
                    String.format("heap size %d exceeds capacity %d", heapSize, capacity));
        }
        for (int i = 1; i < heapSize; i++) {
            if (weaker(heap[i], heap[(i - 1) / 2])) {
                throw new InvariantViolationException("TopKSelector",
                        String.format("entry at %d ranks below its parent", i));
            }
            if (heap[i].heapIndex != i) {
                throw new InvariantViolationException("TopKSelector",
                        String.format("entry at %d records position %d", i, heap[i].heapIndex));
            }
        }
    }

    /** {@code true} when {@code a} ranks strictly below {@code b}. */
    private static boolean weaker(Frequency<?> a, Frequency<?> b)
    {
        if (a.count != b.count) {
            return a.count < b.count;
        }
        return a.firstSeen > b.firstSeen;
    }

    private static <K> void siftUp(Frequency<K>[] array, int index, boolean track)
    {
        int i = index;
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (!weaker(array[i], array[parent])) {
                break;
            }
            swap(array, i, parent, track);
            i = parent;
        }
    }

    private static <K> void siftDown(Frequency<K>[] array, int size, int index, boolean track)
    {
        int i = index;
        while (true) {
            int left = 2 * i + 1;
            int right = left + 1;
            int weakest = i;

            if (left < size && weaker(array[left], array[weakest])) {
                weakest = left;
            }
            if (right < size && weaker(array[right], array[weakest])) {
                weakest = right;
            }
            if (weakest == i) {
                return;
            }
            swap(array, i, weakest, track);
            i = weakest;
        }
    }

    private static <K> void swap(Frequency<K>[] array, int i, int j, boolean track)
    {
        Frequency<K> tmp = array[i];
        array[i] = array[j];
        array[j] = tmp;
        if (track) {
            array[i].heapIndex = i;
            array[j].heapIndex = j;
        }
    }

    /** Mutable count slot; {@code heapIndex} is -1 while outside the candidate heap. */
    private static final class Frequency<K>
    {
        private final K category;
        private final long firstSeen;
        private long count;
        private int heapIndex = -1;

        private Frequency(K category, long firstSeen)
        {
            this.category = category;
            this.firstSeen = firstSeen;
        }

        private FrequencyRecord<K> toRecord()
        {
            return new FrequencyRecord<>(category, count);
        }
    }
}
