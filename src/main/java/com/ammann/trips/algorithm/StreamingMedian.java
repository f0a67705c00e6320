/* (C)2026 */
package com.ammann.trips.algorithm;

import com.ammann.trips.exception.InvariantViolationException;
import java.util.OptionalDouble;

/**
 * Running median over a stream of real values, kept in two heaps.
 *
 * <p>The lower half lives in a max-heap and the upper half in a min-heap. Every lower value
 * is &lt;= every upper value, and the lower heap holds either the same number of values as
 * the upper heap or exactly one more. The median is therefore read from the heap tops in
 * O(1) after every insertion, and each insertion costs O(log n).
 *
 * <p>Not thread-safe. Instances are meant for a single owner that feeds values in order;
 * callers sharing one instance must guard each insert/read pair with a common lock.
 */
public final class StreamingMedian
{
    private final DoubleHeap lower = DoubleHeap.maxHeap();
    private final DoubleHeap upper = DoubleHeap.minHeap();

    /**
     * Adds one sample.
     *
     * @param value finite sample
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public void insert(double value)
    {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    String.format("Median input must be finite, got %s", value));
        }

        if (lower.isEmpty() || value <= lower.peek()) {
            lower.push(value);
        } else {
            upper.push(value);
        }

        if (lower.size() > upper.size() + 1) {
            upper.push(lower.pop());
        } else if (upper.size() > lower.size()) {
            lower.push(upper.pop());
        }

        checkInvariants();
    }

    /**
     * Adds every sample in order.
     */
    public void insertAll(Iterable<Double> values)
    {
        for (Double value : values) {
            if (value == null) {
                throw new IllegalArgumentException("Median input must not contain null values");
            }
            insert(value);
        }
    }

    /**
     * Returns the median of all samples inserted so far.
     *
     * @return the median, or empty if no sample was inserted
     */
    public OptionalDouble median()
    {
        if (lower.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (lower.size() > upper.size()) {
            return OptionalDouble.of(lower.peek());
        }
        return OptionalDouble.of((lower.peek() + upper.peek()) / 2.0);
    }

    public int size()
    {
        return lower.size() + upper.size();
    }

    public boolean isEmpty()
    {
        return lower.isEmpty();
    }

    private void checkInvariants()
    {
        int difference = lower.size() - upper.size();
        if (difference < 0 || difference > 1) {
            throw new InvariantViolationException("StreamingMedian",
                    String.format("heap sizes lower=%d upper=%d", lower.size(), upper.size()));
        }
        if (!upper.isEmpty() && lower.peek() > upper.peek()) {
            throw new InvariantViolationException("StreamingMedian",
                    String.format("lower top %s exceeds upper top %s", lower.peek(), upper.peek()));
        }
    }
}
