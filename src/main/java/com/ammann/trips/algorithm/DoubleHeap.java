/* (C)2026 */
package com.ammann.trips.algorithm;

import java.util.Arrays;

/**
 * Growable array-backed binary heap of primitive {@code double} values.
 *
 * <p>A max-heap keeps its largest value at the root, a min-heap its smallest. Children of
 * slot {@code i} live at {@code 2i + 1} and {@code 2i + 2}.
 */
final class DoubleHeap
{
    private static final int INITIAL_CAPACITY = 16;

    private final boolean maxHeap;
    private double[] values = new double[INITIAL_CAPACITY];
    private int size;

    private DoubleHeap(boolean maxHeap)
    {
        this.maxHeap = maxHeap;
    }

    static DoubleHeap maxHeap()
    {
        return new DoubleHeap(true);
    }

    static DoubleHeap minHeap()
    {
        return new DoubleHeap(false);
    }

    int size()
    {
        return size;
    }

    boolean isEmpty()
    {
        return size == 0;
    }

    double peek()
    {
        if (size == 0) {
            throw new IllegalStateException("Heap is empty");
        }
        return values[0];
    }

    void push(double value)
    {
        if (size == values.length) {
            values = Arrays.copyOf(values, values.length * 2);
        }
        values[size] = value;
        siftUp(size);
        size++;
    }

    double pop()
    {
        double top = peek();
        size--;
        if (size > 0) {
            values[0] = values[size];
            siftDown(0);
        }
        return top;
    }

    /** {@code true} when {@code a} belongs closer to the root than {@code b}. */
    private boolean precedes(double a, double b)
    {
        return maxHeap ? a > b : a < b;
    }

    private void siftUp(int index)
    {
        int i = index;
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (!precedes(values[i], values[parent])) {
                break;
            }
            swap(i, parent);
            i = parent;
        }
    }

    private void siftDown(int index)
    {
        int i = index;
        while (true) {
            int left = 2 * i + 1;
            int right = left + 1;
            int best = i;

            if (left < size && precedes(values[left], values[best])) {
                best = left;
            }
            if (right < size && precedes(values[right], values[best])) {
                best = right;
            }
            if (best == i) {
                return;
            }
            swap(i, best);
            i = best;
        }
    }

    private void swap(int i, int j)
    {
        double tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }
}
