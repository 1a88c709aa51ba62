package com.chunkflow.core.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits an ordered sequence into contiguous, non-overlapping slices.
 * Every element lands in exactly one slice and order is preserved within and
 * across slices; only the last slice may be shorter than the batch size.
 */
public final class BatchPartitioner {

    private BatchPartitioner() {}

    /**
     * Lazily partitions {@code items} into slices of at most {@code batchSize} elements.
     * Slices are read-only views over a snapshot of the input; the iterable can be walked more than once.
     * Elements are not inspected, so null elements are carried through like any other.
     *
     * @throws IllegalArgumentException if batchSize is not positive
     */
    public static <T> Iterable<List<T>> partition(List<T> items, int batchSize) {
        requireValidBatchSize(batchSize);
        List<T> source = Collections.unmodifiableList(new ArrayList<>(items));
        return () -> new Iterator<>() {
            private int offset;

            @Override
            public boolean hasNext() {
                return offset < source.size();
            }

            @Override
            public List<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int end = Math.min(offset + batchSize, source.size());
                List<T> slice = source.subList(offset, end);
                offset = end;
                return slice;
            }
        };
    }

    /** Number of slices {@link #partition} produces for {@code itemCount} elements. */
    public static int batchCount(int itemCount, int batchSize) {
        requireValidBatchSize(batchSize);
        return (itemCount + batchSize - 1) / batchSize;
    }

    static void requireValidBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        }
    }
}
