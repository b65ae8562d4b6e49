package com.watchdog.core.detection;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-capacity rolling window of numeric samples.
 *
 * <p>
 * {@link #push(double)} is O(1) and overwrites the oldest sample once the
 * buffer is full. {@link #values()} returns the samples oldest first.
 * </p>
 *
 * <h3>Empty buffers</h3>
 * <p>
 * {@link #median()}, {@link #mean()}, {@link #min()} and {@link #max()} return
 * {@code 0} when no sample has been pushed. Callers must consult
 * {@link #count()} before treating a zero as a real value.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. {@link AnomalyDetector} guards each buffer it owns.
 * </p>
 *
 * @since 1.0.0
 */
public class RingBuffer {

    private final double[] slots;

    /** Next write position. */
    private int cursor;

    /** Number of samples held, never more than the capacity. */
    private int count;

    /**
     * @param capacity maximum number of samples; must be &gt; 0
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be > 0, got: " + capacity);
        }
        this.slots = new double[capacity];
    }

    /**
     * Rebuild a buffer from its snapshot.
     *
     * @param snapshot capacity and values, oldest first
     * @return an equivalent buffer
     * @throws NullPointerException     if the snapshot or its values are
     *                                  {@code null}
     * @throws IllegalArgumentException if the snapshot capacity is not positive
     */
    public static RingBuffer fromSnapshot(BufferSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Objects.requireNonNull(snapshot.getValues(), "Snapshot values must not be null");
        RingBuffer buffer = new RingBuffer(snapshot.getCapacity());
        for (Double value : snapshot.getValues()) {
            if (value != null) {
                buffer.push(value);
            }
        }
        return buffer;
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    public void push(double value) {
        slots[cursor] = value;
        cursor = (cursor + 1) % slots.length;
        if (count < slots.length) {
            count++;
        }
    }

    public void clear() {
        Arrays.fill(slots, 0);
        cursor = 0;
        count = 0;
    }

    // ---------------------------------------------------------------
    // Readout
    // ---------------------------------------------------------------

    /**
     * @return a copy of the held samples, oldest first
     */
    public double[] values() {
        double[] out = new double[count];
        if (count < slots.length) {
            System.arraycopy(slots, 0, out, 0, count);
        } else {
            int tail = slots.length - cursor;
            System.arraycopy(slots, cursor, out, 0, tail);
            System.arraycopy(slots, 0, out, tail, cursor);
        }
        return out;
    }

    public int count() {
        return count;
    }

    public int capacity() {
        return slots.length;
    }

    public boolean isFull() {
        return count == slots.length;
    }

    /**
     * Median of the held samples; the mean of the two middle samples when the
     * count is even.
     *
     * @return the median, or 0 when empty
     */
    public double median() {
        if (count == 0) {
            return 0;
        }
        double[] sorted = values();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0
                ? (sorted[mid - 1] + sorted[mid]) / 2
                : sorted[mid];
    }

    /**
     * @return arithmetic mean, or 0 when empty
     */
    public double mean() {
        if (count == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values()) {
            sum += v;
        }
        return sum / count;
    }

    /**
     * @return smallest sample, or 0 when empty
     */
    public double min() {
        return count == 0 ? 0 : Arrays.stream(values()).min().orElse(0);
    }

    /**
     * @return largest sample, or 0 when empty
     */
    public double max() {
        return count == 0 ? 0 : Arrays.stream(values()).max().orElse(0);
    }

    /**
     * @return serializable capacity and values
     */
    public BufferSnapshot toSnapshot() {
        return new BufferSnapshot(slots.length, Arrays.stream(values()).boxed().toList());
    }

    @Override
    public String toString() {
        return "RingBuffer{capacity=" + slots.length + ", count=" + count + '}';
    }
}
