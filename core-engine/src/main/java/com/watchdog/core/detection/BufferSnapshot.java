package com.watchdog.core.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of a {@link RingBuffer}: its capacity and its values,
 * oldest first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BufferSnapshot {

    private int capacity;
    private List<Double> values = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public BufferSnapshot() {
    }

    public BufferSnapshot(int capacity, List<Double> values) {
        this.capacity = capacity;
        this.values = values != null ? new ArrayList<>(values) : null;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public List<Double> getValues() {
        return values;
    }

    public void setValues(List<Double> values) {
        this.values = values;
    }
}
