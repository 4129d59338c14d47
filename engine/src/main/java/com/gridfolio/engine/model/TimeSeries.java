package com.gridfolio.engine.model;

import com.gridfolio.engine.exception.InvalidConfigurationException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.DoubleStream;

/**
 * Hourly series of finite values. Timestamps are implied by {@code start + i hours},
 * so they are strictly increasing and gap-free by construction.
 */
public final class TimeSeries {

    private final LocalDateTime start;
    private final double[] values;

    public TimeSeries(LocalDateTime start, double[] values) {
        this.start = Objects.requireNonNull(start, "start");
        Objects.requireNonNull(values, "values");
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidConfigurationException(
                        "Series value at " + start.plusHours(i) + " must be finite but was " + values[i]);
            }
        }
        this.values = values.clone();
    }

    public static TimeSeries of(LocalDateTime start, double... values) {
        return new TimeSeries(start, values);
    }

    public static TimeSeries constant(LocalDateTime start, int length, double value) {
        double[] values = new double[length];
        Arrays.fill(values, value);
        return new TimeSeries(start, values);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return values.length == 0 ? null : timestampAt(values.length - 1);
    }

    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int index) {
        return values[index];
    }

    public LocalDateTime timestampAt(int index) {
        return start.plusHours(index);
    }

    public List<LocalDateTime> timestamps() {
        List<LocalDateTime> timestamps = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            timestamps.add(timestampAt(i));
        }
        return timestamps;
    }

    public DoubleStream stream() {
        return Arrays.stream(values);
    }

    public TimeSeries map(DoubleUnaryOperator operator) {
        double[] mapped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            mapped[i] = operator.applyAsDouble(values[i]);
        }
        return new TimeSeries(start, mapped);
    }

    /**
     * Sub-series over {@code [fromIndex, toIndex)}.
     */
    public TimeSeries slice(int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex > values.length || fromIndex > toIndex) {
            throw new IndexOutOfBoundsException("Slice [" + fromIndex + ", " + toIndex + ") outside series of size " + values.length);
        }
        return new TimeSeries(timestampAt(fromIndex), Arrays.copyOfRange(values, fromIndex, toIndex));
    }

    public boolean isAlignedWith(TimeSeries other) {
        return other != null && start.equals(other.start) && values.length == other.values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeries other)) {
            return false;
        }
        return start.equals(other.start) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimeSeries{start=" + start + ", size=" + values.length + "}";
    }
}
