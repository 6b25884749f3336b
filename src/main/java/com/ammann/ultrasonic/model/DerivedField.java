/* (C)2026 */
package com.ammann.ultrasonic.model;

import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * Per-point scalar values computed from a measurement sequence, in input order.
 *
 * <p>Entries that could not be computed hold the {@link #MISSING} sentinel. Consumers
 * must treat such entries as absent and leave them out of any aggregate. Instances are
 * immutable; the backing array is copied on the way in and on the way out.
 */
public final class DerivedField
{
    /** Missing-value sentinel. Compare with {@link Double#isFinite(double)}, never with {@code ==}. */
    public static final double MISSING = Double.NaN;

    private final double[] values;

    private DerivedField(double[] values)
    {
        this.values = values;
    }

    /**
     * Wraps a copy of the given values. Non-finite entries are normalized to {@link #MISSING}.
     */
    public static DerivedField of(double... values)
    {
        double[] copy = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = Double.isFinite(values[i]) ? values[i] : MISSING;
        }
        return new DerivedField(copy);
    }

    /** A field of the given size in which every entry is missing. */
    public static DerivedField allMissing(int size)
    {
        double[] values = new double[size];
        Arrays.fill(values, MISSING);
        return new DerivedField(values);
    }

    public int size()
    {
        return values.length;
    }

    /** Raw value at {@code index}, {@link #MISSING} when absent. */
    public double get(int index)
    {
        return values[index];
    }

    public OptionalDouble valueAt(int index)
    {
        return isMissing(index) ? OptionalDouble.empty() : OptionalDouble.of(values[index]);
    }

    public boolean isMissing(int index)
    {
        return !Double.isFinite(values[index]);
    }

    /** Finite entries only, in input order. */
    public double[] finiteValues()
    {
        return DoubleStream.of(values).filter(Double::isFinite).toArray();
    }

    public int finiteCount()
    {
        return (int) DoubleStream.of(values).filter(Double::isFinite).count();
    }

    public int missingCount()
    {
        return values.length - finiteCount();
    }

    public double[] toArray()
    {
        return values.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof DerivedField other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString()
    {
        return "DerivedField{size=" + values.length + ", missing=" + missingCount() + "}";
    }
}
