package org.rapidpll.utils;

public class FreqRange {

    private final double min;
    private final double max;

    public FreqRange(double min, double max) {
        assert min <= max: "Invalid frequency range: " + min + " > " + max;
        this.min = min;
        this.max = max;
    }

    public static FreqRange of(double min, double max) {
        return new FreqRange(min, max);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    // both bounds are inclusive
    public boolean contains(double freq) {
        return freq >= min && freq <= max;
    }

    @Override
    public String toString() {
        return String.format("[%.3fMHz, %.3fMHz]", min / 1e6, max / 1e6);
    }
}
