package org.rapidpll.utils;

public class DivRange {

    private final int low;
    private final int high;

    public DivRange(int low, int high) {
        assert low >= 1: "Divider must be positive: " + low;
        assert low <= high: "Invalid divider range: [" + low + ", " + high + ")";
        this.low = low;
        this.high = high;
    }

    public static DivRange of(int low, int high) {
        return new DivRange(low, high);
    }

    public int getLow() {
        return low;
    }

    public int getHigh() {
        return high;
    }

    public boolean contains(int div) {
        return div >= low && div < high;
    }

    @Override
    public String toString() {
        return String.format("[%d, %d)", low, high);
    }
}
