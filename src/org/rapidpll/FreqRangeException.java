package org.rapidpll;

import org.rapidpll.utils.FreqRange;

public class FreqRangeException extends PLLConfigException {

    private final double freq;
    private final FreqRange range;

    public FreqRangeException(String clockName, double freq, FreqRange range) {
        super(String.format("Frequency of %s (%.6fMHz) is out of range %s", clockName, freq / 1e6, range));
        this.freq = freq;
        this.range = range;
    }

    public double getFreq() {
        return freq;
    }

    public FreqRange getRange() {
        return range;
    }
}
