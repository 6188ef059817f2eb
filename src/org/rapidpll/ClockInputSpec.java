package org.rapidpll;

public class ClockInputSpec {

    private final String signalName;
    private final double freq;

    public ClockInputSpec(String signalName, double freq) {
        this.signalName = signalName;
        this.freq = freq;
    }

    public String getSignalName() {
        return signalName;
    }

    public double getFreq() {
        return freq;
    }

    @Override
    public String toString() {
        return String.format("%s@%.3fMHz", signalName, freq / 1e6);
    }
}
