package org.rapidpll;

import java.util.Objects;

public class ClockOutputRequest {

    public static final double DEFAULT_PHASE = 0.0;
    public static final double DEFAULT_MARGIN = 1e-2;

    private final int slot;
    private final String domainName;
    private final double freq;
    private final double phase;
    private final double margin;
    private final boolean withReset;
    private final boolean usesDynamicPhase;

    public ClockOutputRequest(int slot, String domainName, double freq, double phase, double margin,
                              boolean withReset, boolean usesDynamicPhase) {
        this.slot = slot;
        this.domainName = domainName;
        this.freq = freq;
        this.phase = phase;
        this.margin = margin;
        this.withReset = withReset;
        this.usesDynamicPhase = usesDynamicPhase;
    }

    // internal slot closing the feedback loop, no clock domain attached
    public static ClockOutputRequest feedbackOnly(int slot) {
        return new ClockOutputRequest(slot, null, 0.0, 0.0, 0.0, false, false);
    }

    public int getSlot() {
        return slot;
    }

    public String getDomainName() {
        return domainName;
    }

    public double getFreq() {
        return freq;
    }

    public double getPhase() {
        return phase;
    }

    public double getMargin() {
        return margin;
    }

    public boolean hasReset() {
        return withReset;
    }

    public boolean usesDynamicPhase() {
        return usesDynamicPhase;
    }

    public boolean isFeedbackOnly() {
        return domainName == null;
    }

    public boolean acceptsFreq(double actualFreq) {
        return Math.abs(actualFreq - freq) <= freq * margin;
    }

    // an output tuned by dynamic phase adjustment cannot close the loop
    public boolean canDriveFeedback(boolean dynamicPhaseEnabled) {
        return !(usesDynamicPhase && dynamicPhaseEnabled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClockOutputRequest)) {
            return false;
        }
        ClockOutputRequest other = (ClockOutputRequest) o;
        return slot == other.slot && Double.compare(freq, other.freq) == 0
            && Double.compare(phase, other.phase) == 0 && Double.compare(margin, other.margin) == 0
            && withReset == other.withReset && usesDynamicPhase == other.usesDynamicPhase
            && Objects.equals(domainName, other.domainName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slot, domainName, freq, phase, margin, withReset, usesDynamicPhase);
    }

    @Override
    public String toString() {
        if (isFeedbackOnly()) {
            return String.format("ClkOut%d(feedback)", slot);
        }
        return String.format("ClkOut%d(%s, %.3fMHz, %.1fdeg, +-%.2f%%)", slot, domainName, freq / 1e6, phase, margin * 100);
    }
}
