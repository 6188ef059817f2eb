package org.rapidpll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class DividerConfiguration {

    private final double clkinFreq;
    private final int clkiDiv;
    private final int clkfbDiv;
    private final double vcoFreq;
    private final int feedbackSlot;
    private final List<ClockOutputSolution> outputs;

    public DividerConfiguration(double clkinFreq, int clkiDiv, int clkfbDiv, double vcoFreq, int feedbackSlot,
                                List<ClockOutputSolution> outputs) {
        this.clkinFreq = clkinFreq;
        this.clkiDiv = clkiDiv;
        this.clkfbDiv = clkfbDiv;
        this.vcoFreq = vcoFreq;
        this.feedbackSlot = feedbackSlot;
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        assert feedbackSlot >= 0 && feedbackSlot < outputs.size(): "Feedback slot not resolved: " + feedbackSlot;
    }

    public double getClkinFreq() {
        return clkinFreq;
    }

    public int getClkiDiv() {
        return clkiDiv;
    }

    public int getClkfbDiv() {
        return clkfbDiv;
    }

    public double getPfdFreq() {
        return clkinFreq / clkiDiv;
    }

    public double getVcoFreq() {
        return vcoFreq;
    }

    public int getFeedbackSlot() {
        return feedbackSlot;
    }

    public ClockOutputSolution getFeedbackOutput() {
        return outputs.get(feedbackSlot);
    }

    public boolean hasFeedbackOnlySlot() {
        return getFeedbackOutput().isFeedbackOnly();
    }

    // total division of the feedback loop: CLKFB_DIV times the divider of the output closing it
    public int getFeedbackTotalDiv() {
        return clkfbDiv * getFeedbackOutput().getDiv();
    }

    public List<ClockOutputSolution> getOutputs() {
        return outputs;
    }

    public ClockOutputSolution getOutput(int slot) {
        return outputs.get(slot);
    }

    public int getOutputNum() {
        return outputs.size();
    }

    public Map<String, Object> toSummaryMap() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("clki_div", clkiDiv);
        summary.put("clkfb_div", clkfbDiv);
        summary.put("clkfb", feedbackSlot);
        summary.put("vco", String.format("%.2fMHz", vcoFreq / 1e6));
        for (ClockOutputSolution output : outputs) {
            int slot = output.getSlot();
            summary.put("clko" + slot + "_div", output.getDiv());
            if (!output.isFeedbackOnly()) {
                summary.put("clko" + slot + "_freq", String.format("%.2fMHz", output.getFreq() / 1e6));
                summary.put("clko" + slot + "_phase", String.format("%.2f", output.getPhase()));
            }
        }
        return summary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DividerConfiguration)) {
            return false;
        }
        DividerConfiguration other = (DividerConfiguration) o;
        return clkiDiv == other.clkiDiv && clkfbDiv == other.clkfbDiv && feedbackSlot == other.feedbackSlot
            && Double.compare(clkinFreq, other.clkinFreq) == 0 && Double.compare(vcoFreq, other.vcoFreq) == 0
            && outputs.equals(other.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clkinFreq, clkiDiv, clkfbDiv, vcoFreq, feedbackSlot, outputs);
    }

    @Override
    public String toString() {
        return "DividerConfiguration" + toSummaryMap();
    }
}
