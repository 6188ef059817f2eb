package org.rapidpll;

import java.util.Objects;

public class ClockOutputSolution {

    private final ClockOutputRequest request;
    private final int div;
    private final double freq;

    public ClockOutputSolution(ClockOutputRequest request, int div, double freq) {
        this.request = request;
        this.div = div;
        this.freq = freq;
    }

    public ClockOutputRequest getRequest() {
        return request;
    }

    public int getSlot() {
        return request.getSlot();
    }

    public int getDiv() {
        return div;
    }

    public double getFreq() {
        return freq;
    }

    public double getPhase() {
        return request.getPhase();
    }

    public boolean isFeedbackOnly() {
        return request.isFeedbackOnly();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClockOutputSolution)) {
            return false;
        }
        ClockOutputSolution other = (ClockOutputSolution) o;
        return div == other.div && Double.compare(freq, other.freq) == 0 && request.equals(other.request);
    }

    @Override
    public int hashCode() {
        return Objects.hash(request, div, freq);
    }
}
