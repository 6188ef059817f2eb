package org.rapidpll;

public final class PhaseEncoder {

    private PhaseEncoder() {
    }

    public static int encode(double phase, int div) {
        assert div >= 1: "Output divider must be positive: " + div;
        return (int) (phase * (div + 1) / 360 + div - 1);
    }
}
