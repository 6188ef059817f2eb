package org.rapidpll;

public class ClockOutputCapacityException extends PLLConfigException {

    private final int maxClkoutNum;

    public ClockOutputCapacityException(String domainName, int maxClkoutNum) {
        super(String.format("Cannot create output for %s: all %d PLL outputs are in use", domainName, maxClkoutNum));
        this.maxClkoutNum = maxClkoutNum;
    }

    public int getMaxClkoutNum() {
        return maxClkoutNum;
    }
}
