package org.rapidpll;

import org.rapidpll.utils.DivRange;
import org.rapidpll.utils.FreqRange;

public class PLLRangeTable {

    public static final PLLRangeTable ECP5 = new PLLRangeTable(
        4,
        DivRange.of(1, 128 + 1),
        DivRange.of(1, 128 + 1),
        DivRange.of(1, 128 + 1),
        FreqRange.of(8e6, 400e6),
        FreqRange.of(3.125e6, 400e6),
        FreqRange.of(400e6, 800e6),
        FreqRange.of(10e6, 400e6)
    );

    private final int maxClkoutNum;
    private final DivRange clkiDivRange;
    private final DivRange clkfbDivRange;
    private final DivRange clkoDivRange;
    private final FreqRange clkiFreqRange;
    private final FreqRange clkoFreqRange;
    private final FreqRange vcoFreqRange;
    private final FreqRange pfdFreqRange;

    public PLLRangeTable(int maxClkoutNum, DivRange clkiDivRange, DivRange clkfbDivRange, DivRange clkoDivRange,
                         FreqRange clkiFreqRange, FreqRange clkoFreqRange, FreqRange vcoFreqRange, FreqRange pfdFreqRange) {
        assert maxClkoutNum > 0;
        this.maxClkoutNum = maxClkoutNum;
        this.clkiDivRange = clkiDivRange;
        this.clkfbDivRange = clkfbDivRange;
        this.clkoDivRange = clkoDivRange;
        this.clkiFreqRange = clkiFreqRange;
        this.clkoFreqRange = clkoFreqRange;
        this.vcoFreqRange = vcoFreqRange;
        this.pfdFreqRange = pfdFreqRange;
    }

    public int getMaxClkoutNum() {
        return maxClkoutNum;
    }

    public DivRange getClkiDivRange() {
        return clkiDivRange;
    }

    public DivRange getClkfbDivRange() {
        return clkfbDivRange;
    }

    public DivRange getClkoDivRange() {
        return clkoDivRange;
    }

    public FreqRange getClkiFreqRange() {
        return clkiFreqRange;
    }

    public FreqRange getClkoFreqRange() {
        return clkoFreqRange;
    }

    public FreqRange getVcoFreqRange() {
        return vcoFreqRange;
    }

    public FreqRange getPfdFreqRange() {
        return pfdFreqRange;
    }
}
