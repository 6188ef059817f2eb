package org.rapidpll;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import org.rapidpll.utils.DivRange;
import org.rapidpll.utils.HierarchicalLogger;

// first-fit search, ascending over input divider, shared feedback output divider, then feedback divider
public class DividerSolver {

    public static final long UNLIMITED_ITERATIONS = Long.MAX_VALUE;

    public static class Candidate {
        private final DividerConfiguration config;
        private final String rejectReason;

        private Candidate(DividerConfiguration config, String rejectReason) {
            this.config = config;
            this.rejectReason = rejectReason;
        }

        public static Candidate valid(DividerConfiguration config) {
            return new Candidate(config, null);
        }

        public static Candidate rejected(String reason) {
            return new Candidate(null, reason);
        }

        public boolean isValid() {
            return config != null;
        }

        public DividerConfiguration getConfig() {
            return config;
        }

        public String getRejectReason() {
            return rejectReason;
        }
    }

    private final PLLRangeTable rangeTable;
    private final HierarchicalLogger logger;
    private final long maxIterations;

    public DividerSolver(PLLRangeTable rangeTable, HierarchicalLogger logger, long maxIterations) {
        assert maxIterations > 0;
        this.rangeTable = rangeTable;
        this.logger = logger;
        this.maxIterations = maxIterations;
    }

    public DividerSolver(PLLRangeTable rangeTable, HierarchicalLogger logger) {
        this(rangeTable, logger, UNLIMITED_ITERATIONS);
    }

    public DividerSolver(HierarchicalLogger logger) {
        this(PLLRangeTable.ECP5, logger);
    }

    public DividerConfiguration solve(double clkinFreq, List<ClockOutputRequest> outputs, boolean dynamicPhaseEnabled) {
        for (int i = 0; i < outputs.size(); i++) {
            assert outputs.get(i).getSlot() == i: "Output slots must be numbered in registration order";
        }

        DivRange clkiDivRange = rangeTable.getClkiDivRange();
        DivRange clkoDivRange = rangeTable.getClkoDivRange();
        DivRange clkfbDivRange = rangeTable.getClkfbDivRange();
        long iterNum = 0;

        for (int clkiDiv = clkiDivRange.getLow(); clkiDiv < clkiDivRange.getHigh(); clkiDiv++) {
            double pfdFreq = clkinFreq / clkiDiv;
            if (!rangeTable.getPfdFreqRange().contains(pfdFreq)) {
                continue;
            }

            for (int clkofbDiv = clkoDivRange.getLow(); clkofbDiv < clkoDivRange.getHigh(); clkofbDiv++) {
                for (int clkfbDiv = clkfbDivRange.getLow(); clkfbDiv < clkfbDivRange.getHigh(); clkfbDiv++) {
                    iterNum++;
                    if (iterNum > maxIterations) {
                        String msg = String.format("No PLL config found within %d search iterations", maxIterations);
                        logger.severe(msg);
                        throw new NoPLLConfigFoundException(msg, iterNum - 1);
                    }

                    double vcoFreq = pfdFreq * clkfbDiv * clkofbDiv;
                    if (!rangeTable.getVcoFreqRange().contains(vcoFreq)) {
                        continue;
                    }

                    Candidate candidate = evaluate(clkinFreq, clkiDiv, clkofbDiv, clkfbDiv, outputs, dynamicPhaseEnabled);
                    if (candidate.isValid()) {
                        DividerConfiguration config = candidate.getConfig();
                        logger.logKeyValues(Level.INFO, "PLL configuration found:", config.toSummaryMap());
                        return config;
                    }

                    if (logger.isLoggable(Level.FINEST)) {
                        logger.finest(String.format("Reject clki_div=%d clkofb_div=%d clkfb_div=%d vco=%.3fMHz: %s",
                            clkiDiv, clkofbDiv, clkfbDiv, vcoFreq / 1e6, candidate.getRejectReason()));
                    }
                }
            }
        }

        String msg = String.format("No PLL config found for input %.3fMHz and %d outputs", clkinFreq / 1e6, outputs.size());
        logger.severe(msg);
        throw new NoPLLConfigFoundException(msg, iterNum);
    }

    // the vco frequency is not range checked here
    public Candidate evaluate(double clkinFreq, int clkiDiv, int clkofbDiv, int clkfbDiv,
                              List<ClockOutputRequest> outputs, boolean dynamicPhaseEnabled) {
        double vcoFreq = (clkinFreq / clkiDiv) * clkfbDiv * clkofbDiv;
        DivRange clkoDivRange = rangeTable.getClkoDivRange();

        List<ClockOutputSolution> solutions = new ArrayList<>(outputs.size() + 1);
        int feedbackSlot = -1;

        for (ClockOutputRequest request : outputs) {
            ClockOutputSolution solution = null;
            for (int div = clkoDivRange.getLow(); div < clkoDivRange.getHigh(); div++) {
                double clkFreq = vcoFreq / div;
                if (request.acceptsFreq(clkFreq)) {
                    solution = new ClockOutputSolution(request, div, clkFreq);
                    break;
                }
            }

            // smallest divider within margin wins, not the nearest frequency
            if (solution == null) {
                return Candidate.rejected("no divider meets the margin of " + request);
            }
            solutions.add(solution);

            if (feedbackSlot < 0 && solution.getDiv() == clkofbDiv && request.canDriveFeedback(dynamicPhaseEnabled)) {
                feedbackSlot = request.getSlot();
            }
        }

        if (feedbackSlot < 0) {
            int freeSlot = outputs.size();
            if (freeSlot >= rangeTable.getMaxClkoutNum()) {
                return Candidate.rejected("no output can drive feedback and no free slot is left");
            }

            int feedbackDiv = (int) Math.rint((vcoFreq * clkiDiv) / (clkinFreq * clkfbDiv));
            assert clkoDivRange.contains(feedbackDiv): "Feedback divider out of range: " + feedbackDiv;
            solutions.add(new ClockOutputSolution(ClockOutputRequest.feedbackOnly(freeSlot), feedbackDiv, vcoFreq / feedbackDiv));
            feedbackSlot = freeSlot;
        }

        return Candidate.valid(new DividerConfiguration(clkinFreq, clkiDiv, clkfbDiv, vcoFreq, feedbackSlot, solutions));
    }
}
