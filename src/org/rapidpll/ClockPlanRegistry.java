package org.rapidpll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.rapidpll.utils.HierarchicalLogger;

public class ClockPlanRegistry {

    private final String planName;
    private final PLLRangeTable rangeTable;
    private final HierarchicalLogger logger;

    private ClockInputSpec clkin;
    private final List<ClockOutputRequest> clkouts = new ArrayList<>();
    private boolean dynamicPhaseEnabled = false;
    private boolean finalized = false;
    private long maxSearchIterations = DividerSolver.UNLIMITED_ITERATIONS;

    public ClockPlanRegistry(String planName, PLLRangeTable rangeTable, HierarchicalLogger logger) {
        this.planName = planName;
        this.rangeTable = rangeTable;
        this.logger = logger;
        logger.info("Creating " + NameConvention.primitiveName + " plan " + planName);
    }

    public ClockPlanRegistry(String planName, HierarchicalLogger logger) {
        this(planName, PLLRangeTable.ECP5, logger);
    }

    public void registerInput(String signalName, double freq) {
        if (clkin != null) {
            throw new IllegalStateException("Input clock of plan " + planName + " is already registered: " + clkin);
        }
        if (!rangeTable.getClkiFreqRange().contains(freq)) {
            logger.severe("Input clock " + signalName + " rejected");
            throw new FreqRangeException(signalName, freq, rangeTable.getClkiFreqRange());
        }
        clkin = new ClockInputSpec(signalName, freq);
        logger.info(String.format("Registering ClkIn %s of %.2fMHz", signalName, freq / 1e6));
    }

    public void registerOutput(String domainName, double freq) {
        registerOutput(domainName, freq, ClockOutputRequest.DEFAULT_PHASE);
    }

    public void registerOutput(String domainName, double freq, double phase) {
        registerOutput(domainName, freq, phase, ClockOutputRequest.DEFAULT_MARGIN);
    }

    public void registerOutput(String domainName, double freq, double phase, double margin) {
        registerOutput(domainName, freq, phase, margin, true, true);
    }

    public void registerOutput(String domainName, double freq, double phase, double margin,
                               boolean withReset, boolean usesDynamicPhase) {
        checkNotFinalized();
        if (clkin == null) {
            throw new IllegalStateException("Register the input clock before creating outputs of plan " + planName);
        }
        if (domainName == null) {
            throw new IllegalArgumentException("Output clock domain name is required");
        }
        if (!(margin >= 0)) {
            throw new IllegalArgumentException("Margin of " + domainName + " must be non-negative: " + margin);
        }
        if (!Double.isFinite(phase)) {
            throw new IllegalArgumentException("Phase of " + domainName + " must be finite: " + phase);
        }
        if (!rangeTable.getClkoFreqRange().contains(freq)) {
            logger.severe("Output clock " + domainName + " rejected");
            throw new FreqRangeException(domainName, freq, rangeTable.getClkoFreqRange());
        }
        if (clkouts.size() >= rangeTable.getMaxClkoutNum()) {
            logger.severe("Output clock " + domainName + " rejected");
            throw new ClockOutputCapacityException(domainName, rangeTable.getMaxClkoutNum());
        }

        int slot = clkouts.size();
        clkouts.add(new ClockOutputRequest(slot, domainName, freq, phase, margin, withReset, usesDynamicPhase));
        logger.info(String.format("Creating ClkOut%d %s of %.2fMHz (+-%.2f%%)", slot, domainName, freq / 1e6, margin * 100));
    }

    public void enableDynamicPhaseAdjust() {
        checkNotFinalized();
        dynamicPhaseEnabled = true;
        logger.info("Enabling dynamic phase adjustment");
    }

    public void setMaxSearchIterations(long maxSearchIterations) {
        if (maxSearchIterations <= 0) {
            throw new IllegalArgumentException("Search iteration cap must be positive: " + maxSearchIterations);
        }
        this.maxSearchIterations = maxSearchIterations;
    }

    public DividerConfiguration solve() {
        if (clkin == null) {
            throw new IllegalStateException("Input clock of plan " + planName + " is not registered");
        }
        DividerSolver solver = new DividerSolver(rangeTable, logger, maxSearchIterations);
        return solver.solve(clkin.getFreq(), getOutputs(), dynamicPhaseEnabled);
    }

    public PrimitiveParameters finalizePlan() {
        checkNotFinalized();
        logger.info("Finalizing plan " + planName);
        logger.newSubStep();
        try {
            DividerConfiguration config = solve();
            finalized = true;
            return new ConfigFinalizer(logger).finalizeConfig(planName, clkin, config, dynamicPhaseEnabled);
        } finally {
            logger.endSubStep();
        }
    }

    private void checkNotFinalized() {
        if (finalized) {
            throw new IllegalStateException("Plan " + planName + " is already finalized");
        }
    }

    public String getPlanName() {
        return planName;
    }

    public PLLRangeTable getRangeTable() {
        return rangeTable;
    }

    public ClockInputSpec getInput() {
        return clkin;
    }

    public List<ClockOutputRequest> getOutputs() {
        return Collections.unmodifiableList(clkouts);
    }

    public int getOutputNum() {
        return clkouts.size();
    }

    public boolean isDynamicPhaseEnabled() {
        return dynamicPhaseEnabled;
    }

    public boolean isFinalized() {
        return finalized;
    }
}
