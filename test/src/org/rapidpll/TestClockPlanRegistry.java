package org.rapidpll;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import org.rapidpll.utils.HierarchicalLogger;

public class TestClockPlanRegistry {

    private ClockPlanRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new ClockPlanRegistry("pll0", HierarchicalLogger.createPseudoLogger("TestClockPlanRegistry"));
    }

    @ParameterizedTest
    @ValueSource(doubles = {7.999e6, 400.001e6, 0.0, -25e6})
    public void testInputOutOfRange(double freq) {
        FreqRangeException e = Assertions.assertThrows(FreqRangeException.class, () -> registry.registerInput("clk", freq));
        Assertions.assertEquals(freq, e.getFreq());
        Assertions.assertNull(registry.getInput());
    }

    @ParameterizedTest
    @ValueSource(doubles = {8e6, 400e6})
    public void testInputRangeIsInclusive(double freq) {
        registry.registerInput("clk", freq);
        Assertions.assertEquals(freq, registry.getInput().getFreq());
    }

    @Test
    public void testInputRegisteredOnce() {
        registry.registerInput("clk25", 25e6);
        Assertions.assertThrows(IllegalStateException.class, () -> registry.registerInput("clk25", 25e6));
        Assertions.assertEquals("clk25", registry.getInput().getSignalName());
    }

    @Test
    public void testOutputBeforeInput() {
        Assertions.assertThrows(IllegalStateException.class, () -> registry.registerOutput("sys", 100e6));
    }

    @ParameterizedTest
    @ValueSource(doubles = {1e6, 3.124e6, 400.5e6})
    public void testOutputOutOfRange(double freq) {
        registry.registerInput("clk25", 25e6);
        Assertions.assertThrows(FreqRangeException.class, () -> registry.registerOutput("sys", freq, 0, 1e-5));
        Assertions.assertEquals(0, registry.getOutputNum());
    }

    @Test
    public void testOutputRangeIsInclusive() {
        registry.registerInput("clk25", 25e6);
        registry.registerOutput("slow", 3.125e6);
        registry.registerOutput("fast", 400e6);
        Assertions.assertEquals(2, registry.getOutputNum());
    }

    @Test
    public void testCapacity() {
        registry.registerInput("clk25", 25e6);
        for (int i = 0; i < 4; i++) {
            registry.registerOutput("cd" + i, 100e6);
        }
        Assertions.assertEquals(4, registry.getOutputNum());

        ClockOutputCapacityException e = Assertions.assertThrows(ClockOutputCapacityException.class,
            () -> registry.registerOutput("cd4", 100e6));
        Assertions.assertEquals(4, e.getMaxClkoutNum());
        Assertions.assertEquals(4, registry.getOutputNum());
    }

    @Test
    public void testOutputDefaultsAndSlots() {
        registry.registerInput("clk25", 25e6);
        registry.registerOutput("sys", 100e6);
        registry.registerOutput("sys_ps", 100e6, 90);
        registry.registerOutput("io", 50e6, 0, 0.05, false, false);

        List<ClockOutputRequest> outputs = registry.getOutputs();
        Assertions.assertEquals(3, outputs.size());

        ClockOutputRequest sys = outputs.get(0);
        Assertions.assertEquals(0, sys.getSlot());
        Assertions.assertEquals("sys", sys.getDomainName());
        Assertions.assertEquals(0.0, sys.getPhase());
        Assertions.assertEquals(0.01, sys.getMargin());
        Assertions.assertTrue(sys.hasReset());
        Assertions.assertTrue(sys.usesDynamicPhase());

        Assertions.assertEquals(1, outputs.get(1).getSlot());
        Assertions.assertEquals(90.0, outputs.get(1).getPhase());

        ClockOutputRequest io = outputs.get(2);
        Assertions.assertEquals(2, io.getSlot());
        Assertions.assertEquals(0.05, io.getMargin());
        Assertions.assertFalse(io.hasReset());
        Assertions.assertFalse(io.usesDynamicPhase());

        Assertions.assertThrows(UnsupportedOperationException.class, () -> outputs.remove(0));
    }

    @Test
    public void testInvalidMarginAndPhase() {
        registry.registerInput("clk25", 25e6);
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.registerOutput("sys", 100e6, 0, -0.01));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.registerOutput("sys", 100e6, 0, Double.NaN));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.registerOutput("sys", 100e6, Double.NaN));
        Assertions.assertEquals(0, registry.getOutputNum());
    }

    @Test
    public void testFinalizeOnce() {
        registry.registerInput("clk25", 25e6);
        registry.registerOutput("sys", 100e6);
        PrimitiveParameters params = registry.finalizePlan();

        Assertions.assertNotNull(params);
        Assertions.assertTrue(registry.isFinalized());
        Assertions.assertThrows(IllegalStateException.class, () -> registry.finalizePlan());
        Assertions.assertThrows(IllegalStateException.class, () -> registry.enableDynamicPhaseAdjust());
        Assertions.assertThrows(IllegalStateException.class, () -> registry.registerOutput("late", 50e6));
    }

    @Test
    public void testFinalizeWithoutInput() {
        Assertions.assertThrows(IllegalStateException.class, () -> registry.finalizePlan());
    }

    @Test
    public void testFailedFinalizeLeavesPlanOpen() {
        registry.registerInput("clk8", 8e6);
        registry.registerOutput("sys", 100e6);

        Assertions.assertThrows(NoPLLConfigFoundException.class, () -> registry.finalizePlan());
        Assertions.assertFalse(registry.isFinalized());
    }

    @Test
    public void testDynamicPhaseChangesFeedbackSource() {
        registry.registerInput("clk400", 400e6);
        registry.registerOutput("sys", 400e6);
        Assertions.assertEquals(0, registry.solve().getFeedbackSlot());

        registry.enableDynamicPhaseAdjust();
        Assertions.assertTrue(registry.isDynamicPhaseEnabled());
        Assertions.assertEquals(1, registry.solve().getFeedbackSlot());
    }

    @Test
    public void testSearchIterationCap() {
        registry.registerInput("clk25", 25e6);
        registry.registerOutput("sys", 100e6);
        registry.setMaxSearchIterations(5);

        Assertions.assertThrows(NoPLLConfigFoundException.class, () -> registry.solve());
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.setMaxSearchIterations(0));
    }

    @Test
    public void testSolveLeavesRequestsUntouched() {
        registry.registerInput("clk25", 25e6);
        registry.registerOutput("sys", 100e6);

        DividerConfiguration config = registry.solve();
        Assertions.assertTrue(config.hasFeedbackOnlySlot());
        Assertions.assertEquals(1, registry.getOutputNum());
        Assertions.assertEquals(config, registry.solve());
    }
}
