package org.rapidpll;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.rapidpll.utils.HierarchicalLogger;

public class ConfigFinalizer {

    private final HierarchicalLogger logger;

    public ConfigFinalizer(HierarchicalLogger logger) {
        this.logger = logger;
    }

    public PrimitiveParameters finalizeConfig(String planName, ClockInputSpec clkin, DividerConfiguration config,
                                              boolean dynamicPhaseEnabled) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("FREQUENCY_PIN_CLKI", Double.toString(clkin.getFreq() / 1e6));
        // device calibration constants
        attributes.put("ICP_CURRENT", "6");
        attributes.put("LPF_RESISTOR", "16");
        attributes.put("MFG_ENABLE_FILTEROPAMP", "1");
        attributes.put("MFG_GMCREF_SEL", "2");

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("FEEDBK_PATH", NameConvention.getFeedbackPathTag(config.getFeedbackSlot()));
        parameters.put("CLKFB_DIV", config.getClkfbDiv());
        parameters.put("CLKI_DIV", config.getClkiDiv());

        String rstSignal = NameConvention.getPlanSignalName(planName, "RST");
        String lockSignal = NameConvention.getPlanSignalName(planName, "LOCK");
        Map<String, String> inputPorts = new LinkedHashMap<>();
        inputPorts.put("RST", rstSignal);
        inputPorts.put("CLKI", clkin.getSignalName());
        inputPorts.put("STDBY", NameConvention.getPlanSignalName(planName, "STDBY"));

        Map<String, String> outputPorts = new LinkedHashMap<>();
        outputPorts.put("LOCK", lockSignal);

        List<String> resetSyncDomains = new ArrayList<>();
        for (ClockOutputSolution output : config.getOutputs()) {
            int slot = output.getSlot();
            int cphase = PhaseEncoder.encode(output.getPhase(), output.getDiv());

            parameters.put(NameConvention.getClkoParamName(slot, "ENABLE"), NameConvention.enabledValue);
            parameters.put(NameConvention.getClkoParamName(slot, "DIV"), output.getDiv());
            parameters.put(NameConvention.getClkoParamName(slot, "FPHASE"), 0);
            parameters.put(NameConvention.getClkoParamName(slot, "CPHASE"), cphase);

            ClockOutputRequest request = output.getRequest();
            if (request.isFeedbackOnly()) {
                outputPorts.put(NameConvention.getClkoPortName(slot), NameConvention.getFeedbackSignalName(planName, slot));
            } else {
                outputPorts.put(NameConvention.getClkoPortName(slot), NameConvention.getClkoSignalName(request.getDomainName()));
                if (request.hasReset()) {
                    resetSyncDomains.add(request.getDomainName());
                }
            }
        }

        if (dynamicPhaseEnabled) {
            String phaseSel = NameConvention.getPlanSignalName(planName, "PHASE_SEL");
            parameters.put("DPHASE_SOURCE", NameConvention.enabledValue);
            inputPorts.put("PHASESEL0", phaseSel + "[0]");
            inputPorts.put("PHASESEL1", phaseSel + "[1]");
            inputPorts.put("PHASEDIR", NameConvention.getPlanSignalName(planName, "PHASE_DIR"));
            inputPorts.put("PHASESTEP", NameConvention.getPlanSignalName(planName, "PHASE_STEP"));
            inputPorts.put("PHASELOADREG", NameConvention.getPlanSignalName(planName, "PHASE_LOAD"));
        }

        String lockedExpr = lockSignal + " & ~" + rstSignal;
        logger.fine(String.format("Finalized %s with feedback path %s", NameConvention.primitiveName,
            parameters.get("FEEDBK_PATH")));

        return new PrimitiveParameters(NameConvention.primitiveName, attributes, parameters, inputPorts, outputPorts,
            resetSyncDomains, lockedExpr);
    }
}
