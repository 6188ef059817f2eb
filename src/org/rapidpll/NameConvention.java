package org.rapidpll;

public class NameConvention {

    public static final String primitiveName = "EHXPLLL";
    public static final String enabledValue = "ENABLED";
    public static final String planOutputSuffix = "_pll.json";
    public static final String logFileName = "rapidpll.log";

    // output slot index to the letter used in EHXPLLL port and parameter names
    private static final String[] slotLetters = {"P", "S", "S2", "S3"};

    public static String getSlotLetter(int slot) {
        if (slot < 0 || slot >= slotLetters.length) {
            throw new IllegalArgumentException("No EHXPLLL output for slot " + slot);
        }
        return slotLetters[slot];
    }

    public static String getClkoPortName(int slot) {
        return "CLKO" + getSlotLetter(slot);
    }

    public static String getClkoParamName(int slot, String field) {
        return String.format("CLKO%s_%s", getSlotLetter(slot), field);
    }

    public static String getFeedbackPathTag(int slot) {
        return "INT_O" + getSlotLetter(slot);
    }

    public static String getClkoSignalName(String domainName) {
        return domainName + "_clk";
    }

    public static String getFeedbackSignalName(String planName, int slot) {
        return String.format("%s_clkfb_%d", planName, slot);
    }

    public static String getPlanSignalName(String planName, String portName) {
        return planName + "_" + portName.toLowerCase();
    }

    public static String getPlanOutputFileName(String planName) {
        return planName + planOutputSuffix;
    }
}
