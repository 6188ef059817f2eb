package org.rapidpll;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;

import org.rapidpll.utils.HierarchicalLogger;

public class PLLConfigurator {

    public enum PLLStep {
        REGISTER_CLOCKS,
        FINALIZE,
        WRITE_PARAMS;

        public static PLLStep[] getOrderedSteps() {
            return new PLLStep[] {
                REGISTER_CLOCKS, FINALIZE, WRITE_PARAMS
            };
        }

        public static PLLStep getLastStep() {
            return WRITE_PARAMS;
        }
    }

    private final PLLPlanParams planParams;
    private final PLLRangeTable rangeTable;
    private HierarchicalLogger logger;

    private ClockPlanRegistry registry;
    private PrimitiveParameters primitiveParams;
    private Path outputFilePath;

    public PLLConfigurator(PLLPlanParams planParams, PLLRangeTable rangeTable, boolean enableLogger) {
        this.planParams = planParams;
        this.rangeTable = rangeTable;

        try {
            Files.createDirectories(planParams.getOutputDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to create output directory: " + planParams.getOutputDir(), e);
        }

        setupLogger(enableLogger);
    }

    public PLLConfigurator(String jsonFilePath, boolean enableLogger) {
        this(new PLLPlanParams(Path.of(jsonFilePath).toAbsolutePath()), PLLRangeTable.ECP5, enableLogger);
    }

    protected void setupLogger(boolean enableLogger) {
        String loggerName = "rapidpll." + planParams.getPlanName();
        if (enableLogger) {
            Path logFilePath = planParams.getOutputDir().resolve(NameConvention.logFileName);
            Level logLevel = planParams.isVerbose() ? Level.FINE : Level.INFO;
            logger = HierarchicalLogger.createLogger(loggerName, logFilePath, true, logLevel);
        } else {
            logger = HierarchicalLogger.createPseudoLogger(loggerName);
        }
    }

    private void registerClocks() {
        logger.infoHeader("Register Clocks");
        registry = planParams.createRegistry(rangeTable, logger);
    }

    private void finalizePlan() {
        logger.infoHeader("Solve PLL Dividers");
        primitiveParams = registry.finalizePlan();
    }

    private void writeParams() {
        logger.infoHeader("Write Primitive Parameters");
        outputFilePath = planParams.getOutputDir().resolve(NameConvention.getPlanOutputFileName(planParams.getPlanName()));
        try {
            Files.write(outputFilePath, primitiveParams.toJson().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to write primitive parameters: " + outputFilePath, e);
        }
        logger.info("Write primitive parameters to " + outputFilePath);
    }

    public PrimitiveParameters run(PLLStep endStep) {
        logger.info("Start configuring PLL plan " + planParams.getPlanName());

        try {
            runSteps(endStep);
            logger.info("Complete configuring PLL plan " + planParams.getPlanName());
        } finally {
            logger.close();
        }
        return primitiveParams;
    }

    private void runSteps(PLLStep endStep) {
        for (PLLStep step : PLLStep.getOrderedSteps()) {
            switch (step) {
                case REGISTER_CLOCKS:
                    registerClocks();
                    break;

                case FINALIZE:
                    finalizePlan();
                    break;

                case WRITE_PARAMS:
                    writeParams();
                    break;

                default:
                    break;
            }

            if (step == endStep) {
                break;
            }
        }
    }

    public PrimitiveParameters run() {
        return run(PLLStep.getLastStep());
    }

    public ClockPlanRegistry getRegistry() {
        return registry;
    }

    public Path getOutputFilePath() {
        return outputFilePath;
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: PLLConfigurator <plan.json>");
            System.exit(1);
        }
        PLLConfigurator configurator = new PLLConfigurator(args[0], true);
        configurator.run();
    }
}
