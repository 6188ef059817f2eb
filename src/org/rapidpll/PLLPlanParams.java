package org.rapidpll;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import org.rapidpll.utils.HierarchicalLogger;

public class PLLPlanParams {

    public static class ClkoutParams {
        private final String domain;
        private final double freq;
        private final double phase;
        private final double margin;
        private final boolean withReset;
        private final boolean usesDynamicPhase;

        public ClkoutParams(String domain, double freq, double phase, double margin, boolean withReset, boolean usesDynamicPhase) {
            this.domain = domain;
            this.freq = freq;
            this.phase = phase;
            this.margin = margin;
            this.withReset = withReset;
            this.usesDynamicPhase = usesDynamicPhase;
        }

        public String getDomain() {
            return domain;
        }

        public double getFreq() {
            return freq;
        }

        public double getPhase() {
            return phase;
        }

        public double getMargin() {
            return margin;
        }

        public boolean hasReset() {
            return withReset;
        }

        public boolean usesDynamicPhase() {
            return usesDynamicPhase;
        }
    }

    private String planName;
    private String clkinName = "clkin";
    private double clkinFreq;
    private List<ClkoutParams> clkouts;
    private Boolean dynamicPhaseAdjust = false;
    private Boolean verbose = false;
    private Path outputDir;
    private long maxSearchIterations = DividerSolver.UNLIMITED_ITERATIONS;

    private static class ParamsJson {
        public String planName;
        public String clkinName;
        public Double clkinFreq;
        public List<ClkoutJson> clkouts;
        public Boolean dynamicPhaseAdjust;
        public Boolean verbose;
        public String outputDir;
        public Long maxSearchIterations;
    }

    private static class ClkoutJson {
        public String domain;
        public Double freq;
        public Double phase;
        public Double margin;
        public Boolean withReset;
        public Boolean usesDynamicPhase;
    }

    public PLLPlanParams(Path jsonFilePath) {
        try (FileReader reader = new FileReader(jsonFilePath.toFile())) {
            load(reader, jsonFilePath.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to read PLL plan: " + jsonFilePath, e);
        }
    }

    public PLLPlanParams(Reader reader, Path baseDir) {
        load(reader, baseDir);
    }

    private void load(Reader reader, Path baseDir) {
        Gson gson = new GsonBuilder().create();
        ParamsJson params;
        try {
            params = gson.fromJson(reader, ParamsJson.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed PLL plan: " + e.getMessage(), e);
        }
        if (params == null) {
            throw new IllegalArgumentException("Empty PLL plan");
        }

        if (params.planName == null) {
            throw new IllegalArgumentException("planName not found in json file");
        }
        this.planName = params.planName;

        if (params.clkinName != null) {
            this.clkinName = params.clkinName;
        }

        if (params.clkinFreq == null) {
            throw new IllegalArgumentException("clkinFreq not found in json file");
        }
        this.clkinFreq = params.clkinFreq;

        Set<String> domainNameSet = new HashSet<>();
        clkouts = new ArrayList<>();
        if (params.clkouts != null) {
            for (ClkoutJson clkout : params.clkouts) {
                if (clkout == null || clkout.domain == null || clkout.freq == null) {
                    throw new IllegalArgumentException("Each clkout needs a domain and a freq");
                }
                if (!domainNameSet.add(clkout.domain)) {
                    throw new IllegalArgumentException("Duplicate clock domain name: " + clkout.domain);
                }
                clkouts.add(new ClkoutParams(
                    clkout.domain,
                    clkout.freq,
                    clkout.phase != null ? clkout.phase : ClockOutputRequest.DEFAULT_PHASE,
                    clkout.margin != null ? clkout.margin : ClockOutputRequest.DEFAULT_MARGIN,
                    clkout.withReset != null ? clkout.withReset : true,
                    clkout.usesDynamicPhase != null ? clkout.usesDynamicPhase : true
                ));
            }
        }

        if (params.dynamicPhaseAdjust != null) {
            this.dynamicPhaseAdjust = params.dynamicPhaseAdjust;
        }

        if (params.verbose != null) {
            this.verbose = params.verbose;
        }

        if (params.outputDir != null) {
            Path dir = Path.of(params.outputDir);
            this.outputDir = baseDir != null ? baseDir.resolve(dir).toAbsolutePath() : dir.toAbsolutePath();
        } else {
            this.outputDir = baseDir != null ? baseDir.toAbsolutePath() : Path.of("").toAbsolutePath();
        }

        if (params.maxSearchIterations != null) {
            if (params.maxSearchIterations <= 0) {
                throw new IllegalArgumentException("maxSearchIterations must be positive");
            }
            this.maxSearchIterations = params.maxSearchIterations;
        }
    }

    public ClockPlanRegistry createRegistry(PLLRangeTable rangeTable, HierarchicalLogger logger) {
        ClockPlanRegistry registry = new ClockPlanRegistry(planName, rangeTable, logger);
        registry.setMaxSearchIterations(maxSearchIterations);
        registry.registerInput(clkinName, clkinFreq);
        for (ClkoutParams clkout : clkouts) {
            registry.registerOutput(clkout.getDomain(), clkout.getFreq(), clkout.getPhase(), clkout.getMargin(),
                clkout.hasReset(), clkout.usesDynamicPhase());
        }
        if (dynamicPhaseAdjust) {
            registry.enableDynamicPhaseAdjust();
        }
        return registry;
    }

    // getters
    public String getPlanName() {
        return planName;
    }

    public String getClkinName() {
        return clkinName;
    }

    public double getClkinFreq() {
        return clkinFreq;
    }

    public List<ClkoutParams> getClkouts() {
        return Collections.unmodifiableList(clkouts);
    }

    public boolean isDynamicPhaseAdjust() {
        return dynamicPhaseAdjust;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public long getMaxSearchIterations() {
        return maxSearchIterations;
    }
}
