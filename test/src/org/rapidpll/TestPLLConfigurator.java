package org.rapidpll;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestPLLConfigurator {

    private static Path writePlan(Path dir, String planName, double clkoutFreq) throws IOException {
        String json = "{\n"
            + "  \"planName\": \"" + planName + "\",\n"
            + "  \"clkinName\": \"clk25\",\n"
            + "  \"clkinFreq\": 25e6,\n"
            + "  \"outputDir\": \"build\",\n"
            + "  \"clkouts\": [{\"domain\": \"sys\", \"freq\": " + clkoutFreq + "}]\n"
            + "}\n";
        Path jsonPath = dir.resolve(planName + ".json");
        Files.writeString(jsonPath, json);
        return jsonPath;
    }

    @Test
    public void testRunWritesParameters(@TempDir Path tmpDir) throws IOException {
        Path jsonPath = writePlan(tmpDir, "crg", 100e6);

        PLLConfigurator configurator = new PLLConfigurator(jsonPath.toString(), false);
        PrimitiveParameters params = configurator.run();

        Path outputPath = tmpDir.resolve("build").resolve("crg_pll.json");
        Assertions.assertEquals(outputPath, configurator.getOutputFilePath());
        Assertions.assertTrue(Files.exists(outputPath));

        JsonObject json = JsonParser.parseString(Files.readString(outputPath)).getAsJsonObject();
        Assertions.assertEquals("EHXPLLL", json.get("primitiveName").getAsString());
        Assertions.assertEquals(4, json.getAsJsonObject("parameters").get("CLKOP_DIV").getAsInt());
        Assertions.assertEquals(params.getParameter("CLKFB_DIV"), json.getAsJsonObject("parameters").get("CLKFB_DIV").getAsInt());
    }

    @Test
    public void testRunStopsAtStep(@TempDir Path tmpDir) throws IOException {
        Path jsonPath = writePlan(tmpDir, "partial", 100e6);

        PLLConfigurator configurator = new PLLConfigurator(jsonPath.toString(), false);
        Assertions.assertNull(configurator.run(PLLConfigurator.PLLStep.REGISTER_CLOCKS));
        Assertions.assertEquals(1, configurator.getRegistry().getOutputNum());
        Assertions.assertFalse(configurator.getRegistry().isFinalized());
        Assertions.assertNull(configurator.getOutputFilePath());
    }

    @Test
    public void testLogFile(@TempDir Path tmpDir) throws IOException {
        Path jsonPath = writePlan(tmpDir, "logged", 50e6);

        new PLLConfigurator(jsonPath.toString(), true).run();

        Path logPath = tmpDir.resolve("build").resolve(NameConvention.logFileName);
        String log = Files.readString(logPath);
        Assertions.assertTrue(log.contains("INFO: # PLL configuration found:"));
        Assertions.assertTrue(log.contains("Creating ClkOut0 sys of 50.00MHz (+-1.00%)"));
    }

    @Test
    public void testSameNamePlansKeepSeparateLogs(@TempDir Path tmpDir) throws IOException {
        Path firstDir = Files.createDirectories(tmpDir.resolve("a"));
        Path secondDir = Files.createDirectories(tmpDir.resolve("b"));
        Path firstLog = firstDir.resolve("build").resolve(NameConvention.logFileName);
        Path secondLog = secondDir.resolve("build").resolve(NameConvention.logFileName);

        new PLLConfigurator(writePlan(firstDir, "crg", 100e6).toString(), true).run();
        List<String> firstLines = Files.readAllLines(firstLog);

        new PLLConfigurator(writePlan(secondDir, "crg", 50e6).toString(), true).run();

        Assertions.assertEquals(firstLines, Files.readAllLines(firstLog));
        String secondText = Files.readString(secondLog);
        Assertions.assertTrue(secondText.contains("Creating ClkOut0 sys of 50.00MHz (+-1.00%)"));
        Assertions.assertFalse(secondText.contains("Creating ClkOut0 sys of 100.00MHz"));
        Assertions.assertEquals(firstLines.size(), Files.readAllLines(secondLog).size());
    }

    @Test
    public void testUnsolvablePlan(@TempDir Path tmpDir) throws IOException {
        String json = "{\"planName\": \"bad\", \"clkinFreq\": 8e6, \"clkouts\": [{\"domain\": \"sys\", \"freq\": 100e6}]}";
        Path jsonPath = tmpDir.resolve("bad.json");
        Files.writeString(jsonPath, json);

        PLLConfigurator configurator = new PLLConfigurator(jsonPath.toString(), false);
        Assertions.assertThrows(NoPLLConfigFoundException.class, () -> configurator.run());
        Assertions.assertFalse(Files.exists(tmpDir.resolve("bad_pll.json")));
    }
}
