package work.lcod.reshape.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ReshapeCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        int exitCode = commandLine.execute(args);
        commandLine.getOut().flush();
        commandLine.getErr().flush();
        return exitCode;
    }

    private static String fixture(String name) throws Exception {
        return Path.of(ReshapeCommandTest.class.getResource("/cli/" + name).toURI()).toString();
    }

    @Test
    void evaluatesPathSpecsAgainstJsonTargets() {
        assertEquals(0, run("a.b", "{\"a\": {\"b\": 3}}"));
        assertEquals("3", out.toString().trim());
    }

    @Test
    void buildsMappingsFromYamlSpecFiles() throws Exception {
        int exitCode = run("--spec-file", fixture("summary.yaml"), "--target-file", fixture("inventory.json"), "--indent", "0");

        assertEquals(0, exitCode, err.toString());
        assertEquals("{\"name\":\"north\",\"first\":\"a-1\",\"count\":0}", out.toString().trim());
    }

    @Test
    void readsTomlTargets() throws Exception {
        int exitCode = run("items.0.sku", "--target-file", fixture("inventory.toml"), "--target-format", "toml");

        assertEquals(0, exitCode, err.toString());
        assertEquals("\"a-1\"", out.toString().trim());
    }

    @Test
    void templatesComeFromArrays() {
        assertEquals(0, run("--indent", "0", "[sku]", "[{\"sku\": \"x\"}, {\"sku\": \"y\"}]"));
        assertEquals("[\"x\",\"y\"]", out.toString().trim());
    }

    @Test
    void failuresPrintShortMessages() {
        int exitCode = run("missing", "{}");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("could not access 'missing', index 0"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void debugModeAddsTheEvaluationTrace() {
        System.setProperty(ShortErrorHandler.DEBUG_PROPERTY, "true");
        try {
            assertEquals(1, run("missing", "{}"));
        } finally {
            System.clearProperty(ShortErrorHandler.DEBUG_PROPERTY);
        }

        assertTrue(err.toString().contains("PathAccessException"), err.toString());
        assertTrue(err.toString().contains("spec: 'missing'"), err.toString());
    }

    @Test
    void defaultValueReplacesFailures() {
        assertEquals(0, run("--default", "\"none\"", "missing", "{}"));
        assertEquals("\"none\"", out.toString().trim());
    }

    @Test
    void rejectsSpecGivenTwice() throws Exception {
        int exitCode = run("--spec-file", fixture("summary.yaml"), "a", "{}");

        assertEquals(2, exitCode);
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("reshape (java) "), out.toString());
    }
}
