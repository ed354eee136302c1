package work.tikzgraph.props.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ResolveCommandTest {
    private static final String DIAGRAM = Path.of("src", "test", "resources", "documents", "diagram.json").toString();
    private static final String CONFLICT = Path.of("src", "test", "resources", "documents", "conflict.json").toString();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    @Test
    void printsResolvedDocument() {
        int exitCode = commandLine.execute("-d", DIAGRAM, "--log-level", "error");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"status\" : \"success\""));
        assertTrue(out.toString().contains("\"elements\""));
    }

    @Test
    void rendererOptionNarrowsCompatibility() {
        int exitCode = commandLine.execute("-d", DIAGRAM, "-r", "common", "--log-level", "error");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"renderers\" : [ \"common\" ]"));
    }

    @Test
    void missingDocumentIsAUsageError() {
        int exitCode = commandLine.execute("-d", "src/test/resources/documents/missing.json");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Property document not found"));
    }

    @Test
    void missingConfigIsAUsageError() {
        int exitCode = commandLine.execute("-d", DIAGRAM, "-c", "src/test/resources/config/missing.toml");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Configuration file not found"));
    }

    @Test
    void abortOnInvalidFailsTheRun() {
        int exitCode = commandLine.execute("-d", DIAGRAM, "--abort-on-invalid", "--log-level", "off");

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("\"status\" : \"failure\""));
    }

    @Test
    void strictConfigFailsOnConflicts() {
        int exitCode = commandLine.execute(
            "-d", CONFLICT,
            "-c", "src/test/resources/config/strict.toml",
            "--log-level", "off"
        );

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("Cannot place"));
    }

    @Test
    void invalidConfigurationIsReportedOnStandardError(@TempDir Path dir) throws Exception {
        Path config = Files.writeString(dir.resolve("bad.toml"), "[hierarchy]\nmode = \"chaotic\"\n");

        int exitCode = commandLine.execute("-d", DIAGRAM, "-c", config.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Configuration error: Invalid configuration"));
        assertEquals("", out.toString());
    }

    @Test
    void versionNamesGrammar() {
        int exitCode = commandLine.execute("--version");

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("tikzgraph-props "));
        assertTrue(out.toString().contains("declaration grammar 1"));
    }
}
