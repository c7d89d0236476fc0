package com.czesl.vert.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.czesl.vert.Version;
import com.czesl.vert.testing.Fixtures;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;

final class VertConverterCliTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    @Test
    void requiresExactlyOneInput() {
        assertEquals(VertConverterCli.EXIT_USAGE, run());
        assertEquals(VertConverterCli.EXIT_USAGE, run("-d", "x", "-f", "a.w.xml"));
        assertTrue(text(stderr).contains("Exactly one of -d or -f"));
    }

    @Test
    void rejectsUnknownAndIncompleteOptions() {
        assertEquals(VertConverterCli.EXIT_USAGE, run("--bogus"));
        assertEquals(VertConverterCli.EXIT_USAGE, run("-d"));
        assertEquals(VertConverterCli.EXIT_USAGE, run("stray.w.xml"));
    }

    @Test
    void printsHelpAndVersion() {
        assertEquals(VertConverterCli.EXIT_OK, run("--help"));
        assertTrue(text(stdout).startsWith("Usage:"));
        assertEquals(VertConverterCli.EXIT_OK, run("--version"));
        assertTrue(text(stdout).contains("czesl-vert " + Version.FULL));
    }

    @Test
    void convertsDirectoryIntoOutputFile() throws Exception {
        Path dir = copySample(Files.createTempDirectory("czesl-cli"));
        Path output = Files.createTempFile("czesl-cli", ".vert");

        int exit = run("-d", dir.toString(), "-o", output.toString());

        assertEquals(VertConverterCli.EXIT_OK, exit);
        assertEquals(
                Fixtures.resource("sample.vert"),
                Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    void convertsListedFilesToStdout() throws Exception {
        Path dir = copySample(Files.createTempDirectory("czesl-cli"));

        int exit =
                run(
                        "-f",
                        dir.resolve("sample.w.xml").toString(),
                        dir.resolve("sample.a.xml").toString(),
                        dir.resolve("sample.b.xml").toString());

        assertEquals(VertConverterCli.EXIT_OK, exit);
        assertEquals(Fixtures.resource("sample.vert"), text(stdout));
    }

    @Test
    void incompleteSetFailsTheRun() throws Exception {
        Path dir = Files.createTempDirectory("czesl-cli");
        Files.writeString(dir.resolve("essay.w.xml"), "<wdata/>");

        assertEquals(VertConverterCli.EXIT_FAILED_SETS, run("-d", dir.toString()));
        assertTrue(text(stderr).contains("essay.a.xml"));
    }

    @Test
    void failedSetIsListedOnStderr() throws Exception {
        Path dir = copySample(Files.createTempDirectory("czesl-cli"));
        Files.writeString(dir.resolve("broken.w.xml"), "<wdata>");
        Files.writeString(dir.resolve("broken.a.xml"), "<adata/>");
        Files.writeString(dir.resolve("broken.b.xml"), "<bdata/>");

        int exit = run("-d", dir.toString());

        assertEquals(VertConverterCli.EXIT_FAILED_SETS, exit);
        assertTrue(text(stderr).contains("Skipped document set: broken"));
        assertEquals(Fixtures.resource("sample.vert"), text(stdout));
    }

    @Test
    void bundledLoggingConfigurationIsApplied() {
        PrintStream err = new PrintStream(stderr, true, StandardCharsets.UTF_8);

        assertTrue(VertConverterCli.configureLogging(err));
        assertEquals(Level.WARNING, Logger.getLogger("com.czesl.vert").getLevel());
        assertEquals("", text(stderr));
    }

    private int run(String... args) {
        return VertConverterCli.run(
                args,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private static String text(ByteArrayOutputStream stream) {
        return stream.toString(StandardCharsets.UTF_8);
    }

    private static Path copySample(Path dir) throws Exception {
        for (String layer : new String[] {"w", "a", "b"}) {
            String name = "sample." + layer + ".xml";
            Files.writeString(dir.resolve(name), Fixtures.resource(name), StandardCharsets.UTF_8);
        }
        return dir;
    }
}
