package com.czesl.vert.tools;

import com.czesl.vert.Version;
import com.czesl.vert.convert.ConverterOptions;
import com.czesl.vert.convert.VertConverter;
import com.czesl.vert.io.MetaFile;
import com.czesl.vert.io.MetaFiles;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.LogManager;

/**
 * Command-line converter. Takes either a directory ({@code -d}) or a list of files ({@code -f}),
 * groups them into document sets and writes the vertical output to stdout or {@code -o}.
 */
public final class VertConverterCli {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_SETS = 1;
    static final int EXIT_USAGE = 2;

    private static final String LOGGING_RESOURCE = "/logging.properties";
    private static final String LOGGING_CONFIG_FILE = "java.util.logging.config.file";
    private static final String LOGGING_CONFIG_CLASS = "java.util.logging.config.class";

    private static final String USAGE =
            String.join(
                    System.lineSeparator(),
                    "Usage: VertConverterCli (-d DIR | -f FILE...) [-o OUT] [--guess-errors]",
                    "  -d, --dir DIR       convert all document sets in DIR",
                    "  -f, --files FILE... convert the document sets formed by FILEs",
                    "  -o, --output OUT    write to OUT instead of stdout",
                    "      --guess-errors  mark spelling differences without error tags",
                    "  -h, --help          show this help",
                    "      --version       print the version");

    private VertConverterCli() {}

    public static void main(String[] args) {
        configureLogging(System.err);
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Applies the bundled {@code logging.properties} unless the user named a configuration with
     * {@code -Djava.util.logging.config.file} or {@code config.class}.
     *
     * @return whether the bundled configuration was read
     */
    static boolean configureLogging(PrintStream stderr) {
        if (System.getProperty(LOGGING_CONFIG_FILE) != null
                || System.getProperty(LOGGING_CONFIG_CLASS) != null) {
            return false;
        }
        try (InputStream in = VertConverterCli.class.getResourceAsStream(LOGGING_RESOURCE)) {
            if (in == null) {
                stderr.println("Missing " + LOGGING_RESOURCE + ", using JDK logging defaults");
                return false;
            }
            LogManager.getLogManager().readConfiguration(in);
            return true;
        } catch (IOException ex) {
            stderr.println("Unable to read " + LOGGING_RESOURCE + ": " + ex.getMessage());
            return false;
        }
    }

    static int run(String[] args, PrintStream stdout, PrintStream stderr) {
        Path dir = null;
        List<Path> files = new ArrayList<>();
        Path output = null;
        ConverterOptions options = ConverterOptions.fromEnvironment();
        boolean readingFiles = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    stdout.println(USAGE);
                    return EXIT_OK;
                }
                case "--version" -> {
                    stdout.println("czesl-vert " + Version.FULL);
                    return EXIT_OK;
                }
                case "-d", "--dir" -> {
                    if (i + 1 >= args.length) {
                        return usageError(stderr, "Missing value for " + arg);
                    }
                    dir = Path.of(args[++i]);
                    readingFiles = false;
                }
                case "-o", "--output" -> {
                    if (i + 1 >= args.length) {
                        return usageError(stderr, "Missing value for " + arg);
                    }
                    output = Path.of(args[++i]);
                    readingFiles = false;
                }
                case "-f", "--files" -> readingFiles = true;
                case "--guess-errors" -> {
                    options = options.withGuessErrors(true);
                    readingFiles = false;
                }
                default -> {
                    if (!readingFiles || arg.startsWith("-")) {
                        return usageError(stderr, "Unexpected argument: " + arg);
                    }
                    files.add(Path.of(arg));
                }
            }
        }
        if ((dir == null) == files.isEmpty()) {
            return usageError(stderr, "Exactly one of -d or -f is required");
        }

        BatchResult result;
        try {
            List<MetaFile> metaFiles =
                    dir != null ? MetaFiles.fromDirectory(dir) : MetaFiles.fromFiles(files);
            result = convert(metaFiles, output, options, stdout);
        } catch (IOException ex) {
            stderr.println("Error: " + ex.getMessage());
            return EXIT_FAILED_SETS;
        }
        for (String failed : result.getFailed()) {
            stderr.println("Skipped document set: " + failed);
        }
        return result.isSuccessful() ? EXIT_OK : EXIT_FAILED_SETS;
    }

    private static BatchResult convert(
            List<MetaFile> metaFiles, Path output, ConverterOptions options, PrintStream stdout)
            throws IOException {
        BatchConverter batch = new BatchConverter(new VertConverter(options));
        if (output == null) {
            Writer writer = new BufferedWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
            BatchResult result = batch.run(metaFiles, writer);
            writer.flush();
            return result;
        }
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            return batch.run(metaFiles, writer);
        }
    }

    private static int usageError(PrintStream stderr, String message) {
        stderr.println(message);
        stderr.println(USAGE);
        return EXIT_USAGE;
    }
}
