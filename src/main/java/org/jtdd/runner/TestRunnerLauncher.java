package org.jtdd.runner;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.jtdd.obs.JsonLinesLogger;
import org.jtdd.obs.StructuredJsonLinesLogger;
import org.jtdd.registry.TestRegistry;

/**
 * Command-line entry point that runs every test registered in the global registry.
 *
 * <p>Classes named with {@code --class} are initialized first so that declarations in their
 * static initializers register. The exit status is the number of failures, capped at 255.
 */
public final class TestRunnerLauncher {
    static final int MAX_EXIT_STATUS = 255;

    private TestRunnerLauncher() {}

    public static void main(final String[] args) {
        final int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs with the report printed to {@link TestOutput#current()}.
     */
    static int run(final String[] args) {
        return run(args, TestOutput.current(), System.err);
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");

        final Config config;
        try {
            config = parseArgs(args);
        } catch (final IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return 2;
        }

        if (config.help()) {
            printUsage(out);
            return 0;
        }

        try {
            initializeClasses(config.testClasses());
        } catch (final ClassNotFoundException e) {
            err.println("test class not found: " + e.getMessage());
            return 1;
        } catch (final ExceptionInInitializerError e) {
            err.println("test class failed to initialize: " + e.getCause());
            return 1;
        }

        final RunReport report;
        try (JsonLinesLogger logger = openEventLog(config.eventsPath())) {
            report = new TestRunner(
                    TestRegistry.global(),
                    out,
                    logger,
                    Clock.systemUTC(),
                    UUID.randomUUID().toString()).run();
        } catch (final IOException | UncheckedIOException e) {
            err.println("test runner failed: " + e.getMessage());
            return 1;
        }

        try {
            writeReports(config, report);
        } catch (final IOException e) {
            err.println("failed to write report: " + e.getMessage());
            return 1;
        }
        return Math.min(report.failedCount(), MAX_EXIT_STATUS);
    }

    private static void initializeClasses(final List<String> classNames) throws ClassNotFoundException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TestRunnerLauncher.class.getClassLoader();
        }
        for (final String className : classNames) {
            Class.forName(className, true, loader);
        }
    }

    private static JsonLinesLogger openEventLog(final Path eventsPath) throws IOException {
        if (eventsPath == null) {
            return JsonLinesLogger.NOOP;
        }
        return StructuredJsonLinesLogger.open(eventsPath);
    }

    private static void writeReports(final Config config, final RunReport report) throws IOException {
        final RunReportRenderer renderer = new RunReportRenderer();
        if (config.jsonReportPath() != null) {
            writeFile(config.jsonReportPath(), renderer.toJson(report));
        }
        if (config.markdownReportPath() != null) {
            writeFile(config.markdownReportPath(), renderer.toMarkdown(report));
        }
    }

    private static void writeFile(final Path path, final String content) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    private static Config parseArgs(final String[] args) {
        final List<String> testClasses = new ArrayList<>();
        Path eventsPath = null;
        Path jsonReportPath = null;
        Path markdownReportPath = null;
        boolean help = false;

        for (final String arg : args) {
            if (arg == null || arg.isBlank()) {
                continue;
            }
            if ("--help".equals(arg) || "-h".equals(arg)) {
                help = true;
                continue;
            }
            if (arg.startsWith("--class=")) {
                testClasses.add(valueAfterPrefix(arg, "--class="));
                continue;
            }
            if (arg.startsWith("--events=")) {
                eventsPath = Path.of(valueAfterPrefix(arg, "--events="));
                continue;
            }
            if (arg.startsWith("--report-json=")) {
                jsonReportPath = Path.of(valueAfterPrefix(arg, "--report-json="));
                continue;
            }
            if (arg.startsWith("--report-markdown=")) {
                markdownReportPath = Path.of(valueAfterPrefix(arg, "--report-markdown="));
                continue;
            }
            throw new IllegalArgumentException("unknown argument: " + arg);
        }
        return new Config(List.copyOf(testClasses), eventsPath, jsonReportPath, markdownReportPath, help);
    }

    private static String valueAfterPrefix(final String arg, final String prefix) {
        final String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " must have a value");
        }
        return value;
    }

    private static void printUsage(final PrintStream stream) {
        stream.println("Usage: TestRunnerLauncher [--class=<fqcn>]... [--events=<path>]"
                + " [--report-json=<path>] [--report-markdown=<path>]");
        stream.println("  --class=<fqcn>            Initialize a class whose static block declares tests (repeatable)");
        stream.println("  --events=<path>           Write run events as JSON lines");
        stream.println("  --report-json=<path>      Write the run report as JSON");
        stream.println("  --report-markdown=<path>  Write the run report as markdown");
        stream.println("  --help                    Show usage");
    }

    private record Config(
            List<String> testClasses,
            Path eventsPath,
            Path jsonReportPath,
            Path markdownReportPath,
            boolean help) {}
}
