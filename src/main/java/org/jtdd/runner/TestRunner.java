package org.jtdd.runner;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.jtdd.obs.CorrelationContext;
import org.jtdd.obs.JsonLinesLogger;
import org.jtdd.registry.SuiteNotFoundException;
import org.jtdd.registry.TestCase;
import org.jtdd.registry.TestRegistry;
import org.jtdd.registry.TestSuite;
import org.jtdd.registry.TestUnit;

/**
 * Runs every registered test, suite by suite, and prints a pass/fail report.
 *
 * <p>Suite identifiers are visited in sorted order. For each identifier the registered
 * suites' setups run first, in registration order, stopping at the first failure; a failed
 * setup skips the identifier's tests and teardowns. Tests run in registration order, then the
 * teardowns. Every throwable raised by a test or lifecycle operation is turned into a
 * recorded verdict; only a suite identifier without any registered suite stops the run.
 */
public final class TestRunner {
    static final String SUITE_PREFIX = "------------------ Suite: ";
    static final String TEST_PREFIX = "------------ Test: ";
    static final String SETUP_PREFIX = "------------ Setup: ";
    static final String TEARDOWN_PREFIX = "------------ Teardown: ";
    static final String SUMMARY_SEPARATOR = "-------------------------";
    static final String SINGLE_TESTS_LABEL = "Single Tests";

    private final TestRegistry registry;
    private final PrintStream out;
    private final JsonLinesLogger logger;
    private final Clock clock;
    private final String runId;

    public TestRunner(TestRegistry registry, PrintStream out) {
        this(registry, out, JsonLinesLogger.NOOP, Clock.systemUTC(), UUID.randomUUID().toString());
    }

    public TestRunner(TestRegistry registry, PrintStream out, JsonLinesLogger logger, Clock clock, String runId) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.out = Objects.requireNonNull(out, "out");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.runId = Objects.requireNonNull(runId, "runId");
    }

    /**
     * Runs the global registry, printing to {@link TestOutput#current()}.
     *
     * @return number of failed tests and suite lifecycle operations
     */
    public static int runTests() {
        return new TestRunner(TestRegistry.global(), TestOutput.current()).run().failedCount();
    }

    public RunReport run() {
        Counters counters = new Counters();
        List<String> suiteNames = registry.suiteNames();
        out.println("Running " + suiteNames.size() + " test suites");
        logger.info("run.start", CorrelationContext.of(runId), Map.of(
            "suiteCount", suiteNames.size(),
            "testCount", registry.testCount()
        ));

        for (String suiteName : suiteNames) {
            printSuiteHeader(suiteName);
            try {
                runSuite(suiteName, counters);
            } catch (SuiteNotFoundException e) {
                out.println("Test suite is not found. Exiting test application.");
                logger.error("suite.notFound", suiteContext(suiteName), Map.of("detail", e.getMessage()));
                counters.failed++;
                out.flush();
                return report(counters, true);
            }
        }

        printSummary(counters);
        RunReport report = report(counters, false);
        logger.info("run.complete", CorrelationContext.of(runId), Map.of(
            "passed", report.passedCount(),
            "failed", report.failedCount(),
            "missedFailures", report.missedFailureCount()
        ));
        return report;
    }

    private void runSuite(String suiteName, Counters counters) {
        List<TestSuite> suites = registry.requireSuites(suiteName);
        List<TestCase> tests = registry.testsIn(suiteName);
        logger.info("suite.start", suiteContext(suiteName), Map.of(
            "suiteCount", suites.size(),
            "testCount", tests.size()
        ));

        if (!runLifecycle(suites, UnitResult.Kind.SETUP, counters)) {
            out.println("Test suite setup failed. Skipping tests in suite.");
            for (TestCase test : tests) {
                counters.results.add(UnitResult.skipped(test));
            }
            return;
        }

        for (TestCase test : tests) {
            runTest(test, counters);
        }

        if (!runLifecycle(suites, UnitResult.Kind.TEARDOWN, counters)) {
            out.println("Test suite teardown failed.");
        }
    }

    private boolean runLifecycle(List<TestSuite> suites, UnitResult.Kind kind, Counters counters) {
        for (TestSuite suite : suites) {
            boolean setup = kind == UnitResult.Kind.SETUP;
            out.println((setup ? SETUP_PREFIX : TEARDOWN_PREFIX) + suite.name());
            Outcome outcome = Outcome.capture(setup ? suite::setup : suite::teardown);
            outcome.applyTo(suite);
            Verdict verdict = Verdict.classify(outcome);
            recordVerdict(suite, kind, verdict, outcome, counters);
            if (verdict == Verdict.FAILED) {
                return false;
            }
        }
        return true;
    }

    private void runTest(TestCase test, Counters counters) {
        out.println(TEST_PREFIX + test.name());
        Outcome outcome = test.executed()
            ? Outcome.alreadyRan()
            : Outcome.capture(test::execute);
        outcome.applyTo(test);
        Verdict verdict = Verdict.classify(outcome, test.expectedFailureReason().orElse(null));
        recordVerdict(test, UnitResult.Kind.TEST, verdict, outcome, counters);
    }

    private void recordVerdict(TestUnit unit, UnitResult.Kind kind, Verdict verdict, Outcome outcome, Counters counters) {
        switch (verdict) {
            case PASSED -> {
                counters.passed++;
                out.println("Passed");
            }
            case EXPECTED_FAILURE -> {
                counters.passed++;
                out.println("Expected failure");
                out.println(unit.reason());
            }
            case MISSED_EXPECTED_FAILURE -> {
                counters.missedFailures++;
                out.println("Missed expected failure");
                out.println("Test passed but was expected to fail.");
            }
            case FAILED -> {
                counters.failed++;
                if (unit.confirmLine() != TestUnit.NO_LINE) {
                    out.println("Failed confirm on line " + unit.confirmLine());
                } else {
                    out.println("Failed");
                }
                out.println(unit.reason());
            }
            case SKIPPED -> throw new IllegalStateException("executed units are never skipped");
        }
        counters.results.add(UnitResult.of(unit, kind, verdict));
        logVerdict(unit, kind, verdict, outcome);
    }

    private void logVerdict(TestUnit unit, UnitResult.Kind kind, Verdict verdict, Outcome outcome) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("kind", kind.name());
        fields.put("verdict", verdict.name());
        outcome.reason().ifPresent(reason -> fields.put("reason", reason));
        if (outcome.line() != TestUnit.NO_LINE) {
            fields.put("line", outcome.line());
        }
        outcome.exceptionClass().ifPresent(exceptionClass -> fields.put("exception", exceptionClass));
        CorrelationContext context = CorrelationContext.builder(runId)
            .suiteName(unit.suiteName())
            .unitName(unit.name())
            .phase(kind.name().toLowerCase(Locale.ROOT))
            .build();
        if (verdict == Verdict.FAILED || verdict == Verdict.MISSED_EXPECTED_FAILURE) {
            logger.warn("unit.verdict", context, fields);
        } else {
            logger.info("unit.verdict", context, fields);
        }
    }

    private void printSuiteHeader(String suiteName) {
        out.println(SUITE_PREFIX + (suiteName.isEmpty() ? SINGLE_TESTS_LABEL : suiteName));
    }

    private void printSummary(Counters counters) {
        out.println(SUMMARY_SEPARATOR);
        out.println("Tests passed: " + counters.passed);
        out.print("Tests failed: " + counters.failed);
        if (counters.missedFailures != 0) {
            out.println();
            out.print("Missed failures: " + counters.missedFailures);
        }
        out.println();
        out.flush();
    }

    private CorrelationContext suiteContext(String suiteName) {
        return CorrelationContext.builder(runId).suiteName(suiteName).build();
    }

    private RunReport report(Counters counters, boolean aborted) {
        return new RunReport(
            runId,
            clock.instant(),
            counters.results,
            counters.passed,
            counters.failed,
            counters.missedFailures,
            aborted
        );
    }

    private static final class Counters {
        private int passed;
        private int failed;
        private int missedFailures;
        private final List<UnitResult> results = new ArrayList<>();
    }
}
