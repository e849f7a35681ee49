package org.jtdd.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Registered tests and suites keyed by suite identifier.
 *
 * <p>Suite identifiers are iterated in lexicographic order, not registration order; tests and
 * suites under one identifier keep their registration order. The registry only grows:
 * registration happens before a run and nothing is removed.
 */
public final class TestRegistry {
    private final Map<String, List<TestCase>> tests = new TreeMap<>();
    private final Map<String, List<TestSuite>> suites = new TreeMap<>();

    /**
     * Process-wide registry used by declarations that do not name one.
     */
    public static TestRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    public void addTest(String suiteName, TestCase test) {
        Objects.requireNonNull(test, "test");
        requireMatchingSuite(suiteName, test);
        List<TestCase> suiteTests = tests.computeIfAbsent(suiteName, key -> new ArrayList<>());
        for (TestCase registered : suiteTests) {
            if (registered == test) {
                throw new IllegalArgumentException("test '" + test.name() + "' is already registered");
            }
        }
        suiteTests.add(test);
    }

    public void addSuite(String suiteName, TestSuite suite) {
        Objects.requireNonNull(suite, "suite");
        requireMatchingSuite(suiteName, suite);
        suites.computeIfAbsent(suiteName, key -> new ArrayList<>()).add(suite);
    }

    /**
     * Suite identifiers that have at least one test, in sorted order. The empty identifier
     * sorts first.
     */
    public List<String> suiteNames() {
        return List.copyOf(tests.keySet());
    }

    public List<TestCase> testsIn(String suiteName) {
        return List.copyOf(tests.getOrDefault(suiteName, List.of()));
    }

    public List<TestSuite> suitesIn(String suiteName) {
        return List.copyOf(suites.getOrDefault(suiteName, List.of()));
    }

    public boolean hasSuite(String suiteName) {
        return suites.containsKey(suiteName);
    }

    /**
     * @throws SuiteNotFoundException if no suite is registered under a non-empty identifier
     */
    public List<TestSuite> requireSuites(String suiteName) {
        if (suiteName.isEmpty()) {
            return List.of();
        }
        if (!hasSuite(suiteName)) {
            throw new SuiteNotFoundException(suiteName);
        }
        return suitesIn(suiteName);
    }

    public int testCount() {
        int count = 0;
        for (List<TestCase> suiteTests : tests.values()) {
            count += suiteTests.size();
        }
        return count;
    }

    private static void requireMatchingSuite(String suiteName, TestUnit unit) {
        Objects.requireNonNull(suiteName, "suiteName");
        if (!suiteName.equals(unit.suiteName())) {
            throw new IllegalArgumentException(
                "'" + unit.name() + "' belongs to suite '" + unit.suiteName()
                    + "' but was registered under '" + suiteName + "'");
        }
    }

    private static final class GlobalHolder {
        private static final TestRegistry INSTANCE = new TestRegistry();
    }
}
