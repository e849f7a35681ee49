package org.jtdd.registry;

/**
 * Tests were registered under a suite identifier that has no registered suite.
 */
public final class SuiteNotFoundException extends IllegalStateException {
    private final String suiteName;

    public SuiteNotFoundException(String suiteName) {
        super("no test suite registered for '" + suiteName + "'");
        this.suiteName = suiteName;
    }

    public String suiteName() {
        return suiteName;
    }
}
