package org.jtdd.registry;

import java.util.Objects;

/**
 * Setup and teardown shared by every test registered under the same suite identifier.
 */
public final class TestSuite extends TestUnit {
    private final TestBody setup;
    private final TestBody teardown;

    TestSuite(String name, String suiteName, TestBody setup, TestBody teardown) {
        super(name, requireText(suiteName));
        this.setup = Objects.requireNonNull(setup, "setup");
        this.teardown = Objects.requireNonNull(teardown, "teardown");
    }

    public void setup() throws Exception {
        setup.run();
    }

    public void teardown() throws Exception {
        teardown.run();
    }

    private static String requireText(String suiteName) {
        if (suiteName == null || suiteName.isEmpty()) {
            throw new IllegalArgumentException("suiteName must not be empty");
        }
        return suiteName;
    }
}
