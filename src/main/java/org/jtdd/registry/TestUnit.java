package org.jtdd.registry;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Identity and verdict state shared by registered tests and suites.
 *
 * <p>Identity is fixed at construction. The verdict starts as passed and only changes
 * through {@link #setFailed(String, int)}.
 */
public abstract class TestUnit {
    public static final int NO_LINE = -1;

    private final String name;
    private final String suiteName;
    private boolean passed;
    private String reason;
    private int confirmLine;

    TestUnit(String name, String suiteName) {
        this.name = Objects.requireNonNull(name, "name");
        this.suiteName = Objects.requireNonNull(suiteName, "suiteName");
        this.passed = true;
        this.reason = "";
        this.confirmLine = NO_LINE;
    }

    public String name() {
        return name;
    }

    /**
     * Suite identifier; empty for ungrouped tests.
     */
    public String suiteName() {
        return suiteName;
    }

    public boolean passed() {
        return passed;
    }

    public String reason() {
        return reason;
    }

    public int confirmLine() {
        return confirmLine;
    }

    public OptionalInt sourceLine() {
        return confirmLine == NO_LINE ? OptionalInt.empty() : OptionalInt.of(confirmLine);
    }

    public void setFailed(String reason) {
        setFailed(reason, NO_LINE);
    }

    public void setFailed(String reason, int confirmLine) {
        if (reason == null || reason.isEmpty()) {
            throw new IllegalArgumentException("failure reason must not be empty");
        }
        this.passed = false;
        this.reason = reason;
        this.confirmLine = confirmLine < 0 ? NO_LINE : confirmLine;
    }
}
