package org.jtdd.runner;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Process-wide sink for runner status lines. Defaults to standard output.
 */
public final class TestOutput {
    private static volatile PrintStream current = System.out;

    private TestOutput() {
    }

    public static PrintStream current() {
        return current;
    }

    /**
     * Replaces the sink used by {@link TestRunner#runTests()}; call before a run.
     */
    public static void setOutStream(PrintStream stream) {
        current = Objects.requireNonNull(stream, "stream");
    }

    public static void reset() {
        current = System.out;
    }
}
