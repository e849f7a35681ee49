package org.jtdd.runner;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.jtdd.registry.TestUnit;

/**
 * Reported result of one test, suite setup or suite teardown.
 */
public final class UnitResult {
    public enum Kind {
        TEST,
        SETUP,
        TEARDOWN
    }

    private final String suiteName;
    private final String name;
    private final Kind kind;
    private final Verdict verdict;
    private final String reason;
    private final int line;

    UnitResult(String suiteName, String name, Kind kind, Verdict verdict, String reason, int line) {
        this.suiteName = Objects.requireNonNull(suiteName, "suiteName");
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.verdict = Objects.requireNonNull(verdict, "verdict");
        this.reason = reason == null || reason.isEmpty() ? null : reason;
        this.line = line < 0 ? TestUnit.NO_LINE : line;
    }

    static UnitResult of(TestUnit unit, Kind kind, Verdict verdict) {
        return new UnitResult(unit.suiteName(), unit.name(), kind, verdict, unit.reason(), unit.confirmLine());
    }

    static UnitResult skipped(TestUnit unit) {
        return new UnitResult(unit.suiteName(), unit.name(), Kind.TEST, Verdict.SKIPPED, null, TestUnit.NO_LINE);
    }

    public String suiteName() {
        return suiteName;
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public Verdict verdict() {
        return verdict;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    public OptionalInt line() {
        return line == TestUnit.NO_LINE ? OptionalInt.empty() : OptionalInt.of(line);
    }
}
