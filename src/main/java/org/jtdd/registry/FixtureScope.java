package org.jtdd.registry;

import java.util.Objects;

/**
 * Runs a fixture's setup on open and its teardown on close.
 *
 * <pre>{@code
 * try (FixtureScope<TempEntry> entry = FixtureScope.open(new TempEntry())) {
 *     updateName(entry.get().id(), "");
 * }
 * }</pre>
 */
public final class FixtureScope<T extends Fixture> implements AutoCloseable {
    private final T fixture;
    private boolean closed;

    private FixtureScope(T fixture) {
        this.fixture = fixture;
    }

    public static <T extends Fixture> FixtureScope<T> open(T fixture) throws Exception {
        Objects.requireNonNull(fixture, "fixture");
        fixture.setup();
        return new FixtureScope<>(fixture);
    }

    public T get() {
        return fixture;
    }

    @Override
    public void close() throws Exception {
        if (closed) {
            return;
        }
        closed = true;
        fixture.teardown();
    }
}
