package org.jtdd.registry;

/**
 * Setup and teardown pair, usable as suite lifecycle or through {@link FixtureScope}
 * inside a single test.
 */
public interface Fixture {
    void setup() throws Exception;

    void teardown() throws Exception;
}
