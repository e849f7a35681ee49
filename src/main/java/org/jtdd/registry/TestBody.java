package org.jtdd.registry;

/**
 * Body of a test or of a suite lifecycle operation.
 */
@FunctionalInterface
public interface TestBody {
    void run() throws Exception;
}
