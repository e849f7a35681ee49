package org.jtdd.registry;

import java.util.Objects;

/**
 * Declarations that build tests and suites and register them immediately.
 *
 * <p>Declarations placed in a static initializer register when the class is initialized:
 *
 * <pre>{@code
 * static {
 *     Tests.test("multiplies by two", () -> Confirm.confirm(4, multiplyBy2(2)));
 *     Tests.test("rejects empty names")
 *         .inSuite("Entries")
 *         .expectThrows(IllegalArgumentException.class)
 *         .register(() -> updateName(100, ""));
 *     Tests.suite("temp entry", "Entries", new TempEntry());
 * }
 * }</pre>
 */
public final class Tests {
    private Tests() {
    }

    public static TestCase test(String name, TestBody body) {
        return test(name).register(body);
    }

    public static Declaration test(String name) {
        return new Declaration(name);
    }

    public static TestSuite suite(String name, String suiteName, Fixture fixture) {
        return suite(TestRegistry.global(), name, suiteName, fixture);
    }

    public static TestSuite suite(String name, String suiteName, TestBody setup, TestBody teardown) {
        return suite(TestRegistry.global(), name, suiteName, setup, teardown);
    }

    public static TestSuite suite(TestRegistry registry, String name, String suiteName, Fixture fixture) {
        Objects.requireNonNull(fixture, "fixture");
        return suite(registry, name, suiteName, fixture::setup, fixture::teardown);
    }

    public static TestSuite suite(
        TestRegistry registry,
        String name,
        String suiteName,
        TestBody setup,
        TestBody teardown
    ) {
        Objects.requireNonNull(registry, "registry");
        TestSuite suite = new TestSuite(name, suiteName, setup, teardown);
        registry.addSuite(suite.suiteName(), suite);
        return suite;
    }

    /**
     * Test under construction; nothing is registered until {@link #register(TestBody)}.
     */
    public static final class Declaration {
        private final String name;
        private String suiteName = "";
        private String expectedFailureReason;
        private Class<? extends Throwable> requiredException;
        private String requiredExceptionName;
        private TestRegistry registry = TestRegistry.global();

        private Declaration(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Declaration inSuite(String suiteName) {
            this.suiteName = Objects.requireNonNull(suiteName, "suiteName");
            return this;
        }

        /**
         * Marks the test as expected to fail with exactly this reason.
         */
        public Declaration expectFailure(String reason) {
            this.expectedFailureReason = Objects.requireNonNull(reason, "reason");
            return this;
        }

        public Declaration expectThrows(Class<? extends Throwable> exceptionType) {
            return expectThrows(exceptionType, exceptionType.getSimpleName());
        }

        /**
         * Requires the body to throw {@code exceptionType}; {@code displayName} is used in the
         * failure reason when it does not.
         */
        public Declaration expectThrows(Class<? extends Throwable> exceptionType, String displayName) {
            this.requiredException = Objects.requireNonNull(exceptionType, "exceptionType");
            this.requiredExceptionName = displayName;
            return this;
        }

        public Declaration into(TestRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        public TestCase register(TestBody body) {
            TestCase test = new TestCase(
                name,
                suiteName,
                body,
                expectedFailureReason,
                requiredException,
                requiredExceptionName
            );
            registry.addTest(test.suiteName(), test);
            return test;
        }
    }
}
