package org.jtdd.registry;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.jtdd.confirm.BoolConfirmException;
import org.jtdd.confirm.Confirm;
import org.jtdd.confirm.MissingExpectedException;
import org.junit.jupiter.api.Test;

class TestCaseTest {
    @Test
    void swallowsRequiredExceptionType() {
        TestCase test = Tests.test("Test will run setup and teardown code")
            .expectThrows(IllegalArgumentException.class)
            .into(new TestRegistry())
            .register(() -> updateTestEntryName(100, ""));

        assertDoesNotThrow(test::execute);
        assertTrue(test.executed());
    }

    @Test
    void acceptsSubtypesOfRequiredException() {
        TestCase test = Tests.test("subtype")
            .expectThrows(RuntimeException.class)
            .into(new TestRegistry())
            .register(() -> {
                throw new IllegalStateException("boom");
            });

        assertDoesNotThrow(test::execute);
    }

    @Test
    void requiredInterruptedExceptionKeepsInterruptFlag() {
        TestCase test = Tests.test("interrupt expected")
            .expectThrows(InterruptedException.class)
            .into(new TestRegistry())
            .register(() -> {
                throw new InterruptedException("stop");
            });

        try {
            assertDoesNotThrow(test::execute);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void raisesMissingExpectedExceptionWithDisplayName() {
        TestCase test = Tests.test("never throws")
            .expectThrows(IllegalArgumentException.class, "int")
            .into(new TestRegistry())
            .register(() -> updateTestEntryName(100, "named"));

        MissingExpectedException missing = assertThrows(MissingExpectedException.class, test::execute);
        assertEquals("Expected exception type int was not thrown.", missing.reason());
    }

    @Test
    void defaultsDisplayNameToSimpleClassName() {
        TestCase test = Tests.test("never throws")
            .expectThrows(IllegalArgumentException.class)
            .into(new TestRegistry())
            .register(() -> {
            });

        assertEquals("IllegalArgumentException", test.requiredExceptionName().orElseThrow());
        MissingExpectedException missing = assertThrows(MissingExpectedException.class, test::execute);
        assertEquals("Expected exception type IllegalArgumentException was not thrown.", missing.reason());
    }

    @Test
    void propagatesOtherThrowablesWhenRequiredTypeDiffers() {
        TestCase test = Tests.test("wrong type")
            .expectThrows(IllegalArgumentException.class)
            .into(new TestRegistry())
            .register(() -> Confirm.confirmTrue(false, 3));

        assertThrows(BoolConfirmException.class, test::execute);
    }

    @Test
    void runsOnlyOnce() throws Exception {
        TestCase test = Tests.test("once").into(new TestRegistry()).register(() -> {
        });

        test.execute();
        assertThrows(IllegalStateException.class, test::execute);
    }

    @Test
    void verdictFieldsStartPassedAndRecordFailure() {
        TestCase test = Tests.test("verdict").into(new TestRegistry()).register(() -> {
        });

        assertTrue(test.passed());
        assertEquals("", test.reason());
        assertFalse(test.sourceLine().isPresent());

        test.setFailed("Expected: true", 12);
        assertFalse(test.passed());
        assertEquals("Expected: true", test.reason());
        assertEquals(12, test.confirmLine());
        assertThrows(IllegalArgumentException.class, () -> test.setFailed(""));
    }

    @Test
    void emptyExpectedFailureReasonMeansNoExpectation() {
        TestCase test = Tests.test("blank").expectFailure("").into(new TestRegistry()).register(() -> {
        });

        assertFalse(test.expectedFailureReason().isPresent());
    }

    @Test
    void fixtureScopeRunsSetupOnOpenAndTeardownOnClose() throws Exception {
        List<String> events = new ArrayList<>();
        TempEntry entry = new TempEntry(events);

        try (FixtureScope<TempEntry> scope = FixtureScope.open(entry)) {
            events.add("body " + scope.get().id());
        }

        assertEquals(List.of("create", "body 100", "delete 100"), events);
    }

    @Test
    void fixtureScopeTearsDownWhenBodyThrows() {
        List<String> events = new ArrayList<>();
        TestCase test = Tests.test("Test will run setup and teardown code")
            .expectThrows(IllegalArgumentException.class)
            .into(new TestRegistry())
            .register(() -> {
                try (FixtureScope<TempEntry> entry = FixtureScope.open(new TempEntry(events))) {
                    updateTestEntryName(entry.get().id(), "");
                }
            });

        assertDoesNotThrow(test::execute);
        assertEquals(List.of("create", "delete 100"), events);
    }

    private static void updateTestEntryName(int id, String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty for entry " + id);
        }
    }

    static final class TempEntry implements Fixture {
        private final List<String> events;
        private int id;

        TempEntry(List<String> events) {
            this.events = events;
        }

        @Override
        public void setup() {
            id = 100;
            events.add("create");
        }

        @Override
        public void teardown() {
            events.add("delete " + id);
        }

        int id() {
            return id;
        }
    }
}
