package org.patternlab.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PatternContractException Tests")
class PatternContractExceptionTest {

    @Test
    @DisplayName("invalidArgument carries category, reason code and prefixed message")
    void testInvalidArgumentFactory() {
        PatternContractException ex = PatternContractException.invalidArgument("TEST_REASON", "details");

        assertEquals(PatternContractException.Category.INVALID_ARGUMENT, ex.category());
        assertEquals("TEST_REASON", ex.reasonCode());
        assertEquals("[TEST_REASON] details", ex.getMessage());
        assertFalse(ex.isNotFound());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("notFound is distinguishable without knowing the reason code")
    void testNotFoundFactory() {
        PatternContractException ex = PatternContractException.notFound("ANY_CODE", "missing");

        assertEquals(PatternContractException.Category.NOT_FOUND, ex.category());
        assertTrue(ex.isNotFound());
    }

    @Test
    @DisplayName("Full constructor preserves the cause")
    void testCausePreserved() {
        IllegalStateException cause = new IllegalStateException("boom");
        PatternContractException ex = new PatternContractException(
                PatternContractException.Category.NOT_FOUND,
                "TEST_REASON",
                "details",
                cause
        );

        assertSame(cause, ex.getCause());
        assertEquals("[TEST_REASON] details", ex.getMessage());
    }

    @Test
    @DisplayName("Blank reason code, null reason code, null message and null category are rejected")
    void testInvalidArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PatternContractException.invalidArgument(" ", "details"));
        assertThrows(NullPointerException.class, () -> PatternContractException.notFound(null, "details"));
        assertThrows(NullPointerException.class, () -> PatternContractException.notFound("TEST_REASON", null));
        assertThrows(
                NullPointerException.class,
                () -> new PatternContractException(null, "TEST_REASON", "details")
        );
    }
}
