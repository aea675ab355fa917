package com.warmlead.crm.common.error;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassificationTest {

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"AUTHENTICATION", "VALIDATION"})
    void testOf_HumanInterventionKinds_AreNotRecoverable(ErrorKind kind) {
        assertFalse(ErrorClassification.of(kind).recoverable());
    }

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"AUTHENTICATION", "VALIDATION"}, mode = EnumSource.Mode.EXCLUDE)
    void testOf_OtherKinds_AreRecoverable(ErrorKind kind) {
        assertTrue(ErrorClassification.of(kind).recoverable());
    }

    @Test
    void testOf_RetryAfterOnlyForRateLimitAndNetwork() {
        assertEquals(60_000L, ErrorClassification.of(ErrorKind.RATE_LIMIT).retryAfterMs().getAsLong());
        assertEquals(5_000L, ErrorClassification.of(ErrorKind.NETWORK).retryAfterMs().getAsLong());
        assertTrue(ErrorClassification.of(ErrorKind.DATABASE).retryAfterMs().isEmpty());
        assertTrue(ErrorClassification.of(ErrorKind.UNKNOWN).retryAfterMs().isEmpty());
    }

    @Test
    void testOf_UserMessageComesFromKind() {
        assertEquals("Rate limit exceeded. Please wait a moment and try again.",
            ErrorClassification.of(ErrorKind.RATE_LIMIT).userMessage());
        assertEquals("An unexpected error occurred. Please try again.",
            ErrorClassification.of(ErrorKind.UNKNOWN).userMessage());
    }
}
