package com.warmlead.crm.sync.pipedrive;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class PipedriveTimestampsTest {

    @Test
    void testParse_PipedriveFormat_IsUtc() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 11, 0), PipedriveTimestamps.parse("2024-01-01 11:00:00"));
    }

    @Test
    void testParse_IsoWithOffset_ConvertsToUtc() {
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 0), PipedriveTimestamps.parse("2024-01-01T12:00:00+02:00"));
        assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), PipedriveTimestamps.parse("2024-01-01T12:00:00Z"));
    }

    @Test
    void testParse_Garbage_ReturnsNull() {
        assertNull(PipedriveTimestamps.parse("yesterday"));
        assertNull(PipedriveTimestamps.parse(" "));
        assertNull(PipedriveTimestamps.parse(null));
    }
}
