package com.ai.trainingstudio.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UploadTypeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void should_FallBackToAlternativeCounters() throws Exception {
        assertEquals("Loaded 4 courses.",
                UploadType.COURSES.successMessage(objectMapper.readTree("{\"records_loaded\":4}")));
        assertEquals("Loaded the uploaded courses.",
                UploadType.COURSES.successMessage(objectMapper.readTree("{\"courses_loaded\":0}")));
        assertEquals("Guidelines imported (unknown characters).", UploadType.GUIDELINES.successMessage(null));
    }

    @Test
    void should_MatchExtensionIgnoringCase() {
        assertTrue(UploadType.HOLIDAYS.accepts("Holidays-2024.CSV"));
        assertFalse(UploadType.GUIDELINES.accepts("guidelines.csv"));
        assertFalse(UploadType.COURSES.accepts(null));
    }

    @Test
    void should_ResolveByKeyOrName() {
        assertEquals(UploadType.COURSES, UploadType.fromKey("courses"));
        assertEquals(UploadType.HOLIDAYS, UploadType.fromKey("HOLIDAYS"));
        assertThrows(IllegalArgumentException.class, () -> UploadType.fromKey("weather"));
    }
}
