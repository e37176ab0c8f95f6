package com.urlsentry.app.logging;

import com.urlsentry.core.util.StructuredLog;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogSetupTest {

    @Test
    void structured_records_are_recognised_by_logger_name() {
        LogRecord structured = new LogRecord(Level.INFO, "{\"event\":\"run-done\"}");
        structured.setLoggerName(StructuredLog.LOGGER_PREFIX + "com.urlsentry.core.service.ValidationService");
        LogRecord plain = new LogRecord(Level.INFO, "Validation done");
        plain.setLoggerName("com.urlsentry.core.service.ValidationService");

        assertTrue(LogSetup.isStructured(structured));
        assertFalse(LogSetup.isStructured(plain));
    }

    @Test
    void level_names_fall_back_to_info() {
        assertEquals(Level.FINE, LogSetup.levelOf("fine"));
        assertEquals(Level.WARNING, LogSetup.levelOf(" warning "));
        assertEquals(Level.INFO, LogSetup.levelOf("chatty"));
        assertEquals(Level.INFO, LogSetup.levelOf(null));
    }
}
