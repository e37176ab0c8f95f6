package com.urlsentry.core.http;

import com.urlsentry.core.model.Classification;
import com.urlsentry.core.model.Classification.Kind;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeClassifierTest {

    private final OutcomeClassifier strict = new OutcomeClassifier(false, Set.of());

    @Test
    void two_xx_is_success() {
        Classification c = strict.classify(ProbeResult.status(204, 3));
        assertEquals(Kind.SUCCESS, c.kind());
        assertEquals(204, c.statusCode());
        assertFalse(c.isIssue());
    }

    @Test
    void other_codes_are_http_errors() {
        assertEquals(Kind.HTTP_ERROR, strict.classify(ProbeResult.status(404, 1)).kind());
        assertEquals(Kind.HTTP_ERROR, strict.classify(ProbeResult.status(301, 1)).kind());
        assertEquals(Kind.HTTP_ERROR, strict.classify(ProbeResult.status(503, 1)).kind());
    }

    @Test
    void allowed_code_becomes_success() {
        OutcomeClassifier lenient = new OutcomeClassifier(false, Set.of(403));
        Classification c = lenient.classify(ProbeResult.status(403, 1));
        assertEquals(Kind.SUCCESS, c.kind());
        assertEquals(403, c.statusCode());
    }

    @Test
    void timeout_depends_on_allow_flag() {
        assertEquals(Kind.TIMEOUT, strict.classify(ProbeResult.timeout(5000)).kind());
        Classification allowed = new OutcomeClassifier(true, Set.of()).classify(ProbeResult.timeout(5000));
        assertEquals(Kind.TIMEOUT_ALLOWED, allowed.kind());
        assertFalse(allowed.isIssue());
    }

    @Test
    void connection_and_invalid_url_keep_description() {
        Classification refused = strict.classify(ProbeResult.connection("Connection refused", 2));
        assertEquals(Kind.CONNECTION_ERROR, refused.kind());
        assertEquals("Connection refused", refused.description());
        assertTrue(refused.isIssue());

        Classification invalid = strict.classify(ProbeResult.invalidUrl("invalid URL: bad host"));
        assertEquals(Kind.CONNECTION_ERROR, invalid.kind());
        assertEquals("invalid URL: bad host", invalid.description());
    }

    @Test
    void blank_description_gets_generic_text() {
        Classification c = strict.classify(ProbeResult.connection("  ", 1));
        assertEquals("connection failed", c.description());
    }
}
