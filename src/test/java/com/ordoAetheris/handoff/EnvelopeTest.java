package com.ordoAetheris.handoff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {

    @Test
    @DisplayName("data envelope carries its value, null included")
    void dataEnvelope() {
        Envelope<String> e = Envelope.of("x");
        assertFalse(e.isEndOfStream());
        assertEquals("x", e.value());

        Envelope<String> empty = Envelope.of(null);
        assertFalse(empty.isEndOfStream(), "null is data, not the end-of-stream marker");
        assertNull(empty.value());
    }

    @Test
    @DisplayName("end-of-stream marker has no value")
    void endOfStreamMarker() {
        Envelope<Integer> eos = Envelope.endOfStream();
        assertTrue(eos.isEndOfStream());
        assertThrows(IllegalStateException.class, eos::value);
        assertEquals("Envelope[EOS]", eos.toString());
    }

    @Test
    @DisplayName("every marker is recognised by its flag, not by identity")
    void markersAreRecognisedByFlag() {
        Envelope<String> a = Envelope.endOfStream();
        Envelope<String> b = Envelope.endOfStream();
        assertNotSame(a, b);
        assertTrue(a.isEndOfStream());
        assertTrue(b.isEndOfStream());
    }
}
