package com.questrail.bamboo.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class ScriptValueTest
{
    @Test
    void nullTextIsAbsent() {
        assertSame(ScriptValue.ABSENT, ScriptValue.of((String) null));
        assertTrue(ScriptValue.absent().isAbsent());
    }

    @Test
    void accessorsOnlyMatchTheirKind() {
        ScriptValue n = ScriptValue.of(3);

        assertEquals(Optional.of(3.0), n.asNumber());
        assertTrue(n.asText().isEmpty());
        assertTrue(n.asBoolean().isEmpty());
        assertEquals(Optional.of("x"), ScriptValue.of("x").asText());
        assertEquals(Optional.of(true), ScriptValue.of(true).asBoolean());
    }

    @Test
    void navigationIsAllowedUntilDenied() {
        NavigationRequest request = new NavigationRequest("https://a.test/", true, false);

        assertTrue(request.isAllowed());
        assertTrue(request.isRedirect());
        request.deny();
        assertFalse(request.isAllowed());
        request.setAllowed(true);
        assertTrue(request.isAllowed());
    }
}
