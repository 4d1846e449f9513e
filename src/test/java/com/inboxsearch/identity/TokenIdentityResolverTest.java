package com.inboxsearch.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.inboxsearch.runtime.ConfigurationException;

class TokenIdentityResolverTest {
    private static final UUID ALICE = UUID.fromString("5b7a4a8e-3f7c-4a52-9d0a-0c6f8f2f1a11");

    private final TokenIdentityResolver resolver = new TokenIdentityResolver(Map.of("alice-token", ALICE.toString()));

    @Test
    void shouldResolveRawAndBearerCredentials() {
        assertEquals(new Principal(ALICE), resolver.resolve("alice-token"));
        assertEquals(new Principal(ALICE), resolver.resolve("Bearer alice-token"));
    }

    @Test
    void shouldRejectMissingOrUnknownCredentials() {
        assertThrows(UnauthenticatedException.class, () -> resolver.resolve(null));
        assertThrows(UnauthenticatedException.class, () -> resolver.resolve("  "));
        assertThrows(UnauthenticatedException.class, () -> resolver.resolve("Bearer bob-token"));
    }

    @Test
    void shouldRejectMalformedTokenTable() {
        assertThrows(ConfigurationException.class, () -> new TokenIdentityResolver(Map.of("t", "not-a-uuid")));
        assertThrows(ConfigurationException.class, () -> new TokenIdentityResolver(Map.of(" ", ALICE.toString())));
        Map<String, String> missingPrincipal = new HashMap<>();
        missingPrincipal.put("t", null);
        assertThrows(ConfigurationException.class, () -> new TokenIdentityResolver(missingPrincipal));
    }
}
