package com.inboxsearch.identity;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.inboxsearch.runtime.ConfigurationException;

public class TokenIdentityResolver implements IdentityResolver {
    private final Map<String, Principal> principalsByToken = new HashMap<>();

    public TokenIdentityResolver(Map<String, String> tokens) {
        for (Map.Entry<String, String> entry : tokens.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ConfigurationException("identity token must not be blank");
            }
            if (entry.getValue() == null) {
                throw new ConfigurationException("identity token has no principal id");
            }
            try {
                principalsByToken.put(entry.getKey(), new Principal(UUID.fromString(entry.getValue())));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("identity token maps to invalid principal id: " + entry.getValue(), e);
            }
        }
    }

    @Override
    public Principal resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new UnauthenticatedException("missing credential");
        }
        String token = credential.startsWith("Bearer ") ? credential.substring("Bearer ".length()).strip() : credential;
        Principal principal = principalsByToken.get(token);
        if (principal == null) {
            throw new UnauthenticatedException("unknown credential");
        }
        return principal;
    }
}
