package com.inboxsearch.identity;

public interface IdentityResolver {
    /**
     * Resolves the principal behind a bearer credential.
     *
     * @throws UnauthenticatedException when the credential is missing or unknown
     */
    Principal resolve(String credential);
}
