package com.inboxsearch.identity;

import java.util.Objects;
import java.util.UUID;

/**
 * The authenticated owner every stored entity and every query is scoped to.
 */
public record Principal(UUID id) {
    public Principal {
        Objects.requireNonNull(id, "principal id");
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
