package com.ephemera.store.model;

import com.ephemera.store.common.constants.StoreConstants;
import com.ephemera.store.common.exception.NamespaceForbiddenException;

import java.util.Collection;
import java.util.Set;

/**
 * Namespaces an API token may touch. Membership of {@code "*"} grants all of them.
 */
public record AccessScope(Set<String> namespaces) {

    public AccessScope {
        namespaces = Set.copyOf(namespaces);
    }

    public static AccessScope of(Collection<String> namespaces) {
        return new AccessScope(namespaces == null ? Set.of() : Set.copyOf(namespaces));
    }

    public static AccessScope universal() {
        return new AccessScope(Set.of(StoreConstants.WILDCARD));
    }

    public boolean isUniversal() {
        return namespaces.contains(StoreConstants.WILDCARD);
    }

    public boolean allows(String namespace) {
        return isUniversal() || namespaces.contains(namespace);
    }

    public void check(String namespace) {
        if (!allows(namespace)) {
            throw new NamespaceForbiddenException(namespace);
        }
    }
}
