package io.endsession.core.spi;

import java.util.Objects;
import java.util.Set;

/**
 * A registered client application as seen by the logout endpoint.
 *
 * @param id                     opaque application identifier
 * @param permissions            granted permissions (e.g. {@code ept:logout})
 * @param postLogoutRedirectUris registered post-logout redirect URIs
 */
public record Application(String id, Set<String> permissions, Set<String> postLogoutRedirectUris) {

    public Application {
        Objects.requireNonNull(id, "id must not be null");
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        postLogoutRedirectUris = postLogoutRedirectUris != null ? Set.copyOf(postLogoutRedirectUris) : Set.of();
    }
}
