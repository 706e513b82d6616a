package io.endsession.standalone.config;

import io.endsession.core.spi.Application;
import java.util.List;
import java.util.Set;

/**
 * A client application declared in the {@code applications} section.
 *
 * @param id                     application identifier
 * @param permissions            granted permissions, e.g. {@code ept:logout}
 * @param postLogoutRedirectUris registered post-logout redirect URIs
 */
public record ApplicationConfig(String id, List<String> permissions, List<String> postLogoutRedirectUris) {

    public ApplicationConfig {
        permissions = permissions != null ? List.copyOf(permissions) : List.of();
        postLogoutRedirectUris = postLogoutRedirectUris != null ? List.copyOf(postLogoutRedirectUris) : List.of();
    }

    public Application toApplication() {
        return new Application(id, Set.copyOf(permissions), Set.copyOf(postLogoutRedirectUris));
    }
}
