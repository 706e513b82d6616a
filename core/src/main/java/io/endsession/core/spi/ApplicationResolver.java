package io.endsession.core.spi;

import java.util.stream.Stream;

/**
 * Looks up registered applications for the logout endpoint.
 *
 * <p>
 * Implementations may block (for example on a database call) and MUST be thread-safe. The
 * endpoint consumes the returned stream lazily, stops at the first accepted application and
 * closes the stream afterwards.
 */
public interface ApplicationResolver {

    /**
     * Returns the applications that registered the exact given post-logout redirect URI, in
     * preference order.
     *
     * @param uri the redirect URI exactly as sent by the client
     * @return a possibly empty stream, never {@code null}
     */
    Stream<Application> findByPostLogoutRedirectUri(String uri);

    /**
     * Returns whether the application was granted the given permission.
     *
     * @param application an application returned by {@link #findByPostLogoutRedirectUri}
     * @param permission  the permission, e.g. {@code ept:logout}
     */
    boolean hasPermission(Application application, String permission);
}
