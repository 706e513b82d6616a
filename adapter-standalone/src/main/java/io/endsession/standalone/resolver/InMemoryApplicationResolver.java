package io.endsession.standalone.resolver;

import io.endsession.core.spi.Application;
import io.endsession.core.spi.ApplicationResolver;
import io.endsession.standalone.config.ApplicationConfig;
import java.util.List;
import java.util.stream.Stream;

/**
 * Application registry backed by the {@code applications} configuration section. Lookups
 * return applications in declaration order.
 */
public final class InMemoryApplicationResolver implements ApplicationResolver {

    private final List<Application> applications;

    public InMemoryApplicationResolver(List<Application> applications) {
        this.applications = List.copyOf(applications);
    }

    public static InMemoryApplicationResolver fromConfig(List<ApplicationConfig> configs) {
        return new InMemoryApplicationResolver(
                configs.stream().map(ApplicationConfig::toApplication).toList());
    }

    @Override
    public Stream<Application> findByPostLogoutRedirectUri(String uri) {
        return applications.stream().filter(app -> app.postLogoutRedirectUris().contains(uri));
    }

    @Override
    public boolean hasPermission(Application application, String permission) {
        return application.permissions().contains(permission);
    }

    public int size() {
        return applications.size();
    }
}
