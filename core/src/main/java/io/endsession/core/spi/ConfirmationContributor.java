package io.endsession.core.spi;

import io.endsession.core.model.ProtocolRequest;
import io.endsession.core.model.ProtocolResponse;

/**
 * Fills the inline confirmation returned when a logout request is not redirected. The host
 * application uses it to acknowledge the sign-out (for example with a message for the user).
 */
@FunctionalInterface
public interface ConfirmationContributor {

    /** Contributor that leaves the confirmation empty. */
    ConfirmationContributor NONE = (request, response) -> {};

    /**
     * Adds parameters to the confirmation response.
     *
     * @param request  the bound logout request
     * @param response the response being built; handler-set parameters are already present
     */
    void contribute(ProtocolRequest request, ProtocolResponse response);
}
