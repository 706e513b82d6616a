package io.endsession.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** An inbound protocol request, bound from the query string or the form body. */
public final class ProtocolRequest extends ProtocolMessage {

    public ProtocolRequest() {}

    public ProtocolRequest(Map<String, Parameter> parameters) {
        super(parameters);
    }

    /**
     * Builds a request from a multi-value map. Names with a single value become {@link
     * Parameter.Kind#STRING} parameters, repeated names become {@link Parameter.Kind#STRING_LIST}.
     */
    public static ProtocolRequest fromMultiValueMap(Map<String, List<String>> values) {
        Map<String, Parameter> parameters = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((name, list) -> {
                if (list == null || list.isEmpty()) {
                    return;
                }
                parameters.put(name, list.size() == 1 ? Parameter.of(list.get(0)) : Parameter.of(list));
            });
        }
        return new ProtocolRequest(parameters);
    }

    public String postLogoutRedirectUri() {
        return getString(OAuthConstants.Parameters.POST_LOGOUT_REDIRECT_URI);
    }

    public void setPostLogoutRedirectUri(String value) {
        setParameter(OAuthConstants.Parameters.POST_LOGOUT_REDIRECT_URI, value);
    }

    public String state() {
        return getString(OAuthConstants.Parameters.STATE);
    }

    public void setState(String value) {
        setParameter(OAuthConstants.Parameters.STATE, value);
    }
}
