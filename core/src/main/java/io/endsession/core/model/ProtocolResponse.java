package io.endsession.core.model;

/** An outbound protocol response, populated by stage defaults and handlers. */
public final class ProtocolResponse extends ProtocolMessage {

    public String error() {
        return getString(OAuthConstants.Parameters.ERROR);
    }

    public void setError(String value) {
        setParameter(OAuthConstants.Parameters.ERROR, value);
    }

    public String errorDescription() {
        return getString(OAuthConstants.Parameters.ERROR_DESCRIPTION);
    }

    public void setErrorDescription(String value) {
        setParameter(OAuthConstants.Parameters.ERROR_DESCRIPTION, value);
    }

    public String errorUri() {
        return getString(OAuthConstants.Parameters.ERROR_URI);
    }

    public void setErrorUri(String value) {
        setParameter(OAuthConstants.Parameters.ERROR_URI, value);
    }

    public String state() {
        return getString(OAuthConstants.Parameters.STATE);
    }

    public void setState(String value) {
        setParameter(OAuthConstants.Parameters.STATE, value);
    }

    /** True if an {@code error} parameter is present. */
    public boolean isError() {
        String error = error();
        return error != null && !error.isEmpty();
    }
}
