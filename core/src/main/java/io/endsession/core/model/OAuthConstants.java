package io.endsession.core.model;

/** Protocol constants shared by the pipeline and the endpoint bindings. */
public final class OAuthConstants {

    private OAuthConstants() {
        // constants holder
    }

    /** Standard error codes. */
    public static final class Errors {
        public static final String INVALID_REQUEST = "invalid_request";
        public static final String SERVER_ERROR = "server_error";
        public static final String TEMPORARILY_UNAVAILABLE = "temporarily_unavailable";

        private Errors() {}
    }

    /** Parameter names. */
    public static final class Parameters {
        public static final String ERROR = "error";
        public static final String ERROR_DESCRIPTION = "error_description";
        public static final String ERROR_URI = "error_uri";
        public static final String POST_LOGOUT_REDIRECT_URI = "post_logout_redirect_uri";
        public static final String STATE = "state";

        private Parameters() {}
    }

    /** Application permissions checked by the endpoints. */
    public static final class Permissions {
        public static final String ENDPOINT_LOGOUT = "ept:logout";

        private Permissions() {}
    }
}
