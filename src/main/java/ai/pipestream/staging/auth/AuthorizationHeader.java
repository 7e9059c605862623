package ai.pipestream.staging.auth;

import ai.pipestream.staging.exception.AuthenticationException;

/**
 * A parsed {@code Authorization} header. Only {@code Basic} and {@code Bearer} are
 * recognized, matched case-sensitively including the trailing space.
 */
public record AuthorizationHeader(Scheme scheme, String token) {

    public enum Scheme {
        BASIC("Basic "),
        BEARER("Bearer ");

        private final String prefix;

        Scheme(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public static AuthorizationHeader parse(String raw) {
        if (raw == null) {
            throw new AuthenticationException(AuthenticationException.Reason.INVALID_HEADER,
                    "Missing Authorization header");
        }
        for (Scheme scheme : Scheme.values()) {
            if (raw.startsWith(scheme.prefix())) {
                return new AuthorizationHeader(scheme, raw.substring(scheme.prefix().length()).trim());
            }
        }
        throw new AuthenticationException(AuthenticationException.Reason.INVALID_HEADER,
                "Unsupported Authorization scheme");
    }

    @Override
    public String toString() {
        return scheme.prefix() + "<redacted>";
    }
}
