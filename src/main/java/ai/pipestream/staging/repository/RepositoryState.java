package ai.pipestream.staging.repository;

/**
 * Lifecycle of a staging repository: {@code OPEN -> CLOSED -> RELEASED}.
 * {@link #NOT_FOUND} is only ever synthesized for keys that fail validation.
 */
public enum RepositoryState {
    OPEN("open"),
    CLOSED("closed"),
    RELEASED("released"),
    NOT_FOUND("not_found");

    private final String token;

    RepositoryState(String token) {
        this.token = token;
    }

    /**
     * @return the lowercase token persisted in the state marker and reported to clients
     */
    public String token() {
        return token;
    }

    /**
     * Parses a persisted token. Surrounding whitespace is ignored, case is not.
     *
     * @throws IllegalArgumentException for anything that is not one of the four tokens
     */
    public static RepositoryState fromToken(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (RepositoryState state : values()) {
                if (state.token.equals(trimmed)) {
                    return state;
                }
            }
        }
        throw new IllegalArgumentException("Could not convert " + value + " into a RepositoryState");
    }

    @Override
    public String toString() {
        return token;
    }
}
