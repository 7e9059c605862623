package ai.pipestream.staging.publish;

/**
 * How the publishing service treats an uploaded bundle.
 */
public enum PublishingType {
    /**
     * The bundle is validated and then waits for a manual publish.
     */
    USER_MANAGED,

    /**
     * The bundle is validated and published automatically.
     */
    AUTOMATIC;

    /**
     * {@code automatic} in any case selects {@link #AUTOMATIC}; anything else,
     * including null, is {@link #USER_MANAGED}.
     */
    public static PublishingType fromParameter(String value) {
        return value != null && value.trim().equalsIgnoreCase("automatic") ? AUTOMATIC : USER_MANAGED;
    }
}
