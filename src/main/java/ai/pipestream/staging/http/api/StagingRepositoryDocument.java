package ai.pipestream.staging.http.api;

import ai.pipestream.staging.repository.RepositoryState;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * State of one staging repository. Only {@code repositoryId} and {@code type} (the state token)
 * carry information; the rest are placeholders legacy clients require to be present.
 */
@JacksonXmlRootElement(localName = "stagingProfileRepository")
@JsonPropertyOrder({"profileId", "profileName", "profileType", "repositoryId", "type", "policy", "userId",
        "userAgent", "ipAddress", "repositoryURI", "created", "createdDate", "createdTimestamp", "updated",
        "updatedDate", "updatedTimestamp", "description", "provider", "releaseRepositoryId",
        "releaseRepositoryName", "notifications", "transitioning"})
public record StagingRepositoryDocument(
        String profileId,
        String profileName,
        String profileType,
        String repositoryId,
        String type,
        String policy,
        String userId,
        String userAgent,
        String ipAddress,
        @JsonProperty("repositoryURI") String repositoryUri,
        String created,
        String createdDate,
        long createdTimestamp,
        String updated,
        String updatedDate,
        long updatedTimestamp,
        String description,
        String provider,
        String releaseRepositoryId,
        String releaseRepositoryName,
        int notifications,
        boolean transitioning) {

    private static final String EPOCH = "1970-01-01T00:00:00.000Z";
    private static final String EPOCH_DATE = "Thu Jan 1 00:00:00 UTC 1970";

    public static StagingRepositoryDocument of(String baseUrl, String repositoryId, RepositoryState state) {
        return new StagingRepositoryDocument(
                "profile_id",
                "profile_name",
                "repository",
                repositoryId,
                state.token(),
                "release",
                "user_id",
                "user_agent",
                "ip_address",
                baseUrl + "/content/repositories/" + repositoryId,
                EPOCH,
                EPOCH_DATE,
                0,
                EPOCH,
                EPOCH_DATE,
                0,
                "description",
                "maven2",
                "releases",
                "Releases",
                0,
                false);
    }
}
