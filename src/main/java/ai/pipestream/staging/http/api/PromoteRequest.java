package ai.pipestream.staging.http.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code promoteRequest} body of start and finish calls. Start sends only a description;
 * finish also names the repository.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromoteRequest {

    public Data data;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {
        public String stagedRepositoryId;
        public String description;
    }
}
