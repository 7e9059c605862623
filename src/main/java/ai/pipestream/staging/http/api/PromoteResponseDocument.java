package ai.pipestream.staging.http.api;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * Answer to a start request, carrying the new repository id.
 */
@JacksonXmlRootElement(localName = "promoteResponse")
public record PromoteResponseDocument(Data data) {

    @JsonPropertyOrder({"stagedRepositoryId", "description"})
    public record Data(String stagedRepositoryId, String description) {
    }

    public static PromoteResponseDocument of(String stagedRepositoryId, String description) {
        return new PromoteResponseDocument(new Data(stagedRepositoryId, description == null ? "" : description));
    }
}
