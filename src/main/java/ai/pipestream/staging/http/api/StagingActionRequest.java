package ai.pipestream.staging.http.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

/**
 * {@code stagingActionRequest} body of the bulk close and promote calls.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StagingActionRequest {

    public Data data;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {
        @JacksonXmlElementWrapper(localName = "stagedRepositoryIds")
        @JacksonXmlProperty(localName = "string")
        public List<String> stagedRepositoryIds;
        public String description;
        public boolean autoDropAfterRelease;
    }
}
