package ai.pipestream.staging.http.api;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

@JacksonXmlRootElement(localName = "profileResponse")
public record ProfileResponseDocument(StagingProfile data) {

    public static ProfileResponseDocument of(String baseUrl, String profileId) {
        return new ProfileResponseDocument(StagingProfile.forNamespace(baseUrl, profileId,
                baseUrl + "/service/local/staging/profiles/" + profileId + "/" + profileId));
    }
}
