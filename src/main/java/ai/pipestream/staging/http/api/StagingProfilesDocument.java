package ai.pipestream.staging.http.api;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

@JacksonXmlRootElement(localName = "stagingProfiles")
public record StagingProfilesDocument(
        @JacksonXmlElementWrapper(localName = "data") @JacksonXmlProperty(localName = "stagingProfile")
        List<StagingProfile> data) {

    /**
     * One profile per namespace, each pointing at its evaluate resource.
     */
    public static StagingProfilesDocument evaluate(String baseUrl, List<String> namespaces) {
        return new StagingProfilesDocument(namespaces.stream()
                .map(ns -> StagingProfile.forNamespace(baseUrl, ns,
                        baseUrl + "/service/local/staging/profile_evaluate/" + ns))
                .toList());
    }
}
