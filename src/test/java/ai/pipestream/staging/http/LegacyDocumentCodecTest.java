package ai.pipestream.staging.http;

import ai.pipestream.staging.exception.InvalidRequestException;
import ai.pipestream.staging.http.api.PromoteRequest;
import ai.pipestream.staging.http.api.StagingActionRequest;
import ai.pipestream.staging.http.api.StagingProfilesDocument;
import ai.pipestream.staging.http.api.StagingRepositoryDocument;
import ai.pipestream.staging.repository.RepositoryState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.core.MediaType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LegacyDocumentCodecTest {

    private static final String BASE = "https://s01.oss.sonatype.org";

    private final LegacyDocumentCodec codec = new LegacyDocumentCodec(new ObjectMapper());

    @Test
    void testStagingProfilesAsXml() {
        String xml = codec.write(LegacyDocumentCodec.Format.XML,
                StagingProfilesDocument.evaluate(BASE, List.of("com.example")));

        assertThat(xml)
                .contains("<stagingProfiles>")
                .contains("<data>")
                .contains("<stagingProfile>")
                .contains("<resourceURI>" + BASE + "/service/local/staging/profile_evaluate/com.example</resourceURI>")
                .contains("<deployURI>" + BASE + "/service/local/staging/deploy/maven2</deployURI>")
                .contains("<string>com.example-deployer</string>")
                .contains("class=\"linked-hash-map\"");
        assertThat(xml.indexOf("<resourceURI>")).isLessThan(xml.indexOf("<id>"));
    }

    @Test
    void testEachProfileListKeepsItsOwnElement() {
        String xml = codec.write(LegacyDocumentCodec.Format.XML,
                StagingProfilesDocument.evaluate(BASE, List.of("com.example", "org.acme"))).replaceAll(">\\s+<", "><");

        assertThat(xml)
                .contains("<targetGroups><string>staging</string></targetGroups>")
                .contains("<finishNotifyRoles><string>com.example-deployer</string></finishNotifyRoles>")
                .contains("<finishNotifyRoles><string>org.acme-deployer</string></finishNotifyRoles>")
                .contains("<closeRuleSets><string>close_rule_set</string></closeRuleSets>")
                .contains("promotionNotifyRoles")
                .doesNotContain("<string><string>");
    }

    @Test
    void testStagingProfilesAsJson() throws Exception {
        String json = codec.write(LegacyDocumentCodec.Format.JSON,
                StagingProfilesDocument.evaluate(BASE, List.of("com.example")));

        JsonNode profile = new ObjectMapper().readTree(json).get("data").get(0);
        assertEquals("com.example", profile.get("id").asText());
        assertEquals(BASE + "/service/local/staging/profile_evaluate/com.example", profile.get("resourceURI").asText());
        assertEquals("staging", profile.get("targetGroups").get(0).asText());
        assertTrue(profile.get("promotionNotifyRoles").isEmpty());
        assertEquals(12345, profile.get("order").asInt());
        assertEquals("linked-hash-map", profile.get("properties").get("@class").asText());
    }

    @Test
    void testRepositoryStateIsReportedAsType() throws Exception {
        String json = codec.write(LegacyDocumentCodec.Format.JSON,
                StagingRepositoryDocument.of(BASE, "com.example-0", RepositoryState.NOT_FOUND));
        String xml = codec.write(LegacyDocumentCodec.Format.XML,
                StagingRepositoryDocument.of(BASE, "com.example-0", RepositoryState.RELEASED));

        JsonNode node = new ObjectMapper().readTree(json);
        assertEquals("not_found", node.get("type").asText());
        assertEquals(BASE + "/content/repositories/com.example-0", node.get("repositoryURI").asText());
        assertThat(xml).contains("<stagingProfileRepository>").contains("<type>released</type>");
    }

    @Test
    void testReadPromoteRequestFromXmlAndJson() {
        PromoteRequest xml = codec.read(MediaType.APPLICATION_XML_TYPE, bytes(
                "<promoteRequest><data><stagedRepositoryId>com.example-3</stagedRepositoryId>"
                        + "<description>Release 1.0</description></data></promoteRequest>"), PromoteRequest.class);
        PromoteRequest json = codec.read(MediaType.APPLICATION_JSON_TYPE, bytes(
                "{\"data\":{\"description\":\"Release 1.0\",\"extra\":true}}"), PromoteRequest.class);

        assertEquals("com.example-3", xml.data.stagedRepositoryId);
        assertEquals("Release 1.0", xml.data.description);
        assertNull(json.data.stagedRepositoryId);
        assertEquals("Release 1.0", json.data.description);
    }

    @Test
    void testReadBulkRequestFromXml() {
        StagingActionRequest request = codec.read(new MediaType("application", "xml", "UTF-8"), bytes(
                "<stagingActionRequest><data><stagedRepositoryIds><string>com.example-0</string>"
                        + "<string>com.example-1</string></stagedRepositoryIds><description>bulk</description>"
                        + "<autoDropAfterRelease>true</autoDropAfterRelease></data></stagingActionRequest>"),
                StagingActionRequest.class);

        assertEquals(List.of("com.example-0", "com.example-1"), request.data.stagedRepositoryIds);
        assertTrue(request.data.autoDropAfterRelease);
    }

    @Test
    void testUnreadableBodiesAreClientErrors() {
        assertThrows(InvalidRequestException.class,
                () -> codec.read(MediaType.APPLICATION_JSON_TYPE, bytes("{not json"), PromoteRequest.class));
        assertThrows(InvalidRequestException.class,
                () -> codec.read(MediaType.APPLICATION_XML_TYPE, new byte[0], PromoteRequest.class));
    }

    @Test
    void testResponseFormatNegotiation() {
        assertEquals(LegacyDocumentCodec.Format.JSON, LegacyDocumentCodec.responseFormat(
                List.of(MediaType.APPLICATION_JSON_TYPE), MediaType.APPLICATION_XML_TYPE));
        assertEquals(LegacyDocumentCodec.Format.XML, LegacyDocumentCodec.responseFormat(
                List.of(MediaType.WILDCARD_TYPE), MediaType.APPLICATION_XML_TYPE));
        assertEquals(LegacyDocumentCodec.Format.JSON, LegacyDocumentCodec.responseFormat(
                List.of(MediaType.TEXT_PLAIN_TYPE), new MediaType("application", "vnd.api+json")));
        assertEquals(LegacyDocumentCodec.Format.XML, LegacyDocumentCodec.responseFormat(List.of(), null));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
