package ai.pipestream.staging.http.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/**
 * One staging profile. Every namespace is presented as its own profile whose id and name
 * are the namespace itself; the remaining fields are the fixed values legacy clients expect.
 */
@JsonPropertyOrder({"resourceURI", "id", "name", "repositoryType", "repositoryTemplateId", "repositoryTargetId",
        "inProgress", "order", "deployURI", "targetGroups", "finishNotifyRoles", "promotionNotifyRoles",
        "dropNotifyRoles", "closeRuleSets", "promoteRuleSets", "promotionTargetRepository", "mode",
        "finishNotifyCreator", "promotionNotifyCreator", "dropNotifyCreator", "autoStagingDisabled",
        "repositoriesSearchable", "properties"})
public record StagingProfile(
        @JsonProperty("resourceURI") String resourceUri,
        String id,
        String name,
        String repositoryType,
        String repositoryTemplateId,
        String repositoryTargetId,
        boolean inProgress,
        int order,
        @JsonProperty("deployURI") String deployUri,
        LegacyStringList targetGroups,
        LegacyStringList finishNotifyRoles,
        LegacyStringList promotionNotifyRoles,
        LegacyStringList dropNotifyRoles,
        LegacyStringList closeRuleSets,
        LegacyStringList promoteRuleSets,
        String promotionTargetRepository,
        String mode,
        boolean finishNotifyCreator,
        boolean promotionNotifyCreator,
        boolean dropNotifyCreator,
        boolean autoStagingDisabled,
        boolean repositoriesSearchable,
        Properties properties) {

    public static StagingProfile forNamespace(String baseUrl, String namespace, String resourceUri) {
        return new StagingProfile(
                resourceUri,
                namespace,
                namespace,
                "maven2",
                "default_hosted_release",
                "repository_target_id",
                false,
                12345,
                baseUrl + "/service/local/staging/deploy/maven2",
                LegacyStringList.of("staging"),
                LegacyStringList.of(namespace + "-deployer"),
                LegacyStringList.of(),
                LegacyStringList.of(),
                LegacyStringList.of("close_rule_set"),
                LegacyStringList.of(),
                "releases",
                "BOTH",
                true,
                true,
                true,
                false,
                false,
                new Properties());
    }

    /**
     * Always empty; rendered as {@code <properties class="linked-hash-map"/>} or
     * {@code {"@class": "linked-hash-map"}}.
     */
    public static final class Properties {
        @JsonProperty("@class")
        @JacksonXmlProperty(isAttribute = true, localName = "class")
        public final String type = "linked-hash-map";
    }
}
