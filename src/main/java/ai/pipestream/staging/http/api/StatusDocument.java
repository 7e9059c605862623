package ai.pipestream.staging.http.api;

import ai.pipestream.staging.config.GatewayConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

@JacksonXmlRootElement(localName = "status")
public record StatusDocument(Data data) {

    private static final String EPOCH = "1970-01-01 00:00:00.000 UTC";

    @JsonPropertyOrder({"appName", "formattedAppName", "version", "apiVersion", "editionLong", "editionShort",
            "attributionsURL", "purchaseURL", "userLicenseURL", "state", "initializedAt", "startedAt",
            "lastConfigChange", "firstStart", "instanceUpgraded", "configurationUpgraded", "baseUrl",
            "licenseInstalled", "licenseExpired", "trialLicense"})
    public record Data(
            String appName,
            String formattedAppName,
            String version,
            String apiVersion,
            String editionLong,
            String editionShort,
            @JsonProperty("attributionsURL") String attributionsUrl,
            @JsonProperty("purchaseURL") String purchaseUrl,
            @JsonProperty("userLicenseURL") String userLicenseUrl,
            String state,
            String initializedAt,
            String startedAt,
            String lastConfigChange,
            boolean firstStart,
            boolean instanceUpgraded,
            boolean configurationUpgraded,
            String baseUrl,
            boolean licenseInstalled,
            boolean licenseExpired,
            boolean trialLicense) {
    }

    public static StatusDocument started(GatewayConfig.Legacy legacy, String baseUrl) {
        return new StatusDocument(new Data(
                legacy.appName(),
                legacy.appName(),
                legacy.version(),
                legacy.version(),
                legacy.editionLong(),
                legacy.editionShort(),
                "http://links.sonatype.com/products/nexus/pro/attributions",
                "http://links.sonatype.com/products/nexus/pro/store",
                "http://links.sonatype.com/products/nexus/pro/eula",
                "STARTED",
                EPOCH,
                EPOCH,
                EPOCH,
                false,
                false,
                false,
                baseUrl,
                true,
                false,
                false));
    }
}
