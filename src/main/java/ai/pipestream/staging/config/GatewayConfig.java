package ai.pipestream.staging.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the staging gateway.
 * All keys are namespaced under {@code gateway.*}.
 */
@ConfigMapping(prefix = "gateway")
public interface GatewayConfig {

    /**
     * Local staging area configuration.
     */
    Staging staging();

    /**
     * Downstream publishing service.
     */
    Central central();

    /**
     * Identity exchange and assertion verification.
     */
    Identity identity();

    Publish publish();

    /**
     * Values echoed back in legacy protocol documents.
     */
    Legacy legacy();

    interface Staging {
        /**
         * Root directory for staged repositories.
         * When absent a temporary directory is created and removed on shutdown.
         */
        Optional<String> root();
    }

    interface Central {
        @WithDefault("https://central.sonatype.com")
        String url();

        @WithDefault("/api/v1/publisher/upload")
        String uploadPath();
    }

    interface Identity {
        /**
         * Exchange legacy tokens for signed assertions and enforce namespace scoping.
         * When disabled the legacy token is forwarded as-is.
         * Default: true.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Absolute URL of the identity service token exchange endpoint.
         */
        Optional<String> exchangeUrl();

        /**
         * PEM file holding the RSA public key that signs assertions.
         */
        Optional<String> publicKeyLocation();

        @WithDefault("user-service")
        String issuer();

        @WithDefault("ossrh-proxy")
        String audience();

        /**
         * Tolerated clock difference when checking assertion expiry.
         * Default: 30 seconds.
         */
        @WithDefault("PT30S")
        Duration clockSkew();
    }

    interface Publish {
        /**
         * Appended in parentheses to the repository id to form the deployment name.
         */
        @WithDefault("via OSSRH API Proxy")
        String deploymentNameAnnotation();
    }

    interface Legacy {
        @WithDefault("Nexus Repository Manager")
        String appName();

        @WithDefault("2.15.1-02")
        String version();

        @WithDefault("Professional")
        String editionLong();

        @WithDefault("PRO")
        String editionShort();
    }
}
