package ai.pipestream.staging.auth;

import ai.pipestream.staging.exception.AuthenticationException;
import ai.pipestream.staging.exception.AuthenticationException.Reason;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.RsaKeyUtil;
import org.jose4j.lang.JoseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.time.Duration;
import java.util.List;

/**
 * Verifies RS256 identity assertions issued by the identity service.
 * <p>
 * Issuer and audience must match exactly. Expiry is enforced when the assertion carries one.
 * The claims {@code userId}, {@code nameCode} and {@code namespaces} are required.
 */
public class AssertionVerifier {

    private static final Logger LOG = Logger.getLogger(AssertionVerifier.class);

    static final String USER_ID_CLAIM = "userId";
    static final String NAME_CODE_CLAIM = "nameCode";
    static final String NAMESPACES_CLAIM = "namespaces";

    private final JwtConsumer consumer;

    public AssertionVerifier(PublicKey publicKey, String issuer, String audience, Duration clockSkew) {
        this.consumer = new JwtConsumerBuilder()
                .setVerificationKey(publicKey)
                .setExpectedIssuer(true, issuer)
                .setExpectedAudience(true, audience)
                .setAllowedClockSkewInSeconds((int) clockSkew.getSeconds())
                .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT,
                        AlgorithmIdentifiers.RSA_USING_SHA256)
                .build();
    }

    /**
     * Load an RSA public key from a PEM ({@code BEGIN PUBLIC KEY}) file.
     */
    public static PublicKey loadPublicKey(Path pemFile) {
        try {
            String pem = Files.readString(pemFile, StandardCharsets.UTF_8);
            PublicKey key = new RsaKeyUtil().fromPemEncoded(pem);
            LOG.debugf("Loaded assertion verification key from %s", pemFile);
            return key;
        } catch (IOException | JoseException | InvalidKeySpecException e) {
            throw new IllegalStateException("Unable to load assertion verification key from " + pemFile, e);
        }
    }

    public IdentityContext verify(String assertion) {
        try {
            JwtClaims claims = consumer.processToClaims(assertion);
            String userId = requiredString(claims, USER_ID_CLAIM);
            String nameCode = requiredString(claims, NAME_CODE_CLAIM);
            if (!claims.hasClaim(NAMESPACES_CLAIM)) {
                throw new AuthenticationException(Reason.VERIFICATION_FAILED, "Missing claim " + NAMESPACES_CLAIM);
            }
            List<String> namespaces = claims.getStringListClaimValue(NAMESPACES_CLAIM);
            LOG.debugf("Verified assertion for user %s (%s), namespaces=%s", userId, nameCode, namespaces);
            return IdentityContext.verified(userId, nameCode, namespaces, assertion);
        } catch (InvalidJwtException e) {
            throw new AuthenticationException(Reason.VERIFICATION_FAILED, "Assertion rejected: " + e.getMessage(), e);
        } catch (MalformedClaimException e) {
            throw new AuthenticationException(Reason.VERIFICATION_FAILED, "Malformed claim: " + e.getMessage(), e);
        }
    }

    private static String requiredString(JwtClaims claims, String name) throws MalformedClaimException {
        String value = claims.getStringClaimValue(name);
        if (value == null) {
            throw new AuthenticationException(Reason.VERIFICATION_FAILED, "Missing claim " + name);
        }
        return value;
    }
}
