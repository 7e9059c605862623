package ai.pipestream.staging.util;

import io.smallrye.jwt.build.Jwt;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Base64;
import java.util.List;

/**
 * RSA key material and signed identity assertions for tests.
 */
public final class TestAssertions {

    public static final String ISSUER = "user-service";
    public static final String AUDIENCE = "ossrh-proxy";

    private TestAssertions() {
    }

    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Path writePem(PublicKey publicKey, Path file) throws IOException {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(publicKey.getEncoded());
        Files.writeString(file, "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n",
                StandardCharsets.US_ASCII);
        return file;
    }

    public static String sign(PrivateKey key, String issuer, String audience, String userId, String nameCode,
                              List<String> namespaces) {
        return Jwt.issuer(issuer)
                .audience(audience)
                .claim("userId", userId)
                .claim("nameCode", nameCode)
                .claim("namespaces", namespaces)
                .expiresIn(300)
                .sign(key);
    }

    public static String sign(PrivateKey key, String userId, String nameCode, List<String> namespaces) {
        return sign(key, ISSUER, AUDIENCE, userId, nameCode, namespaces);
    }
}
