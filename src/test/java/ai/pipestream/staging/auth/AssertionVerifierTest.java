package ai.pipestream.staging.auth;

import ai.pipestream.staging.exception.AuthenticationException;
import ai.pipestream.staging.util.TestAssertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssertionVerifierTest {

    private static KeyPair keyPair;
    private static AssertionVerifier verifier;

    @BeforeAll
    static void setUp() {
        keyPair = TestAssertions.generateKeyPair();
        verifier = new AssertionVerifier(keyPair.getPublic(), TestAssertions.ISSUER, TestAssertions.AUDIENCE,
                Duration.ofSeconds(30));
    }

    @Test
    void testValidAssertionYieldsIdentity() {
        String jwt = TestAssertions.sign(keyPair.getPrivate(), "user-42", "alice", List.of("com.example", "io.acme"));

        IdentityContext identity = verifier.verify(jwt);

        assertEquals("user-42", identity.userId());
        assertEquals("alice", identity.username());
        assertEquals(List.of("com.example", "io.acme"), identity.namespaces());
        assertTrue(identity.verified());
        assertEquals(new OutboundCredential.SignedAssertion(jwt), identity.credential());
    }

    @Test
    void testWrongIssuerIsRejected() {
        String jwt = TestAssertions.sign(keyPair.getPrivate(), "someone-else", TestAssertions.AUDIENCE,
                "user-42", "alice", List.of("com.example"));

        assertVerificationFails(jwt);
    }

    @Test
    void testWrongAudienceIsRejected() {
        String jwt = TestAssertions.sign(keyPair.getPrivate(), TestAssertions.ISSUER, "another-service",
                "user-42", "alice", List.of("com.example"));

        assertVerificationFails(jwt);
    }

    @Test
    void testForeignKeyIsRejected() {
        KeyPair other = TestAssertions.generateKeyPair();
        String jwt = TestAssertions.sign(other.getPrivate(), "user-42", "alice", List.of("com.example"));

        assertVerificationFails(jwt);
    }

    @Test
    void testGarbageIsRejected() {
        assertVerificationFails("a.b.c");
        assertVerificationFails("not-a-jwt");
    }

    @Test
    void testPublicKeyLoadsFromPem(@TempDir Path dir) throws Exception {
        Path pem = TestAssertions.writePem(keyPair.getPublic(), dir.resolve("identity.pem"));

        assertArrayEquals(keyPair.getPublic().getEncoded(), AssertionVerifier.loadPublicKey(pem).getEncoded());
    }

    private static void assertVerificationFails(String jwt) {
        AuthenticationException e = assertThrows(AuthenticationException.class, () -> verifier.verify(jwt));
        assertEquals(AuthenticationException.Reason.VERIFICATION_FAILED, e.getReason());
    }
}
