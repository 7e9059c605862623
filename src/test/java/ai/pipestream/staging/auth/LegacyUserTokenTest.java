package ai.pipestream.staging.auth;

import ai.pipestream.staging.exception.AuthenticationException;
import ai.pipestream.staging.exception.AuthenticationException.Reason;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class LegacyUserTokenTest {

    @Test
    void testDecodeSplitsOnFirstColon() {
        LegacyUserToken token = LegacyUserToken.decode(encode("alice:pa:ss"));

        assertEquals("alice", token.username());
        assertEquals("pa:ss", token.password());
    }

    @Test
    void testEncodedRoundTrip() {
        LegacyUserToken token = new LegacyUserToken("alice", "secret");

        assertEquals(encode("alice:secret"), token.encoded());
        assertEquals(token, LegacyUserToken.decode(token.encoded()));
    }

    @Test
    void testDecodeFailuresAreDistinct() {
        assertEquals(Reason.BASE64, reasonFor("not base64!"));
        assertEquals(Reason.UTF8, reasonFor(Base64.getEncoder().encodeToString(new byte[] {(byte) 0xff, ':', 'x'})));
        assertEquals(Reason.MALFORMED, reasonFor(encode("alice")));
    }

    @Test
    void testToStringHidesPassword() {
        assertFalse(new LegacyUserToken("alice", "secret").toString().contains("secret"));
    }

    private static Reason reasonFor(String encoded) {
        return assertThrows(AuthenticationException.class, () -> LegacyUserToken.decode(encoded)).getReason();
    }

    private static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
