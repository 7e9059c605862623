package ai.pipestream.staging.auth;

import ai.pipestream.staging.exception.AuthenticationException;
import ai.pipestream.staging.exception.AuthenticationException.Reason;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * The long-lived {@code username:password} token legacy clients send.
 */
public record LegacyUserToken(String username, String password) {

    /**
     * Decode a base64 {@code username:password} token, splitting on the first colon.
     *
     * @throws AuthenticationException with reason BASE64, UTF8 or MALFORMED
     */
    public static LegacyUserToken decode(String encoded) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded == null ? "" : encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException(Reason.BASE64, "Token is not valid base64", e);
        }
        String decoded;
        try {
            decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new AuthenticationException(Reason.UTF8, "Token is not valid UTF-8", e);
        }
        int separator = decoded.indexOf(':');
        if (separator < 0) {
            throw new AuthenticationException(Reason.MALFORMED, "Token has no ':' separator");
        }
        return new LegacyUserToken(decoded.substring(0, separator), decoded.substring(separator + 1));
    }

    public String encoded() {
        return Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "LegacyUserToken{username=" + username + "}";
    }
}
