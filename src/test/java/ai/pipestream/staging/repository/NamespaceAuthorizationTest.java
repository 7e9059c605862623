package ai.pipestream.staging.repository;

import ai.pipestream.staging.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamespaceAuthorizationTest {

    @Test
    void testChildNamespacesAreCovered() {
        NamespaceAuthorization authorization = NamespaceAuthorization.of(List.of("com.example"));

        assertTrue(authorization.covers("com.example"));
        assertTrue(authorization.covers("com.example.tools"));
        assertFalse(authorization.covers("com.examples"));
        assertFalse(authorization.covers("com"));
        assertFalse(authorization.covers(null));
    }

    @Test
    void testUnrestrictedCoversEverything() {
        NamespaceAuthorization authorization = NamespaceAuthorization.unrestricted();

        assertTrue(authorization.covers("anything"));
        authorization.requireFile("test", new RepositoryKey("u1", null, null, 0), "org/other/x.jar");
    }

    @Test
    void testRequireNamespaceThrows() {
        NamespaceAuthorization authorization = NamespaceAuthorization.of(List.of());

        assertThrows(InvalidRequestException.class, () -> authorization.requireNamespace("start", "com.example"));
    }
}
