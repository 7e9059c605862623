package ai.pipestream.staging.repository;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryStateTest {

    @Test
    void testTokensRoundTrip() {
        for (RepositoryState state : RepositoryState.values()) {
            assertEquals(state, RepositoryState.fromToken(state.token()));
        }
        assertEquals("not_found", RepositoryState.NOT_FOUND.token());
        assertEquals(RepositoryState.CLOSED, RepositoryState.fromToken("closed\n"));
    }

    @Test
    void testUnknownTokensFail() {
        assertThrows(IllegalArgumentException.class, () -> RepositoryState.fromToken("OPEN"));
        assertThrows(IllegalArgumentException.class, () -> RepositoryState.fromToken("dropped"));
        assertThrows(IllegalArgumentException.class, () -> RepositoryState.fromToken(null));
    }
}
