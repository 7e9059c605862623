package ai.pipestream.staging.publish;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PublishingTypeTest {

    @Test
    void testAutomaticIsCaseInsensitive() {
        assertEquals(PublishingType.AUTOMATIC, PublishingType.fromParameter("automatic"));
        assertEquals(PublishingType.AUTOMATIC, PublishingType.fromParameter("AUTOMATIC"));
        assertEquals(PublishingType.AUTOMATIC, PublishingType.fromParameter("Automatic"));
    }

    @Test
    void testEverythingElseIsUserManaged() {
        assertEquals(PublishingType.USER_MANAGED, PublishingType.fromParameter(null));
        assertEquals(PublishingType.USER_MANAGED, PublishingType.fromParameter(""));
        assertEquals(PublishingType.USER_MANAGED, PublishingType.fromParameter("user_managed"));
        assertEquals(PublishingType.USER_MANAGED, PublishingType.fromParameter("auto"));
    }
}
