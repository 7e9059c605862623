package ai.pipestream.staging.util;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks test fields that {@link WireMockTestResource} fills in: the
 * {@code WireMockServer} and the {@code KeyPair} that signs assertions.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface InjectGatewayMocks {
}
