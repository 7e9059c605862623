package ai.pipestream.staging.health;

import ai.pipestream.staging.repository.LocalStagingRepository;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StagingAreaHealthCheckTest {

    @Mock
    private LocalStagingRepository mockRepository;

    @TempDir
    Path tempDir;

    private StagingAreaHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        healthCheck = new StagingAreaHealthCheck();
        healthCheck.repository = mockRepository;
    }

    @Test
    void testUpWhenRootIsWritable() {
        when(mockRepository.root()).thenReturn(tempDir);

        HealthCheckResponse response = healthCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("staging-gateway");
    }

    @Test
    void testDownWhenRootIsMissing() {
        when(mockRepository.root()).thenReturn(tempDir.resolve("gone"));

        HealthCheckResponse response = healthCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsEntry("writable", false));
    }
}
