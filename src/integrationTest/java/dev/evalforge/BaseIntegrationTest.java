package dev.evalforge;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance shared by every subclass; Flyway
 * migrates it when the first application context starts.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }
}
