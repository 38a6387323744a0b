package dev.pulse.scheduler.utils;

import dev.pulse.scheduler.config.PulseConfig;
import dev.pulse.scheduler.database.PostgresJobTable;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public class DbSetupTestBase {

  protected static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:16-alpine");

  protected static PulseConfig pulseConfig;
  protected static HikariDataSource dataSource;

  @BeforeAll
  static void onetimeSetup() {
    postgres.start();
    pulseConfig =
        PulseConfig.defaults()
            .withDatabaseUrl(postgres.getJdbcUrl())
            .withDbUser(postgres.getUsername())
            .withDbPassword(postgres.getPassword())
            .withMaximumPoolSize(2);
    dataSource = PostgresJobTable.createDataSource(pulseConfig);
  }

  @AfterAll
  static void afterAll() {
    if (dataSource != null) {
      dataSource.close();
    }
    postgres.stop();
  }
}
