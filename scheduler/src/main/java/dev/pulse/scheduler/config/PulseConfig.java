package dev.pulse.scheduler.config;

import dev.pulse.scheduler.Constants;

import java.nio.file.Path;
import java.util.Objects;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Settings for a {@link dev.pulse.scheduler.Pulse} instance: where the job table lives, which
 * broker and exchange jobs are published to, and where the HTTP front end listens.
 *
 * <p>Build one from {@link #defaults()}, {@link #defaultsFromEnv()} or a HOCON file via {@link
 * #fromFile(Path)}, then refine it with the {@code withX} methods.
 */
public record PulseConfig(
    String databaseUrl,
    String dbUser,
    String dbPassword,
    int maximumPoolSize,
    int connectionTimeout,
    HikariDataSource dataSource,
    String databaseSchema,
    boolean migrate,
    String brokerUri,
    String exchange,
    boolean httpServer,
    String httpHost,
    int httpPort,
    int maxConcurrentPublishes) {

  public PulseConfig {
    if (maximumPoolSize < 1) {
      throw new IllegalArgumentException("PulseConfig.maximumPoolSize must be at least 1");
    }
    if (httpPort < 0 || httpPort > 65535) {
      throw new IllegalArgumentException("PulseConfig.httpPort must be between 0 and 65535");
    }
    if (maxConcurrentPublishes < 1) {
      throw new IllegalArgumentException("PulseConfig.maxConcurrentPublishes must be at least 1");
    }
    if (databaseUrl != null && databaseUrl.isEmpty()) {
      throw new IllegalArgumentException("PulseConfig.databaseUrl must not be empty if specified");
    }
    Objects.requireNonNull(exchange, "PulseConfig.exchange must not be null");
    Objects.requireNonNull(brokerUri, "PulseConfig.brokerUri must not be null");
  }

  public static PulseConfig defaults() {
    return new PulseConfig(
        null, "postgres", null, 4, // maximumPoolSize default
        30000, // connectionTimeout default
        null,
        Constants.DB_SCHEMA,
        true, // migrate
        Constants.DEFAULT_AMQP_URI,
        Constants.DEFAULT_EXCHANGE,
        true, // httpServer
        Constants.DEFAULT_HTTP_HOST,
        Constants.DEFAULT_HTTP_PORT,
        Constants.DEFAULT_MAX_CONCURRENT_PUBLISHES);
  }

  public static PulseConfig defaultsFromEnv() {
    var config = defaults();
    String databaseUrl = System.getenv(Constants.JDBC_URL_ENV_VAR);
    if (databaseUrl != null && !databaseUrl.isEmpty()) {
      config = config.withDatabaseUrl(databaseUrl);
    }
    String dbUser = System.getenv(Constants.POSTGRES_USER_ENV_VAR);
    if (dbUser != null && !dbUser.isEmpty()) {
      config = config.withDbUser(dbUser);
    }
    String dbPassword = System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR);
    if (dbPassword != null) {
      config = config.withDbPassword(dbPassword);
    }
    String brokerUri = System.getenv(Constants.AMQP_URI_ENV_VAR);
    if (brokerUri != null && !brokerUri.isEmpty()) {
      config = config.withBrokerUri(brokerUri);
    }
    return config;
  }

  /** Load a HOCON file, falling back to {@link #defaultsFromEnv()} for anything it omits. */
  public static PulseConfig fromFile(Path path) {
    Objects.requireNonNull(path, "config path must not be null");
    if (!path.toFile().isFile()) {
      throw new IllegalArgumentException("Config file %s does not exist".formatted(path));
    }
    return fromConfig(ConfigFactory.parseFile(path.toFile()).resolve());
  }

  /** Overlay the {@code pulse} section of {@code config} on {@link #defaultsFromEnv()}. */
  public static PulseConfig fromConfig(Config config) {
    var result = defaultsFromEnv();
    if (!config.hasPath("pulse")) {
      return result;
    }
    var pulse = config.getConfig("pulse");

    if (pulse.hasPath("database")) {
      var db = pulse.getConfig("database");
      if (db.hasPath("url")) result = result.withDatabaseUrl(db.getString("url"));
      if (db.hasPath("user")) result = result.withDbUser(db.getString("user"));
      if (db.hasPath("password")) result = result.withDbPassword(db.getString("password"));
      if (db.hasPath("pool-size")) result = result.withMaximumPoolSize(db.getInt("pool-size"));
      if (db.hasPath("connection-timeout"))
        result = result.withConnectionTimeout(db.getInt("connection-timeout"));
      if (db.hasPath("schema")) result = result.withDatabaseSchema(db.getString("schema"));
      if (db.hasPath("migrate")) result = result.withMigrate(db.getBoolean("migrate"));
    }

    if (pulse.hasPath("broker")) {
      var broker = pulse.getConfig("broker");
      if (broker.hasPath("uri")) result = result.withBrokerUri(broker.getString("uri"));
      if (broker.hasPath("exchange")) result = result.withExchange(broker.getString("exchange"));
    }

    if (pulse.hasPath("http")) {
      var http = pulse.getConfig("http");
      if (http.hasPath("enabled")) result = result.withHttpServer(http.getBoolean("enabled"));
      if (http.hasPath("host")) result = result.withHttpHost(http.getString("host"));
      if (http.hasPath("port")) result = result.withHttpPort(http.getInt("port"));
    }

    if (pulse.hasPath("scheduler.max-concurrent-publishes")) {
      result =
          result.withMaxConcurrentPublishes(
              pulse.getInt("scheduler.max-concurrent-publishes"));
    }

    return result;
  }

  public PulseConfig withDatabaseUrl(String v) {
    return new PulseConfig(
        v,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withDbUser(String v) {
    return new PulseConfig(
        databaseUrl,
        v,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withDbPassword(String v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        v,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withMaximumPoolSize(int v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        v,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withConnectionTimeout(int v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        v,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withDataSource(HikariDataSource v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        v,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withDatabaseSchema(String v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        v,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withMigrate(boolean v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        v,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withBrokerUri(String v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        v,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withExchange(String v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        v,
        httpServer,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withHttpServer(boolean v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        v,
        httpHost,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withHttpHost(String v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        v,
        httpPort,
        maxConcurrentPublishes);
  }

  public PulseConfig withHttpPort(int v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        v,
        maxConcurrentPublishes);
  }

  public PulseConfig withMaxConcurrentPublishes(int v) {
    return new PulseConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        brokerUri,
        exchange,
        httpServer,
        httpHost,
        httpPort,
        v);
  }

  @Override
  public String toString() {
    return "PulseConfig[databaseUrl=%s, dbUser=%s, dbPassword=%s, maximumPoolSize=%d, connectionTimeout=%d, databaseSchema=%s, migrate=%s, brokerUri=%s, exchange=%s, httpServer=%s, httpHost=%s, httpPort=%d, maxConcurrentPublishes=%d]"
        .formatted(
            databaseUrl,
            dbUser,
            dbPassword == null ? null : "***",
            maximumPoolSize,
            connectionTimeout,
            databaseSchema,
            migrate,
            brokerUri.replaceAll("//([^:/@]+):[^@]*@", "//$1:***@"),
            exchange,
            httpServer,
            httpHost,
            httpPort,
            maxConcurrentPublishes);
  }
}
