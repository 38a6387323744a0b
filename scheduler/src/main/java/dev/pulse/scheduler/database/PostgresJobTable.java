package dev.pulse.scheduler.database;

import dev.pulse.scheduler.Constants;
import dev.pulse.scheduler.config.PulseConfig;
import dev.pulse.scheduler.exceptions.PulseDatabaseException;
import dev.pulse.scheduler.job.Job;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link JobTable} stored in a PostgreSQL table. Every operation is a single statement, so
 * concurrent callers rely on row atomicity of the database rather than on application locks.
 */
public class PostgresJobTable implements JobTable, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(PostgresJobTable.class);

  public static String sanitizeSchema(String schema) {
    schema =
        Objects.requireNonNullElse(schema, Constants.DB_SCHEMA)
            .replace("\0", "")
            .replace("\"", "\"\"");
    return "\"%s\"".formatted(schema);
  }

  private final HikariDataSource dataSource;
  private final String schema;
  private final boolean ownsDataSource;

  public PostgresJobTable(PulseConfig config) {
    this(
        PostgresJobTable.createDataSource(config),
        Objects.requireNonNull(config).databaseSchema(),
        config.dataSource() == null);
  }

  public PostgresJobTable(HikariDataSource dataSource, String schema) {
    this(dataSource, schema, false);
  }

  private PostgresJobTable(HikariDataSource dataSource, String schema, boolean ownsDataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    this.schema = sanitizeSchema(schema);
    this.ownsDataSource = ownsDataSource;
  }

  @Override
  public void close() {
    if (ownsDataSource) {
      dataSource.close();
    }
  }

  /** Fails with {@link PulseDatabaseException} if the database cannot be reached. */
  public void ping() {
    try (var conn = dataSource.getConnection();
        var stmt = conn.createStatement()) {
      stmt.execute("SELECT 1");
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public Optional<Job> get(String routingKey, String body) {
    final var sql =
        """
          SELECT routing_key, body, interval_seconds, next_run, one_off
          FROM %s.jobs
          WHERE routing_key = ? AND body = ?
        """
            .formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, Objects.requireNonNull(routingKey, "routingKey must not be null"));
      stmt.setString(2, Objects.requireNonNull(body, "body must not be null"));
      try (var rs = stmt.executeQuery()) {
        return rs.next() ? Optional.of(jobFromRow(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public Job insert(Job job) {
    Objects.requireNonNull(job, "job must not be null");
    // the SET clause sees the pre-update row, so next_run is shifted by the old interval
    final var sql =
        """
          INSERT INTO %s.jobs AS j (routing_key, body, interval_seconds, next_run, one_off)
          VALUES (?, ?, ?, ?, ?)
          ON CONFLICT (routing_key, body)
          DO UPDATE SET
            next_run = j.next_run + (EXCLUDED.interval_seconds - j.interval_seconds) * INTERVAL '1 second',
            interval_seconds = EXCLUDED.interval_seconds,
            one_off = EXCLUDED.one_off
          RETURNING routing_key, body, interval_seconds, next_run, one_off
        """
            .formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, job.routingKey());
      stmt.setString(2, job.body());
      stmt.setInt(3, Math.toIntExact(job.intervalSeconds()));
      stmt.setObject(4, toTimestamp(job.nextRun()));
      stmt.setBoolean(5, job.oneOff());
      try (var rs = stmt.executeQuery()) {
        if (rs.next()) {
          var stored = jobFromRow(rs);
          logger.debug("Upserted job {} next run {}", stored.key(), stored.nextRun());
          return stored;
        }
        throw new PulseDatabaseException("Attempted to upsert job %s".formatted(job.key()));
      }
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public boolean updateNextRun(String routingKey, String body, Instant nextRun) {
    final var sql =
        """
          UPDATE %s.jobs SET next_run = ?
          WHERE routing_key = ? AND body = ?
        """
            .formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, toTimestamp(Objects.requireNonNull(nextRun, "nextRun must not be null")));
      stmt.setString(2, routingKey);
      stmt.setString(3, body);
      return stmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public boolean advance(Job current, Instant nextRun) {
    final var sql =
        """
          UPDATE %s.jobs SET next_run = ?
          WHERE routing_key = ? AND body = ?
            AND next_run = ? AND interval_seconds = ? AND one_off = ?
        """
            .formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, toTimestamp(Objects.requireNonNull(nextRun, "nextRun must not be null")));
      setCurrentRow(stmt, 2, current);
      return stmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public boolean delete(String routingKey, String body) {
    final var sql =
        """
          DELETE FROM %s.jobs
          WHERE routing_key = ? AND body = ?
        """
            .formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, routingKey);
      stmt.setString(2, body);
      return stmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public boolean deleteIfUnchanged(Job current) {
    final var sql =
        """
          DELETE FROM %s.jobs
          WHERE routing_key = ? AND body = ?
            AND next_run = ? AND interval_seconds = ? AND one_off = ?
        """
            .formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql)) {
      setCurrentRow(stmt, 1, current);
      return stmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public Optional<Job> earliest() {
    final var sql =
        """
          SELECT routing_key, body, interval_seconds, next_run, one_off
          FROM %s.jobs
          ORDER BY next_run ASC, routing_key ASC, body ASC
          LIMIT 1
        """
            .formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql);
        var rs = stmt.executeQuery()) {
      return rs.next() ? Optional.of(jobFromRow(rs)) : Optional.empty();
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  @Override
  public long count() {
    final var sql = "SELECT COUNT(*) FROM %s.jobs".formatted(this.schema);

    try (var conn = dataSource.getConnection();
        var stmt = conn.prepareStatement(sql);
        var rs = stmt.executeQuery()) {
      return rs.next() ? rs.getLong(1) : 0;
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  private static Job jobFromRow(ResultSet rs) throws SQLException {
    return new Job(
        rs.getString("routing_key"),
        rs.getString("body"),
        Duration.ofSeconds(rs.getInt("interval_seconds")),
        rs.getObject("next_run", OffsetDateTime.class).toInstant(),
        rs.getBoolean("one_off"));
  }

  // binds the five columns that identify an unchanged row, starting at parameter index
  private static void setCurrentRow(PreparedStatement stmt, int index, Job current)
      throws SQLException {
    Objects.requireNonNull(current, "current must not be null");
    stmt.setString(index, current.routingKey());
    stmt.setString(index + 1, current.body());
    stmt.setObject(index + 2, toTimestamp(current.nextRun()));
    stmt.setInt(index + 3, Math.toIntExact(current.intervalSeconds()));
    stmt.setBoolean(index + 4, current.oneOff());
  }

  private static OffsetDateTime toTimestamp(Instant instant) {
    return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  public static HikariDataSource createDataSource(String url, String user, String password) {
    return createDataSource(url, user, password, 0, 0);
  }

  public static HikariDataSource createDataSource(
      String url, String user, String password, int poolSize, int timeout) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(Objects.requireNonNull(url, "database url must not be null"));
    hikariConfig.setUsername(user);
    hikariConfig.setPassword(password);
    hikariConfig.setMaximumPoolSize(poolSize > 0 ? poolSize : 2);
    hikariConfig.setPoolName("pulse-jobs");
    if (timeout > 0) {
      hikariConfig.setConnectionTimeout(timeout);
    }

    return new HikariDataSource(hikariConfig);
  }

  public static HikariDataSource createDataSource(PulseConfig config) {
    if (config.dataSource() != null) {
      return config.dataSource();
    }

    return createDataSource(
        config.databaseUrl(),
        config.dbUser(),
        config.dbPassword(),
        config.maximumPoolSize(),
        config.connectionTimeout());
  }
}
