package ca.gc.cra.feedback.infrastructure.persistence.jdbc;

import ca.gc.cra.feedback.application.port.RawStore;
import ca.gc.cra.feedback.application.port.StorageException;
import ca.gc.cra.feedback.domain.feedback.FeedbackEvent;
import ca.gc.cra.feedback.domain.feedback.RawFeedbackRecord;
import ca.gc.cra.feedback.validation.Strings;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Transactional, idempotent {@link RawStore} over a JDBC table keyed by
 * {@code feedback_id}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Update the existing row, or insert when none exists, inside one transaction.</li>
 *   <li>Retry the update once when a concurrent insert of the same key wins the race.</li>
 *   <li>Roll back and raise {@link StorageException} on any SQL failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call borrows its own connection from the {@link DataSource}.</p>
 *
 * @since 0.1.0
 */
public final class JdbcRawStore implements RawStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcRawStore.class);
  public static final String DEFAULT_TABLE = "raw_feedback";
  /** SQLState for a unique or primary key violation (PostgreSQL and H2). */
  private static final String UNIQUE_VIOLATION = "23505";

  private final DataSource dataSource;
  private final String updateSql;
  private final String insertSql;

  public JdbcRawStore(DataSource dataSource) {
    this(dataSource, DEFAULT_TABLE);
  }

  public JdbcRawStore(DataSource dataSource, String table) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    String name = Strings.requireTableName("table", table);
    this.updateSql = "UPDATE " + name
        + " SET user_id = ?, event_timestamp = ?, comment = ?, received_at = ? WHERE feedback_id = ?";
    this.insertSql = "INSERT INTO " + name
        + " (feedback_id, user_id, event_timestamp, comment, received_at) VALUES (?, ?, ?, ?, ?)";
  }

  @Override
  public void upsert(RawFeedbackRecord record) throws StorageException {
    Objects.requireNonNull(record, "record");
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      try {
        if (update(connection, record) == 0) {
          try {
            insert(connection, record);
          } catch (SQLException ex) {
            if (!isUniqueViolation(ex)) {
              throw ex;
            }
            // Another delivery of the same event inserted first.
            connection.rollback();
            log.debug("Concurrent insert for {}; retrying as update", record.feedbackId());
            if (update(connection, record) == 0) {
              throw new SQLException("Row for " + record.feedbackId() + " vanished after unique violation", ex);
            }
          }
        }
        connection.commit();
      } catch (SQLException ex) {
        rollbackQuietly(connection, ex);
        throw ex;
      }
    } catch (SQLException ex) {
      throw new StorageException("Raw upsert failed for " + record.feedbackId(), ex);
    }
  }

  private int update(Connection connection, RawFeedbackRecord record) throws SQLException {
    FeedbackEvent event = record.event();
    try (PreparedStatement ps = connection.prepareStatement(updateSql)) {
      ps.setString(1, event.userId());
      ps.setString(2, event.timestamp());
      ps.setString(3, event.comment());
      ps.setObject(4, OffsetDateTime.ofInstant(record.receivedAt(), ZoneOffset.UTC));
      ps.setString(5, event.feedbackId());
      return ps.executeUpdate();
    }
  }

  private void insert(Connection connection, RawFeedbackRecord record) throws SQLException {
    FeedbackEvent event = record.event();
    try (PreparedStatement ps = connection.prepareStatement(insertSql)) {
      ps.setString(1, event.feedbackId());
      ps.setString(2, event.userId());
      ps.setString(3, event.timestamp());
      ps.setString(4, event.comment());
      ps.setObject(5, OffsetDateTime.ofInstant(record.receivedAt(), ZoneOffset.UTC));
      ps.executeUpdate();
    }
  }

  static boolean isUniqueViolation(SQLException ex) {
    return UNIQUE_VIOLATION.equals(ex.getSQLState());
  }

  private static void rollbackQuietly(Connection connection, SQLException primary) {
    try {
      connection.rollback();
    } catch (SQLException rollbackFailure) {
      primary.addSuppressed(rollbackFailure);
    }
  }
}
