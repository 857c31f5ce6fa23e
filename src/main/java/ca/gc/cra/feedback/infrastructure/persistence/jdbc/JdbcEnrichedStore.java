package ca.gc.cra.feedback.infrastructure.persistence.jdbc;

import ca.gc.cra.feedback.application.port.EnrichedStore;
import ca.gc.cra.feedback.application.port.StorageException;
import ca.gc.cra.feedback.domain.feedback.EnrichedFeedbackRecord;
import ca.gc.cra.feedback.domain.feedback.Topic;
import ca.gc.cra.feedback.validation.Strings;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.sql.DataSource;

/**
 * Append-only {@link EnrichedStore} writing one analytical row per call through a JDBC batch.
 * Any rejected row fails the whole append. Topics are stored as an ordered comma-separated list.
 *
 * @since 0.1.0
 */
public final class JdbcEnrichedStore implements EnrichedStore {
  public static final String DEFAULT_TABLE = "feedback_analysis";

  private final DataSource dataSource;
  private final String insertSql;

  public JdbcEnrichedStore(DataSource dataSource) {
    this(dataSource, DEFAULT_TABLE);
  }

  public JdbcEnrichedStore(DataSource dataSource, String table) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.insertSql = "INSERT INTO " + Strings.requireTableName("table", table)
        + " (feedback_id, sentiment, topics, analyzed_at) VALUES (?, ?, ?, ?)";
  }

  @Override
  public void append(EnrichedFeedbackRecord record) throws StorageException {
    Objects.requireNonNull(record, "record");
    List<String> rowErrors = new ArrayList<>();
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(insertSql)) {
      ps.setString(1, record.feedbackId());
      ps.setString(2, record.result().sentiment().name());
      ps.setString(3, joinTopics(record.result().topics()));
      ps.setObject(4, OffsetDateTime.ofInstant(record.analyzedAt(), ZoneOffset.UTC));
      ps.addBatch();
      collectRowErrors(ps.executeBatch(), rowErrors);
    } catch (BatchUpdateException ex) {
      collectRowErrors(ex.getUpdateCounts(), rowErrors);
      if (rowErrors.isEmpty()) {
        rowErrors.add("row 0: " + ex.getMessage());
      }
      throw new StorageException(
          "Analysis insert rejected for " + record.feedbackId() + ": " + rowErrors, ex);
    } catch (SQLException ex) {
      throw new StorageException("Analysis insert failed for " + record.feedbackId(), ex);
    }
    if (!rowErrors.isEmpty()) {
      throw new StorageException("Analysis insert rejected for " + record.feedbackId() + ": " + rowErrors);
    }
  }

  static String joinTopics(List<Topic> topics) {
    return topics.stream().map(Topic::name).collect(Collectors.joining(","));
  }

  private static void collectRowErrors(int[] counts, List<String> rowErrors) {
    if (counts == null) {
      return;
    }
    for (int i = 0; i < counts.length; i++) {
      if (counts[i] == Statement.EXECUTE_FAILED) {
        rowErrors.add("row " + i + ": execute failed");
      }
    }
  }
}
