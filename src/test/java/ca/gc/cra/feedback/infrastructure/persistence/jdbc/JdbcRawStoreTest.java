package ca.gc.cra.feedback.infrastructure.persistence.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.feedback.application.port.StorageException;
import ca.gc.cra.feedback.domain.feedback.FeedbackEvent;
import ca.gc.cra.feedback.domain.feedback.RawFeedbackRecord;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcRawStoreTest {
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:raw-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    execute("""
        CREATE TABLE raw_feedback (
          feedback_id VARCHAR(64) PRIMARY KEY,
          user_id VARCHAR(16),
          event_timestamp VARCHAR(64),
          comment VARCHAR(4000) NOT NULL,
          received_at TIMESTAMP WITH TIME ZONE NOT NULL)
        """);
  }

  @Test
  void insertsNewRow() throws Exception {
    JdbcRawStore store = new JdbcRawStore(dataSource);
    Instant receivedAt = Instant.parse("2024-05-01T12:00:00Z");

    store.upsert(record("fb-1", "u-1", "The app is slow", receivedAt));

    try (Connection connection = dataSource.getConnection();
        Statement st = connection.createStatement();
        ResultSet rs = st.executeQuery("SELECT * FROM raw_feedback WHERE feedback_id = 'fb-1'")) {
      assertTrue(rs.next());
      assertEquals("u-1", rs.getString("user_id"));
      assertEquals("2024-05-01T10:00:00Z", rs.getString("event_timestamp"));
      assertEquals("The app is slow", rs.getString("comment"));
      assertEquals(receivedAt, rs.getObject("received_at", OffsetDateTime.class).toInstant());
    }
  }

  @Test
  void redeliveryOverwritesInsteadOfDuplicating() throws Exception {
    JdbcRawStore store = new JdbcRawStore(dataSource, "raw_feedback");

    store.upsert(record("fb-2", "u-1", "first", Instant.parse("2024-05-01T12:00:00Z")));
    store.upsert(record("fb-2", "u-1", "second", Instant.parse("2024-05-01T12:05:00Z")));

    assertEquals(1, count("SELECT COUNT(*) FROM raw_feedback"));
    assertEquals(1, count("SELECT COUNT(*) FROM raw_feedback WHERE comment = 'second'"));
  }

  @Test
  void failedInsertLeavesNoRow() {
    JdbcRawStore store = new JdbcRawStore(dataSource);

    StorageException ex = assertThrows(StorageException.class,
        () -> store.upsert(record("fb-3", "a-user-id-that-is-far-too-long", "hello", Instant.EPOCH)));

    assertTrue(ex.getMessage().contains("fb-3"));
    assertEquals(0, count("SELECT COUNT(*) FROM raw_feedback"));
  }

  @Test
  void missingTableSurfacesAsStorageException() {
    JdbcRawStore store = new JdbcRawStore(dataSource, "no_such_table");
    assertThrows(StorageException.class, () -> store.upsert(record("fb-4", "u", "hi", Instant.EPOCH)));
  }

  @Test
  void rejectsUnsafeTableNames() {
    assertThrows(IllegalArgumentException.class, () -> new JdbcRawStore(dataSource, "raw; DROP TABLE x"));
  }

  @Test
  void classifiesUniqueViolationsBySqlState() {
    assertTrue(JdbcRawStore.isUniqueViolation(new SQLException("duplicate key", "23505")));
    assertFalse(JdbcRawStore.isUniqueViolation(new SQLException("null not allowed", "23502")));
    assertFalse(JdbcRawStore.isUniqueViolation(new SQLException("check violated", "23514")));
    assertFalse(JdbcRawStore.isUniqueViolation(new SQLException("missing table", "42P01")));
    assertFalse(JdbcRawStore.isUniqueViolation(new SQLException("no state")));
  }

  @Test
  void lostInsertRaceIsRetriedAsUpdate() throws Exception {
    AtomicInteger competingInserts = new AtomicInteger();
    JdbcRawStore store = new JdbcRawStore(racingDataSource(competingInserts));

    store.upsert(record("fb-5", "u-1", "mine", Instant.parse("2024-05-01T12:00:00Z")));

    assertEquals(1, competingInserts.get());
    assertEquals(1, count("SELECT COUNT(*) FROM raw_feedback"));
    assertEquals(1, count("SELECT COUNT(*) FROM raw_feedback WHERE feedback_id = 'fb-5' AND comment = 'mine'"));
  }

  @Test
  void otherIntegrityViolationsFailWithoutRetry() throws Exception {
    execute("ALTER TABLE raw_feedback ADD COLUMN channel VARCHAR(16) NOT NULL");
    JdbcRawStore store = new JdbcRawStore(dataSource);

    StorageException ex = assertThrows(StorageException.class,
        () -> store.upsert(record("fb-6", "u-1", "hello", Instant.EPOCH)));

    SQLException cause = (SQLException) ex.getCause();
    assertEquals("23502", cause.getSQLState());
    assertFalse(cause.getMessage().contains("vanished"));
    assertEquals(0, count("SELECT COUNT(*) FROM raw_feedback"));
  }

  private static RawFeedbackRecord record(String id, String user, String comment, Instant receivedAt) {
    return new RawFeedbackRecord(new FeedbackEvent(id, user, "2024-05-01T10:00:00Z", comment), receivedAt);
  }

  /**
   * Wraps the H2 source so that a competing delivery commits the same key just before the store's
   * own insert runs.
   */
  private DataSource racingDataSource(AtomicInteger competingInserts) {
    InvocationHandler sourceHandler = (proxy, method, args) -> {
      if (!method.getName().equals("getConnection")) {
        return invoke(dataSource, method, args);
      }
      Connection real = (Connection) invoke(dataSource, method, args);
      InvocationHandler connectionHandler = (connProxy, connMethod, connArgs) -> {
        if (connMethod.getName().equals("prepareStatement")
            && ((String) connArgs[0]).startsWith("INSERT")
            && competingInserts.getAndIncrement() == 0) {
          execute("INSERT INTO raw_feedback (feedback_id, user_id, event_timestamp, comment, received_at) "
              + "VALUES ('fb-5', 'u-1', 'ts', 'theirs', TIMESTAMP WITH TIME ZONE '2024-05-01 11:59:00+00')");
        }
        return invoke(real, connMethod, connArgs);
      };
      return Proxy.newProxyInstance(
          getClass().getClassLoader(), new Class<?>[] {Connection.class}, connectionHandler);
    };
    return (DataSource) Proxy.newProxyInstance(
        getClass().getClassLoader(), new Class<?>[] {DataSource.class}, sourceHandler);
  }

  private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException ex) {
      throw ex.getCause();
    }
  }

  private void execute(String sql) throws SQLException {
    try (Connection connection = dataSource.getConnection(); Statement st = connection.createStatement()) {
      st.execute(sql);
    }
  }

  private int count(String sql) {
    try (Connection connection = dataSource.getConnection();
        Statement st = connection.createStatement();
        ResultSet rs = st.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    } catch (SQLException ex) {
      throw new AssertionError(ex);
    }
  }
}
