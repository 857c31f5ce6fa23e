package ca.gc.cra.feedback.infrastructure.persistence.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.postgresql.ds.PGSimpleDataSource;

/**
 * Builds the pooled PostgreSQL data source shared by the JDBC stores.
 */
public final class DataSources {
  static final String POOL_NAME = "feedback-jdbc";
  private static final int CONNECT_TIMEOUT_SECONDS = 10;
  private static final int SOCKET_TIMEOUT_SECONDS = 60;

  private DataSources() {}

  /**
   * Creates a connection pool for a {@code jdbc:postgresql://} URL.
   *
   * <p>The pool starts on the first {@code getConnection()}; construction never touches the network.
   * Each worker holds at most one connection at a time, so {@code maxPoolSize} is normally the worker
   * count.</p>
   *
   * @param jdbcUrl connection URL
   * @param user user name; may be blank when the URL carries credentials
   * @param password password; may be blank
   * @param maxPoolSize upper bound on open connections; must be positive
   * @return unstarted pool; the caller closes it
   */
  public static HikariDataSource postgres(String jdbcUrl, String user, String password, int maxPoolSize) {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    if (!jdbcUrl.startsWith("jdbc:postgresql:")) {
      throw new IllegalArgumentException("jdbcUrl must start with jdbc:postgresql:");
    }
    if (maxPoolSize <= 0) {
      throw new IllegalArgumentException("maxPoolSize must be positive (was " + maxPoolSize + ")");
    }
    PGSimpleDataSource driver = new PGSimpleDataSource();
    driver.setURL(jdbcUrl);
    if (user != null && !user.isBlank()) {
      driver.setUser(user);
    }
    if (password != null && !password.isEmpty()) {
      driver.setPassword(password);
    }
    driver.setConnectTimeout(CONNECT_TIMEOUT_SECONDS);
    driver.setSocketTimeout(SOCKET_TIMEOUT_SECONDS);
    driver.setApplicationName("feedback-pipeline");

    HikariDataSource pool = new HikariDataSource();
    pool.setPoolName(POOL_NAME);
    pool.setDataSource(driver);
    pool.setMaximumPoolSize(maxPoolSize);
    pool.setMinimumIdle(1);
    pool.setConnectionTimeout(TimeUnit.SECONDS.toMillis(CONNECT_TIMEOUT_SECONDS));
    // Report an unreachable database as an SQLException from getConnection().
    pool.setInitializationFailTimeout(-1);
    return pool;
  }
}
