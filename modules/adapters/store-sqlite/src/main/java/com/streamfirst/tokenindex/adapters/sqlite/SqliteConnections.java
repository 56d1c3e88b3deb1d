package com.streamfirst.tokenindex.adapters.sqlite;

import com.streamfirst.tokenindex.domain.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hands every thread its own connection to one SQLite database file.
 *
 * <p>A connection is opened on first use by a thread and is never shared with another thread.
 * Connections run in WAL mode so readers do not block the single writer. {@link #close()} closes
 * every connection opened so far; a thread that asks again afterwards gets a fresh one.
 *
 * <p>Databases owned by another program are opened with {@code walMode} off so their journal mode
 * is left as found.
 */
@Slf4j
public class SqliteConnections implements AutoCloseable {

  private static final int BUSY_TIMEOUT_MS = 10_000;

  private final Path database;
  private final String url;
  private final boolean walMode;
  private final ThreadLocal<Connection> perThread = new ThreadLocal<>();
  private final List<Connection> opened = new ArrayList<>();

  public SqliteConnections(Path database) {
    this(database, true);
  }

  public SqliteConnections(Path database, boolean walMode) {
    this.database = Objects.requireNonNull(database, "database");
    this.url = "jdbc:sqlite:" + database.toAbsolutePath();
    this.walMode = walMode;
  }

  public Path getDatabase() {
    return database;
  }

  /**
   * The calling thread's connection, opened on first use.
   *
   * @throws PersistenceException if the database cannot be opened
   */
  public Connection get() {
    Connection con = perThread.get();
    try {
      if (con == null || con.isClosed()) {
        con = open();
        perThread.set(con);
      }
      return con;
    } catch (SQLException sqx) {
      throw new PersistenceException("on opening " + database + " -- " + sqx, sqx);
    }
  }

  /**
   * Runs {@code work} in one transaction on the calling thread's connection. The transaction is
   * rolled back if the work throws.
   *
   * @throws PersistenceException wrapping any {@link SQLException}
   */
  public <T> T inTransaction(String operation, SqlWork<T> work) {
    Connection con = get();
    try {
      con.setAutoCommit(false);
      T result = work.apply(con);
      con.commit();
      return result;
    } catch (SQLException sqx) {
      String msg = "on " + operation;
      if (!rollback(con)) {
        msg += " (rollback failed!)";
      }
      throw new PersistenceException(msg + " -- " + sqx, sqx);
    } catch (RuntimeException e) {
      rollback(con);
      throw e;
    } finally {
      try {
        con.setAutoCommit(true);
      } catch (SQLException sqx) {
        log.warn("Could not restore auto-commit on {}", database, sqx);
      }
    }
  }

  /**
   * Runs a read on the calling thread's connection.
   *
   * @throws PersistenceException wrapping any {@link SQLException}
   */
  public <T> T read(String operation, SqlWork<T> work) {
    try {
      return work.apply(get());
    } catch (SQLException sqx) {
      throw new PersistenceException("on " + operation + " -- " + sqx, sqx);
    }
  }

  /** Number of connections opened so far. */
  public synchronized int openedCount() {
    return opened.size();
  }

  @Override
  public synchronized void close() {
    for (Connection con : opened) {
      try {
        con.close();
      } catch (SQLException sqx) {
        log.warn("Failed to close connection to {}", database, sqx);
      }
    }
    log.debug("Closed {} connection(s) to {}", opened.size(), database);
    opened.clear();
  }

  private Connection open() throws SQLException {
    Path parent = database.toAbsolutePath().getParent();
    if (parent != null) {
      try {
        Files.createDirectories(parent);
      } catch (IOException e) {
        throw new PersistenceException("Cannot create directory " + parent, e);
      }
    }
    Connection con = DriverManager.getConnection(url);
    try (Statement stmt = con.createStatement()) {
      if (walMode) {
        stmt.execute("PRAGMA journal_mode=WAL");
        stmt.execute("PRAGMA synchronous=NORMAL");
      }
      stmt.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
    }
    synchronized (this) {
      opened.add(con);
    }
    log.debug("Opened connection to {} for thread {}", database, Thread.currentThread().getName());
    return con;
  }

  private boolean rollback(Connection con) {
    try {
      con.rollback();
      return true;
    } catch (SQLException sqx) {
      log.warn("Rollback failed on {}", database, sqx);
      return false;
    }
  }

  /** A unit of JDBC work. */
  @FunctionalInterface
  public interface SqlWork<T> {
    T apply(Connection con) throws SQLException;
  }
}
