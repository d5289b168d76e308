package turnstile.jdbc;

import turnstile.events.BuildEvent;
import turnstile.jdbc.spi.Dialect;
import turnstile.spi.BuildEventStore;

import java.sql.Connection;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@link BuildEventStore} over one shared events table keyed by {@code (build_id, sequence_id)}
 * and one counter table holding a {@code next_sequence} per active build.
 */
public final class JdbcBuildEventStore implements BuildEventStore {

  private static final JdbcTemplate.RowMapper<BuildEvent> EVENT_ROW_MAPPER = rs -> new BuildEvent(
      rs.getLong("build_id"),
      rs.getLong("sequence_id"),
      rs.getString("event_type"),
      rs.getString("event_version"),
      rs.getString("payload"));

  private final Dialect dialect;
  private final String eventTable;
  private final String sequenceTable;

  public JdbcBuildEventStore(Dialect dialect) {
    this(dialect, TableNames.DEFAULT_EVENT_TABLE, TableNames.DEFAULT_SEQUENCE_TABLE);
  }

  public JdbcBuildEventStore(Dialect dialect, String eventTable, String sequenceTable) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.eventTable = TableNames.validate(eventTable);
    this.sequenceTable = TableNames.validate(sequenceTable);
  }

  @Override
  public void initialize(Connection conn, long buildId) {
    if (isFinished(conn, buildId)) {
      throw new IllegalStateException("Build " + buildId + " has already finished");
    }
    dialect.initializeSequence(conn, sequenceTable, eventTable, buildId);
  }

  @Override
  public long nextSequence(Connection conn, long buildId) {
    long sequence = dialect.nextSequence(conn, sequenceTable, buildId);
    if (sequence < 0) {
      throw new IllegalStateException("Build " + buildId + " has no event sequence; "
          + "it was never initialized or has already finished");
    }
    return sequence;
  }

  @Override
  public void insert(Connection conn, BuildEvent event) {
    String sql = "INSERT INTO " + eventTable +
        " (build_id, sequence_id, event_type, event_version, payload) VALUES (?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        event.buildId(), event.sequence(), event.type(), event.version(), event.payload());
  }

  @Override
  public List<BuildEvent> eventsSince(Connection conn, long buildId, long fromSequence, int limit) {
    String sql = "SELECT build_id, sequence_id, event_type, event_version, payload FROM " + eventTable +
        " WHERE build_id = ? AND sequence_id >= ? ORDER BY sequence_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, buildId, fromSequence, limit);
  }

  @Override
  public boolean isFinished(Connection conn, long buildId) {
    long counters = JdbcTemplate.queryOne(conn,
        "SELECT COUNT(*) FROM " + sequenceTable + " WHERE build_id = ?",
        rs -> rs.getLong(1), buildId);
    if (counters > 0) {
      return false;
    }
    return !JdbcTemplate.query(conn,
        "SELECT sequence_id FROM " + eventTable + " WHERE build_id = ? LIMIT 1",
        rs -> rs.getLong(1), buildId).isEmpty();
  }

  @Override
  public void finalizeSequence(Connection conn, long buildId) {
    JdbcTemplate.update(conn, "DELETE FROM " + sequenceTable + " WHERE build_id = ?", buildId);
  }

  @Override
  public int delete(Connection conn, Collection<Long> buildIds) {
    if (buildIds.isEmpty()) {
      return 0;
    }
    String placeholders = String.join(",", Collections.nCopies(buildIds.size(), "?"));
    Object[] params = buildIds.toArray();
    JdbcTemplate.update(conn, "DELETE FROM " + sequenceTable + " WHERE build_id IN (" + placeholders + ")", params);
    return JdbcTemplate.update(conn, "DELETE FROM " + eventTable + " WHERE build_id IN (" + placeholders + ")", params);
  }
}
