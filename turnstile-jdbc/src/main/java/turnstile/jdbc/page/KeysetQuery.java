package turnstile.jdbc.page;

import turnstile.jdbc.JdbcTemplate;
import turnstile.jdbc.TableNames;
import turnstile.page.Page;
import turnstile.page.PageResult;
import turnstile.page.Pages;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.ToLongFunction;

/**
 * Keyset pagination over one table ordered by a numeric id column.
 *
 * <p>Rows are always returned newest first. Windows beginning at the older end of a
 * bound ({@code until}, {@code from}) are read ascending so the rows nearest the bound
 * are the ones kept, then reversed.
 *
 * <pre>{@code
 * KeysetQuery<Build> builds = KeysetQuery.<Build>builder()
 *     .table("builds")
 *     .idColumn("id")
 *     .columns("id", "status")
 *     .where("repo_id = ?", repoId)
 *     .mapper(rs -> new Build(rs.getLong("id"), rs.getString("status")))
 *     .idOf(Build::id)
 *     .build();
 *
 * PageResult<Build> page = builds.fetch(conn, Page.since(cursor, 25));
 * }</pre>
 *
 * @param <T> row type
 */
public final class KeysetQuery<T> {

  private final String table;
  private final String idColumn;
  private final String columns;
  private final String filter;
  private final Object[] filterParams;
  private final JdbcTemplate.RowMapper<T> mapper;
  private final ToLongFunction<T> idOf;

  private KeysetQuery(Builder<T> builder) {
    this.table = TableNames.validate(builder.table);
    this.idColumn = TableNames.validate(builder.idColumn);
    List<String> cols = builder.columns.isEmpty() ? List.of("*") : builder.columns;
    for (String col : cols) {
      if (!"*".equals(col)) {
        TableNames.validate(col);
      }
    }
    this.columns = String.join(", ", cols);
    this.filter = builder.filter;
    this.filterParams = builder.filterParams;
    this.mapper = Objects.requireNonNull(builder.mapper, "mapper");
    this.idOf = Objects.requireNonNull(builder.idOf, "idOf");
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /**
   * Reads one page.
   *
   * @param conn JDBC connection
   * @param page requested window
   * @return the rows, newest first, with the adjoining windows
   * @throws turnstile.StoreException on database failure
   */
  public PageResult<T> fetch(Connection conn, Page page) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(page, "page");
    List<T> rows = select(conn, page);
    if (rows.isEmpty()) {
      return PageResult.empty();
    }
    long[] bounds = JdbcTemplate.queryOne(conn,
        "SELECT MIN(" + idColumn + "), MAX(" + idColumn + ") FROM " + table + where(null),
        rs -> new long[] {rs.getLong(1), rs.getLong(2)}, filterParams);
    return Pages.paginate(rows, idOf, bounds[0], bounds[1], page.limit());
  }

  private List<T> select(Connection conn, Page page) {
    int limit = page.limit();
    if (page.since() != null) {
      return descending(conn, idColumn + " < ?", limit, page.since());
    }
    if (page.until() != null) {
      return ascendingReversed(conn, idColumn + " > ?", limit, page.until());
    }
    if (page.from() != null && page.to() != null) {
      return descending(conn, idColumn + " >= ? AND " + idColumn + " <= ?", limit, page.from(), page.to());
    }
    if (page.from() != null) {
      return ascendingReversed(conn, idColumn + " >= ?", limit, page.from());
    }
    if (page.to() != null) {
      return descending(conn, idColumn + " <= ?", limit, page.to());
    }
    if (page.around() != null) {
      List<T> newer = ascendingReversed(conn, idColumn + " > ?", limit / 2, page.around());
      List<T> older = descending(conn, idColumn + " <= ?", limit - newer.size(), page.around());
      List<T> merged = new ArrayList<>(newer.size() + older.size());
      merged.addAll(newer);
      merged.addAll(older);
      return merged;
    }
    return descending(conn, null, limit);
  }

  private List<T> descending(Connection conn, String bound, int limit, Object... boundParams) {
    return run(conn, bound, "DESC", limit, boundParams);
  }

  private List<T> ascendingReversed(Connection conn, String bound, int limit, Object... boundParams) {
    List<T> rows = new ArrayList<>(run(conn, bound, "ASC", limit, boundParams));
    Collections.reverse(rows);
    return rows;
  }

  private List<T> run(Connection conn, String bound, String direction, int limit, Object... boundParams) {
    if (limit <= 0) {
      return List.of();
    }
    String sql = "SELECT " + columns + " FROM " + table + where(bound) +
        " ORDER BY " + idColumn + " " + direction + " LIMIT ?";
    Object[] params = new Object[filterParams.length + boundParams.length + 1];
    System.arraycopy(filterParams, 0, params, 0, filterParams.length);
    System.arraycopy(boundParams, 0, params, filterParams.length, boundParams.length);
    params[params.length - 1] = limit;
    return JdbcTemplate.query(conn, sql, mapper, params);
  }

  private String where(String bound) {
    if (filter == null && bound == null) {
      return "";
    }
    if (filter == null) {
      return " WHERE " + bound;
    }
    if (bound == null) {
      return " WHERE (" + filter + ")";
    }
    return " WHERE (" + filter + ") AND " + bound;
  }

  public static final class Builder<T> {
    private String table;
    private String idColumn = "id";
    private List<String> columns = List.of();
    private String filter;
    private Object[] filterParams = new Object[0];
    private JdbcTemplate.RowMapper<T> mapper;
    private ToLongFunction<T> idOf;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder<T> table(String table) {
      this.table = table;
      return this;
    }

    /**
     * Optional. Defaults to {@code id}.
     */
    public Builder<T> idColumn(String idColumn) {
      this.idColumn = idColumn;
      return this;
    }

    /**
     * Optional. Defaults to {@code *}.
     */
    public Builder<T> columns(String... columns) {
      this.columns = List.of(columns);
      return this;
    }

    /**
     * Optional SQL predicate applied to both the page and its min/max lookup.
     * It is inserted verbatim; pass values through {@code params}.
     */
    public Builder<T> where(String filter, Object... params) {
      this.filter = Objects.requireNonNull(filter, "filter");
      this.filterParams = params.clone();
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<T> mapper(JdbcTemplate.RowMapper<T> mapper) {
      this.mapper = mapper;
      return this;
    }

    /**
     * <p><b>Required.</b> Extracts the id column value from a mapped row.
     */
    public Builder<T> idOf(ToLongFunction<T> idOf) {
      this.idOf = idOf;
      return this;
    }

    public KeysetQuery<T> build() {
      return new KeysetQuery<>(this);
    }
  }
}
