package turnstile.jdbc.page;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import turnstile.page.Page;
import turnstile.page.PageResult;
import turnstile.page.Pagination;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class KeysetQueryTest {

  record Build(long id, String status) {}

  private Connection conn;
  private KeysetQuery<Build> builds;

  @BeforeEach
  void setUp() throws SQLException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    conn = dataSource.getConnection();
    conn.createStatement().execute(
        "CREATE TABLE builds (id BIGINT PRIMARY KEY, repo_id INT NOT NULL, status VARCHAR(16) NOT NULL)");
    try (PreparedStatement ps = conn.prepareStatement("INSERT INTO builds VALUES (?, ?, ?)")) {
      for (long id = 1; id <= 10; id++) {
        ps.setLong(1, id);
        ps.setInt(2, id % 2 == 1 ? 1 : 2);
        ps.setString(3, id == 10 ? "started" : "succeeded");
        ps.executeUpdate();
      }
    }
    builds = query().build();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void unboundedPageReturnsNewest() {
    PageResult<Build> page = builds.fetch(conn, Page.newest(3));

    assertEquals(List.of(10L, 9L, 8L), ids(page));
    assertEquals("started", page.items().get(0).status());
    assertTrue(page.pagination().previousPage().isEmpty());
    assertEquals(Page.since(8, 3), page.pagination().next());
  }

  @Test
  void sinceIsExclusiveAndOlder() {
    PageResult<Build> page = builds.fetch(conn, Page.since(8, 3));

    assertEquals(List.of(7L, 6L, 5L), ids(page));
    assertEquals(Page.until(7, 3), page.pagination().previous());
    assertEquals(Page.since(5, 3), page.pagination().next());
  }

  @Test
  void untilIsExclusiveAndKeepsRowsNearestTheBound() {
    PageResult<Build> page = builds.fetch(conn, Page.until(5, 3));

    assertEquals(List.of(8L, 7L, 6L), ids(page));
    assertEquals(Page.until(8, 3), page.pagination().previous());
    assertEquals(Page.since(6, 3), page.pagination().next());
  }

  @Test
  void fromIsInclusiveLowerBound() {
    assertEquals(List.of(6L, 5L, 4L), ids(builds.fetch(conn, Page.from(4, 3))));
  }

  @Test
  void toIsInclusiveUpperBound() {
    assertEquals(List.of(4L, 3L, 2L), ids(builds.fetch(conn, Page.to(4, 3))));
  }

  @Test
  void rangeReturnsNewestInsideBounds() {
    assertEquals(List.of(9L, 8L, 7L), ids(builds.fetch(conn, Page.range(3, 9, 3))));
    assertEquals(List.of(4L, 3L), ids(builds.fetch(conn, Page.range(3, 4, 10))));
  }

  @Test
  void aroundSplitsTheWindowAndIncludesTheId() {
    assertEquals(List.of(7L, 6L, 5L, 4L), ids(builds.fetch(conn, Page.around(5, 4))));
    assertEquals(List.of(6L, 5L, 4L), ids(builds.fetch(conn, Page.around(5, 3))));
  }

  @Test
  void aroundNewestFillsFromOlderRows() {
    assertEquals(List.of(10L, 9L, 8L, 7L), ids(builds.fetch(conn, Page.around(10, 4))));
  }

  @Test
  void filterAppliesToRowsAndNeighbours() {
    KeysetQuery<Build> repoOne = query().where("repo_id = ?", 1).build();

    PageResult<Build> newest = repoOne.fetch(conn, Page.newest(3));
    assertEquals(List.of(9L, 7L, 5L), ids(newest));
    assertNull(newest.pagination().previous());
    assertEquals(Page.since(5, 3), newest.pagination().next());

    PageResult<Build> oldest = repoOne.fetch(conn, Page.since(5, 3));
    assertEquals(List.of(3L, 1L), ids(oldest));
    assertNull(oldest.pagination().next());
  }

  @Test
  void pastTheEndIsEmpty() {
    PageResult<Build> page = builds.fetch(conn, Page.since(1, 3));

    assertTrue(page.items().isEmpty());
    assertEquals(Pagination.NONE, page.pagination());
  }

  @Test
  void identifiersAreValidated() {
    assertThrows(IllegalArgumentException.class, () -> query().table("builds b").build());
    assertThrows(IllegalArgumentException.class, () -> query().idColumn("id--").build());
    assertThrows(IllegalArgumentException.class, () -> query().columns("id", "status; DROP").build());
  }

  @Test
  void mapperAndIdOfAreRequired() {
    assertThrows(NullPointerException.class,
        () -> KeysetQuery.<Build>builder().table("builds").idOf(Build::id).build());
    assertThrows(NullPointerException.class,
        () -> KeysetQuery.<Build>builder().table("builds")
            .mapper(rs -> new Build(rs.getLong(1), rs.getString(2))).build());
  }

  private static KeysetQuery.Builder<Build> query() {
    return KeysetQuery.<Build>builder()
        .table("builds")
        .columns("id", "status")
        .mapper(rs -> new Build(rs.getLong("id"), rs.getString("status")))
        .idOf(Build::id);
  }

  private static List<Long> ids(PageResult<Build> page) {
    return page.items().stream().map(Build::id).toList();
  }
}
