package turnstile.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void nullDataSourceThrows() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void opensConnectionsFromTheDataSource() throws SQLException {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(H2Databases.empty());

    try (Connection first = provider.getConnection(); Connection second = provider.getConnection()) {
      assertFalse(first.isClosed());
      assertNotSame(first, second);
    }
  }
}
