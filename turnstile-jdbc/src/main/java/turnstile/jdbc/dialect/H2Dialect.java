package turnstile.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing and single-node use.
 *
 * <p>H2 has neither advisory locks nor LISTEN/NOTIFY.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
