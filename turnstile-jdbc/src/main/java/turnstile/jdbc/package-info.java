/**
 * JDBC implementations of the core stores and lock database.
 *
 * <p>SQL differences live behind the {@link turnstile.jdbc.spi.Dialect} SPI; use
 * {@link turnstile.jdbc.dialect.Dialects#detect(javax.sql.DataSource)} to pick one, and
 * {@link turnstile.jdbc.Schemas#create} to create the tables.
 */
package turnstile.jdbc;
