/**
 * Micrometer bridge for {@link turnstile.spi.MetricsExporter}.
 */
package turnstile.micrometer;
