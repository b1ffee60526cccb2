/**
 * Micrometer bridge for exporting dispatcher metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link signals.micrometer.MicrometerMetricsExporter} implements the
 * {@link signals.spi.MetricsExporter} SPI using Micrometer counters, gauges and timers.
 *
 * @see signals.micrometer.MicrometerMetricsExporter
 */
package signals.micrometer;
