/**
 * Micrometer bridge for exporting relay metrics.
 *
 * <p>{@link relaykit.micrometer.MicrometerMetricsExporter} implements the
 * {@link relaykit.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package relaykit.micrometer;
