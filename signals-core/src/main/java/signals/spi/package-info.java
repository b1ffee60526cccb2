/**
 * Service Provider Interfaces (SPI) for extending the signal dispatcher.
 *
 * <p>These interfaces define the extension points that hosts implement to plug in owner
 * lifecycles, listener declaration, signal discovery, and metrics.
 *
 * @see signals.spi.LivenessOracle
 * @see signals.spi.ListenerDiscovery
 * @see signals.spi.SignalTypeScanner
 * @see signals.spi.MetricsExporter
 */
package signals.spi;
