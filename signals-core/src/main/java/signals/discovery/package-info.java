/**
 * Listener and signal type discovery.
 *
 * <p>{@link signals.discovery.AnnotatedListenerDiscovery} reads {@link signals.ListenTo}
 * annotations; {@link signals.discovery.ListenerTable} is the reflection-free alternative.
 * {@link signals.discovery.ServiceLoaderSignalTypeScanner} feeds discovered registries.
 */
package signals.discovery;
