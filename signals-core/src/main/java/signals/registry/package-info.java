/**
 * Signal registries: the mapping from signal type to its single live {@link signals.Signal}.
 *
 * @see signals.registry.SignalRegistry
 */
package signals.registry;
