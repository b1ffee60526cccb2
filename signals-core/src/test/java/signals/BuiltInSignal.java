package signals;

/**
 * Stands in for a signal shipped with the library itself; never auto-registered.
 */
public final class BuiltInSignal extends Signal {
}
