package signals.spi;

import signals.Signal;

import java.lang.reflect.Modifier;
import java.util.Set;

/**
 * Enumerates the signal types available to the process, for auto-discovered registries.
 *
 * @see signals.registry.SignalRegistry#discover(SignalTypeScanner)
 */
@FunctionalInterface
public interface SignalTypeScanner {

  /**
   * Package holding the library's built-in types. Signal types declared here are never
   * auto-registered.
   */
  String BUILT_IN_PACKAGE = "signals";

  /**
   * @return signal types found; may include built-in or abstract types, which callers filter
   *     with {@link #isCandidate(Class)}
   */
  Set<Class<? extends Signal>> scan();

  /**
   * Returns whether a scanned type should be registered: a concrete {@link Signal} subclass
   * declared outside the built-in package.
   */
  static boolean isCandidate(Class<?> type) {
    return Signal.class.isAssignableFrom(type)
        && type != Signal.class
        && !Modifier.isAbstract(type.getModifiers())
        && !type.isInterface()
        && !BUILT_IN_PACKAGE.equals(type.getPackageName());
  }
}
