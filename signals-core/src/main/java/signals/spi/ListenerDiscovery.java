package signals.spi;

import java.util.List;

/**
 * Produces the listeners an owner type declares.
 *
 * <p>Results must be stable for a given type; the dispatcher memoizes them per concrete type.
 *
 * @see signals.discovery.AnnotatedListenerDiscovery
 * @see signals.discovery.ListenerTable
 */
@FunctionalInterface
public interface ListenerDiscovery {

  /**
   * @param ownerType the concrete owner type
   * @return the declared listeners in binding order, empty if none
   * @throws signals.SignalException if a declaration is malformed
   */
  List<ListenerDeclaration> discover(Class<?> ownerType);
}
