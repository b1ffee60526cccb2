package signals.discovery;

import signals.spi.ListenerDeclaration;
import signals.spi.ListenerDiscovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Concatenates the declarations of several discoveries, in the order given.
 */
public final class CompositeListenerDiscovery implements ListenerDiscovery {

  private final List<ListenerDiscovery> delegates;

  public CompositeListenerDiscovery(List<ListenerDiscovery> delegates) {
    Objects.requireNonNull(delegates, "delegates");
    this.delegates = List.copyOf(delegates);
  }

  public static CompositeListenerDiscovery of(ListenerDiscovery... delegates) {
    return new CompositeListenerDiscovery(List.of(delegates));
  }

  @Override
  public List<ListenerDeclaration> discover(Class<?> ownerType) {
    List<ListenerDeclaration> declarations = new ArrayList<>();
    for (ListenerDiscovery delegate : delegates) {
      declarations.addAll(delegate.discover(ownerType));
    }
    return Collections.unmodifiableList(declarations);
  }
}
