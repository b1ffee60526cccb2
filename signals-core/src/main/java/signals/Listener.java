package signals;

import signals.spi.ListenerDeclaration;

import java.util.List;
import java.util.Objects;

/**
 * A listener declaration bound to one owner instance.
 *
 * <p>Equality is owner identity plus declaration name, so binding the same method of the same
 * object twice is detected regardless of which {@link ListenerDeclaration} instance produced it.
 */
public final class Listener {

  private final Object owner;
  private final ListenerDeclaration declaration;

  public Listener(Object owner, ListenerDeclaration declaration) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.declaration = Objects.requireNonNull(declaration, "declaration");
  }

  public Object owner() {
    return owner;
  }

  public String name() {
    return declaration.name();
  }

  public Class<? extends Signal> signalType() {
    return declaration.signalType();
  }

  public List<Class<?>> parameterTypes() {
    return declaration.parameterTypes();
  }

  public ListenerDeclaration declaration() {
    return declaration;
  }

  /**
   * Calls the listener.
   *
   * <p>Unchecked exceptions and errors thrown by the listener body propagate unchanged.
   * Checked exceptions are wrapped once in {@link ListenerInvocationException}.
   *
   * @param args positional arguments
   */
  public void invoke(Object[] args) {
    try {
      declaration.invoker().invoke(owner, args);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ListenerInvocationException(this, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Listener)) return false;
    Listener that = (Listener) o;
    return owner == that.owner && declaration.name().equals(that.declaration.name());
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(owner) + declaration.name().hashCode();
  }

  @Override
  public String toString() {
    return declaration.name() + " on " + owner.getClass().getName()
        + "@" + Integer.toHexString(System.identityHashCode(owner));
  }
}
