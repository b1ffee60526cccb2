package signals;

import java.util.Objects;

/**
 * A {@link Listener} attached to one {@link Signal}, with its {@link Cardinality}.
 *
 * <p>A binding is discarded when it fires with {@link Cardinality#ONCE}, when its owner is
 * found dead, or when it is removed. Discarded bindings are skipped by any pass still in
 * flight and purged from the signal once the outermost pass completes.
 */
public final class ListenerBinding {

  private final Listener listener;
  private final Cardinality cardinality;
  private boolean discarded;

  ListenerBinding(Listener listener, Cardinality cardinality) {
    this.listener = Objects.requireNonNull(listener, "listener");
    this.cardinality = Objects.requireNonNull(cardinality, "cardinality");
  }

  public Listener listener() {
    return listener;
  }

  public Object owner() {
    return listener.owner();
  }

  public Cardinality cardinality() {
    return cardinality;
  }

  public boolean isDiscarded() {
    return discarded;
  }

  void discard() {
    discarded = true;
  }

  @Override
  public String toString() {
    return listener + " (" + cardinality + (discarded ? ", discarded)" : ")");
  }
}
