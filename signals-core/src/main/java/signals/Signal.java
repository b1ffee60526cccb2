package signals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A strongly typed event channel with a fixed parameter list and an ordered set of listeners.
 *
 * <p>Each concrete subclass is one signal kind; its {@link Class} is the kind's identity in a
 * {@link signals.registry.SignalRegistry}. Subclasses declare their parameter types through the
 * constructor and need a no-arg constructor so registries can instantiate them:
 *
 * <pre>{@code
 * public final class Ping extends Signal {
 * }
 *
 * public final class Move extends Signal {
 *   public Move() {
 *     super(Vector.class, float.class);
 *   }
 * }
 * }</pre>
 *
 * <p>Listeners are called in the order they were added. Bindings discarded during a pass
 * ({@link Cardinality#ONCE} listeners that fired, listeners whose owner is dead) are skipped for
 * the rest of the pass and purged once it completes. Listeners added during a pass are not called
 * until the next one.
 *
 * <p>For compile-time checked arguments, extend one of the typed bases {@link Signal0} through
 * {@link Signal4} instead.
 *
 * <p>Not thread-safe: all calls are expected from one thread.
 *
 * @see signals.dispatch.SignalDispatcher
 */
public abstract class Signal {

  private final List<Class<?>> parameterTypes;
  private final List<ListenerBinding> bindings = new ArrayList<>();
  private int passDepth;

  /**
   * @param parameterTypes the positional parameter types every invocation must supply
   * @throws NullPointerException     if any type is null
   * @throws IllegalArgumentException if any type is {@code void}
   */
  protected Signal(Class<?>... parameterTypes) {
    Objects.requireNonNull(parameterTypes, "parameterTypes");
    for (Class<?> type : parameterTypes) {
      Objects.requireNonNull(type, "parameter type");
      if (type == void.class || type == Void.class) {
        throw new IllegalArgumentException("Signal parameters cannot be void: " + getClass().getName());
      }
    }
    this.parameterTypes = List.of(parameterTypes);
  }

  /**
   * @return the number of arguments {@link #invoke} requires
   */
  public final int parameterCount() {
    return parameterTypes.size();
  }

  /**
   * @return the declared parameter types, in order
   */
  public final List<Class<?>> parameterTypes() {
    return parameterTypes;
  }

  /**
   * @return display name used in diagnostics
   */
  public String name() {
    return getClass().getSimpleName();
  }

  /**
   * Appends a listener.
   *
   * @param listener    the listener to add
   * @param cardinality how often it fires
   * @return the new binding
   * @throws DuplicateListenerException if an equal listener is already bound
   */
  public final ListenerBinding addListener(Listener listener, Cardinality cardinality) {
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(cardinality, "cardinality");
    for (ListenerBinding binding : bindings) {
      if (!binding.isDiscarded() && binding.listener().equals(listener)) {
        throw new DuplicateListenerException(this, listener);
      }
    }
    ListenerBinding binding = new ListenerBinding(listener, cardinality);
    bindings.add(binding);
    return binding;
  }

  /**
   * Removes the first binding for an equal listener. Does nothing if none is bound.
   *
   * @param listener the listener to remove
   * @return {@code true} if a binding was removed
   */
  public final boolean removeListener(Listener listener) {
    Objects.requireNonNull(listener, "listener");
    Iterator<ListenerBinding> it = bindings.iterator();
    while (it.hasNext()) {
      ListenerBinding binding = it.next();
      if (!binding.isDiscarded() && binding.listener().equals(listener)) {
        binding.discard();
        it.remove();
        return true;
      }
    }
    return false;
  }

  /**
   * @return a snapshot of the live (not discarded) bindings, in call order
   */
  public final List<ListenerBinding> bindings() {
    List<ListenerBinding> live = new ArrayList<>(bindings.size());
    for (ListenerBinding binding : bindings) {
      if (!binding.isDiscarded()) {
        live.add(binding);
      }
    }
    return Collections.unmodifiableList(live);
  }

  /**
   * @return number of live bindings
   */
  public final int listenerCount() {
    int count = 0;
    for (ListenerBinding binding : bindings) {
      if (!binding.isDiscarded()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Calls every live listener once, in order.
   *
   * <p>This is the raw fan-out. Arguments are passed through unchecked and only {@code context}
   * is told about discarded bindings. Listeners bound through a dispatcher must be invoked
   * through {@link signals.dispatch.SignalDispatcher#invoke(Signal, Object...)}, which validates
   * the arguments and keeps its binding table in step. A {@code null} array is treated as one
   * {@code null} per parameter.
   *
   * <p>If a listener throws, the remaining listeners are not called and the exception
   * propagates; bindings discarded so far are still purged.
   *
   * @param context liveness and bookkeeping callbacks
   * @param args    positional arguments
   * @return the number of listeners called
   */
  public final int invoke(DispatchContext context, Object... args) {
    Objects.requireNonNull(context, "context");
    Object[] arguments = args != null ? args : new Object[parameterTypes.size()];
    ListenerBinding[] pass = bindings.toArray(new ListenerBinding[0]);
    int notified = 0;
    passDepth++;
    try {
      for (ListenerBinding binding : pass) {
        if (binding.isDiscarded()) {
          continue;
        }
        Object owner = binding.owner();
        if (!context.isAlive(owner)) {
          discard(binding, context);
          context.ownerExpired(owner);
          continue;
        }
        // ONCE is discarded before the call so re-entrant passes cannot fire it again
        if (binding.cardinality() == Cardinality.ONCE) {
          discard(binding, context);
        }
        binding.listener().invoke(arguments);
        notified++;
      }
    } finally {
      if (--passDepth == 0) {
        bindings.removeIf(ListenerBinding::isDiscarded);
      }
    }
    return notified;
  }

  private static void discard(ListenerBinding binding, DispatchContext context) {
    binding.discard();
    context.bindingDiscarded(binding);
  }

  @Override
  public String toString() {
    return name() + parameterTypes.stream()
        .map(Class::getSimpleName)
        .collect(Collectors.joining(", ", "(", ")"));
  }
}
