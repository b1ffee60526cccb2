package signals;

/**
 * Callbacks a {@link Signal} makes while it fans an invocation out to its listeners.
 *
 * <p>{@link signals.dispatch.SignalDispatcher} supplies its own context, which consults the
 * configured {@link signals.spi.LivenessOracle} and keeps the owner binding table in step with
 * the signal. {@link #DETACHED} treats every owner as alive and keeps no books.
 */
public interface DispatchContext {

  /**
   * Context that treats every owner as alive.
   */
  DispatchContext DETACHED = owner -> true;

  /**
   * Returns whether the owner of a binding may still receive invocations.
   *
   * @param owner the listener owner
   * @return {@code false} to skip the binding and discard it after the pass
   */
  boolean isAlive(Object owner);

  /**
   * Called when {@link #isAlive(Object)} reported the owner as gone.
   *
   * @param owner the expired owner
   */
  default void ownerExpired(Object owner) {
  }

  /**
   * Called when a binding is marked for removal, either because it fired with
   * {@link Cardinality#ONCE} or because its owner expired.
   *
   * @param binding the discarded binding
   */
  default void bindingDiscarded(ListenerBinding binding) {
  }
}
