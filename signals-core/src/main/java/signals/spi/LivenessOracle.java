package signals.spi;

import signals.Disposable;

/**
 * Answers whether a listener owner may still receive invocations.
 *
 * <p>Consulted once per binding per dispatch. An owner reported as not alive has its binding
 * skipped, and all of its bindings are reclaimed once the dispatch completes. Implementations
 * must tolerate owners that have already been destroyed; if one throws, the dispatcher treats
 * the owner as not alive.
 */
@FunctionalInterface
public interface LivenessOracle {

  /**
   * Every owner is alive until explicitly unbound.
   */
  LivenessOracle ALWAYS_ALIVE = owner -> true;

  /**
   * @param owner the listener owner
   * @return {@code false} if the owner has been destroyed
   */
  boolean isAlive(Object owner);

  /**
   * Treats owners implementing {@link Disposable} as dead once they report
   * {@link Disposable#isDisposed()}. Other owners are always alive.
   */
  static LivenessOracle disposable() {
    return owner -> !(owner instanceof Disposable) || !((Disposable) owner).isDisposed();
  }
}
