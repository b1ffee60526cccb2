package signals;

/**
 * Listener owner with an explicit end of life.
 *
 * <p>Used by {@link signals.spi.LivenessOracle#disposable()}: once {@link #isDisposed()}
 * returns {@code true}, the owner's bindings are skipped and reclaimed by the next dispatch.
 */
public interface Disposable {

  /**
   * @return {@code true} once the owner has been destroyed
   */
  boolean isDisposed();
}
