package signals.spi;

/**
 * Observability hook for exporting dispatcher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of {@code invoke} calls that completed without an exception.
   */
  void incrementDispatchSuccess();

  /**
   * Increments the count of {@code invoke} calls that ended in an exception, whether raised by
   * validation or by a listener.
   */
  void incrementDispatchFailure();

  /**
   * Adds to the count of listener calls made.
   *
   * @param count listeners called by one dispatch
   */
  void incrementListenersNotified(int count);

  /**
   * Increments the count of bindings discarded during dispatch ({@code ONCE} listeners that
   * fired, or owners found dead).
   */
  void incrementListenersDiscarded();

  /**
   * Increments the count of unbind requests deferred because a dispatch was in progress.
   */
  default void incrementDeferredUnbinds() {
  }

  /**
   * Records the number of owners currently holding bindings.
   *
   * @param owners owners in the binding table
   */
  void recordBoundOwners(int owners);

  /**
   * Records the wall time of one {@code invoke} call.
   *
   * @param durationNanos duration in nanoseconds (always non-negative)
   */
  default void recordDispatchDurationNanos(long durationNanos) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementDispatchSuccess() {
    }

    @Override
    public void incrementDispatchFailure() {
    }

    @Override
    public void incrementListenersNotified(int count) {
    }

    @Override
    public void incrementListenersDiscarded() {
    }

    @Override
    public void recordBoundOwners(int owners) {
    }
  }
}
