package signals.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import signals.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code signals.dispatch.success}: invocations that completed</li>
 *   <li>{@code signals.dispatch.failure}: invocations that ended in an exception</li>
 *   <li>{@code signals.listeners.notified}: listener calls made</li>
 *   <li>{@code signals.listeners.discarded}: bindings dropped during dispatch (fired once, or
 *       owner dead)</li>
 *   <li>{@code signals.unbind.deferred}: unbinds queued behind a running dispatch</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code signals.owners.bound}: owners currently holding bindings</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code signals.dispatch.duration}: wall time of each invocation</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter listenersNotified;
  private final Counter listenersDiscarded;
  private final Counter deferredUnbinds;
  private final Gauge boundOwnersGauge;
  private final Timer dispatchDuration;

  private final AtomicInteger boundOwners = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "signals"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "signals");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for processes running more than one
   * dispatcher.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "game.signals"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Signal invocations that completed")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Signal invocations that ended in an exception")
        .register(registry);
    this.listenersNotified = Counter.builder(namePrefix + ".listeners.notified")
        .description("Listener calls made by signal invocations")
        .register(registry);
    this.listenersDiscarded = Counter.builder(namePrefix + ".listeners.discarded")
        .description("Listener bindings dropped during dispatch")
        .register(registry);
    this.deferredUnbinds = Counter.builder(namePrefix + ".unbind.deferred")
        .description("Unbinds deferred until the running dispatch completed")
        .register(registry);

    this.boundOwnersGauge = Gauge.builder(namePrefix + ".owners.bound", boundOwners, AtomicInteger::get)
        .description("Owners currently holding listener bindings")
        .register(registry);
    this.dispatchDuration = Timer.builder(namePrefix + ".dispatch.duration")
        .description("Wall time of signal invocations")
        .register(registry);
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementListenersNotified(int count) {
    if (closed || count <= 0) return;
    listenersNotified.increment(count);
  }

  @Override
  public void incrementListenersDiscarded() {
    if (closed) return;
    listenersDiscarded.increment();
  }

  @Override
  public void incrementDeferredUnbinds() {
    if (closed) return;
    deferredUnbinds.increment();
  }

  @Override
  public void recordBoundOwners(int owners) {
    if (closed) return;
    boundOwners.set(owners);
  }

  @Override
  public void recordDispatchDurationNanos(long durationNanos) {
    if (closed) return;
    dispatchDuration.record(durationNanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the dispatcher is discarded to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatchSuccess, dispatchFailure, listenersNotified,
        listenersDiscarded, deferredUnbinds, boundOwnersGauge, dispatchDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
