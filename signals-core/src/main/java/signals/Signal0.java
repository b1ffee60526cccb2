package signals;

import signals.dispatch.SignalDispatcher;

/**
 * Base for signals without parameters.
 *
 * <pre>{@code
 * public final class Ping extends Signal0 {
 * }
 *
 * dispatcher.getSignal(Ping.class).invoke(dispatcher);
 * }</pre>
 */
public abstract class Signal0 extends Signal {

  protected Signal0() {
    super();
  }

  /**
   * Invokes this signal through {@code dispatcher}.
   *
   * @return the number of listeners called
   */
  public final int invoke(SignalDispatcher dispatcher) {
    return dispatcher.invoke(this);
  }
}
