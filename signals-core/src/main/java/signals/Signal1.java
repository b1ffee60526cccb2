package signals;

import signals.dispatch.SignalDispatcher;

/**
 * Base for signals with one parameter.
 *
 * @param <A> the parameter type; for a primitive parameter, its wrapper
 */
public abstract class Signal1<A> extends Signal {

  protected Signal1(Class<A> a) {
    super(a);
  }

  /**
   * Invokes this signal through {@code dispatcher}.
   *
   * @return the number of listeners called
   */
  public final int invoke(SignalDispatcher dispatcher, A a) {
    return dispatcher.invoke(this, a);
  }
}
