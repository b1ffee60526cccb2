package signals;

import signals.dispatch.SignalDispatcher;

/**
 * Base for signals with three parameters.
 */
public abstract class Signal3<A, B, C> extends Signal {

  protected Signal3(Class<A> a, Class<B> b, Class<C> c) {
    super(a, b, c);
  }

  public final int invoke(SignalDispatcher dispatcher, A a, B b, C c) {
    return dispatcher.invoke(this, a, b, c);
  }
}
