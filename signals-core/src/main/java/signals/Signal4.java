package signals;

import signals.dispatch.SignalDispatcher;

/**
 * Base for signals with four parameters.
 */
public abstract class Signal4<A, B, C, D> extends Signal {

  protected Signal4(Class<A> a, Class<B> b, Class<C> c, Class<D> d) {
    super(a, b, c, d);
  }

  public final int invoke(SignalDispatcher dispatcher, A a, B b, C c, D d) {
    return dispatcher.invoke(this, a, b, c, d);
  }
}
