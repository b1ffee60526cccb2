package signals;

import signals.dispatch.SignalDispatcher;

/**
 * Base for signals with two parameters.
 *
 * <pre>{@code
 * public final class Move extends Signal2<Vector, Float> {
 *   public Move() {
 *     super(Vector.class, float.class);
 *   }
 * }
 *
 * dispatcher.getSignal(Move.class).invoke(dispatcher, position, 1.5f);
 * }</pre>
 *
 * <p>Passing {@code float.class} keeps the parameter primitive, so {@code null} is rejected at
 * invoke time.
 *
 * @param <A> the first parameter type
 * @param <B> the second parameter type
 */
public abstract class Signal2<A, B> extends Signal {

  protected Signal2(Class<A> a, Class<B> b) {
    super(a, b);
  }

  public final int invoke(SignalDispatcher dispatcher, A a, B b) {
    return dispatcher.invoke(this, a, b);
  }
}
