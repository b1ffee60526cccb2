package signals;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a listener for a {@link Signal} type.
 *
 * <p>The method's parameters must match the signal's declared parameter types, position by
 * position. The method may be private; it must not be static.
 *
 * <pre>{@code
 * public class Hud {
 *   @ListenTo(Ping.class)
 *   void onPing() { ... }
 *
 *   @ListenTo(value = Move.class, cardinality = Cardinality.ONCE)
 *   void onFirstMove(Vector position, float speed) { ... }
 * }
 *
 * dispatcher.bind(hud);
 * }</pre>
 *
 * @see signals.dispatch.SignalDispatcher#bind(Object)
 * @see signals.discovery.AnnotatedListenerDiscovery
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ListenTo {

  /**
   * The signal type to listen to.
   */
  Class<? extends Signal> value();

  /**
   * Whether the listener fires on every invocation or only the first one.
   */
  Cardinality cardinality() default Cardinality.EVERY;
}
