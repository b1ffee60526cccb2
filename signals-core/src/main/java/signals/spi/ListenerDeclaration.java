package signals.spi;

import signals.Cardinality;
import signals.Signal;

import java.util.List;
import java.util.Objects;

/**
 * One listener an owner type declares: which signal it listens to, how often, and how to call it.
 *
 * <p>{@code name} identifies the declaration within its owner type. Two bindings with the same
 * owner instance and the same name are duplicates.
 *
 * @param signalType     the signal listened to
 * @param cardinality    {@link Cardinality#EVERY} or {@link Cardinality#ONCE}
 * @param name           declaration name, unique per owner type
 * @param parameterTypes the listener's declared parameter types
 * @param invoker        calls the listener on an owner instance
 */
public record ListenerDeclaration(
    Class<? extends Signal> signalType,
    Cardinality cardinality,
    String name,
    List<Class<?>> parameterTypes,
    Invoker invoker
) {

  public ListenerDeclaration {
    Objects.requireNonNull(signalType, "signalType");
    Objects.requireNonNull(cardinality, "cardinality");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(invoker, "invoker");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Listener name cannot be empty");
    }
    parameterTypes = List.copyOf(parameterTypes);
  }

  /**
   * @return number of declared parameters
   */
  public int parameterCount() {
    return parameterTypes.size();
  }

  /**
   * Calls a declared listener on a specific owner.
   */
  @FunctionalInterface
  public interface Invoker {

    /**
     * @param owner the bound owner instance
     * @param args  positional arguments, already validated against the signal
     * @throws Exception whatever the listener body throws
     */
    void invoke(Object owner, Object[] args) throws Exception;
  }
}
