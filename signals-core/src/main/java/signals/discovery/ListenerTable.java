package signals.discovery;

import signals.Cardinality;
import signals.Signal;
import signals.spi.ListenerDeclaration;
import signals.spi.ListenerDiscovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit listener registration without reflection.
 *
 * <p>The host declares each listener once per owner type with a method reference or lambda;
 * {@link #discover(Class)} then returns the declarations of the owner type and all of its
 * supertypes, in declaration order.
 *
 * <pre>{@code
 * ListenerTable table = new ListenerTable()
 *     .declare(Hud.class, Ping.class, Cardinality.EVERY, "onPing", Hud::onPing)
 *     .declare(Hud.class, Move.class, Cardinality.EVERY, "onMove",
 *         Vector.class, float.class, Hud::onMove);
 * }</pre>
 *
 * <p>Parameter types are passed as class tokens so bind-time validation can check them against
 * the signal. Use {@code float.class} for a primitive parameter; the lambda receives the boxed
 * value.
 */
public final class ListenerTable implements ListenerDiscovery {

  private final Map<Class<?>, List<ListenerDeclaration>> declarations = new LinkedHashMap<>();

  @FunctionalInterface
  public interface Listener0<O> {
    void accept(O owner) throws Exception;
  }

  @FunctionalInterface
  public interface Listener1<O, A> {
    void accept(O owner, A a) throws Exception;
  }

  @FunctionalInterface
  public interface Listener2<O, A, B> {
    void accept(O owner, A a, B b) throws Exception;
  }

  @FunctionalInterface
  public interface Listener3<O, A, B, C> {
    void accept(O owner, A a, B b, C c) throws Exception;
  }

  @FunctionalInterface
  public interface Listener4<O, A, B, C, D> {
    void accept(O owner, A a, B b, C c, D d) throws Exception;
  }

  public <O> ListenerTable declare(
      Class<O> ownerType, Class<? extends Signal> signalType, Cardinality cardinality, String name,
      Listener0<? super O> listener) {
    Objects.requireNonNull(listener, "listener");
    return add(ownerType, signalType, cardinality, name, List.of(),
        (owner, args) -> listener.accept(ownerType.cast(owner)));
  }

  @SuppressWarnings("unchecked")
  public <O, A> ListenerTable declare(
      Class<O> ownerType, Class<? extends Signal> signalType, Cardinality cardinality, String name,
      Class<A> a, Listener1<? super O, ? super A> listener) {
    Objects.requireNonNull(listener, "listener");
    return add(ownerType, signalType, cardinality, name, List.of(a),
        (owner, args) -> listener.accept(ownerType.cast(owner), (A) args[0]));
  }

  @SuppressWarnings("unchecked")
  public <O, A, B> ListenerTable declare(
      Class<O> ownerType, Class<? extends Signal> signalType, Cardinality cardinality, String name,
      Class<A> a, Class<B> b, Listener2<? super O, ? super A, ? super B> listener) {
    Objects.requireNonNull(listener, "listener");
    return add(ownerType, signalType, cardinality, name, List.of(a, b),
        (owner, args) -> listener.accept(ownerType.cast(owner), (A) args[0], (B) args[1]));
  }

  @SuppressWarnings("unchecked")
  public <O, A, B, C> ListenerTable declare(
      Class<O> ownerType, Class<? extends Signal> signalType, Cardinality cardinality, String name,
      Class<A> a, Class<B> b, Class<C> c, Listener3<? super O, ? super A, ? super B, ? super C> listener) {
    Objects.requireNonNull(listener, "listener");
    return add(ownerType, signalType, cardinality, name, List.of(a, b, c),
        (owner, args) -> listener.accept(ownerType.cast(owner), (A) args[0], (B) args[1], (C) args[2]));
  }

  @SuppressWarnings("unchecked")
  public <O, A, B, C, D> ListenerTable declare(
      Class<O> ownerType, Class<? extends Signal> signalType, Cardinality cardinality, String name,
      Class<A> a, Class<B> b, Class<C> c, Class<D> d,
      Listener4<? super O, ? super A, ? super B, ? super C, ? super D> listener) {
    Objects.requireNonNull(listener, "listener");
    return add(ownerType, signalType, cardinality, name, List.of(a, b, c, d),
        (owner, args) -> listener.accept(
            ownerType.cast(owner), (A) args[0], (B) args[1], (C) args[2], (D) args[3]));
  }

  /**
   * Declares a listener of any arity. The invoker receives the owner and the validated
   * arguments.
   */
  public ListenerTable declare(
      Class<?> ownerType, Class<? extends Signal> signalType, Cardinality cardinality, String name,
      List<Class<?>> parameterTypes, ListenerDeclaration.Invoker invoker) {
    return add(ownerType, signalType, cardinality, name, parameterTypes, invoker);
  }

  private ListenerTable add(
      Class<?> ownerType, Class<? extends Signal> signalType, Cardinality cardinality, String name,
      List<Class<?>> parameterTypes, ListenerDeclaration.Invoker invoker) {
    Objects.requireNonNull(ownerType, "ownerType");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(parameterTypes, "parameterTypes");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Listener name cannot be empty");
    }
    ListenerDeclaration declaration = new ListenerDeclaration(
        signalType, cardinality, ownerType.getSimpleName() + "." + name, parameterTypes, invoker);
    List<ListenerDeclaration> forType = declarations.computeIfAbsent(ownerType, ignored -> new ArrayList<>());
    for (ListenerDeclaration existing : forType) {
      if (existing.name().equals(declaration.name())) {
        throw new IllegalArgumentException("Listener '" + name + "' is already declared for "
            + ownerType.getName());
      }
    }
    forType.add(declaration);
    return this;
  }

  @Override
  public List<ListenerDeclaration> discover(Class<?> ownerType) {
    Objects.requireNonNull(ownerType, "ownerType");
    List<ListenerDeclaration> result = new ArrayList<>();
    for (Map.Entry<Class<?>, List<ListenerDeclaration>> entry : declarations.entrySet()) {
      if (entry.getKey().isAssignableFrom(ownerType)) {
        result.addAll(entry.getValue());
      }
    }
    return Collections.unmodifiableList(result);
  }
}
