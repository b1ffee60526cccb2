package signals.discovery;

import signals.ListenTo;
import signals.SignalException;
import signals.spi.ListenerDeclaration;
import signals.spi.ListenerDiscovery;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds listener methods annotated with {@link ListenTo}.
 *
 * <p>The whole class hierarchy is searched, so listeners declared on a superclass are found for
 * subclasses and for runtime proxies. A method annotated in both a subclass and a superclass is
 * reported once, for the most-derived declaration; an unannotated override does not hide an
 * annotated superclass method. Within a class, methods are ordered by name, then by parameter
 * types. Subclass listeners come before superclass listeners.
 *
 * <p>Non-public methods are made accessible. Static methods carrying {@link ListenTo} are
 * rejected with a {@link SignalException}.
 */
public final class AnnotatedListenerDiscovery implements ListenerDiscovery {

  private static final Comparator<Method> METHOD_ORDER = Comparator
      .comparing(Method::getName)
      .thenComparing(AnnotatedListenerDiscovery::parameterList);

  @Override
  public List<ListenerDeclaration> discover(Class<?> ownerType) {
    Objects.requireNonNull(ownerType, "ownerType");
    List<ListenerDeclaration> declarations = new ArrayList<>();
    Set<String> claimed = new HashSet<>();
    for (Class<?> type = ownerType; type != null && type != Object.class; type = type.getSuperclass()) {
      Method[] methods = type.getDeclaredMethods();
      Arrays.sort(methods, METHOD_ORDER);
      for (Method method : methods) {
        if (method.isBridge() || method.isSynthetic()) {
          continue;
        }
        ListenTo listenTo = method.getAnnotation(ListenTo.class);
        if (listenTo == null) {
          continue;
        }
        if (Modifier.isStatic(method.getModifiers())) {
          throw new SignalException("Listener method " + describe(method) + " must not be static");
        }
        // private methods are not overridden, so they never clash with a subclass declaration
        String key = Modifier.isPrivate(method.getModifiers())
            ? type.getName() + "#" + signature(method)
            : signature(method);
        if (!claimed.add(key)) {
          continue;
        }
        declarations.add(declaration(method, listenTo));
      }
    }
    return Collections.unmodifiableList(declarations);
  }

  private static ListenerDeclaration declaration(Method method, ListenTo listenTo) {
    if (!method.trySetAccessible()) {
      throw new SignalException("Listener method " + describe(method) + " is not accessible");
    }
    String name = describe(method);
    return new ListenerDeclaration(
        listenTo.value(),
        listenTo.cardinality(),
        name,
        Arrays.asList(method.getParameterTypes()),
        (owner, args) -> invoke(method, name, owner, args));
  }

  private static void invoke(Method method, String name, Object owner, Object[] args) throws Exception {
    try {
      method.invoke(owner, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    } catch (IllegalAccessException | IllegalArgumentException e) {
      throw new SignalException("Unable to call listener method " + name + ": " + e.getMessage(), e);
    }
  }

  private static String signature(Method method) {
    return method.getName() + "(" + parameterList(method) + ")";
  }

  private static String parameterList(Method method) {
    return Arrays.stream(method.getParameterTypes())
        .map(Class::getName)
        .collect(Collectors.joining(","));
  }

  // parameter types are qualified: the name is the listener's identity for duplicate detection
  private static String describe(Method method) {
    return method.getDeclaringClass().getSimpleName() + "." + method.getName()
        + Arrays.stream(method.getParameterTypes())
            .map(Class::getTypeName)
            .collect(Collectors.joining(", ", "(", ")"));
  }
}
