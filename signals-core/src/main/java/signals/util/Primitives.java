package signals.util;

import java.util.Map;

/**
 * Boxing-aware type checks shared by bind-time and invoke-time validation.
 */
public final class Primitives {

  private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      short.class, Short.class,
      char.class, Character.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class);

  private Primitives() {
  }

  /**
   * @return the wrapper class for a primitive type, or the type itself
   */
  public static Class<?> wrap(Class<?> type) {
    Class<?> wrapper = WRAPPERS.get(type);
    return wrapper != null ? wrapper : type;
  }

  /**
   * Returns whether a value of {@code type} may be passed to a listener parameter of type
   * {@code parameterType}. A primitive parameter does not accept a reference type, which may
   * carry {@code null}.
   *
   * @param parameterType the listener's parameter type
   * @param type          the signal's parameter type
   */
  public static boolean accepts(Class<?> parameterType, Class<?> type) {
    if (parameterType.isPrimitive() && !type.isPrimitive()) {
      return false;
    }
    return wrap(parameterType).isAssignableFrom(wrap(type));
  }

  /**
   * Returns whether a runtime argument matches a declared parameter type exactly, without
   * widening. {@code null} matches any reference type.
   */
  public static boolean isInstance(Class<?> type, Object value) {
    if (value == null) {
      return !type.isPrimitive();
    }
    return wrap(type).isInstance(value);
  }
}
