package signals.dispatch;

import signals.ArgumentTypeMismatchException;
import signals.ArityMismatchException;
import signals.NullArgumentException;
import signals.Signal;
import signals.util.Primitives;

import java.util.List;

/**
 * Invoke-time checks of arguments against a signal's declared parameters.
 */
final class ArgumentValidator {

  private ArgumentValidator() {
  }

  /**
   * @return the arguments to pass on; a {@code null} array means no arguments for a
   *     parameterless signal and a single {@code null} argument for a one-parameter signal
   * @throws ArityMismatchException         if the count differs
   * @throws NullArgumentException          if {@code null} is passed for a primitive parameter
   * @throws ArgumentTypeMismatchException  if an argument is not an instance of its parameter type
   */
  static Object[] validate(Class<? extends Signal> signalType, Signal signal, Object[] args) {
    List<Class<?>> parameterTypes = signal.parameterTypes();
    Object[] arguments = args;
    if (arguments == null) {
      // invoke(type, null) passes a null varargs array rather than one null argument
      if (parameterTypes.isEmpty()) {
        return new Object[0];
      }
      if (parameterTypes.size() != 1) {
        throw new ArityMismatchException(signalType, parameterTypes.size(), 1);
      }
      arguments = new Object[] {null};
    }
    if (arguments.length != parameterTypes.size()) {
      throw new ArityMismatchException(signalType, parameterTypes.size(), arguments.length);
    }
    for (int i = 0; i < arguments.length; i++) {
      Class<?> expected = parameterTypes.get(i);
      Object value = arguments[i];
      if (value == null) {
        if (expected.isPrimitive()) {
          throw new NullArgumentException(signalType, i + 1, expected);
        }
      } else if (!Primitives.isInstance(expected, value)) {
        throw new ArgumentTypeMismatchException(signalType, i + 1, expected, value.getClass());
      }
    }
    return arguments;
  }
}
