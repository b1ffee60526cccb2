package signals;

import signals.util.Ordinals;

/**
 * Thrown at bind time when a listener's declared parameters disagree with its signal.
 *
 * <p>{@link #position()} is the 1-based parameter at fault, or {@code 0} when the parameter
 * count differs.
 */
public final class SignatureMismatchException extends SignalException {

  private final Class<? extends Signal> signalType;
  private final String listenerName;
  private final int position;

  private SignatureMismatchException(
      Class<? extends Signal> signalType, String listenerName, int position, String message) {
    super(message);
    this.signalType = signalType;
    this.listenerName = listenerName;
    this.position = position;
  }

  /**
   * Listener declares a different number of parameters than the signal.
   */
  public static SignatureMismatchException countMismatch(
      Class<? extends Signal> signalType, String listenerName, int expected, int found) {
    return new SignatureMismatchException(signalType, listenerName, 0,
        "Incorrect number of parameters found when binding '" + listenerName + "' to '"
            + signalType.getSimpleName() + "'. Expected to find " + expected
            + " parameter(s) but found " + found + ".");
  }

  /**
   * Listener parameter at {@code position} (1-based) cannot accept the signal's type.
   */
  public static SignatureMismatchException typeMismatch(
      Class<? extends Signal> signalType, String listenerName, int position,
      Class<?> expected, Class<?> found) {
    return new SignatureMismatchException(signalType, listenerName, position,
        "Incorrect parameter type while binding listener method '" + listenerName + "'. Expected '"
            + expected.getSimpleName() + "' but found '" + found.getSimpleName() + "'. The "
            + Ordinals.of(position) + " parameter in the listener method does not match what is defined by '"
            + signalType.getSimpleName() + "'.");
  }

  public Class<? extends Signal> signalType() {
    return signalType;
  }

  public String listenerName() {
    return listenerName;
  }

  public int position() {
    return position;
  }
}
