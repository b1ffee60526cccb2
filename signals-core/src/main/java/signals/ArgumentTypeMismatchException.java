package signals;

import signals.util.Ordinals;

/**
 * Thrown when an {@code invoke} argument does not match the signal's declared parameter type.
 *
 * <p>{@link #position()} is 1-based. {@link #foundType()} is {@code null} when the argument
 * was {@code null}.
 */
public class ArgumentTypeMismatchException extends SignalException {

  private final Class<? extends Signal> signalType;
  private final int position;
  private final Class<?> expectedType;
  private final Class<?> foundType;

  public ArgumentTypeMismatchException(
      Class<? extends Signal> signalType, int position, Class<?> expectedType, Class<?> foundType) {
    super("Incorrect argument type passed to 'invoke(" + signalType.getSimpleName() + ", ...)'. "
        + "Expected '" + expectedType.getSimpleName() + "' but found '"
        + (foundType == null ? "null" : foundType.getSimpleName()) + "'. The "
        + Ordinals.of(position) + " argument does not match what is defined by '"
        + signalType.getSimpleName() + "'.");
    this.signalType = signalType;
    this.position = position;
    this.expectedType = expectedType;
    this.foundType = foundType;
  }

  public Class<? extends Signal> signalType() {
    return signalType;
  }

  public int position() {
    return position;
  }

  public Class<?> expectedType() {
    return expectedType;
  }

  public Class<?> foundType() {
    return foundType;
  }
}
