package signals;

/**
 * Thrown when {@code null} is passed for a primitive signal parameter.
 */
public final class NullArgumentException extends ArgumentTypeMismatchException {

  public NullArgumentException(Class<? extends Signal> signalType, int position, Class<?> expectedType) {
    super(signalType, position, expectedType, null);
  }
}
