package signals;

/**
 * Thrown when {@code invoke} receives a different number of arguments than the signal declares.
 */
public final class ArityMismatchException extends SignalException {

  private final Class<? extends Signal> signalType;
  private final int expected;
  private final int provided;

  public ArityMismatchException(Class<? extends Signal> signalType, int expected, int provided) {
    super("Incorrect number of arguments passed to 'invoke(" + signalType.getSimpleName() + ", ...)'. "
        + "Expected " + expected + " argument(s) but " + provided + " were provided.");
    this.signalType = signalType;
    this.expected = expected;
    this.provided = provided;
  }

  public Class<? extends Signal> signalType() {
    return signalType;
  }

  public int expected() {
    return expected;
  }

  public int provided() {
    return provided;
  }
}
