package signals;

/**
 * Thrown when a signal type is invoked or listened to but was never registered with the active
 * {@link signals.registry.SignalRegistry}.
 */
public final class UnregisteredSignalException extends SignalException {

  private final Class<? extends Signal> signalType;

  private UnregisteredSignalException(Class<? extends Signal> signalType, String message) {
    super(message);
    this.signalType = signalType;
  }

  /**
   * For {@code invoke} against an unknown signal type.
   */
  public static UnregisteredSignalException forInvoke(Class<? extends Signal> signalType) {
    return new UnregisteredSignalException(signalType, "The signal '" + signalType.getSimpleName()
        + "' is not registered with the dispatcher's registry. Register it before invoking it.");
  }

  /**
   * For {@code bind} of an owner that listens to an unknown signal type.
   */
  public static UnregisteredSignalException forBind(Class<?> ownerType, Class<? extends Signal> signalType) {
    return new UnregisteredSignalException(signalType, "Unable to bind signals for an instance of '"
        + ownerType.getName() + "'. The signal '" + signalType.getName()
        + "' is not registered with the dispatcher.");
  }

  public Class<? extends Signal> signalType() {
    return signalType;
  }
}
