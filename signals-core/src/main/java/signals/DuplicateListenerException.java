package signals;

/**
 * Thrown when the same listener of the same owner is added to a signal twice.
 */
public final class DuplicateListenerException extends SignalException {

  private final transient Listener listener;

  public DuplicateListenerException(Signal signal, Listener listener) {
    super("Attempted to add a duplicate " + listener.name() + " listener to '" + signal.name()
        + "' for " + listener.owner().getClass().getName());
    this.listener = listener;
  }

  public Listener listener() {
    return listener;
  }
}
