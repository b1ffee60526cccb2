package signals;

/**
 * Carries a checked exception thrown by a listener body out of {@code invoke}.
 *
 * <p>Not a {@link SignalException}: it reports a listener failure, not a dispatcher failure.
 * Unchecked listener exceptions are never wrapped.
 */
public final class ListenerInvocationException extends RuntimeException {

  private final transient Listener listener;

  public ListenerInvocationException(Listener listener, Exception cause) {
    super("Listener " + listener.name() + " failed: " + cause, cause);
    this.listener = listener;
  }

  public Listener listener() {
    return listener;
  }
}
