package signals;

/**
 * Base type for failures raised by the dispatcher itself, as opposed to failures raised inside
 * listener bodies.
 *
 * <p>All subclasses are local and recoverable: the dispatcher's binding state is consistent
 * after any of them.
 */
public class SignalException extends RuntimeException {

  public SignalException(String message) {
    super(message);
  }

  public SignalException(String message, Throwable cause) {
    super(message, cause);
  }
}
