/**
 * Typed in-process signals.
 *
 * <p>A {@link signals.Signal} subclass declares an event kind and its parameter types. Owners
 * declare listeners with {@link signals.ListenTo}, and a
 * {@link signals.dispatch.SignalDispatcher} binds them and invokes signals synchronously, in
 * bind order.
 *
 * <p>Every failure the dispatcher raises extends {@link signals.SignalException}.
 */
package signals;
