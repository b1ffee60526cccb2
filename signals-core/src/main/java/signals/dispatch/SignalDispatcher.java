package signals.dispatch;

import signals.DispatchContext;
import signals.Listener;
import signals.ListenerBinding;
import signals.Signal;
import signals.SignatureMismatchException;
import signals.UnregisteredSignalException;
import signals.discovery.AnnotatedListenerDiscovery;
import signals.discovery.CachingListenerDiscovery;
import signals.discovery.ServiceLoaderSignalTypeScanner;
import signals.registry.SignalRegistry;
import signals.spi.ListenerDeclaration;
import signals.spi.ListenerDiscovery;
import signals.spi.LivenessOracle;
import signals.spi.MetricsExporter;
import signals.spi.SignalTypeScanner;
import signals.util.Primitives;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binds listener owners to the signals of the active {@link SignalRegistry} and invokes those
 * signals with validated arguments.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SignalDispatcher dispatcher = SignalDispatcher.builder()
 *     .livenessOracle(LivenessOracle.disposable())
 *     .build();
 * dispatcher.registerSignalTypes(SignalRegistry.curated(Ping.class, Move.class));
 *
 * dispatcher.bind(hud);
 * dispatcher.invoke(Move.class, vector, 1.5f);
 * dispatcher.unbind(hud);
 * }</pre>
 *
 * <h2>Re-entrancy</h2>
 * <p>Listeners may call {@link #bind}, {@link #unbind} and {@link #invoke} on the dispatcher that
 * is calling them. Dispatch depth is counted, so nested invocations are tracked correctly.
 * While any invocation is in progress, {@link #unbind} is deferred; deferred unbinds run when the
 * outermost {@link #invoke} returns or throws. Listeners bound during an invocation are first
 * called by the next one.
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Confine a dispatcher and its registry to one thread.
 *
 * @see SignalDispatcher.Builder
 * @see ListenerBindingTable
 */
public final class SignalDispatcher {
  private static final Logger logger = Logger.getLogger(SignalDispatcher.class.getName());

  private final LivenessOracle livenessOracle;
  private final CachingListenerDiscovery listenerDiscovery;
  private final SignalTypeScanner signalTypeScanner;
  private final MetricsExporter metrics;
  private final ListenerBindingTable bindingTable = new ListenerBindingTable();
  private final List<Object> deferredUnbinds = new ArrayList<>();
  private final DispatchContext context = new Context();

  private SignalRegistry registry;
  private int dispatchDepth;

  private SignalDispatcher(Builder builder) {
    this.livenessOracle = builder.livenessOracle != null ? builder.livenessOracle : LivenessOracle.ALWAYS_ALIVE;
    this.listenerDiscovery = CachingListenerDiscovery.of(
        builder.listenerDiscovery != null ? builder.listenerDiscovery : new AnnotatedListenerDiscovery());
    this.signalTypeScanner = builder.signalTypeScanner != null
        ? builder.signalTypeScanner : new ServiceLoaderSignalTypeScanner();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Binds an owner through a dispatcher that may not have been created yet.
   *
   * @throws IllegalArgumentException if {@code dispatcher} is null
   */
  public static void bind(SignalDispatcher dispatcher, Object owner) {
    if (dispatcher == null) {
      throw new IllegalArgumentException("No signal dispatcher is available to bind "
          + (owner == null ? "null" : owner.getClass().getName()));
    }
    dispatcher.bind(owner);
  }

  /**
   * Unbinds an owner, doing nothing if {@code dispatcher} is null. Suited to teardown paths
   * that may run after the dispatcher is gone.
   */
  public static void unbind(SignalDispatcher dispatcher, Object owner) {
    if (dispatcher != null) {
      dispatcher.unbind(owner);
    }
  }

  /**
   * Installs the active registry.
   *
   * <p>If a registry was already installed, every owner bound against it is unbound first, so no
   * binding keeps a reference into the replaced registry. Passing {@code null} installs a new
   * {@link SignalRegistry.Mode#DISCOVERED discovered} registry built from the configured
   * {@link SignalTypeScanner}.
   *
   * @param registry the registry to install, or {@code null} to discover one
   * @return the installed registry
   * @throws IllegalStateException if called while an invocation is in progress
   */
  public SignalRegistry registerSignalTypes(SignalRegistry registry) {
    if (dispatchDepth > 0) {
      throw new IllegalStateException("Cannot replace the signal registry while a signal is being invoked");
    }
    SignalRegistry next = registry != null ? registry : SignalRegistry.discover(signalTypeScanner);
    if (this.registry != null && !bindingTable.isEmpty()) {
      logger.log(Level.INFO, "Replacing signal registry; unbinding {0} owner(s) bound to the previous one",
          bindingTable.size());
      for (Object owner : bindingTable.owners()) {
        unbindNow(owner);
      }
    }
    this.registry = next;
    logger.log(Level.FINE, "Installed {0}", next);
    return next;
  }

  /**
   * Attaches every listener the owner declares to its signal.
   *
   * <p>All declarations are resolved and checked before any listener is attached. If attaching
   * fails part-way, the listeners already attached are removed again and the owner is left
   * unbound.
   *
   * @param owner the listener owner
   * @throws IllegalStateException                 if no registry is installed
   * @throws UnregisteredSignalException            if a listener targets an unregistered signal
   * @throws SignatureMismatchException             if a listener's parameters disagree with its signal
   * @throws signals.DuplicateListenerException     if a listener is already bound
   */
  public void bind(Object owner) {
    Objects.requireNonNull(owner, "owner");
    SignalRegistry active = requireRegistry("bind");
    Class<?> ownerType = owner.getClass();

    List<ListenerDeclaration> declarations = listenerDiscovery.discover(ownerType);
    List<Signal> targets = new ArrayList<>(declarations.size());
    for (ListenerDeclaration declaration : declarations) {
      Signal signal = active.get(declaration.signalType());
      if (signal == null) {
        throw UnregisteredSignalException.forBind(ownerType, declaration.signalType());
      }
      checkSignature(signal, declaration);
      targets.add(signal);
    }

    List<ListenerBindingTable.Entry> attached = new ArrayList<>(declarations.size());
    try {
      for (int i = 0; i < declarations.size(); i++) {
        ListenerDeclaration declaration = declarations.get(i);
        Listener listener = new Listener(owner, declaration);
        targets.get(i).addListener(listener, declaration.cardinality());
        attached.add(new ListenerBindingTable.Entry(targets.get(i), listener));
      }
    } catch (RuntimeException e) {
      for (ListenerBindingTable.Entry entry : attached) {
        entry.signal().removeListener(entry.listener());
      }
      logger.log(Level.WARNING, "Bind of {0} failed; detached {1} listener(s) already attached",
          new Object[] {describe(owner), attached.size()});
      throw e;
    }

    for (ListenerBindingTable.Entry entry : attached) {
      bindingTable.record(owner, entry.signal(), entry.listener());
    }
    metrics.recordBoundOwners(bindingTable.size());
    logger.log(Level.FINE, "Bound {0} listener(s) of {1}", new Object[] {attached.size(), describe(owner)});
  }

  /**
   * Detaches every listener bound for the owner. Does nothing if the owner holds no bindings.
   *
   * <p>While an invocation is in progress the unbind is queued and runs when the outermost
   * invocation completes.
   *
   * @param owner the listener owner
   */
  public void unbind(Object owner) {
    Objects.requireNonNull(owner, "owner");
    if (dispatchDepth > 0) {
      if (bindingTable.contains(owner) && !isDeferred(owner)) {
        deferredUnbinds.add(owner);
        metrics.incrementDeferredUnbinds();
        logger.log(Level.FINE, "Deferred unbind of {0} until dispatch completes", describe(owner));
      }
      return;
    }
    unbindNow(owner);
  }

  /**
   * Invokes a signal: every live listener bound to it is called once, in bind order.
   *
   * <p>Arguments are checked against the signal's parameters first; on failure no listener is
   * called. An unchecked exception thrown by a listener stops the fan-out and propagates
   * unchanged; a checked one is wrapped in {@link signals.ListenerInvocationException}. Deferred
   * unbinds are processed either way.
   *
   * @param signalType the signal to invoke
   * @param args       positional arguments matching the signal's parameters
   * @return the number of listeners called
   * @throws IllegalStateException                   if no registry is installed
   * @throws UnregisteredSignalException              if the signal type is not registered
   * @throws signals.ArityMismatchException           if the argument count is wrong
   * @throws signals.ArgumentTypeMismatchException    if an argument has the wrong type
   */
  public int invoke(Class<? extends Signal> signalType, Object... args) {
    Objects.requireNonNull(signalType, "signalType");
    SignalRegistry active = requireRegistry("invoke");
    return dispatch(signalType, active.get(signalType), args);
  }

  /**
   * Invokes a signal instance obtained from {@link #getSignal}, with the same checks and
   * bookkeeping as {@link #invoke(Class, Object...)}.
   *
   * @param signal the signal to invoke
   * @param args   positional arguments matching the signal's parameters
   * @return the number of listeners called
   * @throws IllegalStateException       if no registry is installed
   * @throws UnregisteredSignalException if the signal is not the instance held by the active registry
   */
  public int invoke(Signal signal, Object... args) {
    Objects.requireNonNull(signal, "signal");
    SignalRegistry active = requireRegistry("invoke");
    Class<? extends Signal> signalType = signal.getClass();
    return dispatch(signalType, active.get(signalType) == signal ? signal : null, args);
  }

  private int dispatch(Class<? extends Signal> signalType, Signal signal, Object[] args) {
    long start = System.nanoTime();
    boolean succeeded = false;
    dispatchDepth++;
    try {
      if (signal == null) {
        throw UnregisteredSignalException.forInvoke(signalType);
      }
      Object[] arguments = ArgumentValidator.validate(signalType, signal, args);
      int notified = signal.invoke(context, arguments);
      metrics.incrementListenersNotified(notified);
      succeeded = true;
      return notified;
    } finally {
      if (--dispatchDepth == 0) {
        drainDeferredUnbinds();
      }
      if (succeeded) {
        metrics.incrementDispatchSuccess();
      } else {
        metrics.incrementDispatchFailure();
      }
      metrics.recordDispatchDurationNanos(System.nanoTime() - start);
    }
  }

  /**
   * @return the registered signal, or {@code null} if it is not registered or no registry is
   *     installed
   */
  public <T extends Signal> T getSignal(Class<T> signalType) {
    Objects.requireNonNull(signalType, "signalType");
    return registry != null ? registry.get(signalType) : null;
  }

  /**
   * @return the active registry, or {@code null} before {@link #registerSignalTypes} is called
   */
  public SignalRegistry registry() {
    return registry;
  }

  public boolean isBound(Object owner) {
    return bindingTable.contains(owner);
  }

  /**
   * @return {@code true} while an {@link #invoke} call is on the stack
   */
  public boolean isDispatching() {
    return dispatchDepth > 0;
  }

  /**
   * Read-only view of which owners hold which bindings.
   */
  public ListenerBindingTable bindingTable() {
    return bindingTable;
  }

  /**
   * Returns whether instances of {@code ownerType} declare any listener. Discovery results are
   * cached, so this is cheap to call for every candidate owner.
   */
  public boolean declaresListeners(Class<?> ownerType) {
    return !listenerDiscovery.discover(ownerType).isEmpty();
  }

  private SignalRegistry requireRegistry(String operation) {
    if (registry == null) {
      throw new IllegalStateException("Cannot " + operation
          + " before a signal registry is installed; call registerSignalTypes first");
    }
    return registry;
  }

  private static void checkSignature(Signal signal, ListenerDeclaration declaration) {
    List<Class<?>> expected = signal.parameterTypes();
    List<Class<?>> found = declaration.parameterTypes();
    if (expected.size() != found.size()) {
      throw SignatureMismatchException.countMismatch(
          declaration.signalType(), declaration.name(), expected.size(), found.size());
    }
    for (int i = 0; i < expected.size(); i++) {
      if (!Primitives.accepts(found.get(i), expected.get(i))) {
        throw SignatureMismatchException.typeMismatch(
            declaration.signalType(), declaration.name(), i + 1, expected.get(i), found.get(i));
      }
    }
  }

  private void unbindNow(Object owner) {
    List<ListenerBindingTable.Entry> entries = bindingTable.remove(owner);
    if (entries.isEmpty()) {
      return;
    }
    for (ListenerBindingTable.Entry entry : entries) {
      entry.signal().removeListener(entry.listener());
    }
    metrics.recordBoundOwners(bindingTable.size());
    logger.log(Level.FINE, "Unbound {0} listener(s) of {1}", new Object[] {entries.size(), describe(owner)});
  }

  private void drainDeferredUnbinds() {
    while (!deferredUnbinds.isEmpty()) {
      unbindNow(deferredUnbinds.remove(0));
    }
  }

  private boolean isDeferred(Object owner) {
    for (Object deferred : deferredUnbinds) {
      if (deferred == owner) {
        return true;
      }
    }
    return false;
  }

  private static String describe(Object owner) {
    return owner.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(owner));
  }

  /**
   * Keeps the binding table in step with discards made by a signal during dispatch.
   */
  private final class Context implements DispatchContext {

    @Override
    public boolean isAlive(Object owner) {
      try {
        return livenessOracle.isAlive(owner);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Liveness check failed for " + describe(owner) + "; treating it as destroyed", e);
        return false;
      }
    }

    @Override
    public void ownerExpired(Object owner) {
      logger.log(Level.FINE, "Owner {0} is no longer alive; unbinding it", describe(owner));
      unbind(owner);
    }

    @Override
    public void bindingDiscarded(ListenerBinding binding) {
      if (bindingTable.forget(binding.listener())) {
        metrics.recordBoundOwners(bindingTable.size());
      }
      metrics.incrementListenersDiscarded();
    }
  }

  /**
   * Builder for {@link SignalDispatcher}. Every collaborator is optional.
   */
  public static final class Builder {
    private LivenessOracle livenessOracle;
    private ListenerDiscovery listenerDiscovery;
    private SignalTypeScanner signalTypeScanner;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the oracle consulted before each listener call.
     *
     * <p>Optional. Defaults to {@link LivenessOracle#ALWAYS_ALIVE}.
     *
     * @param livenessOracle the liveness oracle
     * @return this builder
     */
    public Builder livenessOracle(LivenessOracle livenessOracle) {
      this.livenessOracle = livenessOracle;
      return this;
    }

    /**
     * Sets how owner types declare their listeners. Results are cached per owner type.
     *
     * <p>Optional. Defaults to {@link AnnotatedListenerDiscovery}.
     *
     * @param listenerDiscovery the listener discovery
     * @return this builder
     */
    public Builder listenerDiscovery(ListenerDiscovery listenerDiscovery) {
      this.listenerDiscovery = listenerDiscovery;
      return this;
    }

    /**
     * Sets the scanner used when {@link SignalDispatcher#registerSignalTypes} is given
     * {@code null}.
     *
     * <p>Optional. Defaults to {@link ServiceLoaderSignalTypeScanner}.
     *
     * @param signalTypeScanner the signal type scanner
     * @return this builder
     */
    public Builder signalTypeScanner(SignalTypeScanner signalTypeScanner) {
      this.signalTypeScanner = signalTypeScanner;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public SignalDispatcher build() {
      return new SignalDispatcher(this);
    }
  }
}
