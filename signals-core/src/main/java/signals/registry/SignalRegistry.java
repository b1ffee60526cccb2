package signals.registry;

import signals.Signal;
import signals.SignalException;
import signals.spi.SignalTypeScanner;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The set of signal types known to one scope of the application, each instantiated as exactly
 * one {@link Signal}.
 *
 * <p>A registry is created in one of two modes, fixed for its lifetime:
 * <ul>
 *   <li>{@link Mode#DISCOVERED}: populated from a {@link SignalTypeScanner}, skipping abstract
 *       and built-in types</li>
 *   <li>{@link Mode#CURATED}: populated from an explicit list supplied by the host</li>
 * </ul>
 * Either way {@link #register(Class)} may add further types afterwards.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SignalRegistry registry = SignalRegistry.curated(Ping.class, Move.class);
 * Move move = registry.get(Move.class);
 * }</pre>
 *
 * <p>Once registered, a signal type keeps the same {@link Signal} instance for the registry's
 * lifetime. Registering it again is a no-op. Not thread-safe.
 *
 * @see signals.dispatch.SignalDispatcher#registerSignalTypes(SignalRegistry)
 */
public final class SignalRegistry {
  private static final Logger logger = Logger.getLogger(SignalRegistry.class.getName());

  /**
   * How a registry was populated.
   */
  public enum Mode {
    DISCOVERED,
    CURATED
  }

  private final Mode mode;
  private final Map<Class<? extends Signal>, Signal> signals = new LinkedHashMap<>();

  private SignalRegistry(Mode mode) {
    this.mode = mode;
  }

  /**
   * Creates a registry holding exactly the given signal types.
   *
   * @param signalTypes concrete signal types
   * @return a new curated registry
   * @throws SignalException if a type cannot be instantiated
   */
  @SafeVarargs
  public static SignalRegistry curated(Class<? extends Signal>... signalTypes) {
    Objects.requireNonNull(signalTypes, "signalTypes");
    return curated(Arrays.asList(signalTypes));
  }

  /**
   * Creates a registry holding exactly the given signal types, in iteration order.
   *
   * @param signalTypes concrete signal types
   * @return a new curated registry
   * @throws SignalException if a type cannot be instantiated
   */
  public static SignalRegistry curated(Collection<Class<? extends Signal>> signalTypes) {
    Objects.requireNonNull(signalTypes, "signalTypes");
    SignalRegistry registry = new SignalRegistry(Mode.CURATED);
    for (Class<? extends Signal> type : signalTypes) {
      registry.register(type);
    }
    return registry;
  }

  /**
   * Creates a registry holding every candidate type the scanner finds. Built-in and abstract
   * types are skipped (see {@link SignalTypeScanner#isCandidate(Class)}).
   *
   * @param scanner source of signal types
   * @return a new discovered registry
   * @throws SignalException if a type cannot be instantiated
   */
  public static SignalRegistry discover(SignalTypeScanner scanner) {
    Objects.requireNonNull(scanner, "scanner");
    SignalRegistry registry = new SignalRegistry(Mode.DISCOVERED);
    for (Class<? extends Signal> type : scanner.scan()) {
      if (SignalTypeScanner.isCandidate(type)) {
        registry.register(type);
      } else {
        logger.log(Level.FINE, "Skipping built-in or abstract signal type {0}", type.getName());
      }
    }
    logger.log(Level.FINE, "Discovered {0} signal type(s)", registry.size());
    return registry;
  }

  /**
   * Registers a signal type, instantiating its {@link Signal} if absent.
   *
   * @param signalType a concrete signal type with a no-arg constructor
   * @return the registered signal, existing or new
   * @throws SignalException if the type is abstract or cannot be instantiated
   */
  public <T extends Signal> T register(Class<T> signalType) {
    Objects.requireNonNull(signalType, "signalType");
    Signal existing = signals.get(signalType);
    if (existing != null) {
      return signalType.cast(existing);
    }
    T signal = instantiate(signalType);
    signals.put(signalType, signal);
    return signal;
  }

  /**
   * Looks up a registered signal. Never registers.
   *
   * @param signalType the signal type
   * @return the signal, or {@code null} if the type is not registered
   */
  public <T extends Signal> T get(Class<T> signalType) {
    Objects.requireNonNull(signalType, "signalType");
    return signalType.cast(signals.get(signalType));
  }

  public boolean contains(Class<? extends Signal> signalType) {
    return signals.containsKey(signalType);
  }

  /**
   * @return registered types, in registration order
   */
  public Set<Class<? extends Signal>> signalTypes() {
    return Collections.unmodifiableSet(signals.keySet());
  }

  public int size() {
    return signals.size();
  }

  public Mode mode() {
    return mode;
  }

  private static <T extends Signal> T instantiate(Class<T> signalType) {
    if (Modifier.isAbstract(signalType.getModifiers())) {
      throw new SignalException("Cannot register abstract signal type " + signalType.getName());
    }
    try {
      var constructor = signalType.getDeclaredConstructor();
      constructor.setAccessible(true);
      return constructor.newInstance();
    } catch (NoSuchMethodException e) {
      throw new SignalException("Signal type " + signalType.getName()
          + " must declare a no-arg constructor", e);
    } catch (InvocationTargetException e) {
      throw new SignalException("Failed to create signal " + signalType.getName(), e.getCause());
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new SignalException("Failed to create signal " + signalType.getName(), e);
    }
  }

  @Override
  public String toString() {
    return "SignalRegistry{mode=" + mode + ", signals=" + signals.values() + "}";
  }
}
