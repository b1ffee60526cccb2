package signals.registry;

import org.junit.jupiter.api.Test;
import signals.BuiltInSignal;
import signals.Signal;
import signals.SignalException;
import signals.discovery.ServiceLoaderSignalTypeScanner;
import signals.fixtures.AbstractPulse;
import signals.fixtures.Count;
import signals.fixtures.Label;
import signals.fixtures.Move;
import signals.fixtures.Ping;
import signals.fixtures.Quad;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SignalRegistryTest {

  public static final class NoDefaultConstructor extends Signal {
    public NoDefaultConstructor(Class<?> type) {
      super(type);
    }
  }

  public static final class FailingConstructor extends Signal {
    public FailingConstructor() {
      throw new IllegalStateException("cannot build");
    }
  }

  @Test
  void curatedRegistryHoldsExactlyTheGivenTypes() {
    SignalRegistry registry = SignalRegistry.curated(Ping.class, Move.class);

    assertEquals(SignalRegistry.Mode.CURATED, registry.mode());
    assertEquals(2, registry.size());
    assertEquals(List.of(Ping.class, Move.class), List.copyOf(registry.signalTypes()));
    assertNotNull(registry.get(Ping.class));
    assertNull(registry.get(Count.class));
  }

  @Test
  void registerIsIdempotentAndKeepsSignalIdentity() {
    SignalRegistry registry = SignalRegistry.curated(Ping.class);
    Ping first = registry.get(Ping.class);

    Ping again = registry.register(Ping.class);

    assertSame(first, again);
    assertSame(first, registry.get(Ping.class));
    assertEquals(1, registry.size());
  }

  @Test
  void getNeverRegisters() {
    SignalRegistry registry = SignalRegistry.curated();

    assertNull(registry.get(Ping.class));
    assertFalse(registry.contains(Ping.class));
    assertEquals(0, registry.size());
  }

  @Test
  void registerAddsToCuratedRegistry() {
    SignalRegistry registry = SignalRegistry.curated(Ping.class);

    Count count = registry.register(Count.class);

    assertSame(count, registry.get(Count.class));
    assertTrue(registry.contains(Count.class));
  }

  @Test
  void discoverSkipsAbstractAndBuiltInTypes() {
    Set<Class<? extends Signal>> scanned = new LinkedHashSet<>(
        List.of(Ping.class, AbstractPulse.class, BuiltInSignal.class, Label.class));

    SignalRegistry registry = SignalRegistry.discover(() -> scanned);

    assertEquals(SignalRegistry.Mode.DISCOVERED, registry.mode());
    assertEquals(List.of(Ping.class, Label.class), List.copyOf(registry.signalTypes()));
  }

  @Test
  void discoverReadsServiceFilesFromClassPath() {
    SignalRegistry registry = SignalRegistry.discover(new ServiceLoaderSignalTypeScanner());

    assertEquals(Set.of(Ping.class, Move.class, Label.class, Count.class, Quad.class), registry.signalTypes());
  }

  @Test
  void abstractTypeCannotBeRegistered() {
    SignalRegistry registry = SignalRegistry.curated();

    assertThrows(SignalException.class, () -> registry.register(AbstractPulse.class));
  }

  @Test
  void typeWithoutNoArgConstructorFailsWithSignalException() {
    SignalException ex = assertThrows(SignalException.class,
        () -> SignalRegistry.curated(NoDefaultConstructor.class));

    assertTrue(ex.getMessage().contains("no-arg constructor"));
  }

  @Test
  void constructorFailureIsWrappedWithCause() {
    SignalException ex = assertThrows(SignalException.class,
        () -> SignalRegistry.curated(FailingConstructor.class));

    assertInstanceOf(IllegalStateException.class, ex.getCause());
  }
}
