package signals.spring.boot;

import org.junit.jupiter.api.Test;
import signals.registry.SignalRegistry;
import signals.spring.boot.sample.AbstractSampleSignal;
import signals.spring.boot.sample.Ping;
import signals.spring.boot.sample.Score;
import signals.spring.boot.sample.Scoreboard;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathSignalTypeScannerTest {

  private final ClassLoader classLoader = getClass().getClassLoader();

  @Test
  void findsSignalSubclassesUnderPackage() {
    var scanner = new ClasspathSignalTypeScanner(List.of("signals.spring.boot.sample"), classLoader);

    var types = scanner.scan();

    assertEquals(Set.of(Ping.class, Score.class, AbstractSampleSignal.class), types);
    assertFalse(types.contains(Scoreboard.class));
  }

  @Test
  void discoveredRegistrySkipsAbstractTypes() {
    var scanner = new ClasspathSignalTypeScanner(List.of("signals.spring.boot.sample"), classLoader);

    SignalRegistry registry = SignalRegistry.discover(scanner);

    assertEquals(Set.of(Ping.class, Score.class), registry.signalTypes());
  }

  @Test
  void noPackagesFindsNothing() {
    assertTrue(new ClasspathSignalTypeScanner(List.of(), classLoader).scan().isEmpty());
  }

  @Test
  void packageWithoutSignalsFindsNothing() {
    var scanner = new ClasspathSignalTypeScanner(List.of("signals.spring.boot.missing"), classLoader);

    assertTrue(scanner.scan().isEmpty());
  }
}
