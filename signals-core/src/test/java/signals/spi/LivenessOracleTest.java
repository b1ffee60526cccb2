package signals.spi;

import org.junit.jupiter.api.Test;
import signals.Disposable;

import static org.junit.jupiter.api.Assertions.*;

class LivenessOracleTest {

  static final class Component implements Disposable {
    boolean disposed;

    @Override
    public boolean isDisposed() {
      return disposed;
    }
  }

  @Test
  void alwaysAliveAcceptsEverything() {
    assertTrue(LivenessOracle.ALWAYS_ALIVE.isAlive(new Object()));
  }

  @Test
  void disposableOracleTracksDisposedFlag() {
    LivenessOracle oracle = LivenessOracle.disposable();
    Component component = new Component();

    assertTrue(oracle.isAlive(component));
    component.disposed = true;
    assertFalse(oracle.isAlive(component));
  }

  @Test
  void disposableOracleTreatsPlainObjectsAsAlive() {
    assertTrue(LivenessOracle.disposable().isAlive("plain"));
  }

  @Test
  void candidateExcludesAbstractAndBuiltInTypes() {
    assertTrue(SignalTypeScanner.isCandidate(signals.fixtures.Ping.class));
    assertFalse(SignalTypeScanner.isCandidate(signals.fixtures.AbstractPulse.class));
    assertFalse(SignalTypeScanner.isCandidate(signals.BuiltInSignal.class));
    assertFalse(SignalTypeScanner.isCandidate(signals.Signal.class));
    assertFalse(SignalTypeScanner.isCandidate(String.class));
  }
}
