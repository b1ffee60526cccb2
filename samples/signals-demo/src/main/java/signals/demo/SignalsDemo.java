package signals.demo;

import signals.Cardinality;
import signals.Disposable;
import signals.ListenTo;
import signals.Signal0;
import signals.Signal2;
import signals.discovery.ListenerTable;
import signals.dispatch.SignalDispatcher;
import signals.registry.SignalRegistry;
import signals.spi.LivenessOracle;

/**
 * Simple demo showing signal dispatch without Spring.
 *
 * Run with: mvn -pl samples/signals-demo exec:java
 */
public final class SignalsDemo {

  public static void main(String[] args) {
    // 1. Register the signal types the demo uses
    SignalDispatcher dispatcher = SignalDispatcher.builder()
        .livenessOracle(LivenessOracle.disposable())
        .build();
    dispatcher.registerSignalTypes(SignalRegistry.curated(Ping.class, Move.class));

    // 2. Bind an annotated owner
    Hud hud = new Hud();
    dispatcher.bind(hud);

    dispatcher.invoke(Ping.class);
    dispatcher.invoke(Ping.class);
    dispatcher.invoke(Move.class, new Vector(1, 2), 1.5f);
    dispatcher.getSignal(Move.class).invoke(dispatcher, new Vector(3, 4), 2.0f);
    System.out.println("[Demo] pings=" + hud.pings + ", moves=" + hud.moves);

    // 3. A disposed owner is skipped and reclaimed by the next dispatch
    hud.dispose();
    int notified = dispatcher.invoke(Ping.class);
    System.out.println("[Demo] after dispose: notified=" + notified + ", bound=" + dispatcher.isBound(hud));

    // 4. Explicit declarations without annotations
    SignalDispatcher explicit = SignalDispatcher.builder()
        .listenerDiscovery(new ListenerTable()
            .declare(Radar.class, Move.class, Cardinality.EVERY, "track",
                Vector.class, float.class, Radar::track))
        .build();
    explicit.registerSignalTypes(SignalRegistry.curated(Move.class));
    Radar radar = new Radar();
    explicit.bind(radar);
    explicit.invoke(Move.class, new Vector(5, 6), 0.5f);
    explicit.unbind(radar);
    explicit.invoke(Move.class, new Vector(7, 8), 0.5f);
    System.out.println("[Demo] radar tracked " + radar.tracked + " move(s)");
  }

  public static final class Ping extends Signal0 {
  }

  public static final class Move extends Signal2<Vector, Float> {
    public Move() {
      super(Vector.class, float.class);
    }
  }

  public static final class Vector {
    final float x;
    final float y;

    Vector(float x, float y) {
      this.x = x;
      this.y = y;
    }

    @Override
    public String toString() {
      return "(" + x + ", " + y + ")";
    }
  }

  static final class Hud implements Disposable {
    int pings;
    int moves;
    private boolean disposed;

    @ListenTo(Ping.class)
    void onPing() {
      pings++;
      System.out.println("[Hud] ping #" + pings);
    }

    @ListenTo(value = Move.class, cardinality = Cardinality.ONCE)
    void onFirstMove(Vector position, float speed) {
      moves++;
      System.out.println("[Hud] first move to " + position + " at " + speed);
    }

    void dispose() {
      disposed = true;
    }

    @Override
    public boolean isDisposed() {
      return disposed;
    }
  }

  static final class Radar {
    int tracked;

    void track(Vector position, Float speed) {
      tracked++;
      System.out.println("[Radar] " + position + " at " + speed);
    }
  }
}
