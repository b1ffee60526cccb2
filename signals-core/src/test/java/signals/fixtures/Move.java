package signals.fixtures;

import signals.Signal2;

public final class Move extends Signal2<Vector, Float> {

  public Move() {
    super(Vector.class, float.class);
  }
}
