package signals.fixtures;

import signals.Signal0;

public final class Ping extends Signal0 {
}
