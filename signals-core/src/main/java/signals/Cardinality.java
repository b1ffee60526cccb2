package signals;

/**
 * How often a bound listener fires.
 */
public enum Cardinality {
  /** Fires on every invocation until unbound. */
  EVERY,
  /** Fires on the first invocation and is then removed. */
  ONCE
}
