package graphqlfilter.api;

/** Which implementors of a reachable interface become reachable themselves. */
public enum ImplementorPolicy {

  /**
   * Every object implementing a reachable interface is reachable, even when no exposed field leads
   * to it. This is the default: clients selecting on the interface can then use fragments on every
   * concrete type.
   */
  ALL_IMPLEMENTORS,

  /** Only implementors reached through exposed fields, unions or other edges are kept. */
  REACHABLE_ONLY
}
