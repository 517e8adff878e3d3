package graphqlfilter.api;

/** How the filtered schema is produced once the reachable types are known. */
public enum FilterStrategy {

  /**
   * Rebuilds a new type graph in three phases (provisional build, reference reconciliation, root
   * assembly) over a name-keyed arena. Keeps every piece of metadata the in-memory schema carries.
   */
  RECONSTRUCT,

  /**
   * Prints the source schema to SDL, prunes the parsed document and lets the schema generator
   * re-resolve all references. Loses anything SDL cannot express.
   */
  TEXT
}
