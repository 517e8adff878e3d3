package graphqlfilter.core.format;

/** How the formatter orders a list of definitions or fields. */
public enum SortOrder {
  /** Sorted by name. */
  ALPHABETICAL,
  /** Printed in the order the schema printer produced. */
  NONE
}
