package graphqlfilter.core.format;

/**
 * Options for {@link SchemaFormatter}.
 *
 * @param definitions ordering of top-level definitions within their groups
 * @param fields ordering of the fields of objects, interfaces and input objects
 */
public record FormatOptions(SortOrder definitions, SortOrder fields) {

  private static final FormatOptions ALPHABETICAL =
      new FormatOptions(SortOrder.ALPHABETICAL, SortOrder.ALPHABETICAL);

  /** Sorts both definitions and fields. */
  public static FormatOptions alphabetical() {
    return ALPHABETICAL;
  }
}
