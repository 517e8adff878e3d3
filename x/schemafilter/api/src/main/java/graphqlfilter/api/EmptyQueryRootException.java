package graphqlfilter.api;

/**
 * Raised when no field of the query root is exposed to the requested target.
 *
 * <p>Empty mutation and subscription roots are simply left out of the filtered schema, but a
 * GraphQL schema cannot exist without a query root.
 */
public class EmptyQueryRootException extends SchemaFilterException {

  private final String target;

  public EmptyQueryRootException(String queryTypeName, String target) {
    super(
        "No field of query root '"
            + queryTypeName
            + "' is exposed to target '"
            + target
            + "'");
    this.target = target;
  }

  public String getTarget() {
    return target;
  }
}
