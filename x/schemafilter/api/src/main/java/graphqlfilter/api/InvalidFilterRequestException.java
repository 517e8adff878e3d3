package graphqlfilter.api;

/** Raised before any analysis starts when a {@link FilterRequest} cannot be served. */
public class InvalidFilterRequestException extends SchemaFilterException {

  public InvalidFilterRequestException(String message) {
    super(message);
  }
}
