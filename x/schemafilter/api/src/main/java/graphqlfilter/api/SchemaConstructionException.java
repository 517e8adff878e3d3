package graphqlfilter.api;

/**
 * Raised when the filtered schema graph cannot be assembled consistently, for example when two
 * distinct types share one name or a reference cannot be resolved.
 *
 * <p>This always signals a defect in the build order, never a transient condition, and is never
 * recovered from by deduplicating types.
 */
public class SchemaConstructionException extends SchemaFilterException {

  public SchemaConstructionException(String message) {
    super(message);
  }

  public SchemaConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
