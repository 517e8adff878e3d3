package graphqlfilter.api;

/** Base class of every error raised while filtering a schema. */
public class SchemaFilterException extends RuntimeException {

  public SchemaFilterException(String message) {
    super(message);
  }

  public SchemaFilterException(String message, Throwable cause) {
    super(message, cause);
  }
}
