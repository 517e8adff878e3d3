package graphqlfilter.api;

import org.jspecify.annotations.Nullable;

/**
 * A request to derive the schema visible to one target.
 *
 * <p>The target is validated when the request is created, so no analysis work is ever started for
 * an unusable request.
 *
 * @param target the audience identifier, e.g. {@code "admin"}
 * @param entryPoints optional manual entry points; {@code null} starts from every root field
 */
public record FilterRequest(String target, @Nullable EntryPoints entryPoints) {

  public FilterRequest {
    if (target == null || target.isBlank()) {
      throw new InvalidFilterRequestException("target must be a non-empty string");
    }
  }

  /**
   * Creates a request for the given target starting from every root field.
   *
   * @param target the audience identifier
   * @return the request
   * @throws InvalidFilterRequestException if the target is null or blank
   */
  public static FilterRequest of(String target) {
    return new FilterRequest(target, null);
  }

  /** Returns a copy of this request restricted to the given entry points. */
  public FilterRequest withEntryPoints(EntryPoints entryPoints) {
    return new FilterRequest(target, entryPoints);
  }
}
