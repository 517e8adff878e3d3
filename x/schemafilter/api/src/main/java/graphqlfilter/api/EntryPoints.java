package graphqlfilter.api;

import java.util.Set;

/**
 * Root fields a filter run starts from.
 *
 * <p>When a request carries entry points, a root field survives only if it is listed here for its
 * operation and its own {@code @expose} rule admits the target. Listing a field that does not exist
 * on its root type is not an error: it is reported as a warning and skipped.
 *
 * @param queryFields field names on the query root
 * @param mutationFields field names on the mutation root
 * @param subscriptionFields field names on the subscription root
 */
public record EntryPoints(
    Set<String> queryFields, Set<String> mutationFields, Set<String> subscriptionFields) {

  public EntryPoints {
    queryFields = Set.copyOf(queryFields);
    mutationFields = Set.copyOf(mutationFields);
    subscriptionFields = Set.copyOf(subscriptionFields);
  }

  /** Entry points on the query root only. */
  public static EntryPoints queries(String... fieldNames) {
    return new EntryPoints(Set.of(fieldNames), Set.of(), Set.of());
  }

  /** Returns a copy that additionally starts from the given mutation fields. */
  public EntryPoints withMutations(String... fieldNames) {
    return new EntryPoints(queryFields, Set.of(fieldNames), subscriptionFields);
  }

  /** Returns a copy that additionally starts from the given subscription fields. */
  public EntryPoints withSubscriptions(String... fieldNames) {
    return new EntryPoints(queryFields, mutationFields, Set.of(fieldNames));
  }

  /**
   * Returns the listed field names for a root operation.
   *
   * @param operation the root operation
   * @return the field names, possibly empty
   */
  public Set<String> fieldsFor(RootOperation operation) {
    return switch (operation) {
      case QUERY -> queryFields;
      case MUTATION -> mutationFields;
      case SUBSCRIPTION -> subscriptionFields;
    };
  }
}
