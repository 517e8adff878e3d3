package graphqlfilter.core.analysis;

import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphqlfilter.api.RootOperation;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Names of the root types a schema declares. Each root is optional.
 *
 * @param query the query root name
 * @param mutation the mutation root name
 * @param subscription the subscription root name
 */
public record RootTypeNames(
    @Nullable String query, @Nullable String mutation, @Nullable String subscription) {

  /** Reads the root type names of a schema. */
  public static RootTypeNames of(GraphQLSchema schema) {
    return new RootTypeNames(
        nameOf(schema.getQueryType()),
        nameOf(schema.getMutationType()),
        nameOf(schema.getSubscriptionType()));
  }

  public @Nullable String nameFor(RootOperation operation) {
    return switch (operation) {
      case QUERY -> query;
      case MUTATION -> mutation;
      case SUBSCRIPTION -> subscription;
    };
  }

  /**
   * Finds the operation a type name is the root of.
   *
   * @param typeName the type name
   * @return the operation, or empty if the type is not a root type
   */
  public Optional<RootOperation> operationOf(String typeName) {
    for (RootOperation operation : RootOperation.values()) {
      if (typeName.equals(nameFor(operation))) {
        return Optional.of(operation);
      }
    }
    return Optional.empty();
  }

  public boolean contains(String typeName) {
    return operationOf(typeName).isPresent();
  }

  private static @Nullable String nameOf(@Nullable GraphQLObjectType type) {
    return type == null ? null : type.getName();
  }
}
