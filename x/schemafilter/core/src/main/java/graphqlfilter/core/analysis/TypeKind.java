package graphqlfilter.core.analysis;

import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLUnionType;

/** The closed set of named type kinds a schema can declare. */
public enum TypeKind {
  OBJECT,
  INTERFACE,
  UNION,
  INPUT_OBJECT,
  ENUM,
  SCALAR;

  private static final String RESERVED_PREFIX = "__";

  /**
   * Classifies a named type.
   *
   * @param type the type
   * @return the kind
   * @throws IllegalArgumentException for type references or unknown implementations
   */
  public static TypeKind of(GraphQLNamedType type) {
    if (type instanceof GraphQLObjectType) {
      return OBJECT;
    } else if (type instanceof GraphQLInterfaceType) {
      return INTERFACE;
    } else if (type instanceof GraphQLUnionType) {
      return UNION;
    } else if (type instanceof GraphQLInputObjectType) {
      return INPUT_OBJECT;
    } else if (type instanceof GraphQLEnumType) {
      return ENUM;
    } else if (type instanceof GraphQLScalarType) {
      return SCALAR;
    }
    throw new IllegalArgumentException(
        "Unsupported named type " + type.getName() + " (" + type.getClass().getSimpleName() + ")");
  }

  /** Checks whether a type name is reserved for introspection. */
  public static boolean isReservedName(String typeName) {
    return typeName.startsWith(RESERVED_PREFIX);
  }

  /** Object and interface fields default to hidden on root and disabled types; inputs do not. */
  public boolean hasOutputFields() {
    return this == OBJECT || this == INTERFACE;
  }
}
