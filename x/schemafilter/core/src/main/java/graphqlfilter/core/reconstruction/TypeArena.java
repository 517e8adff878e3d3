package graphqlfilter.core.reconstruction;

import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeReference;
import graphqlfilter.api.SchemaConstructionException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-keyed table of the types being built for one filtered schema.
 *
 * <p>Each name moves through two states: <em>provisional</em> once phase 1 decides the type
 * survives, and <em>reconciled</em> once its final instance has been built. A name is reconciled
 * exactly once; a second reconciliation means two distinct instances would share the name and is
 * rejected as a construction error.
 *
 * <p>{@link #resolve(String)} is how every reference inside the filtered schema is created: it
 * returns the reconciled instance when one exists and a {@link GraphQLTypeReference} placeholder
 * otherwise. Placeholders are replaced by the schema builder with the single instance registered
 * under that name, so forward references and self references end at the final type as well.
 */
final class TypeArena {

  private record Entry(GraphQLNamedType type, boolean reconciled) {}

  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /**
   * Publishes the phase 1 form of a surviving type.
   *
   * @throws SchemaConstructionException if the name is already published
   */
  void publishProvisional(GraphQLNamedType type) {
    Entry previous = entries.putIfAbsent(type.getName(), new Entry(type, false));
    if (previous != null) {
      throw new SchemaConstructionException(
          "Type '" + type.getName() + "' was published twice during the provisional build");
    }
  }

  /**
   * Replaces the provisional entry of a type with its final instance.
   *
   * @throws SchemaConstructionException if the name was never published or is already reconciled
   */
  void reconcile(GraphQLNamedType type) {
    Entry current = entries.get(type.getName());
    if (current == null) {
      throw new SchemaConstructionException(
          "Type '" + type.getName() + "' was reconciled without being published");
    }
    if (current.reconciled()) {
      throw new SchemaConstructionException(
          "Type '" + type.getName() + "' was reconciled twice");
    }
    entries.put(type.getName(), new Entry(type, true));
  }

  boolean contains(String name) {
    return entries.containsKey(name);
  }

  boolean isReconciled(String name) {
    Entry entry = entries.get(name);
    return entry != null && entry.reconciled();
  }

  /**
   * Returns the current entry for a name, provisional or reconciled.
   *
   * @throws SchemaConstructionException if the name was never published
   */
  GraphQLNamedType lookup(String name) {
    Entry entry = entries.get(name);
    if (entry == null) {
      throw new SchemaConstructionException(
          "Type '" + name + "' is referenced but is not part of the filtered schema");
    }
    return entry.type();
  }

  /**
   * Resolves a reference to a named type.
   *
   * @param name the referenced type name
   * @return the reconciled instance, or a type reference if the name is still provisional
   * @throws SchemaConstructionException if the name was never published
   */
  GraphQLNamedType resolve(String name) {
    Entry entry = entries.get(name);
    if (entry == null) {
      throw new SchemaConstructionException(
          "Type '" + name + "' is referenced but is not part of the filtered schema");
    }
    return entry.reconciled() ? entry.type() : GraphQLTypeReference.typeRef(name);
  }

  /**
   * Rebuilds a wrapped type (lists and non-nulls around one named type) with the named type
   * resolved through this arena.
   */
  GraphQLType rewrap(GraphQLType type) {
    if (type instanceof GraphQLNonNull nonNull) {
      return GraphQLNonNull.nonNull(rewrap(nonNull.getWrappedType()));
    }
    if (type instanceof GraphQLList list) {
      return GraphQLList.list(rewrap(list.getWrappedType()));
    }
    return resolve(((GraphQLNamedType) type).getName());
  }

  /** Reconciled types, in publication order. */
  List<GraphQLNamedType> reconciledTypes() {
    List<GraphQLNamedType> types = new ArrayList<>();
    for (Entry entry : entries.values()) {
      if (entry.reconciled()) {
        types.add(entry.type());
      }
    }
    return types;
  }

  int size() {
    return entries.size();
  }
}
