package graphqlfilter.core.reconstruction;

import graphql.GraphQLException;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLDirective;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLTypeReference;
import graphql.schema.GraphQLUnionType;
import graphql.schema.idl.DirectiveInfo;
import graphqlfilter.api.EmptyQueryRootException;
import graphqlfilter.api.RootOperation;
import graphqlfilter.api.SchemaConstructionException;
import graphqlfilter.core.FilterLog;
import graphqlfilter.core.analysis.FieldExposure;
import graphqlfilter.core.analysis.RootTypeNames;
import graphqlfilter.core.analysis.TypeKind;
import graphqlfilter.core.reachability.ReachableSet;
import graphqlfilter.core.reachability.SurvivingTypes;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a new, self-contained filtered schema from the reachable part of a source schema.
 *
 * <p>The build runs in three phases over a {@link TypeArena}:
 *
 * <ol>
 *   <li><b>Provisional build</b> - every surviving type, roots included, is published with its
 *       filtered field set. Fields still point at source types; the entries only mark which names
 *       exist.
 *   <li><b>Reference reconciliation</b> - every surviving non-root type is rebuilt from its
 *       source definition, with each field, argument, interface and union member resolved through
 *       the arena, and replaces its provisional entry immediately. A reference to a type that is
 *       not reconciled yet (a later type, or the type itself) becomes a type reference that the
 *       schema builder swaps for the final instance.
 *   <li><b>Root assembly</b> - the query, mutation and subscription roots are rebuilt the same
 *       way. Empty mutation and subscription roots are left out; an empty query root raises
 *       {@link EmptyQueryRootException}.
 * </ol>
 *
 * <p>Enum and scalar types, and input types used by custom directive definitions, are shared with
 * the source schema rather than copied. They are never filtered, and applied directives copied
 * from source elements refer to them through their arguments, so sharing keeps those references
 * identical to the types the filtered schema registers. Every other type of the result is a new
 * instance, and no new instance refers back to a source object or interface.
 */
public class SchemaReconstructor {

  private final FilterLog log;

  public SchemaReconstructor(FilterLog log) {
    this.log = log.forClass(SchemaReconstructor.class);
  }

  /**
   * Reconstructs the filtered schema.
   *
   * @param schema the source schema, left unchanged
   * @param exposure the exposure predicate of the request
   * @param reachable the types reachable for the request
   * @return the filtered schema
   * @throws EmptyQueryRootException if no query root field is exposed
   * @throws SchemaConstructionException if the result graph is inconsistent
   */
  public GraphQLSchema reconstruct(
      GraphQLSchema schema, FieldExposure exposure, ReachableSet reachable) {
    SurvivingTypes survivors = SurvivingTypes.compute(schema, exposure, reachable);
    RootTypeNames rootTypeNames = exposure.rootTypeNames();
    requireQueryRoot(rootTypeNames, survivors, exposure.target());

    TypeArena arena = new TypeArena();
    provisionalBuild(schema, survivors, arena);
    log.debug("[Reconstruction] Phase 1: {} provisional types", arena.size());

    reconcileReferences(schema, survivors, rootTypeNames, arena);
    log.debug("[Reconstruction] Phase 2: {} types reconciled", arena.reconciledTypes().size());

    Map<RootOperation, GraphQLObjectType> roots =
        assembleRoots(schema, survivors, rootTypeNames, arena, exposure.target());
    log.debug("[Reconstruction] Phase 3: roots {}", roots.keySet());

    return assemble(schema, arena, roots, exposure.target());
  }

  private void provisionalBuild(GraphQLSchema schema, SurvivingTypes survivors, TypeArena arena) {
    for (String name : survivors.typeNames()) {
      GraphQLNamedType source = schema.getTypeMap().get(name);
      GraphQLNamedType provisional =
          switch (TypeKind.of(source)) {
            case OBJECT -> {
              GraphQLObjectType object = (GraphQLObjectType) source;
              yield object.transform(
                  builder -> {
                    builder.clearFields();
                    survivors.keptFields(object).forEach(builder::field);
                  });
            }
            case INTERFACE -> {
              GraphQLInterfaceType iface = (GraphQLInterfaceType) source;
              yield iface.transform(
                  builder -> {
                    builder.clearFields();
                    survivors.keptFields(iface).forEach(builder::field);
                  });
            }
            case INPUT_OBJECT -> {
              GraphQLInputObjectType input = (GraphQLInputObjectType) source;
              if (survivors.isDirectiveInput(name)) {
                yield input;
              }
              yield input.transform(
                  builder -> {
                    builder.clearFields();
                    survivors.keptFields(input).forEach(builder::field);
                  });
            }
            case UNION, ENUM, SCALAR -> source;
          };
      arena.publishProvisional(provisional);
    }
  }

  private void reconcileReferences(
      GraphQLSchema schema,
      SurvivingTypes survivors,
      RootTypeNames rootTypeNames,
      TypeArena arena) {
    for (String name : survivors.typeNames()) {
      if (rootTypeNames.contains(name)) {
        continue;
      }
      GraphQLNamedType source = schema.getTypeMap().get(name);
      GraphQLNamedType rebuilt =
          switch (TypeKind.of(source)) {
            case OBJECT -> rebuildObject((GraphQLObjectType) source, survivors, arena);
            case INTERFACE -> rebuildInterface((GraphQLInterfaceType) source, survivors, arena);
            case UNION -> rebuildUnion((GraphQLUnionType) source, survivors, arena);
            case INPUT_OBJECT ->
                survivors.isDirectiveInput(name)
                    ? source
                    : rebuildInput((GraphQLInputObjectType) source, survivors, arena);
            case ENUM, SCALAR -> source;
          };
      arena.reconcile(rebuilt);
    }
  }

  private Map<RootOperation, GraphQLObjectType> assembleRoots(
      GraphQLSchema schema,
      SurvivingTypes survivors,
      RootTypeNames rootTypeNames,
      TypeArena arena,
      String target) {
    Map<RootOperation, GraphQLObjectType> roots = new EnumMap<>(RootOperation.class);
    for (RootOperation operation : RootOperation.values()) {
      String name = rootTypeNames.nameFor(operation);
      if (name == null) {
        continue;
      }
      if (!survivors.contains(name)) {
        log.info("Root type {} has no fields exposed to target '{}', omitting it", name, target);
        continue;
      }
      GraphQLObjectType root =
          rebuildObject(schema.getObjectType(name), survivors, arena);
      arena.reconcile(root);
      roots.put(operation, root);
    }
    return roots;
  }

  /**
   * Builds the schema from a fully reconciled arena. Duplicate names and unresolved references
   * surface here as graphql-java errors and are reported as construction failures.
   */
  static GraphQLSchema assemble(
      GraphQLSchema source,
      TypeArena arena,
      Map<RootOperation, GraphQLObjectType> roots,
      String target) {
    GraphQLSchema.Builder builder =
        GraphQLSchema.newSchema().codeRegistry(source.getCodeRegistry());
    builder.query(roots.get(RootOperation.QUERY));
    if (roots.containsKey(RootOperation.MUTATION)) {
      builder.mutation(roots.get(RootOperation.MUTATION));
    }
    if (roots.containsKey(RootOperation.SUBSCRIPTION)) {
      builder.subscription(roots.get(RootOperation.SUBSCRIPTION));
    }

    for (GraphQLNamedType type : arena.reconciledTypes()) {
      if (!roots.containsValue(type)) {
        builder.additionalType(type);
      }
    }

    for (GraphQLDirective directive : source.getDirectives()) {
      if (!DirectiveInfo.isGraphqlSpecifiedDirective(directive.getName())) {
        builder.additionalDirective(rebuildDirective(directive, arena));
      }
    }

    try {
      return builder.build();
    } catch (GraphQLException e) {
      throw new SchemaConstructionException(
          "Filtered schema for target '" + target + "' could not be built: " + e.getMessage(), e);
    }
  }

  private static void requireQueryRoot(
      RootTypeNames rootTypeNames, SurvivingTypes survivors, String target) {
    String query = rootTypeNames.query();
    if (query == null || !survivors.contains(query)) {
      throw new EmptyQueryRootException(query == null ? "Query" : query, target);
    }
  }

  private static GraphQLObjectType rebuildObject(
      GraphQLObjectType source, SurvivingTypes survivors, TypeArena arena) {
    return source.transform(
        builder -> {
          builder.clearFields();
          for (GraphQLFieldDefinition field : survivors.keptFields(source)) {
            builder.field(rebuildField(field, arena));
          }
          builder.replaceInterfaces(
              survivingInterfaces(source.getInterfaces(), survivors, arena));
        });
  }

  private static GraphQLInterfaceType rebuildInterface(
      GraphQLInterfaceType source, SurvivingTypes survivors, TypeArena arena) {
    return source.transform(
        builder -> {
          builder.clearFields();
          for (GraphQLFieldDefinition field : survivors.keptFields(source)) {
            builder.field(rebuildField(field, arena));
          }
          builder.replaceInterfacesOrReferences(
              survivingInterfaces(source.getInterfaces(), survivors, arena));
        });
  }

  // Reconciled interfaces, or type references for those not reconciled yet
  private static List<GraphQLNamedOutputType> survivingInterfaces(
      List<GraphQLNamedOutputType> interfaces, SurvivingTypes survivors, TypeArena arena) {
    List<GraphQLNamedOutputType> resolved = new ArrayList<>();
    for (GraphQLNamedOutputType iface : interfaces) {
      if (survivors.contains(iface.getName())) {
        resolved.add((GraphQLNamedOutputType) arena.resolve(iface.getName()));
      }
    }
    return resolved;
  }

  private static GraphQLUnionType rebuildUnion(
      GraphQLUnionType source, SurvivingTypes survivors, TypeArena arena) {
    return source.transform(
        builder -> {
          builder.clearPossibleTypes();
          for (GraphQLNamedOutputType member : source.getTypes()) {
            if (!survivors.contains(member.getName())) {
              continue;
            }
            GraphQLNamedType resolved = arena.resolve(member.getName());
            if (resolved instanceof GraphQLObjectType reconciled) {
              builder.possibleType(reconciled);
            } else {
              builder.possibleType((GraphQLTypeReference) resolved);
            }
          }
        });
  }

  private static GraphQLInputObjectType rebuildInput(
      GraphQLInputObjectType source, SurvivingTypes survivors, TypeArena arena) {
    return source.transform(
        builder -> {
          builder.clearFields();
          for (GraphQLInputObjectField field : survivors.keptFields(source)) {
            builder.field(
                field.transform(
                    fieldBuilder ->
                        fieldBuilder.type((GraphQLInputType) arena.rewrap(field.getType()))));
          }
        });
  }

  private static GraphQLFieldDefinition rebuildField(
      GraphQLFieldDefinition field, TypeArena arena) {
    return field.transform(
        builder -> {
          builder.type((GraphQLOutputType) arena.rewrap(field.getType()));
          // Arguments are keyed by name, so each rebuilt argument replaces its source copy
          for (GraphQLArgument argument : field.getArguments()) {
            builder.argument(rebuildArgument(argument, arena));
          }
        });
  }

  private static GraphQLDirective rebuildDirective(GraphQLDirective directive, TypeArena arena) {
    return directive.transform(
        builder -> {
          for (GraphQLArgument argument : directive.getArguments()) {
            builder.argument(rebuildArgument(argument, arena));
          }
        });
  }

  private static GraphQLArgument rebuildArgument(GraphQLArgument argument, TypeArena arena) {
    return argument.transform(
        builder -> builder.type((GraphQLInputType) arena.rewrap(argument.getType())));
  }
}
