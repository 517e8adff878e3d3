package graphqlfilter.core.reachability;

import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLDirective;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;
import graphql.schema.idl.DirectiveInfo;
import graphqlfilter.api.ImplementorPolicy;
import graphqlfilter.api.RootOperation;
import graphqlfilter.core.FilterLog;
import graphqlfilter.core.analysis.FieldExposure;
import graphqlfilter.core.analysis.TypeKind;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Computes the types reachable from the schema roots for one target.
 *
 * <p>The traversal is breadth-first with a visited-by-name set, so cycles terminate and each type
 * is expanded once. Edges are:
 *
 * <ul>
 *   <li>object and interface fields exposed to the target: the return type and every argument
 *       type
 *   <li>interfaces declared by an object or interface, always
 *   <li>objects implementing a reached interface, under {@link ImplementorPolicy#ALL_IMPLEMENTORS}
 *   <li>union members, always
 *   <li>input object field types, always; input field exposure is applied when the schema is
 *       rebuilt
 * </ul>
 *
 * <p>Argument types of custom directive definitions are reachable as well, since those
 * definitions are carried into every filtered schema.
 */
public class ReachabilityAnalyzer {

  private final ImplementorPolicy implementorPolicy;
  private final FilterLog log;

  public ReachabilityAnalyzer(ImplementorPolicy implementorPolicy, FilterLog log) {
    this.implementorPolicy = implementorPolicy;
    this.log = log.forClass(ReachabilityAnalyzer.class);
  }

  /**
   * Runs the traversal.
   *
   * @param schema the source schema
   * @param exposure the exposure predicate of the request
   * @return the reachable type names
   */
  public ReachableSet analyze(GraphQLSchema schema, FieldExposure exposure) {
    Set<String> visited = new LinkedHashSet<>();
    Deque<GraphQLNamedType> queue = new ArrayDeque<>();

    for (RootOperation operation : RootOperation.values()) {
      String rootName = exposure.rootTypeNames().nameFor(operation);
      if (rootName != null) {
        enqueue(schema.getType(rootName), visited, queue);
      }
    }
    for (GraphQLDirective directive : schema.getDirectives()) {
      if (DirectiveInfo.isGraphqlSpecifiedDirective(directive.getName())) {
        continue;
      }
      for (GraphQLArgument argument : directive.getArguments()) {
        enqueue(argument.getType(), visited, queue);
      }
    }

    while (!queue.isEmpty()) {
      GraphQLNamedType type = queue.poll();
      if (!visited.add(type.getName())) {
        continue;
      }
      log.debug("[Reachability] Discovered type: {}", type.getName());
      expand(schema, type, exposure, visited, queue);
    }

    log.debug("[Reachability] Traversal complete. Total types discovered: {}", visited.size());
    return new ReachableSet(visited);
  }

  private void expand(
      GraphQLSchema schema,
      GraphQLNamedType type,
      FieldExposure exposure,
      Set<String> visited,
      Deque<GraphQLNamedType> queue) {
    switch (TypeKind.of(type)) {
      case OBJECT -> {
        GraphQLObjectType object = (GraphQLObjectType) type;
        expandFields(object, exposure, visited, queue);
        for (GraphQLNamedOutputType iface : object.getInterfaces()) {
          enqueue(iface, visited, queue);
        }
      }
      case INTERFACE -> {
        GraphQLInterfaceType iface = (GraphQLInterfaceType) type;
        expandFields(iface, exposure, visited, queue);
        for (GraphQLNamedOutputType parent : iface.getInterfaces()) {
          enqueue(parent, visited, queue);
        }
        if (implementorPolicy == ImplementorPolicy.ALL_IMPLEMENTORS) {
          for (GraphQLObjectType implementation : schema.getImplementations(iface)) {
            enqueue(implementation, visited, queue);
          }
        }
      }
      case UNION -> {
        for (GraphQLNamedOutputType member : ((GraphQLUnionType) type).getTypes()) {
          enqueue(member, visited, queue);
        }
      }
      case INPUT_OBJECT -> {
        for (GraphQLInputObjectField field :
            ((GraphQLInputObjectType) type).getFieldDefinitions()) {
          enqueue(field.getType(), visited, queue);
        }
      }
      case ENUM, SCALAR -> {
        // Leaves
      }
    }
  }

  private void expandFields(
      GraphQLFieldsContainer container,
      FieldExposure exposure,
      Set<String> visited,
      Deque<GraphQLNamedType> queue) {
    for (GraphQLFieldDefinition field : container.getFieldDefinitions()) {
      if (!exposure.isExposed(container.getName(), field.getName())) {
        continue;
      }
      enqueue(field.getType(), visited, queue);
      for (GraphQLArgument argument : field.getArguments()) {
        enqueue(argument.getType(), visited, queue);
      }
    }
  }

  private static void enqueue(
      @Nullable GraphQLType type, Set<String> visited, Deque<GraphQLNamedType> queue) {
    if (type == null) {
      return;
    }
    GraphQLNamedType named = GraphQLTypeUtil.unwrapAll(type);
    if (TypeKind.isReservedName(named.getName()) || visited.contains(named.getName())) {
      return;
    }
    queue.add(named);
  }
}
