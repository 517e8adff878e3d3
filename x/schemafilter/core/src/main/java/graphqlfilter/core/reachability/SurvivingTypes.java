package graphqlfilter.core.reachability;

import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLDirective;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLImplementingType;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;
import graphql.schema.idl.DirectiveInfo;
import graphqlfilter.core.analysis.FieldExposure;
import graphqlfilter.core.analysis.TypeKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Decides which reachable types and which of their fields end up in the filtered schema.
 *
 * <p>A reachable type survives if its filtered form is non-empty: an object, interface or input
 * keeps at least one field, a union keeps at least one member. A field is kept when it is exposed
 * and every type it mentions survives. An interface field is kept only if every surviving type
 * implementing that interface keeps a field of the same name, so implementors always satisfy the
 * interfaces they still declare. Dropping a type can empty another one, so the decision is
 * repeated until nothing changes. Root types take part in the computation like any other type.
 *
 * <p>Input types used by the arguments of custom directive definitions, directly or through
 * other input types, keep all of their fields. Those definitions are carried into every filtered
 * schema unchanged and need their argument types whole.
 *
 * <p>Both filtering strategies consult the same instance, which keeps their outputs identical.
 */
public final class SurvivingTypes {

  private final GraphQLSchema schema;
  private final FieldExposure exposure;
  private final Set<String> survivors;
  private final Map<String, List<GraphQLImplementingType>> implementors;
  private final Set<String> directiveInputs;

  private SurvivingTypes(
      GraphQLSchema schema,
      FieldExposure exposure,
      Set<String> survivors,
      Map<String, List<GraphQLImplementingType>> implementors,
      Set<String> directiveInputs) {
    this.schema = schema;
    this.exposure = exposure;
    this.survivors = survivors;
    this.implementors = implementors;
    this.directiveInputs = directiveInputs;
  }

  /**
   * Computes the surviving types.
   *
   * @param schema the source schema
   * @param exposure the exposure predicate of the request
   * @param reachable the reachable types
   * @return the survivorship decision
   */
  public static SurvivingTypes compute(
      GraphQLSchema schema, FieldExposure exposure, ReachableSet reachable) {
    Set<String> alive = new LinkedHashSet<>();
    for (String name : reachable.typeNames()) {
      if (!TypeKind.isReservedName(name) && schema.getTypeMap().containsKey(name)) {
        alive.add(name);
      }
    }

    Map<String, List<GraphQLImplementingType>> implementors = implementorsByInterface(schema);
    Set<String> directiveInputs = directiveInputs(schema);
    SurvivingTypes candidate =
        new SurvivingTypes(schema, exposure, alive, implementors, directiveInputs);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (String name : new ArrayList<>(alive)) {
        if (!candidate.hasContent(schema.getTypeMap().get(name))) {
          alive.remove(name);
          changed = true;
        }
      }
    }

    return new SurvivingTypes(
        schema, exposure, Collections.unmodifiableSet(alive), implementors, directiveInputs);
  }

  private static Map<String, List<GraphQLImplementingType>> implementorsByInterface(
      GraphQLSchema schema) {
    Map<String, List<GraphQLImplementingType>> implementors = new HashMap<>();
    for (GraphQLNamedType type : schema.getAllTypesAsList()) {
      if (type instanceof GraphQLImplementingType implementing) {
        for (GraphQLNamedOutputType iface : implementing.getInterfaces()) {
          implementors
              .computeIfAbsent(iface.getName(), name -> new ArrayList<>())
              .add(implementing);
        }
      }
    }
    return implementors;
  }

  private static Set<String> directiveInputs(GraphQLSchema schema) {
    Set<String> inputs = new LinkedHashSet<>();
    Deque<GraphQLInputObjectType> queue = new ArrayDeque<>();
    for (GraphQLDirective directive : schema.getDirectives()) {
      if (DirectiveInfo.isGraphqlSpecifiedDirective(directive.getName())) {
        continue;
      }
      for (GraphQLArgument argument : directive.getArguments()) {
        if (GraphQLTypeUtil.unwrapAll(argument.getType()) instanceof GraphQLInputObjectType input) {
          queue.add(input);
        }
      }
    }
    while (!queue.isEmpty()) {
      GraphQLInputObjectType input = queue.poll();
      if (!inputs.add(input.getName())) {
        continue;
      }
      for (GraphQLInputObjectField field : input.getFieldDefinitions()) {
        if (GraphQLTypeUtil.unwrapAll(field.getType()) instanceof GraphQLInputObjectType nested) {
          queue.add(nested);
        }
      }
    }
    return inputs;
  }

  /** Names of the surviving types, in reachability order. */
  public Set<String> typeNames() {
    return survivors;
  }

  public boolean contains(String typeName) {
    return survivors.contains(typeName);
  }

  /**
   * Checks whether an input type is used by a custom directive definition. Such types keep every
   * field and are carried into the filtered schema as they are.
   */
  public boolean isDirectiveInput(String typeName) {
    return directiveInputs.contains(typeName);
  }

  /**
   * Checks whether a field of an object or interface type is kept.
   *
   * @param typeName the owning type name
   * @param fieldName the field name
   * @return true if the owner survives, the field is exposed, and its return and argument types
   *     survive
   */
  public boolean keepsField(String typeName, String fieldName) {
    if (!survivors.contains(typeName)) {
      return false;
    }
    GraphQLFieldDefinition field = fieldOf(typeName, fieldName);
    return field != null && keeps(typeName, field);
  }

  /**
   * Checks whether a field of an input type is kept.
   *
   * @param typeName the owning input type name
   * @param fieldName the field name
   * @return true if the owner survives, the field is exposed, and its type survives
   */
  public boolean keepsInputField(String typeName, String fieldName) {
    if (!survivors.contains(typeName)
        || !(schema.getType(typeName) instanceof GraphQLInputObjectType input)) {
      return false;
    }
    GraphQLInputObjectField field = input.getFieldDefinition(fieldName);
    return field != null && keeps(typeName, field);
  }

  /** Fields of an object or interface type that are kept, in source order. */
  public List<GraphQLFieldDefinition> keptFields(GraphQLFieldsContainer container) {
    List<GraphQLFieldDefinition> kept = new ArrayList<>();
    for (GraphQLFieldDefinition field : container.getFieldDefinitions()) {
      if (keeps(container.getName(), field)) {
        kept.add(field);
      }
    }
    return kept;
  }

  /** Fields of an input type that are kept, in source order. */
  public List<GraphQLInputObjectField> keptFields(GraphQLInputObjectType input) {
    List<GraphQLInputObjectField> kept = new ArrayList<>();
    for (GraphQLInputObjectField field : input.getFieldDefinitions()) {
      if (keeps(input.getName(), field)) {
        kept.add(field);
      }
    }
    return kept;
  }

  private boolean hasContent(GraphQLNamedType type) {
    return switch (TypeKind.of(type)) {
      case OBJECT, INTERFACE -> !keptFields((GraphQLFieldsContainer) type).isEmpty();
      case INPUT_OBJECT -> !keptFields((GraphQLInputObjectType) type).isEmpty();
      case UNION -> {
        for (GraphQLNamedOutputType member : ((GraphQLUnionType) type).getTypes()) {
          if (survivors.contains(member.getName())) {
            yield true;
          }
        }
        yield false;
      }
      case ENUM, SCALAR -> true;
    };
  }

  private boolean keeps(String typeName, GraphQLFieldDefinition field) {
    if (!exposure.isExposed(typeName, field.getName()) || !survives(field.getType())) {
      return false;
    }
    for (GraphQLArgument argument : field.getArguments()) {
      if (!survives(argument.getType())) {
        return false;
      }
    }
    // Interface hierarchies are acyclic, so this terminates
    for (GraphQLImplementingType implementor : implementors.getOrDefault(typeName, List.of())) {
      if (!survivors.contains(implementor.getName())) {
        continue;
      }
      GraphQLFieldDefinition implemented = implementor.getFieldDefinition(field.getName());
      if (implemented == null || !keeps(implementor.getName(), implemented)) {
        return false;
      }
    }
    return true;
  }

  private boolean keeps(String typeName, GraphQLInputObjectField field) {
    return (directiveInputs.contains(typeName) || exposure.isExposed(typeName, field.getName()))
        && survives(field.getType());
  }

  private boolean survives(GraphQLType type) {
    return survivors.contains(GraphQLTypeUtil.unwrapAll(type).getName());
  }

  private @Nullable GraphQLFieldDefinition fieldOf(String typeName, String fieldName) {
    GraphQLType type = schema.getType(typeName);
    if (type instanceof GraphQLFieldsContainer container) {
      return container.getFieldDefinition(fieldName);
    }
    return null;
  }
}
