package graphqlfilter.core.analysis;

import graphql.schema.GraphQLAppliedDirective;
import graphql.schema.GraphQLAppliedDirectiveArgument;
import graphql.schema.GraphQLDirectiveContainer;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphqlfilter.api.ExposeDirectives;
import graphqlfilter.api.LogLevel;
import graphqlfilter.core.FilterLog;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Reads the {@code @expose} and {@code @disableAutoExpose} annotations of a schema into a {@link
 * SchemaAnalysis}.
 *
 * <p>The resolver is stateless: analyzing the same schema twice yields equal results, and the
 * schema is never modified.
 */
public class ExposureResolver {

  /**
   * Analyzes a schema.
   *
   * @param schema the source schema
   * @return the analysis
   */
  public SchemaAnalysis analyze(GraphQLSchema schema) {
    RootTypeNames rootTypeNames = RootTypeNames.of(schema);
    Map<String, TypeExposure> types = new LinkedHashMap<>();

    for (GraphQLNamedType type : schema.getAllTypesAsList()) {
      if (TypeKind.isReservedName(type.getName())) {
        continue;
      }
      TypeExposure exposure =
          switch (TypeKind.of(type)) {
            case OBJECT -> objectExposure((GraphQLObjectType) type, rootTypeNames);
            case INTERFACE -> interfaceExposure((GraphQLInterfaceType) type);
            case INPUT_OBJECT -> inputExposure((GraphQLInputObjectType) type);
            case UNION, ENUM, SCALAR -> null;
          };
      if (exposure != null) {
        types.put(type.getName(), exposure);
      }
    }

    return new SchemaAnalysis(rootTypeNames, types);
  }

  /**
   * Logs the analysis at debug level: root types, types with auto-expose disabled, and every
   * field-level tag list.
   *
   * @param analysis the analysis to describe
   * @param log the log to write to
   */
  public static void describe(SchemaAnalysis analysis, FilterLog log) {
    if (!log.isEnabled(LogLevel.DEBUG)) {
      return;
    }
    RootTypeNames roots = analysis.rootTypeNames();
    log.debug("=== Root Types ===");
    log.debug("  Query: {}", orNone(roots.query()));
    log.debug("  Mutation: {}", orNone(roots.mutation()));
    log.debug("  Subscription: {}", orNone(roots.subscription()));

    log.debug("=== Types with @{} ===", ExposeDirectives.DISABLE_AUTO_EXPOSE);
    List<String> disabled =
        analysis.types().values().stream()
            .filter(TypeExposure::autoExposeDisabled)
            .map(TypeExposure::typeName)
            .toList();
    if (disabled.isEmpty()) {
      log.debug("  (none)");
    }
    disabled.forEach(name -> log.debug("  {}", name));

    log.debug("=== Field-level @{} ===", ExposeDirectives.EXPOSE);
    boolean any = false;
    for (TypeExposure type : analysis.types().values()) {
      for (Map.Entry<String, List<String>> field : type.fieldTags().entrySet()) {
        any = true;
        log.debug("  {}.{}: {}", type.typeName(), field.getKey(), field.getValue());
      }
    }
    if (!any) {
      log.debug("  (none)");
    }
  }

  private TypeExposure objectExposure(GraphQLObjectType type, RootTypeNames rootTypeNames) {
    Map<String, List<String>> fieldTags = new LinkedHashMap<>();
    for (GraphQLFieldDefinition field : type.getFieldDefinitions()) {
      exposeTags(field).ifPresent(tags -> fieldTags.put(field.getName(), tags));
    }
    return new TypeExposure(
        type.getName(),
        TypeKind.OBJECT,
        rootTypeNames.contains(type.getName()),
        type.hasAppliedDirective(ExposeDirectives.DISABLE_AUTO_EXPOSE),
        fieldTags);
  }

  private TypeExposure interfaceExposure(GraphQLInterfaceType type) {
    Map<String, List<String>> fieldTags = new LinkedHashMap<>();
    for (GraphQLFieldDefinition field : type.getFieldDefinitions()) {
      exposeTags(field).ifPresent(tags -> fieldTags.put(field.getName(), tags));
    }
    // Interfaces are never roots
    return new TypeExposure(
        type.getName(),
        TypeKind.INTERFACE,
        false,
        type.hasAppliedDirective(ExposeDirectives.DISABLE_AUTO_EXPOSE),
        fieldTags);
  }

  private TypeExposure inputExposure(GraphQLInputObjectType type) {
    Map<String, List<String>> fieldTags = new LinkedHashMap<>();
    for (GraphQLInputObjectField field : type.getFieldDefinitions()) {
      exposeTags(field).ifPresent(tags -> fieldTags.put(field.getName(), tags));
    }
    return new TypeExposure(type.getName(), TypeKind.INPUT_OBJECT, false, false, fieldTags);
  }

  /**
   * Collects the tags of every {@code @expose} applied to an element. Repeated applications are
   * merged in order without duplicates.
   *
   * @return the tags, or empty if the element carries no {@code @expose}
   */
  static Optional<List<String>> exposeTags(GraphQLDirectiveContainer element) {
    List<GraphQLAppliedDirective> applied =
        element.getAppliedDirectives(ExposeDirectives.EXPOSE);
    if (applied.isEmpty()) {
      return Optional.empty();
    }

    Set<String> tags = new LinkedHashSet<>();
    for (GraphQLAppliedDirective directive : applied) {
      GraphQLAppliedDirectiveArgument argument =
          directive.getArgument(ExposeDirectives.TAGS_ARGUMENT);
      if (argument == null) {
        continue;
      }
      Object value = argument.getValue();
      if (value instanceof Collection<?> values) {
        for (Object tag : values) {
          if (tag != null) {
            tags.add(tag.toString());
          }
        }
      } else if (value != null) {
        // Input coercion allows a single value where a list is expected
        tags.add(value.toString());
      }
    }
    return Optional.of(new ArrayList<>(tags));
  }

  private static String orNone(@Nullable String name) {
    return name == null ? "(none)" : name;
  }
}
