package graphqlfilter.core.analysis;

import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphqlfilter.api.EntryPoints;
import graphqlfilter.api.FilterRequest;
import graphqlfilter.api.RootOperation;
import graphqlfilter.core.FilterLog;
import org.jspecify.annotations.Nullable;

/**
 * The field exposure predicate of one filter request: a {@link SchemaAnalysis} bound to a target
 * and, optionally, to manual entry points.
 *
 * <p>Instances are immutable and cheap; every component of a filter run consults the same one, so
 * reachability and reconstruction can never disagree about a field.
 */
public final class FieldExposure {

  private final SchemaAnalysis analysis;
  private final String target;
  private final @Nullable EntryPoints entryPoints;

  private FieldExposure(
      SchemaAnalysis analysis, String target, @Nullable EntryPoints entryPoints) {
    this.analysis = analysis;
    this.target = target;
    this.entryPoints = entryPoints;
  }

  /**
   * Binds an analysis to a request. Entry points naming a field that does not exist on its root
   * type are reported as warnings and otherwise ignored.
   *
   * @param schema the source schema, used to check entry points
   * @param analysis the analysis of that schema
   * @param request the filter request
   * @param log the log for entry point warnings
   * @return the predicate
   */
  public static FieldExposure forRequest(
      GraphQLSchema schema, SchemaAnalysis analysis, FilterRequest request, FilterLog log) {
    EntryPoints entryPoints = request.entryPoints();
    if (entryPoints != null) {
      checkEntryPoints(schema, analysis.rootTypeNames(), entryPoints, log);
    }
    return new FieldExposure(analysis, request.target(), entryPoints);
  }

  /** A predicate without entry point restrictions. */
  public static FieldExposure forTarget(SchemaAnalysis analysis, String target) {
    return new FieldExposure(analysis, target, null);
  }

  public SchemaAnalysis analysis() {
    return analysis;
  }

  public String target() {
    return target;
  }

  public RootTypeNames rootTypeNames() {
    return analysis.rootTypeNames();
  }

  /**
   * Decides whether a field is part of the filtered schema for this request.
   *
   * @param typeName the owning type name
   * @param fieldName the field name
   * @return true if the field is exposed
   */
  public boolean isExposed(String typeName, String fieldName) {
    if (!analysis.isExposed(typeName, fieldName, target)) {
      return false;
    }
    if (entryPoints == null) {
      return true;
    }
    EntryPoints restriction = entryPoints;
    return analysis
        .rootTypeNames()
        .operationOf(typeName)
        .map(operation -> restriction.fieldsFor(operation).contains(fieldName))
        .orElse(true);
  }

  private static void checkEntryPoints(
      GraphQLSchema schema, RootTypeNames roots, EntryPoints entryPoints, FilterLog log) {
    for (RootOperation operation : RootOperation.values()) {
      String rootName = roots.nameFor(operation);
      GraphQLObjectType root = rootName == null ? null : schema.getObjectType(rootName);
      for (String fieldName : entryPoints.fieldsFor(operation)) {
        if (root == null) {
          log.warn("Root type for {} not found in schema, skipping {}", operation, fieldName);
        } else if (root.getFieldDefinition(fieldName) == null) {
          log.warn("Field {} not found in {} type, skipping", fieldName, rootName);
        }
      }
    }
  }
}
