package graphqlfilter.core;

import graphql.schema.GraphQLSchema;
import graphqlfilter.api.FilterOptions;
import graphqlfilter.api.FilterRequest;
import graphqlfilter.core.analysis.ExposureResolver;
import graphqlfilter.core.analysis.FieldExposure;
import graphqlfilter.core.analysis.SchemaAnalysis;
import graphqlfilter.core.analysis.TypeKind;
import graphqlfilter.core.reachability.ReachabilityAnalyzer;
import graphqlfilter.core.reachability.ReachableSet;
import graphqlfilter.core.reconstruction.SchemaReconstructor;
import graphqlfilter.core.text.SdlSchemaFilter;

/**
 * Derives the schema visible to one target from a source schema annotated with {@code @expose}
 * and {@code @disableAutoExpose}.
 *
 * <pre>{@code
 * SchemaFilter filter = new SchemaFilter();
 * GraphQLSchema readonly = filter.filter(schema, "readonly");
 * }</pre>
 *
 * <p>The source schema is never modified. A filter holds no per-run state, so one instance may
 * serve concurrent calls for different targets on the same schema.
 */
public class SchemaFilter {

  private final FilterOptions options;
  private final FilterLog log;

  public SchemaFilter() {
    this(FilterOptions.defaults());
  }

  public SchemaFilter(FilterOptions options) {
    this.options = options;
    this.log = FilterLog.of(SchemaFilter.class, options.logLevel());
  }

  public FilterOptions options() {
    return options;
  }

  /**
   * Filters a schema for one target.
   *
   * @throws graphqlfilter.api.InvalidFilterRequestException if the target is null or blank
   */
  public GraphQLSchema filter(GraphQLSchema schema, String target) {
    return filter(schema, FilterRequest.of(target));
  }

  /**
   * Filters a schema for one request.
   *
   * @param schema the source schema
   * @param request the validated request
   * @return a new schema holding only what the request's target may see
   * @throws graphqlfilter.api.EmptyQueryRootException if no query field is exposed to the target
   * @throws graphqlfilter.api.SchemaConstructionException if the filtered schema is inconsistent
   */
  public GraphQLSchema filter(GraphQLSchema schema, FilterRequest request) {
    return filter(schema, analyze(schema), request);
  }

  /**
   * Filters a schema with an analysis computed earlier by {@link #analyze(GraphQLSchema)}, so
   * that several targets can share one analysis pass.
   */
  public GraphQLSchema filter(
      GraphQLSchema schema, SchemaAnalysis analysis, FilterRequest request) {
    log.info("Filtering schema for target '{}' using {}", request.target(), options.strategy());

    FieldExposure exposure = FieldExposure.forRequest(schema, analysis, request, log);
    ReachableSet reachable =
        new ReachabilityAnalyzer(options.implementorPolicy(), log).analyze(schema, exposure);

    GraphQLSchema filtered =
        switch (options.strategy()) {
          case RECONSTRUCT -> new SchemaReconstructor(log).reconstruct(schema, exposure, reachable);
          case TEXT -> new SdlSchemaFilter(log).filter(schema, exposure, reachable);
        };
    log.info(
        "Filtered schema for target '{}' has {} types, {} were reachable",
        request.target(),
        countNamedTypes(filtered),
        reachable.size());
    return filtered;
  }

  /** Analyzes the visibility directives of a schema, logging the result at debug level. */
  public SchemaAnalysis analyze(GraphQLSchema schema) {
    SchemaAnalysis analysis = new ExposureResolver().analyze(schema);
    ExposureResolver.describe(analysis, log);
    return analysis;
  }

  private static long countNamedTypes(GraphQLSchema schema) {
    return schema.getAllTypesAsList().stream()
        .filter(type -> !TypeKind.isReservedName(type.getName()))
        .count();
  }
}
