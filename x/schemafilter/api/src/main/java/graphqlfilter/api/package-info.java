/**
 * Public request, option and error types for GraphQL schema filtering.
 *
 * <p>A caller describes <em>who</em> the filtered schema is for with a {@link
 * graphqlfilter.api.FilterRequest} and <em>how</em> it should be derived with {@link
 * graphqlfilter.api.FilterOptions}. The visibility annotations recognized in source schemas are
 * described by {@link graphqlfilter.api.ExposeDirectives}.
 *
 * <p>All types in this package are non-null by default unless explicitly annotated with {@link
 * org.jspecify.annotations.Nullable @Nullable}.
 */
@NullMarked
package graphqlfilter.api;

import org.jspecify.annotations.NullMarked;
