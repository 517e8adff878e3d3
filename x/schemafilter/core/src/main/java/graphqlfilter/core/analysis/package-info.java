/**
 * Resolution of {@code @expose} and {@code @disableAutoExpose} annotations into an immutable
 * {@link graphqlfilter.core.analysis.SchemaAnalysis} and the per-request {@link
 * graphqlfilter.core.analysis.FieldExposure} predicate.
 */
@NullMarked
package graphqlfilter.core.analysis;

import org.jspecify.annotations.NullMarked;
