/**
 * Entry point for deriving audience-specific GraphQL schemas.
 *
 * <p>{@link graphqlfilter.core.SchemaFilter} wires the pipeline together: the exposure resolver
 * summarizes the {@code @expose} annotations of a source schema, the reachability analyzer
 * computes which types a target needs, and one of two strategies builds the filtered schema:
 *
 * <ul>
 *   <li>{@link graphqlfilter.core.reconstruction.SchemaReconstructor} - rebuilds a new type graph
 *       in three phases over a name-keyed arena
 *   <li>{@link graphqlfilter.core.text.SdlSchemaFilter} - prunes the printed SDL and lets the
 *       schema generator re-resolve references
 * </ul>
 */
@NullMarked
package graphqlfilter.core;

import org.jspecify.annotations.NullMarked;
