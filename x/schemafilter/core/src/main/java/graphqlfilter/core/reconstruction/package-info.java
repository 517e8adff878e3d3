/**
 * Three-phase reconstruction of a filtered schema over a name-keyed arena.
 *
 * <p>graphql-java types are immutable and capture the instances they reference, so a cyclic graph
 * cannot be copied type by type in one pass. {@link
 * graphqlfilter.core.reconstruction.TypeArena} holds one entry per surviving name and every
 * reference is resolved through it; {@link
 * graphqlfilter.core.reconstruction.SchemaReconstructor} fills it in three phases.
 */
@NullMarked
package graphqlfilter.core.reconstruction;

import org.jspecify.annotations.NullMarked;
