/** Deterministic SDL output for filtered schemas. */
@NullMarked
package graphqlfilter.core.format;

import org.jspecify.annotations.NullMarked;
