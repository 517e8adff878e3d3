/**
 * Breadth-first reachability over the source type graph, and the survivorship decision shared by
 * both filtering strategies.
 */
@NullMarked
package graphqlfilter.core.reachability;

import org.jspecify.annotations.NullMarked;
