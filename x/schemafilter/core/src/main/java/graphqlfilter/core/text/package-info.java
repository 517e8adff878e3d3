/** Filtering at the SDL level: print, prune the document, and let graphql-java rebuild it. */
@NullMarked
package graphqlfilter.core.text;

import org.jspecify.annotations.NullMarked;
