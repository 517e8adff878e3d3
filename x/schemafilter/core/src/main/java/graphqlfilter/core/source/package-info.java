/** Loading source schemas from SDL text, readers and files. */
@NullMarked
package graphqlfilter.core.source;

import org.jspecify.annotations.NullMarked;
