package graphqlfilter.core.reachability;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names of the types a target needs, in discovery order.
 *
 * @param typeNames the reachable type names
 */
public record ReachableSet(Set<String> typeNames) {

  public ReachableSet {
    typeNames = Collections.unmodifiableSet(new LinkedHashSet<>(typeNames));
  }

  public boolean contains(String typeName) {
    return typeNames.contains(typeName);
  }

  public int size() {
    return typeNames.size();
  }
}
