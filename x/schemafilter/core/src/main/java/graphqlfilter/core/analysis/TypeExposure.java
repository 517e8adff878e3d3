package graphqlfilter.core.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Visibility annotations of one object, interface or input type.
 *
 * @param typeName the type name
 * @param kind the type kind
 * @param rootType whether the type is a query, mutation or subscription root
 * @param autoExposeDisabled whether the type carries {@code @disableAutoExpose}
 * @param fieldTags tag lists of the fields that carry {@code @expose}; unannotated fields are
 *     absent
 */
public record TypeExposure(
    String typeName,
    TypeKind kind,
    boolean rootType,
    boolean autoExposeDisabled,
    Map<String, List<String>> fieldTags) {

  public TypeExposure {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    fieldTags.forEach((field, tags) -> copy.put(field, List.copyOf(tags)));
    fieldTags = Collections.unmodifiableMap(copy);
  }

  /**
   * Decides whether a field of this type is visible to a target.
   *
   * <p>An explicit tag list always wins. Without one, output fields of root types and of types
   * with {@code @disableAutoExpose} are hidden, other output fields are visible, and input fields
   * are always visible.
   *
   * @param fieldName the field name
   * @param target the target
   * @return true if the field is exposed
   */
  public boolean isExposed(String fieldName, String target) {
    List<String> tags = fieldTags.get(fieldName);
    if (tags != null) {
      return tags.contains(target);
    }
    if (!kind.hasOutputFields()) {
      return true;
    }
    return !(rootType || autoExposeDisabled);
  }

  /** Whether unannotated output fields of this type are hidden. */
  public boolean isExplicitOnly() {
    return kind.hasOutputFields() && (rootType || autoExposeDisabled);
  }
}
