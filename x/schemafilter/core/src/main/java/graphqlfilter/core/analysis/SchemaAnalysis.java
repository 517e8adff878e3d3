package graphqlfilter.core.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable summary of a source schema's visibility annotations, computed once by {@link
 * ExposureResolver} and shared by every filter run against that schema.
 *
 * @param rootTypeNames the root type names
 * @param types exposure information of every object, interface and input type, in schema order
 */
public record SchemaAnalysis(RootTypeNames rootTypeNames, Map<String, TypeExposure> types) {

  public SchemaAnalysis {
    types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
  }

  public Optional<TypeExposure> typeExposure(String typeName) {
    return Optional.ofNullable(types.get(typeName));
  }

  /**
   * Decides whether a field is visible to a target. Types without exposure information (unions,
   * enums, scalars, unknown names) expose nothing.
   *
   * @param typeName the owning type name
   * @param fieldName the field name
   * @param target the target
   * @return true if the field is exposed
   */
  public boolean isExposed(String typeName, String fieldName, String target) {
    TypeExposure exposure = types.get(typeName);
    return exposure != null && exposure.isExposed(fieldName, target);
  }

  public boolean isRootType(String typeName) {
    return rootTypeNames.contains(typeName);
  }
}
