package graphqlfilter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FilterRequestTest {

  @Test
  void acceptsNonBlankTarget() {
    FilterRequest request = FilterRequest.of("admin");

    assertThat(request.target()).isEqualTo("admin");
    assertThat(request.entryPoints()).isNull();
  }

  @Test
  void rejectsEmptyTarget() {
    assertThatThrownBy(() -> FilterRequest.of(""))
        .isInstanceOf(InvalidFilterRequestException.class)
        .isInstanceOf(SchemaFilterException.class)
        .hasMessageContaining("target");
  }

  @Test
  void rejectsBlankTarget() {
    assertThatThrownBy(() -> FilterRequest.of("   "))
        .isInstanceOf(InvalidFilterRequestException.class);
  }

  @Test
  void rejectsNullTarget() {
    assertThatThrownBy(() -> new FilterRequest(null, null))
        .isInstanceOf(InvalidFilterRequestException.class);
  }

  @Test
  void withEntryPointsKeepsTarget() {
    FilterRequest request =
        FilterRequest.of("admin").withEntryPoints(EntryPoints.queries("users", "user"));

    assertThat(request.target()).isEqualTo("admin");
    assertThat(request.entryPoints()).isNotNull();
    assertThat(request.entryPoints().queryFields()).containsExactlyInAnyOrder("users", "user");
  }

  @Test
  void entryPointsAreGroupedByOperation() {
    EntryPoints entryPoints =
        EntryPoints.queries("users").withMutations("createUser").withSubscriptions("userAdded");

    assertThat(entryPoints.fieldsFor(RootOperation.QUERY)).containsExactly("users");
    assertThat(entryPoints.fieldsFor(RootOperation.MUTATION)).containsExactly("createUser");
    assertThat(entryPoints.fieldsFor(RootOperation.SUBSCRIPTION)).containsExactly("userAdded");
  }

  @Test
  void entryPointsCopyTheirInput() {
    Set<String> fields = new HashSet<>(Set.of("users"));
    EntryPoints entryPoints = new EntryPoints(fields, Set.of(), Set.of());

    fields.add("adminUsers");

    assertThat(entryPoints.queryFields()).containsExactly("users");
  }
}
