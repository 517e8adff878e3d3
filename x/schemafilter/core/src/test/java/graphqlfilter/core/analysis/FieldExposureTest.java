package graphqlfilter.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import graphql.schema.GraphQLSchema;
import graphqlfilter.api.EntryPoints;
import graphqlfilter.api.FilterRequest;
import graphqlfilter.api.LogLevel;
import graphqlfilter.core.FilterLog;
import graphqlfilter.core.SchemaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FieldExposureTest {

  private GraphQLSchema schema;
  private SchemaAnalysis analysis;
  private FilterLog log;

  @BeforeEach
  void setUp() {
    schema = SchemaFixtures.load("basic.graphqls");
    analysis = new ExposureResolver().analyze(schema);
    log = FilterLog.of(FieldExposureTest.class, LogLevel.WARN);
  }

  @Test
  void withoutEntryPointsDelegatesToAnalysis() {
    FieldExposure exposure = FieldExposure.forTarget(analysis, "admin");

    assertThat(exposure.target()).isEqualTo("admin");
    assertThat(exposure.isExposed("Query", "adminUsers")).isTrue();
    assertThat(exposure.isExposed("Mutation", "createUser")).isTrue();
  }

  @Test
  void entryPointsRestrictRootFields() {
    FilterRequest request =
        FilterRequest.of("admin").withEntryPoints(EntryPoints.queries("users"));

    FieldExposure exposure = FieldExposure.forRequest(schema, analysis, request, log);

    assertThat(exposure.isExposed("Query", "users")).isTrue();
    assertThat(exposure.isExposed("Query", "adminUsers")).isFalse();
    assertThat(exposure.isExposed("Mutation", "createUser")).isFalse();
    // Non-root types are unaffected
    assertThat(exposure.isExposed("User", "salary")).isTrue();
  }

  @Test
  void entryPointsStillRequireExposure() {
    FilterRequest request =
        FilterRequest.of("readonly").withEntryPoints(EntryPoints.queries("users", "adminUsers"));

    FieldExposure exposure = FieldExposure.forRequest(schema, analysis, request, log);

    assertThat(exposure.isExposed("Query", "users")).isTrue();
    assertThat(exposure.isExposed("Query", "adminUsers")).isFalse();
  }

  @Test
  void unknownEntryPointsAreSkipped() {
    FilterRequest request =
        FilterRequest.of("admin")
            .withEntryPoints(
                EntryPoints.queries("users", "doesNotExist").withSubscriptions("userAdded"));

    FieldExposure exposure = FieldExposure.forRequest(schema, analysis, request, log);

    assertThat(exposure.isExposed("Query", "users")).isTrue();
    assertThat(exposure.isExposed("Query", "doesNotExist")).isFalse();
  }
}
