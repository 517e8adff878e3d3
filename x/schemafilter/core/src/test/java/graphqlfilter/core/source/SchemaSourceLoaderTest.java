package graphqlfilter.core.source;

import static graphqlfilter.core.SchemaFixtures.fieldNames;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import graphql.language.AstPrinter;
import graphql.language.Document;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.errors.SchemaProblem;
import graphqlfilter.api.ExposeDirectives;
import graphqlfilter.core.FilterLog;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SchemaSourceLoaderTest {

  private final SchemaSourceLoader loader = new SchemaSourceLoader();

  @Test
  void loadsFromReader() throws IOException {
    GraphQLSchema schema =
        loader.load(new StringReader("type Query { hello: String @expose(tags: [\"public\"]) }"));

    assertThat(fieldNames(schema, "Query")).containsExactly("hello");
  }

  @Test
  void addsVisibilityDirectiveDeclarations() {
    GraphQLSchema schema = loader.load("type Query { hello: String }");

    assertThat(schema.getDirective(ExposeDirectives.EXPOSE)).isNotNull();
    assertThat(schema.getDirective(ExposeDirectives.EXPOSE).isRepeatable()).isTrue();
    assertThat(schema.getDirective(ExposeDirectives.DISABLE_AUTO_EXPOSE)).isNotNull();
  }

  @Test
  void keepsDeclarationsFromTheSource() {
    GraphQLSchema schema =
        loader.load(
            """
            directive @expose(tags: [String!]!) repeatable on FIELD_DEFINITION
            type Query { hello: String @expose(tags: ["public"]) }
            """);

    assertThat(schema.getDirective(ExposeDirectives.EXPOSE)).isNotNull();
  }

  @Test
  void mergesFragmentsAndStripsUndeclaredDirectives() throws IOException, URISyntaxException {
    GraphQLSchema schema =
        loader.load(List.of(fragment("base.graphqls"), fragment("host.graphqls")));

    assertThat(fieldNames(schema, "Query")).containsExactlyInAnyOrder("listing", "payouts");
    assertThat(fieldNames(schema, "Listing"))
        .containsExactlyInAnyOrder("id", "title", "nightlyRate");
    assertThat(schema.getObjectType("Listing").hasAppliedDirective("key")).isFalse();
    assertThat(
            schema.getQueryType().getFieldDefinition("listing").hasAppliedDirective("cacheControl"))
        .isFalse();
    assertThat(
            schema.getQueryType().getFieldDefinition("listing").hasAppliedDirective("expose"))
        .isTrue();
    assertThat(schema.getObjectType("Payout").getFieldDefinition("currency").isDeprecated())
        .isTrue();
  }

  @Test
  void loadsSingleFile() throws IOException, URISyntaxException {
    GraphQLSchema schema = loader.load(fragment("base.graphqls"));

    assertThat(fieldNames(schema, "Query")).containsExactly("listing");
  }

  @Test
  void stripperKeepsDeclaredDirectives() {
    Document document =
        Parser.parse(
            """
            directive @owner(team: String!) on OBJECT
            type Query @owner(team: "search") @unknown { hello: String @internal }
            """);

    Document stripped =
        new UnknownDirectiveStripper(Set.of(), FilterLog.silent(getClass())).strip(document);

    String printed = AstPrinter.printAst(stripped);
    assertThat(printed).contains("@owner").doesNotContain("@unknown").doesNotContain("@internal");
  }

  @Test
  void syntaxErrorsPropagate() {
    assertThatThrownBy(() -> loader.load("type Query {"))
        .isInstanceOf(InvalidSyntaxException.class);
  }

  @Test
  void invalidSchemasPropagate() {
    assertThatThrownBy(() -> loader.load("type Query { user: Missing }"))
        .isInstanceOf(SchemaProblem.class);
  }

  private static File fragment(String name) throws URISyntaxException {
    return Path.of(
            Objects.requireNonNull(
                    SchemaSourceLoaderTest.class
                        .getClassLoader()
                        .getResource("schemas/fragments/" + name))
                .toURI())
        .toFile();
  }
}
