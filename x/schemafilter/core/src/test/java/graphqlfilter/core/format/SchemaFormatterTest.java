package graphqlfilter.core.format;

import static org.assertj.core.api.Assertions.assertThat;

import graphql.schema.GraphQLSchema;
import graphqlfilter.core.SchemaFilter;
import graphqlfilter.core.SchemaFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaFormatterTest {

  private final SchemaFormatter formatter = new SchemaFormatter();
  private GraphQLSchema filtered;

  @BeforeEach
  void setUp() {
    filtered = new SchemaFilter().filter(SchemaFixtures.load("format.graphqls"), "public");
  }

  @Test
  void groupsAndSortsDefinitions() {
    String sdl =
        formatter.format(filtered, new FormatOptions(SortOrder.ALPHABETICAL, SortOrder.NONE));
    List<String> lines = sdl.lines().toList();

    int schemaPos = indexOf(lines, "schema {");
    int queryPos = indexOf(lines, "type Query");
    int mutationPos = indexOf(lines, "type Mutation");
    int scalarPos = indexOf(lines, "scalar DateTime");
    int directivePos = indexOf(lines, "directive @disableAutoExpose");
    int exposePos = indexOf(lines, "directive @expose");
    int inputPos = indexOf(lines, "input CreateUserInput");
    int nodePos = indexOf(lines, "interface Node");
    int userPos = indexOf(lines, "type User");

    assertThat(schemaPos).isLessThan(queryPos);
    assertThat(queryPos).isLessThan(mutationPos);
    assertThat(mutationPos).isLessThan(scalarPos);
    assertThat(scalarPos).isLessThan(directivePos);
    assertThat(directivePos).isLessThan(exposePos);
    assertThat(exposePos).isLessThan(inputPos);
    assertThat(inputPos).isLessThan(nodePos);
    assertThat(nodePos).isLessThan(userPos);
  }

  @Test
  void sortsFieldsOfObjectsInterfacesAndInputs() {
    String sdl = formatter.format(filtered, FormatOptions.alphabetical());

    assertThat(block(sdl, "type User"))
        .containsSubsequence("aId", "mEmail", "zName", "zUpdatedAt");
    assertThat(block(sdl, "interface Node")).containsSubsequence("aId", "zUpdatedAt");
    assertThat(block(sdl, "input CreateUserInput")).containsSubsequence("aEmail", "zName");
    assertThat(block(sdl, "type Query")).containsSubsequence("aAdmins", "zUsers");
  }

  @Test
  void dropsUnreachableDefinitions() {
    String sdl = formatter.format(filtered, FormatOptions.alphabetical());

    assertThat(sdl).doesNotContain("enum Status");
  }

  @Test
  void noneKeepsEveryDefinition() {
    String sdl = formatter.format(filtered, new FormatOptions(SortOrder.NONE, SortOrder.NONE));

    assertThat(sdl).contains("type Query", "type Mutation", "type User", "scalar DateTime");
  }

  @Test
  void formattingIsStable() {
    String once = formatter.format(filtered, FormatOptions.alphabetical());

    assertThat(formatter.format(once, FormatOptions.alphabetical())).isEqualTo(once);
  }

  @Test
  void dropsExtensionsAndOperationsFromText() {
    String sdl =
        formatter.format(
            """
            type Query { b: String a: String }
            extend type Query { c: String }
            query Ignored { a }
            """,
            FormatOptions.alphabetical());

    assertThat(sdl).contains("type Query").doesNotContain("extend").doesNotContain("Ignored");
    assertThat(block(sdl, "type Query")).containsSubsequence("a", "b").doesNotContain("c:");
  }

  @Test
  void keepsInterfaceDefinitionsWhileDroppingInterfaceExtensions() {
    String sdl =
        formatter.format(
            """
            type Query { node: Node }
            interface Node { id: ID }
            extend interface Node { extra: String }
            type User implements Node { id: ID }
            """,
            FormatOptions.alphabetical());

    assertThat(sdl).contains("interface Node").doesNotContain("extend");
    assertThat(block(sdl, "interface Node")).contains("id").doesNotContain("extra");
  }

  @Test
  void formattedFilterOutputDeclaresEveryImplementedInterface() {
    String sdl = formatter.format(filtered, FormatOptions.alphabetical());

    assertThat(sdl).contains("type User implements Node");
    assertThat(sdl.lines()).anyMatch(line -> line.startsWith("interface Node"));
  }

  @Test
  void honorsRenamedRootTypes() {
    String sdl =
        formatter.format(
            """
            schema { query: RootQuery mutation: RootMutation }
            type AType { id: ID }
            type RootMutation { touch: AType }
            type RootQuery { a: AType }
            """,
            FormatOptions.alphabetical());
    List<String> lines = sdl.lines().toList();

    assertThat(indexOf(lines, "type RootQuery")).isLessThan(indexOf(lines, "type RootMutation"));
    assertThat(indexOf(lines, "type RootMutation")).isLessThan(indexOf(lines, "type AType"));
  }

  private static int indexOf(List<String> lines, String prefix) {
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).startsWith(prefix)) {
        return i;
      }
    }
    throw new AssertionError("No line starting with " + prefix);
  }

  private static String block(String sdl, String header) {
    int start = sdl.indexOf(header + " ");
    assertThat(start).as("definition %s", header).isNotNegative();
    return sdl.substring(start, sdl.indexOf('}', start) + 1);
  }
}
