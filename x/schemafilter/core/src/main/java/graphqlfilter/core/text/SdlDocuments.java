package graphqlfilter.core.text;

import graphql.language.Definition;
import graphql.language.DirectiveDefinition;
import graphql.language.Document;
import graphql.language.ScalarTypeDefinition;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.DirectiveInfo;
import graphql.schema.idl.ScalarInfo;
import graphql.schema.idl.SchemaPrinter;
import java.util.ArrayList;
import java.util.List;

/** Conversions between a {@link GraphQLSchema} and its SDL document. */
public final class SdlDocuments {

  private SdlDocuments() {}

  /** Prints a schema as SDL, schema block included. */
  public static String print(GraphQLSchema schema) {
    SchemaPrinter printer =
        new SchemaPrinter(SchemaPrinter.Options.defaultOptions().includeSchemaDefinition(true));
    return printer.print(schema);
  }

  /**
   * Prints a schema and parses the result back into a document without the definitions of
   * graphql-specified directives and scalars. graphql-java adds those itself when a document is
   * built into a schema.
   */
  public static Document toDocument(GraphQLSchema schema) {
    return withoutBuiltIns(Parser.parse(print(schema)));
  }

  /** Removes the definitions of graphql-specified directives and scalars from a document. */
  public static Document withoutBuiltIns(Document document) {
    List<Definition> definitions = new ArrayList<>();
    for (Definition<?> definition : document.getDefinitions()) {
      if (definition instanceof DirectiveDefinition directive
          && DirectiveInfo.isGraphqlSpecifiedDirective(directive.getName())) {
        continue;
      }
      if (definition instanceof ScalarTypeDefinition scalar
          && ScalarInfo.isGraphqlSpecifiedScalar(scalar.getName())) {
        continue;
      }
      definitions.add(definition);
    }
    return document.transform(builder -> builder.definitions(definitions));
  }
}
