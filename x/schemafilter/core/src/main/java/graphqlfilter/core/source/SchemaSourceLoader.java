package graphqlfilter.core.source;

import graphql.language.Definition;
import graphql.language.DirectiveDefinition;
import graphql.language.Document;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import graphqlfilter.api.ExposeDirectives;
import graphqlfilter.core.FilterLog;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds source schemas from SDL. Every input is parsed into a document, the documents are merged
 * (so {@code extend type} fragments may live in separate files), applied directives the sources
 * do not declare are removed, and the declarations of the visibility directives are added when
 * the sources leave them out.
 *
 * <p>Syntax errors surface as graphql-java {@code InvalidSyntaxException} and invalid schemas as
 * {@code SchemaProblem}; both are passed through unchanged.
 */
public class SchemaSourceLoader {

  private final UnknownDirectiveStripper stripper;

  public SchemaSourceLoader() {
    this(FilterLog.silent(SchemaSourceLoader.class));
  }

  public SchemaSourceLoader(FilterLog log) {
    this.stripper =
        new UnknownDirectiveStripper(
            Set.of(ExposeDirectives.EXPOSE, ExposeDirectives.DISABLE_AUTO_EXPOSE), log);
  }

  /**
   * Builds a schema from SDL text.
   *
   * @param sdl the schema definition
   * @return the schema
   */
  public GraphQLSchema load(String sdl) {
    return build(List.of(Parser.parse(sdl)));
  }

  /**
   * Builds a schema from a reader. The reader is closed.
   *
   * @param reader the reader to parse from
   * @return the schema
   * @throws IOException if there's an error reading the content
   */
  public GraphQLSchema load(Reader reader) throws IOException {
    return load(readAll(reader));
  }

  /**
   * Builds a schema from a UTF-8 schema file.
   *
   * @param schemaFile the schema file
   * @return the schema
   * @throws IOException if the file cannot be read
   */
  public GraphQLSchema load(File schemaFile) throws IOException {
    return load(List.of(schemaFile));
  }

  /**
   * Builds one schema from several UTF-8 schema files.
   *
   * @param schemaFiles the schema files to merge
   * @return the merged schema
   * @throws IOException if a file cannot be read
   */
  public GraphQLSchema load(List<File> schemaFiles) throws IOException {
    List<Document> documents = new ArrayList<>();
    for (File schemaFile : schemaFiles) {
      documents.add(Parser.parse(Files.readString(schemaFile.toPath(), StandardCharsets.UTF_8)));
    }
    return build(documents);
  }

  /** Merges parsed sources into the document a schema is built from. */
  Document prepare(List<Document> documents) {
    List<Definition> definitions = new ArrayList<>();
    for (Document document : documents) {
      definitions.addAll(document.getDefinitions());
    }
    addMissingDeclaration(definitions, ExposeDirectives.EXPOSE, ExposeDirectives.EXPOSE_DEFINITION);
    addMissingDeclaration(
        definitions,
        ExposeDirectives.DISABLE_AUTO_EXPOSE,
        ExposeDirectives.DISABLE_AUTO_EXPOSE_DEFINITION);
    return stripper.strip(Document.newDocument().definitions(definitions).build());
  }

  private GraphQLSchema build(List<Document> documents) {
    TypeDefinitionRegistry registry = new SchemaParser().buildRegistry(prepare(documents));
    return UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
  }

  private static void addMissingDeclaration(
      List<Definition> definitions, String name, String declaration) {
    for (Definition<?> definition : definitions) {
      if (definition instanceof DirectiveDefinition directive && directive.getName().equals(name)) {
        return;
      }
    }
    definitions.addAll(Parser.parse(declaration).getDefinitions());
  }

  /** Reads all content from a Reader into a String. */
  private static String readAll(Reader reader) throws IOException {
    StringBuilder sb = new StringBuilder();
    try (BufferedReader br = new BufferedReader(reader)) {
      String line;
      while ((line = br.readLine()) != null) {
        sb.append(line).append("\n");
      }
    }
    return sb.toString();
  }
}
