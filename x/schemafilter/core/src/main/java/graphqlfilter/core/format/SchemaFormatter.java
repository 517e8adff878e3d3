package graphqlfilter.core.format;

import graphql.language.AstPrinter;
import graphql.language.Definition;
import graphql.language.DirectiveDefinition;
import graphql.language.Document;
import graphql.language.EnumTypeExtensionDefinition;
import graphql.language.FieldDefinition;
import graphql.language.InputObjectTypeDefinition;
import graphql.language.InputObjectTypeExtensionDefinition;
import graphql.language.InputValueDefinition;
import graphql.language.InterfaceTypeDefinition;
import graphql.language.InterfaceTypeExtensionDefinition;
import graphql.language.NamedNode;
import graphql.language.ObjectTypeDefinition;
import graphql.language.ObjectTypeExtensionDefinition;
import graphql.language.OperationTypeDefinition;
import graphql.language.SDLDefinition;
import graphql.language.ScalarTypeDefinition;
import graphql.language.ScalarTypeExtensionDefinition;
import graphql.language.SchemaDefinition;
import graphql.language.SchemaExtensionDefinition;
import graphql.language.TypeDefinition;
import graphql.language.UnionTypeExtensionDefinition;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import graphqlfilter.core.text.SdlDocuments;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prints a schema as SDL in a stable layout.
 *
 * <p>Definitions are grouped in this order: the schema block, the root types (query, mutation,
 * subscription), scalars, directive definitions, then every other named type. With {@link
 * SortOrder#ALPHABETICAL} definitions are sorted by name inside each group; with {@link
 * SortOrder#NONE} the grouping is skipped and the printer's order is kept. Type extension
 * definitions, and operations or fragments in SDL text, are never printed.
 */
public class SchemaFormatter {

  private static final List<String> ROOT_OPERATIONS = List.of("query", "mutation", "subscription");
  private static final Map<String, String> DEFAULT_ROOT_NAMES =
      Map.of("query", "Query", "mutation", "Mutation", "subscription", "Subscription");

  private enum Group {
    SCHEMA,
    ROOT_TYPES,
    SCALARS,
    DIRECTIVES,
    NAMED_TYPES
  }

  private record Keyed(Group group, String sortKey, Definition<?> definition) {}

  private static final Comparator<Keyed> ORDER =
      Comparator.comparing(Keyed::group).thenComparing(Keyed::sortKey);

  public String format(GraphQLSchema schema, FormatOptions options) {
    return format(SdlDocuments.toDocument(schema), options);
  }

  /** Formats SDL text. The text must parse, but is not validated as a schema. */
  public String format(String sdl, FormatOptions options) {
    return format(Parser.parse(sdl), options);
  }

  public String format(Document document, FormatOptions options) {
    Map<String, String> rootSortKeys = rootSortKeys(document);

    List<Keyed> keyed = new ArrayList<>();
    for (Definition<?> definition : document.getDefinitions()) {
      if (!(definition instanceof SDLDefinition) || isExtension(definition)) {
        continue;
      }
      Definition<?> sorted =
          options.fields() == SortOrder.ALPHABETICAL ? sortFields(definition) : definition;
      keyed.add(key(sorted, rootSortKeys));
    }
    if (options.definitions() == SortOrder.ALPHABETICAL) {
      keyed.sort(ORDER);
    }

    List<Definition> definitions = new ArrayList<>();
    for (Keyed entry : keyed) {
      definitions.add(entry.definition());
    }
    return AstPrinter.printAst(document.transform(builder -> builder.definitions(definitions)));
  }

  // SDLExtensionDefinition is also implemented by plain interface definitions, so the concrete
  // extension classes are checked instead
  private static boolean isExtension(Definition<?> definition) {
    return definition instanceof ObjectTypeExtensionDefinition
        || definition instanceof InterfaceTypeExtensionDefinition
        || definition instanceof UnionTypeExtensionDefinition
        || definition instanceof InputObjectTypeExtensionDefinition
        || definition instanceof EnumTypeExtensionDefinition
        || definition instanceof ScalarTypeExtensionDefinition
        || definition instanceof SchemaExtensionDefinition;
  }

  // Root type name -> sort key that puts query before mutation before subscription
  private static Map<String, String> rootSortKeys(Document document) {
    Map<String, String> rootNames = new HashMap<>(DEFAULT_ROOT_NAMES);
    for (Definition<?> definition : document.getDefinitions()) {
      if (definition instanceof SchemaDefinition schemaDefinition) {
        for (OperationTypeDefinition operation : schemaDefinition.getOperationTypeDefinitions()) {
          rootNames.put(operation.getName(), operation.getTypeName().getName());
        }
      }
    }
    Map<String, String> sortKeys = new HashMap<>();
    for (int i = 0; i < ROOT_OPERATIONS.size(); i++) {
      String operation = ROOT_OPERATIONS.get(i);
      sortKeys.putIfAbsent(rootNames.get(operation), i + "_" + operation);
    }
    return sortKeys;
  }

  private static Keyed key(Definition<?> definition, Map<String, String> rootSortKeys) {
    if (definition instanceof SchemaDefinition) {
      return new Keyed(Group.SCHEMA, "", definition);
    }
    if (definition instanceof ObjectTypeDefinition object
        && rootSortKeys.containsKey(object.getName())) {
      return new Keyed(Group.ROOT_TYPES, rootSortKeys.get(object.getName()), definition);
    }
    if (definition instanceof ScalarTypeDefinition scalar) {
      return new Keyed(Group.SCALARS, scalar.getName(), definition);
    }
    if (definition instanceof DirectiveDefinition directive) {
      return new Keyed(Group.DIRECTIVES, directive.getName(), definition);
    }
    if (definition instanceof TypeDefinition<?> type) {
      return new Keyed(Group.NAMED_TYPES, type.getName(), definition);
    }
    throw new IllegalArgumentException(
        "Not a schema definition: " + definition.getClass().getSimpleName());
  }

  private static Definition<?> sortFields(Definition<?> definition) {
    if (definition instanceof ObjectTypeDefinition object) {
      List<FieldDefinition> fields = byName(object.getFieldDefinitions());
      return object.transform(builder -> builder.fieldDefinitions(fields));
    }
    if (definition instanceof InterfaceTypeDefinition iface) {
      List<FieldDefinition> fields = byName(iface.getFieldDefinitions());
      return iface.transform(builder -> builder.definitions(fields));
    }
    if (definition instanceof InputObjectTypeDefinition input) {
      List<InputValueDefinition> fields = byName(input.getInputValueDefinitions());
      return input.transform(builder -> builder.inputValueDefinitions(fields));
    }
    return definition;
  }

  private static <T extends NamedNode<?>> List<T> byName(List<T> nodes) {
    Comparator<T> byName = Comparator.comparing(NamedNode::getName);
    List<T> sorted = new ArrayList<>(nodes);
    sorted.sort(byName);
    return sorted;
  }
}
