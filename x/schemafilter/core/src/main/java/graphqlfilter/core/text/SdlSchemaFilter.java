package graphqlfilter.core.text;

import graphql.GraphQLException;
import graphql.language.Definition;
import graphql.language.DirectiveDefinition;
import graphql.language.Document;
import graphql.language.EnumTypeDefinition;
import graphql.language.FieldDefinition;
import graphql.language.InputObjectTypeDefinition;
import graphql.language.InputValueDefinition;
import graphql.language.InterfaceTypeDefinition;
import graphql.language.ObjectTypeDefinition;
import graphql.language.OperationTypeDefinition;
import graphql.language.ScalarTypeDefinition;
import graphql.language.SchemaDefinition;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.UnionTypeDefinition;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import graphqlfilter.api.EmptyQueryRootException;
import graphqlfilter.api.SchemaConstructionException;
import graphqlfilter.core.FilterLog;
import graphqlfilter.core.analysis.FieldExposure;
import graphqlfilter.core.reachability.ReachableSet;
import graphqlfilter.core.reachability.SurvivingTypes;
import java.util.ArrayList;
import java.util.List;

/**
 * Filters a schema by editing its SDL document. The source schema is printed and reparsed, type
 * definitions that do not survive are removed together with the fields, interfaces, union members
 * and root operations that mention them, and the remaining document is rebuilt by graphql-java,
 * which resolves every reference by name.
 *
 * <p>Produces the same schema as {@link
 * graphqlfilter.core.reconstruction.SchemaReconstructor} for the same request.
 */
public class SdlSchemaFilter {

  private final FilterLog log;

  public SdlSchemaFilter(FilterLog log) {
    this.log = log.forClass(SdlSchemaFilter.class);
  }

  /**
   * Filters a schema through its SDL form.
   *
   * @throws EmptyQueryRootException if no query root field is exposed
   * @throws SchemaConstructionException if graphql-java rejects the filtered document
   */
  public GraphQLSchema filter(
      GraphQLSchema schema, FieldExposure exposure, ReachableSet reachable) {
    SurvivingTypes survivors = SurvivingTypes.compute(schema, exposure, reachable);
    String query = exposure.rootTypeNames().query();
    if (query == null || !survivors.contains(query)) {
      throw new EmptyQueryRootException(query == null ? "Query" : query, exposure.target());
    }

    Document document = prune(SdlDocuments.toDocument(schema), survivors);
    log.debug("[Text] {} definitions kept", document.getDefinitions().size());

    try {
      TypeDefinitionRegistry registry = new SchemaParser().buildRegistry(document);
      return UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
    } catch (GraphQLException e) {
      throw new SchemaConstructionException(
          "Filtered SDL for target '" + exposure.target() + "' could not be built: "
              + e.getMessage(),
          e);
    }
  }

  /** Removes from a document everything that does not survive. */
  Document prune(Document document, SurvivingTypes survivors) {
    List<Definition> kept = new ArrayList<>();
    for (Definition<?> definition : document.getDefinitions()) {
      if (definition instanceof SchemaDefinition schemaDefinition) {
        kept.add(pruneSchemaDefinition(schemaDefinition, survivors));
      } else if (definition instanceof DirectiveDefinition) {
        kept.add(definition);
      } else if (definition instanceof ObjectTypeDefinition object) {
        if (survivors.contains(object.getName())) {
          kept.add(pruneObject(object, survivors));
        }
      } else if (definition instanceof InterfaceTypeDefinition iface) {
        if (survivors.contains(iface.getName())) {
          kept.add(pruneInterface(iface, survivors));
        }
      } else if (definition instanceof UnionTypeDefinition union) {
        if (survivors.contains(union.getName())) {
          List<Type> members = survivingNames(union.getMemberTypes(), survivors);
          kept.add(union.transform(builder -> builder.memberTypes(members)));
        }
      } else if (definition instanceof InputObjectTypeDefinition input) {
        if (survivors.contains(input.getName())) {
          kept.add(pruneInput(input, survivors));
        }
      } else if (definition instanceof EnumTypeDefinition enumDefinition) {
        if (survivors.contains(enumDefinition.getName())) {
          kept.add(definition);
        }
      } else if (definition instanceof ScalarTypeDefinition scalar) {
        if (survivors.contains(scalar.getName())) {
          kept.add(definition);
        }
      } else {
        log.debug(
            "[Text] Dropping unexpected definition {}", definition.getClass().getSimpleName());
      }
    }
    return document.transform(builder -> builder.definitions(kept));
  }

  private static SchemaDefinition pruneSchemaDefinition(
      SchemaDefinition definition, SurvivingTypes survivors) {
    List<OperationTypeDefinition> operations = new ArrayList<>();
    for (OperationTypeDefinition operation : definition.getOperationTypeDefinitions()) {
      if (survivors.contains(operation.getTypeName().getName())) {
        operations.add(operation);
      }
    }
    return definition.transform(builder -> builder.operationTypeDefinitions(operations));
  }

  private static ObjectTypeDefinition pruneObject(
      ObjectTypeDefinition object, SurvivingTypes survivors) {
    List<FieldDefinition> fields = new ArrayList<>();
    for (FieldDefinition field : object.getFieldDefinitions()) {
      if (survivors.keepsField(object.getName(), field.getName())) {
        fields.add(field);
      }
    }
    List<Type> interfaces = survivingNames(object.getImplements(), survivors);
    return object.transform(builder -> builder.fieldDefinitions(fields).implementz(interfaces));
  }

  private static InterfaceTypeDefinition pruneInterface(
      InterfaceTypeDefinition iface, SurvivingTypes survivors) {
    List<FieldDefinition> fields = new ArrayList<>();
    for (FieldDefinition field : iface.getFieldDefinitions()) {
      if (survivors.keepsField(iface.getName(), field.getName())) {
        fields.add(field);
      }
    }
    List<Type> interfaces = survivingNames(iface.getImplements(), survivors);
    return iface.transform(builder -> builder.definitions(fields).implementz(interfaces));
  }

  private static InputObjectTypeDefinition pruneInput(
      InputObjectTypeDefinition input, SurvivingTypes survivors) {
    List<InputValueDefinition> fields = new ArrayList<>();
    for (InputValueDefinition field : input.getInputValueDefinitions()) {
      if (survivors.keepsInputField(input.getName(), field.getName())) {
        fields.add(field);
      }
    }
    return input.transform(builder -> builder.inputValueDefinitions(fields));
  }

  // Interface and member lists only ever hold named types
  private static List<Type> survivingNames(List<Type> types, SurvivingTypes survivors) {
    List<Type> kept = new ArrayList<>();
    for (Type<?> type : types) {
      if (type instanceof TypeName name && survivors.contains(name.getName())) {
        kept.add(type);
      }
    }
    return kept;
  }
}
