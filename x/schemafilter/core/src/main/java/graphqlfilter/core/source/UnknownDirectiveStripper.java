package graphqlfilter.core.source;

import graphql.language.AstTransformer;
import graphql.language.Definition;
import graphql.language.Directive;
import graphql.language.DirectiveDefinition;
import graphql.language.Document;
import graphql.language.Node;
import graphql.language.NodeVisitorStub;
import graphql.schema.idl.DirectiveInfo;
import graphql.util.TraversalControl;
import graphql.util.TraverserContext;
import graphql.util.TreeTransformerUtil;
import graphqlfilter.core.FilterLog;
import java.util.HashSet;
import java.util.Set;

/**
 * Removes applied directives that the document does not declare. Source fragments often carry
 * directives owned by other tooling, and graphql-java refuses to build a schema that uses an
 * undeclared directive.
 *
 * <p>graphql-specified directives ({@code @deprecated}, {@code @specifiedBy}, ...) are always
 * kept, as are the names passed to the constructor.
 */
final class UnknownDirectiveStripper {

  private final Set<String> alwaysKept;
  private final FilterLog log;

  UnknownDirectiveStripper(Set<String> alwaysKept, FilterLog log) {
    this.alwaysKept = Set.copyOf(alwaysKept);
    this.log = log.forClass(UnknownDirectiveStripper.class);
  }

  Document strip(Document document) {
    Set<String> declared = new HashSet<>(alwaysKept);
    for (Definition<?> definition : document.getDefinitions()) {
      if (definition instanceof DirectiveDefinition directive) {
        declared.add(directive.getName());
      }
    }

    NodeVisitorStub visitor =
        new NodeVisitorStub() {
          @Override
          public TraversalControl visitDirective(Directive node, TraverserContext<Node> context) {
            if (declared.contains(node.getName())
                || DirectiveInfo.isGraphqlSpecifiedDirective(node.getName())) {
              return TraversalControl.CONTINUE;
            }
            log.debug("Stripping undeclared directive @{}", node.getName());
            return TreeTransformerUtil.deleteNode(context);
          }
        };
    return (Document) new AstTransformer().transform(document, visitor);
  }
}
