package graphqlfilter.core.reconstruction;

import static graphql.schema.GraphQLFieldDefinition.newFieldDefinition;
import static graphql.schema.GraphQLObjectType.newObject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import graphql.Scalars;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeReference;
import graphqlfilter.api.SchemaConstructionException;
import org.junit.jupiter.api.Test;

class TypeArenaTest {

  private static GraphQLObjectType user() {
    return newObject()
        .name("User")
        .field(newFieldDefinition().name("id").type(Scalars.GraphQLID))
        .build();
  }

  @Test
  void provisionalNamesResolveToReferences() {
    TypeArena arena = new TypeArena();
    arena.publishProvisional(user());

    assertThat(arena.contains("User")).isTrue();
    assertThat(arena.isReconciled("User")).isFalse();
    assertThat(arena.resolve("User")).isInstanceOf(GraphQLTypeReference.class);
  }

  @Test
  void reconciledNamesResolveToTheFinalInstance() {
    TypeArena arena = new TypeArena();
    arena.publishProvisional(user());
    GraphQLObjectType reconciled = user();

    arena.reconcile(reconciled);

    assertThat(arena.resolve("User")).isSameAs(reconciled);
    assertThat(arena.lookup("User")).isSameAs(reconciled);
    assertThat(arena.reconciledTypes()).containsExactly(reconciled);
  }

  @Test
  void rejectsSecondReconciliation() {
    TypeArena arena = new TypeArena();
    arena.publishProvisional(user());
    arena.reconcile(user());

    assertThatThrownBy(() -> arena.reconcile(user()))
        .isInstanceOf(SchemaConstructionException.class)
        .hasMessageContaining("User");
  }

  @Test
  void rejectsDuplicatePublication() {
    TypeArena arena = new TypeArena();
    arena.publishProvisional(user());

    assertThatThrownBy(() -> arena.publishProvisional(user()))
        .isInstanceOf(SchemaConstructionException.class);
  }

  @Test
  void rejectsUnknownNames() {
    TypeArena arena = new TypeArena();

    assertThatThrownBy(() -> arena.lookup("Ghost"))
        .isInstanceOf(SchemaConstructionException.class)
        .hasMessageContaining("Ghost");
    assertThatThrownBy(() -> arena.resolve("Ghost"))
        .isInstanceOf(SchemaConstructionException.class);
    assertThatThrownBy(() -> arena.reconcile(user()))
        .isInstanceOf(SchemaConstructionException.class);
  }

  @Test
  void rewrapKeepsListAndNonNullStructure() {
    TypeArena arena = new TypeArena();
    arena.publishProvisional(user());
    GraphQLObjectType reconciled = user();
    arena.reconcile(reconciled);

    GraphQLType rewrapped =
        arena.rewrap(GraphQLNonNull.nonNull(GraphQLList.list(GraphQLNonNull.nonNull(user()))));

    assertThat(rewrapped).isInstanceOf(GraphQLNonNull.class);
    GraphQLType list = ((GraphQLNonNull) rewrapped).getWrappedType();
    assertThat(list).isInstanceOf(GraphQLList.class);
    GraphQLType element = ((GraphQLList) list).getWrappedType();
    assertThat(((GraphQLNonNull) element).getWrappedType()).isSameAs(reconciled);
  }
}
