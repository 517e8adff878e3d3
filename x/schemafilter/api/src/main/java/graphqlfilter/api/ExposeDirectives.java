package graphqlfilter.api;

/**
 * Names and declarations of the visibility directives recognized in source schemas.
 *
 * <h2>Field-level: {@code @expose}</h2>
 *
 * <p>Repeatable on output and input fields. The field is visible only to the listed targets; an
 * empty list hides the field from every target.
 *
 * <pre>{@code
 * type Query {
 *   users: [User!]! @expose(tags: ["readonly", "admin"])
 *   adminUsers: [User!]! @expose(tags: ["admin"])
 * }
 * }</pre>
 *
 * <h2>Type-level: {@code @disableAutoExpose}</h2>
 *
 * <p>Fields of ordinary object and interface types are visible by default. Marking a type with
 * {@code @disableAutoExpose} switches it to the same explicit-only mode that root types use: a
 * field without {@code @expose} is hidden.
 *
 * <pre>{@code
 * type BillingInfo @disableAutoExpose {
 *   accountNumber: String @expose(tags: ["admin"])
 *   balance: Float
 * }
 * }</pre>
 */
public final class ExposeDirectives {

  /** Name of the field-level directive. */
  public static final String EXPOSE = "expose";

  /** Name of the {@code @expose} argument holding the target list. */
  public static final String TAGS_ARGUMENT = "tags";

  /** Name of the type-level directive. */
  public static final String DISABLE_AUTO_EXPOSE = "disableAutoExpose";

  /** SDL declaration of {@code @expose}. */
  public static final String EXPOSE_DEFINITION =
      "directive @expose(tags: [String!]!) repeatable on FIELD_DEFINITION | INPUT_FIELD_DEFINITION";

  /** SDL declaration of {@code @disableAutoExpose}. */
  public static final String DISABLE_AUTO_EXPOSE_DEFINITION =
      "directive @disableAutoExpose on OBJECT | INTERFACE";

  private ExposeDirectives() {
    // Static utility class
  }
}
