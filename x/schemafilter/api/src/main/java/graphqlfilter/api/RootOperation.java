package graphqlfilter.api;

/** The three schema entry points, in the order they are printed and assembled. */
public enum RootOperation {
  QUERY,
  MUTATION,
  SUBSCRIPTION
}
