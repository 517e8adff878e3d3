package graphqlfilter.api;

import java.util.Objects;

/**
 * Configuration for a filter run.
 *
 * @param strategy how the filtered schema is produced
 * @param implementorPolicy which implementors of reachable interfaces are kept
 * @param logLevel verbosity threshold for this run
 */
public record FilterOptions(
    FilterStrategy strategy, ImplementorPolicy implementorPolicy, LogLevel logLevel) {

  public FilterOptions {
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(implementorPolicy, "implementorPolicy");
    Objects.requireNonNull(logLevel, "logLevel");
  }

  /** Reconstruction strategy, all implementors, no logging. */
  public static FilterOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized from this configuration. */
  public Builder toBuilder() {
    return new Builder()
        .strategy(strategy)
        .implementorPolicy(implementorPolicy)
        .logLevel(logLevel);
  }

  /** Builder for {@link FilterOptions}. */
  public static final class Builder {
    private FilterStrategy strategy = FilterStrategy.RECONSTRUCT;
    private ImplementorPolicy implementorPolicy = ImplementorPolicy.ALL_IMPLEMENTORS;
    private LogLevel logLevel = LogLevel.NONE;

    private Builder() {}

    public Builder strategy(FilterStrategy strategy) {
      this.strategy = strategy;
      return this;
    }

    public Builder implementorPolicy(ImplementorPolicy implementorPolicy) {
      this.implementorPolicy = implementorPolicy;
      return this;
    }

    public Builder logLevel(LogLevel logLevel) {
      this.logLevel = logLevel;
      return this;
    }

    public FilterOptions build() {
      return new FilterOptions(strategy, implementorPolicy, logLevel);
    }
  }
}
