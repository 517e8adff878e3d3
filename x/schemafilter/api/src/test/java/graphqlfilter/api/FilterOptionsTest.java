package graphqlfilter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FilterOptionsTest {

  @Test
  void defaults() {
    FilterOptions options = FilterOptions.defaults();

    assertThat(options.strategy()).isEqualTo(FilterStrategy.RECONSTRUCT);
    assertThat(options.implementorPolicy()).isEqualTo(ImplementorPolicy.ALL_IMPLEMENTORS);
    assertThat(options.logLevel()).isEqualTo(LogLevel.NONE);
  }

  @Test
  void toBuilderCopiesEverySetting() {
    FilterOptions options =
        FilterOptions.builder()
            .strategy(FilterStrategy.TEXT)
            .implementorPolicy(ImplementorPolicy.REACHABLE_ONLY)
            .logLevel(LogLevel.DEBUG)
            .build();

    assertThat(options.toBuilder().build()).isEqualTo(options);
    assertThat(options.toBuilder().logLevel(LogLevel.WARN).build().strategy())
        .isEqualTo(FilterStrategy.TEXT);
  }

  @Test
  void rejectsMissingSettings() {
    assertThatThrownBy(() -> FilterOptions.builder().strategy(null).build())
        .isInstanceOf(NullPointerException.class)
        .hasMessage("strategy");
  }

  @Test
  void logLevelThresholds() {
    assertThat(LogLevel.DEBUG.allows(LogLevel.DEBUG)).isTrue();
    assertThat(LogLevel.DEBUG.allows(LogLevel.WARN)).isTrue();
    assertThat(LogLevel.INFO.allows(LogLevel.DEBUG)).isFalse();
    assertThat(LogLevel.INFO.allows(LogLevel.INFO)).isTrue();
    assertThat(LogLevel.WARN.allows(LogLevel.INFO)).isFalse();
    assertThat(LogLevel.NONE.allows(LogLevel.WARN)).isFalse();
    assertThat(LogLevel.DEBUG.allows(LogLevel.NONE)).isFalse();
  }
}
