package graphqlfilter.api;

/** Verbosity threshold for a filter run. Messages below the threshold are not emitted. */
public enum LogLevel {
  DEBUG,
  INFO,
  WARN,
  NONE;

  /**
   * Checks whether a message at {@code level} passes this threshold.
   *
   * @param level the message level
   * @return true if the message should be emitted
   */
  public boolean allows(LogLevel level) {
    return level != NONE && level.ordinal() >= ordinal();
  }
}
