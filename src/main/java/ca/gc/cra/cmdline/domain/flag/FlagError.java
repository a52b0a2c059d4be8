package ca.gc.cra.cmdline.domain.flag;

/**
 * <strong>What:</strong> Closed set of reasons a typed flag lookup can fail.
 * <p><strong>Why:</strong> Callers distinguish an undeclared flag (a programming defect) from an absent optional
 * flag or a malformed value supplied by the user, so the kinds are never collapsed into a default value.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum FlagError {
  /** Requested name or alias is not declared on the matched command or any ancestor. */
  UNDEFINED("Flag undefined"),
  /** Flag is declared with a different {@link FlagType} than the accessor requested. */
  TYPE_ERROR("Flag type mismatch"),
  /** Flag is declared but was not supplied for this invocation. */
  NOT_FOUND("Flag not found"),
  /** Flag was supplied without a value token. */
  ARGUMENT_ERROR("Illegal argument"),
  /** Value token could not be parsed as the declared type. */
  VALUE_TYPE_ERROR("Value type mismatch");

  private final String description;

  FlagError(String description) {
    this.description = description;
  }

  /**
   * Returns a short human-readable description.
   *
   * @return description such as {@code "Flag not found"}
   */
  public String description() {
    return description;
  }
}
