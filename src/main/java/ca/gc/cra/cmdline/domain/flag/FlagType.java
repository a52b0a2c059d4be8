package ca.gc.cra.cmdline.domain.flag;

/**
 * Value type declared for a flag.
 *
 * <p><strong>Why:</strong> Determines how a flag's textual value is coerced and whether a value token is
 * required at all.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and safe to share.</p>
 *
 * @since 0.1.0
 */
public enum FlagType {
  /** Switch; presence means {@code true}. Never requires a value token. */
  BOOL("bool"),
  /** Free-form text value. */
  STRING("string"),
  /** Signed 64-bit integer value. */
  INT("int"),
  /** Double-precision floating point value. */
  FLOAT("float");

  private final String label;

  FlagType(String label) {
    this.label = label;
  }

  /**
   * Returns the lower-case label shown in help output.
   *
   * @return label such as {@code int}
   */
  public String label() {
    return label;
  }

  /**
   * Indicates whether occurrences of this type carry a value.
   *
   * @return {@code false} for {@link #BOOL}, {@code true} otherwise
   */
  public boolean takesValue() {
    return this != BOOL;
  }
}
