package ca.gc.cra.cmdline.validation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validation utilities for identifiers declared on command and flag descriptors.
 * <p><strong>Why:</strong> Configuration defects (blank names, embedded whitespace, leading dashes) are rejected
 * when the descriptor tree is built rather than surfacing as silent non-matches at dispatch time.
 * <p><strong>Role:</strong> Domain support utilities invoked by descriptor builders.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a command-line token identifier such as a command name, flag name, or alias.
   *
   * <p>Tokens must be non-blank, contain no whitespace, and must not start with {@code '-'} (the dash prefix
   * is added when the token is typed on the command line).</p>
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate token
   * @return trimmed token
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the token violates the rules above
   */
  public static String requireToken(String name, String value) {
    String token = requireNonBlank(name, value);
    if (token.startsWith("-")) {
      throw new IllegalArgumentException(message(name, "must not start with '-' (was '" + token + "')"));
    }
    for (int i = 0; i < token.length(); i++) {
      if (Character.isWhitespace(token.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain whitespace (was '" + token + "')"));
      }
    }
    return token;
  }

  /**
   * Splits alias declarations on {@code ','}, trims each part, and drops duplicates while keeping order.
   *
   * <p>{@code splitAliases("alias", List.of("a, ad", "x"))} yields {@code [a, ad, x]}.</p>
   *
   * @param name logical parameter name for diagnostics
   * @param declarations alias strings as declared; may be comma-joined
   * @return normalized alias list; never {@code null}
   * @throws IllegalArgumentException if any part is not a valid token
   */
  public static List<String> splitAliases(String name, Iterable<String> declarations) {
    Set<String> aliases = new LinkedHashSet<>();
    if (declarations == null) {
      return List.of();
    }
    for (String declaration : declarations) {
      Objects.requireNonNull(declaration, name);
      for (String part : declaration.split(",")) {
        aliases.add(requireToken(name, part));
      }
    }
    return List.copyOf(aliases);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
