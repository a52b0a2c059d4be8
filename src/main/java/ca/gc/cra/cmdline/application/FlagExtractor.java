package ca.gc.cra.cmdline.application;

import ca.gc.cra.cmdline.domain.flag.RawFlagOccurrence;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Splits raw command-line tokens into positional arguments and flag occurrences.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>{@code --key=value} and {@code -k=value} split on the first {@code '='}; {@code --key=} yields an empty
 *   value.</li>
 *   <li>{@code --key} and {@code -k} consume the next token as their value when it exists and does not start
 *   with {@code '-'}.</li>
 *   <li>Everything else, including a bare {@code -} or {@code --}, is positional.</li>
 * </ul>
 * <p>The extractor does not know declared flag types, so a bool switch followed by a plain token consumes
 * that token too; use {@code --switch=} or place switches last to avoid it.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FlagExtractor {
  private static final String LONG_PREFIX = "--";
  private static final String SHORT_PREFIX = "-";

  private FlagExtractor() {}

  /**
   * Partitions {@code tokens} in a single left-to-right pass.
   *
   * @param tokens raw tokens without the program name; {@code null} is treated as empty
   * @return positionals and occurrences, each in original order
   * @throws NullPointerException if any token is {@code null}
   */
  public static ExtractedTokens extract(List<String> tokens) {
    List<String> positionals = new ArrayList<>();
    List<RawFlagOccurrence> occurrences = new ArrayList<>();
    if (tokens == null) {
      return new ExtractedTokens(positionals, occurrences);
    }

    int i = 0;
    while (i < tokens.size()) {
      String token = Objects.requireNonNull(tokens.get(i), "token");
      String body = flagBody(token);
      if (body == null) {
        positionals.add(token);
        i++;
        continue;
      }
      int eq = body.indexOf('=');
      if (eq >= 0) {
        occurrences.add(RawFlagOccurrence.withValue(body.substring(0, eq), body.substring(eq + 1)));
        i++;
        continue;
      }
      if (i + 1 < tokens.size() && isValueToken(tokens.get(i + 1))) {
        occurrences.add(RawFlagOccurrence.withValue(body, tokens.get(i + 1)));
        i += 2;
      } else {
        occurrences.add(RawFlagOccurrence.withoutValue(body));
        i++;
      }
    }
    return new ExtractedTokens(positionals, occurrences);
  }

  /**
   * Tests whether a token is classified as a flag.
   *
   * @param token raw token
   * @return {@code true} for {@code --key...} or {@code -k...} with a non-empty key
   */
  public static boolean isFlag(String token) {
    return token != null && flagBody(token) != null;
  }

  // Returns the token without its dash prefix, or null when the token is positional.
  private static String flagBody(String token) {
    String body;
    if (token.startsWith(LONG_PREFIX)) {
      body = token.substring(LONG_PREFIX.length());
    } else if (token.startsWith(SHORT_PREFIX)) {
      body = token.substring(SHORT_PREFIX.length());
    } else {
      return null;
    }
    if (body.isEmpty() || body.startsWith("=")) {
      return null;
    }
    return body;
  }

  private static boolean isValueToken(String next) {
    return next != null && !next.startsWith(SHORT_PREFIX);
  }
}
