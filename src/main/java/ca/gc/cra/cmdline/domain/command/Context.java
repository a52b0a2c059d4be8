package ca.gc.cra.cmdline.domain.command;

import ca.gc.cra.cmdline.domain.flag.FlagDescriptor;
import ca.gc.cra.cmdline.domain.flag.FlagError;
import ca.gc.cra.cmdline.domain.flag.FlagException;
import ca.gc.cra.cmdline.domain.flag.FlagType;
import ca.gc.cra.cmdline.domain.flag.RawFlagOccurrence;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Read-only bundle handed to an action: the matched command's positional arguments and
 * the flag occurrences visible to it, with typed accessors.
 * <p><strong>Scope:</strong> flags declared on the matched command and on every ancestor are visible; a
 * declaration closer to the matched command that claims an ancestor flag's name hides that ancestor flag,
 * aliases included.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction. One instance per dispatch.</p>
 *
 * @since 0.1.0
 */
public final class Context {
  private static final Logger log = LoggerFactory.getLogger(Context.class);

  private final List<String> args;
  private final CommandDescriptor command;
  // nearest command first, shadowed declarations removed
  private final List<FlagDescriptor> scope;
  private final Map<String, RawFlagOccurrence> occurrences;
  private final String helpText;
  private final Consumer<String> helpSink;

  private Context(
      List<String> args,
      CommandDescriptor command,
      List<FlagDescriptor> scope,
      Map<String, RawFlagOccurrence> occurrences,
      String helpText,
      Consumer<String> helpSink) {
    this.args = List.copyOf(args);
    this.command = command;
    this.scope = scope;
    this.occurrences = Map.copyOf(occurrences);
    this.helpText = helpText == null ? "" : helpText;
    this.helpSink = helpSink == null ? text -> {} : helpSink;
  }

  /**
   * Builds the context for a resolved invocation.
   *
   * <p>Each occurrence is matched against the flags in scope and stored under the canonical name of the
   * nearest matching declaration; a later occurrence replaces an earlier one. Occurrences matching no
   * declaration are dropped.</p>
   *
   * @param resolution matched command, its path, and the remaining positional arguments
   * @param occurrences every flag occurrence extracted from the command line, in order
   * @param helpText rendered help for the matched command, printed by {@link #help()}
   * @param helpSink destination for {@link #help()}; may be {@code null} to discard
   * @return immutable context
   */
  public static Context of(
      ResolutionResult resolution,
      List<RawFlagOccurrence> occurrences,
      String helpText,
      Consumer<String> helpSink) {
    Objects.requireNonNull(resolution, "resolution");
    List<FlagDescriptor> scope = resolution.visibleFlags();

    Map<String, RawFlagOccurrence> byName = new HashMap<>();
    for (RawFlagOccurrence occurrence : occurrences == null ? List.<RawFlagOccurrence>of() : occurrences) {
      Optional<FlagDescriptor> declared = lookup(scope, occurrence.key());
      if (declared.isPresent()) {
        byName.put(declared.get().name(), occurrence);
      } else {
        log.debug("Ignoring undeclared flag '{}' for command '{}'", occurrence.key(), resolution.command().name());
      }
    }
    return new Context(resolution.remainingArgs(), resolution.command(), scope, byName, helpText, helpSink);
  }

  /**
   * Builds a context without help output, mainly for tests and embedding.
   *
   * @param resolution matched command, its path, and the remaining positional arguments
   * @param occurrences extracted flag occurrences
   * @return immutable context
   */
  public static Context of(ResolutionResult resolution, List<RawFlagOccurrence> occurrences) {
    return of(resolution, occurrences, "", null);
  }

  /**
   * Positional arguments left after command resolution, with flags and their values removed.
   *
   * @return unmodifiable list in command-line order
   */
  public List<String> args() {
    return args;
  }

  public CommandDescriptor command() {
    return command;
  }

  /**
   * Reports whether a bool flag was supplied.
   *
   * <p>Presence with or without a value token means {@code true}. Undeclared names and flags declared with a
   * non-bool type yield {@code false}; this accessor never fails.</p>
   *
   * @param name flag name or alias
   * @return {@code true} when the switch is present
   */
  public boolean boolFlag(String name) {
    Optional<FlagDescriptor> declared = lookup(scope, name);
    if (declared.isEmpty() || declared.get().type() != FlagType.BOOL) {
      return false;
    }
    return occurrences.containsKey(declared.get().name());
  }

  /**
   * Returns the value of a string flag; {@code --name=} yields the empty string.
   *
   * @param name flag name or alias
   * @return supplied value
   * @throws FlagException with {@link FlagError#UNDEFINED}, {@link FlagError#TYPE_ERROR},
   *     {@link FlagError#NOT_FOUND}, or {@link FlagError#ARGUMENT_ERROR}
   */
  public String stringFlag(String name) throws FlagException {
    return rawValue(name, FlagType.STRING);
  }

  /**
   * Returns the value of an int flag.
   *
   * @param name flag name or alias
   * @return parsed value
   * @throws FlagException with any {@link FlagError} kind
   */
  public long intFlag(String name) throws FlagException {
    String raw = rawValue(name, FlagType.INT);
    // Long.parseLong accepts non-ASCII digits
    if (!isPrintableAscii(raw)) {
      throw new FlagException(FlagError.VALUE_TYPE_ERROR, name);
    }
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new FlagException(FlagError.VALUE_TYPE_ERROR, name, ex);
    }
  }

  /**
   * Returns the value of a float flag.
   *
   * @param name flag name or alias
   * @return parsed value
   * @throws FlagException with any {@link FlagError} kind
   */
  public double floatFlag(String name) throws FlagException {
    String raw = rawValue(name, FlagType.FLOAT);
    // Double.parseDouble tolerates padding, hex literals and d/f suffixes
    if (raw.isEmpty() || !isPrintableAscii(raw) || isHexLiteral(raw) || endsWithTypeSuffix(raw)) {
      throw new FlagException(FlagError.VALUE_TYPE_ERROR, name);
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new FlagException(FlagError.VALUE_TYPE_ERROR, name, ex);
    }
  }

  /**
   * Returns the help text rendered for the matched command.
   *
   * @return help text; empty when none was supplied
   */
  public String helpText() {
    return helpText;
  }

  /** Prints the help text for the matched command. */
  public void help() {
    helpSink.accept(helpText);
  }

  private String rawValue(String name, FlagType requested) throws FlagException {
    FlagDescriptor declared = lookup(scope, name)
        .orElseThrow(() -> new FlagException(FlagError.UNDEFINED, name));
    if (declared.type() != requested) {
      throw new FlagException(FlagError.TYPE_ERROR, name);
    }
    RawFlagOccurrence occurrence = occurrences.get(declared.name());
    if (occurrence == null) {
      throw new FlagException(FlagError.NOT_FOUND, name);
    }
    return occurrence.value().orElseThrow(() -> new FlagException(FlagError.ARGUMENT_ERROR, name));
  }

  private static Optional<FlagDescriptor> lookup(List<FlagDescriptor> scope, String key) {
    if (key == null) {
      return Optional.empty();
    }
    for (FlagDescriptor flag : scope) {
      if (flag.matches(key)) {
        return Optional.of(flag);
      }
    }
    return Optional.empty();
  }

  private static boolean isPrintableAscii(String raw) {
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c <= ' ' || c > '~') {
        return false;
      }
    }
    return true;
  }

  private static boolean isHexLiteral(String raw) {
    return raw.indexOf('x') >= 0 || raw.indexOf('X') >= 0;
  }

  private static boolean endsWithTypeSuffix(String raw) {
    char last = raw.charAt(raw.length() - 1);
    return last == 'd' || last == 'D' || last == 'f' || last == 'F';
  }
}
