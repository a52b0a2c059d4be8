package ca.gc.cra.cmdline.config;

import ca.gc.cra.cmdline.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Host-configurable dispatch policy.
 * <p><strong>Why:</strong> The help trigger and console decoration are conventions layered on top of command
 * resolution; hosts tune them without touching the command tree.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safely shareable.</p>
 *
 * @param helpEnabled whether help triggers short-circuit the action
 * @param helpKeys flag keys (without dashes) that request help, such as {@code help} and {@code h}
 * @param color whether help output uses ANSI colors
 * @param verbose whether to raise the logging backend to DEBUG when a dispatcher is created
 *
 * @since 0.1.0
 */
public record DispatchConfig(boolean helpEnabled, Set<String> helpKeys, boolean color, boolean verbose) {
  /** Top-level YAML section read by {@link #load(Path)}. */
  public static final String SECTION = "dispatch";

  private static final Set<String> DEFAULT_HELP_KEYS = Set.of("help", "h");

  public DispatchConfig {
    helpKeys = helpKeys == null ? Set.of() : Set.copyOf(helpKeys);
  }

  /**
   * Returns the built-in policy: help on {@code --help}/{@code -h}, no color, default log level.
   *
   * @return default configuration
   */
  public static DispatchConfig defaults() {
    return new DispatchConfig(true, DEFAULT_HELP_KEYS, false, false);
  }

  /**
   * Reads the {@code dispatch} section of a YAML file, falling back to {@link #defaults()} for missing keys.
   *
   * <pre>
   * dispatch:
   *   verbose: false
   *   help:
   *     enabled: true
   *     keys: [help, h, "?"]
   *     color: true
   * </pre>
   *
   * @param path YAML file; a missing file yields the defaults
   * @return merged configuration
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML or a value is malformed
   */
  public static DispatchConfig load(Path path) throws IOException {
    return YamlConfigLoader.load(path, SECTION)
        .map(DispatchConfig::fromMap)
        .orElseGet(DispatchConfig::defaults);
  }

  /**
   * Builds a configuration from flattened {@code dispatch} keys.
   *
   * @param values flattened keys such as {@code help.enabled}
   * @return merged configuration
   * @throws IllegalArgumentException when a boolean or key value is malformed
   */
  public static DispatchConfig fromMap(Map<String, String> values) {
    DispatchConfig defaults = defaults();
    boolean helpEnabled = bool(values, "help.enabled", defaults.helpEnabled());
    boolean color = bool(values, "help.color", defaults.color());
    boolean verbose = bool(values, "verbose", defaults.verbose());
    Set<String> keys = defaults.helpKeys();
    String rawKeys = values.get("help.keys");
    if (rawKeys != null && !rawKeys.isBlank()) {
      keys = new LinkedHashSet<>(Strings.splitAliases("help.keys", List.of(rawKeys)));
    }
    return new DispatchConfig(helpEnabled, keys, color, verbose);
  }

  /**
   * Returns a copy with help triggering switched on or off.
   *
   * @param enabled whether help triggers are honoured
   * @return updated configuration
   */
  public DispatchConfig withHelpEnabled(boolean enabled) {
    return new DispatchConfig(enabled, helpKeys, color, verbose);
  }

  public DispatchConfig withColor(boolean enabled) {
    return new DispatchConfig(helpEnabled, helpKeys, enabled, verbose);
  }

  private static boolean bool(Map<String, String> values, String key, boolean fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(SECTION + "." + key + " must be a boolean (was '" + raw + "')");
    };
  }
}
