package ca.gc.cra.cmdline.domain.flag;

import ca.gc.cra.cmdline.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable declaration of one configurable option on a command.
 * <p><strong>Why:</strong> The declared {@link FlagType} drives type checking and value coercion in
 * {@code Context} accessors; aliases let short spellings such as {@code -a} map to {@code --age}.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safely shareable.</p>
 *
 * @param name canonical flag name typed after {@code --}; never blank
 * @param aliases alternative keys in declaration order; never {@code null}
 * @param type declared value type; never {@code null}
 * @param description optional human-readable description; may be {@code null}
 *
 * @since 0.1.0
 */
public record FlagDescriptor(String name, List<String> aliases, FlagType type, String description) {

  /**
   * Validates identifiers and normalizes the alias list.
   */
  public FlagDescriptor {
    name = Strings.requireToken("flag name", name);
    type = Objects.requireNonNull(type, "type");
    aliases = Strings.splitAliases("flag alias", aliases);
    if (aliases.contains(name)) {
      List<String> filtered = new ArrayList<>(aliases);
      filtered.remove(name);
      aliases = List.copyOf(filtered);
    }
    if (description != null && description.isBlank()) {
      description = null;
    }
  }

  /**
   * Declares a flag without aliases or description.
   *
   * @param name canonical flag name
   * @param type declared value type
   * @return immutable descriptor
   */
  public static FlagDescriptor of(String name, FlagType type) {
    return new FlagDescriptor(name, List.of(), type, null);
  }

  /**
   * Starts a fluent declaration.
   *
   * @param name canonical flag name
   * @param type declared value type
   * @return builder; validation happens on {@link Builder#build()}
   */
  public static Builder builder(String name, FlagType type) {
    return new Builder(name, type);
  }

  /**
   * Tests whether a key typed on the command line refers to this flag.
   *
   * @param key key without its dash prefix; case-sensitive
   * @return {@code true} when {@code key} equals the name or one of the aliases
   */
  public boolean matches(String key) {
    return key != null && (name.equals(key) || aliases.contains(key));
  }

  /**
   * Returns the name followed by all aliases.
   *
   * @return unmodifiable list of every key that selects this flag
   */
  public List<String> keys() {
    List<String> keys = new ArrayList<>(aliases.size() + 1);
    keys.add(name);
    keys.addAll(aliases);
    return Collections.unmodifiableList(keys);
  }

  /**
   * Returns the description, if one was declared.
   *
   * @return optional description
   */
  public Optional<String> describe() {
    return Optional.ofNullable(description);
  }

  /** Fluent builder mirroring the chained setters used when declaring commands. */
  public static final class Builder {
    private final String name;
    private final FlagType type;
    private final List<String> aliases = new ArrayList<>();
    private String description;

    private Builder(String name, FlagType type) {
      this.name = name;
      this.type = type;
    }

    /**
     * Adds one or more aliases; a comma-joined string declares several at once.
     *
     * @param aliases alias declarations
     * @return this builder
     */
    public Builder alias(String... aliases) {
      Collections.addAll(this.aliases, aliases);
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public FlagDescriptor build() {
      return new FlagDescriptor(name, aliases, type, description);
    }
  }
}
