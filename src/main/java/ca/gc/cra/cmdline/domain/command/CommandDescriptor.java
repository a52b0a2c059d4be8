package ca.gc.cra.cmdline.domain.command;

import ca.gc.cra.cmdline.domain.flag.FlagDescriptor;
import ca.gc.cra.cmdline.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable node of the command tree.
 * <p><strong>Why:</strong> Declares what a command is called, which flags it understands, what runs when it is
 * matched, and which subcommands it owns. The tree is built once at startup and shared read-only by every
 * dispatch.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject duplicate sibling names/aliases and duplicate flag keys when the tree is built.</li>
 *   <li>Answer child and flag lookups in declaration order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class CommandDescriptor {
  private final String name;
  private final List<String> aliases;
  private final String description;
  private final String usage;
  private final List<FlagDescriptor> flags;
  private final List<CommandDescriptor> children;
  private final ResultAction action;

  private CommandDescriptor(Builder builder) {
    this.name = Strings.requireToken("command name", builder.name);
    List<String> normalized = new ArrayList<>(Strings.splitAliases("command alias", builder.aliases));
    normalized.remove(name);
    this.aliases = List.copyOf(normalized);
    this.description = blankToNull(builder.description);
    this.usage = blankToNull(builder.usage);
    this.flags = List.copyOf(builder.flags);
    this.children = List.copyOf(builder.children);
    this.action = builder.action;
    requireUniqueFlagKeys();
    requireUniqueChildKeys();
  }

  /**
   * Starts a fluent declaration.
   *
   * @param name command name matched against positional tokens
   * @return builder; validation happens on {@link Builder#build()}
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public List<String> aliases() {
    return aliases;
  }

  public Optional<String> description() {
    return Optional.ofNullable(description);
  }

  public Optional<String> usage() {
    return Optional.ofNullable(usage);
  }

  public List<FlagDescriptor> flags() {
    return flags;
  }

  public List<CommandDescriptor> children() {
    return children;
  }

  public Optional<ResultAction> action() {
    return Optional.ofNullable(action);
  }

  /**
   * Tests whether a positional token selects this command.
   *
   * @param token positional token; case-sensitive exact match
   * @return {@code true} when the token equals the name or one of the aliases
   */
  public boolean matches(String token) {
    return token != null && (name.equals(token) || aliases.contains(token));
  }

  /**
   * Finds the first declared child selected by {@code token}.
   *
   * @param token positional token
   * @return matching child, or empty when none matches
   */
  public Optional<CommandDescriptor> findChild(String token) {
    for (CommandDescriptor child : children) {
      if (child.matches(token)) {
        return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  /**
   * Finds the flag declared on this command (not its ancestors) selected by {@code key}.
   *
   * @param key flag name or alias without dash prefix
   * @return matching flag, or empty when none matches
   */
  public Optional<FlagDescriptor> findFlag(String key) {
    for (FlagDescriptor flag : flags) {
      if (flag.matches(key)) {
        return Optional.of(flag);
      }
    }
    return Optional.empty();
  }

  private void requireUniqueFlagKeys() {
    Map<String, String> seen = new HashMap<>();
    for (FlagDescriptor flag : flags) {
      for (String key : flag.keys()) {
        String owner = seen.putIfAbsent(key, flag.name());
        if (owner != null) {
          throw new IllegalArgumentException("command '" + name + "' declares flag key '" + key
              + "' for both '" + owner + "' and '" + flag.name() + "'");
        }
      }
    }
  }

  private void requireUniqueChildKeys() {
    Map<String, String> seen = new HashMap<>();
    for (CommandDescriptor child : children) {
      List<String> keys = new ArrayList<>(child.aliases);
      keys.add(0, child.name);
      for (String key : keys) {
        String owner = seen.putIfAbsent(key, child.name);
        if (owner != null) {
          throw new IllegalArgumentException("command '" + name + "' has subcommands '" + owner
              + "' and '" + child.name + "' both matching '" + key + "'");
        }
      }
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  @Override
  public String toString() {
    return "CommandDescriptor[" + name + "]";
  }

  /** Fluent builder; may be reused only until {@link #build()} is called. */
  public static final class Builder {
    private final String name;
    private final List<String> aliases = new ArrayList<>();
    private final List<FlagDescriptor> flags = new ArrayList<>();
    private final List<CommandDescriptor> children = new ArrayList<>();
    private String description;
    private String usage;
    private ResultAction action;

    private Builder(String name) {
      this.name = name;
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

    public Builder usage(String usage) {
      this.usage = usage;
      return this;
    }

    public Builder flag(FlagDescriptor flag) {
      flags.add(Objects.requireNonNull(flag, "flag"));
      return this;
    }

    public Builder flags(List<FlagDescriptor> flags) {
      flags.forEach(this::flag);
      return this;
    }

    public Builder command(CommandDescriptor command) {
      children.add(Objects.requireNonNull(command, "command"));
      return this;
    }

    public Builder commands(List<CommandDescriptor> commands) {
      commands.forEach(this::command);
      return this;
    }

    public Builder action(Action action) {
      this.action = ResultAction.of(Objects.requireNonNull(action, "action"));
      return this;
    }

    public Builder actionWithResult(ResultAction action) {
      this.action = Objects.requireNonNull(action, "action");
      return this;
    }

    /**
     * Validates and freezes the declaration.
     *
     * @return immutable descriptor
     * @throws IllegalArgumentException on blank names or duplicate sibling/flag keys
     */
    public CommandDescriptor build() {
      return new CommandDescriptor(this);
    }
  }
}
