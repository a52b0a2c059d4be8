package ca.gc.cra.cmdline.domain.command;

import ca.gc.cra.cmdline.domain.flag.FlagDescriptor;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Application root: global metadata plus the root of the command tree.
 * <p><strong>Why:</strong> The root command carries the default action, global flags, and top-level commands;
 * the metadata only feeds help output.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across dispatches.</p>
 *
 * @since 0.1.0
 */
public final class App {
  private final String displayName;
  private final String author;
  private final String version;
  private final CommandDescriptor root;

  private App(Builder builder) {
    this.root = builder.root.build();
    this.displayName = builder.displayName;
    this.author = builder.author;
    this.version = builder.version;
  }

  /**
   * Starts a fluent declaration.
   *
   * @param name program name; also the name of the root command
   * @return builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return root.name();
  }

  /**
   * Returns the name shown in help output, falling back to {@link #name()}.
   *
   * @return display name
   */
  public String displayName() {
    return displayName == null || displayName.isBlank() ? root.name() : displayName;
  }

  public Optional<String> author() {
    return Optional.ofNullable(author).filter(s -> !s.isBlank());
  }

  public Optional<String> version() {
    return Optional.ofNullable(version).filter(s -> !s.isBlank());
  }

  public Optional<String> description() {
    return root.description();
  }

  public Optional<String> usage() {
    return root.usage();
  }

  public CommandDescriptor root() {
    return root;
  }

  /** Fluent builder forwarding tree declarations to the root command. */
  public static final class Builder {
    private final CommandDescriptor.Builder root;
    private String displayName;
    private String author;
    private String version;

    private Builder(String name) {
      this.root = CommandDescriptor.builder(name);
    }

    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder author(String author) {
      this.author = author;
      return this;
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public Builder description(String description) {
      root.description(description);
      return this;
    }

    public Builder usage(String usage) {
      root.usage(usage);
      return this;
    }

    public Builder flag(FlagDescriptor flag) {
      root.flag(flag);
      return this;
    }

    public Builder command(CommandDescriptor command) {
      root.command(Objects.requireNonNull(command, "command"));
      return this;
    }

    /**
     * Sets the default action run when no subcommand matches.
     *
     * @param action handler
     * @return this builder
     */
    public Builder action(Action action) {
      root.action(action);
      return this;
    }

    public Builder actionWithResult(ResultAction action) {
      root.actionWithResult(action);
      return this;
    }

    public App build() {
      return new App(this);
    }
  }
}
