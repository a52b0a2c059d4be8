package ca.gc.cra.cmdline.api;

import ca.gc.cra.cmdline.domain.command.App;
import ca.gc.cra.cmdline.domain.command.CommandDescriptor;
import ca.gc.cra.cmdline.domain.command.ResolutionResult;
import ca.gc.cra.cmdline.domain.flag.FlagDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Renders help text for the application root or a matched subcommand.
 * <p><strong>Layout:</strong> {@code Name}, then (root only) {@code Author}, {@code Description},
 * {@code Usage}, {@code Flags}, {@code Commands}, and (root only) {@code Version}. Sections with nothing to
 * show are omitted. Flags list every declaration visible to the command, nearest first, without the ones it
 * shadows.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class HelpRenderer {
  private static final String INDENT = "    ";

  private final UnaryOperator<String> heading;

  /**
   * Creates a renderer.
   *
   * @param color whether section headings are decorated with ANSI colors
   */
  public HelpRenderer(boolean color) {
    this.heading = color ? text -> AnsiColor.bold(AnsiColor.yellow(text)) : UnaryOperator.identity();
  }

  /**
   * Renders help for the command matched in {@code resolution}.
   *
   * @param app application metadata
   * @param resolution matched path; the root path renders application-level help
   * @return multi-line help text without a trailing newline
   */
  public String render(App app, ResolutionResult resolution) {
    Objects.requireNonNull(app, "app");
    Objects.requireNonNull(resolution, "resolution");
    CommandDescriptor command = resolution.command();
    boolean root = resolution.isRoot();
    StringBuilder out = new StringBuilder();

    section(out, "Name", root ? app.displayName() : commandPath(app, resolution));
    if (root) {
      app.author().ifPresent(author -> section(out, "Author", author));
    }
    command.description().ifPresent(description -> section(out, "Description", description));
    command.usage().ifPresent(usage -> section(out, "Usage", usage));

    List<FlagDescriptor> flags = resolution.visibleFlags();
    if (!flags.isEmpty()) {
      section(out, "Flags", flags.stream().map(HelpRenderer::flagLine).collect(Collectors.toList()));
    }
    if (!command.children().isEmpty()) {
      section(out, "Commands", command.children().stream()
          .map(HelpRenderer::commandLine)
          .collect(Collectors.toList()));
    }
    if (root) {
      app.version().ifPresent(version -> section(out, "Version", version));
    }
    return out.toString().stripTrailing();
  }

  private void section(StringBuilder out, String title, String body) {
    section(out, title, List.of(body));
  }

  private void section(StringBuilder out, String title, List<String> lines) {
    out.append(heading.apply(title + ":")).append('\n');
    for (String line : lines) {
      out.append(INDENT).append(line).append('\n');
    }
    out.append('\n');
  }

  private static String commandPath(App app, ResolutionResult resolution) {
    List<String> names = new ArrayList<>();
    names.add(app.displayName());
    for (CommandDescriptor step : resolution.path().subList(1, resolution.path().size())) {
      names.add(step.name());
    }
    return String.join(" ", names);
  }

  private static String flagLine(FlagDescriptor flag) {
    StringBuilder line = new StringBuilder("--").append(flag.name());
    for (String alias : flag.aliases()) {
      line.append(", -").append(alias);
    }
    if (flag.type().takesValue()) {
      line.append(" <").append(flag.type().label()).append('>');
    }
    flag.describe().ifPresent(description -> line.append(" : ").append(description));
    return line.toString();
  }

  private static String commandLine(CommandDescriptor command) {
    StringBuilder line = new StringBuilder(command.name());
    for (String alias : command.aliases()) {
      line.append(", ").append(alias);
    }
    command.description().or(command::usage).ifPresent(text -> line.append(" : ").append(text));
    return line.toString();
  }
}
