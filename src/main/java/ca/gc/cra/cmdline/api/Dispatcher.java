package ca.gc.cra.cmdline.api;

import ca.gc.cra.cmdline.application.CommandResolver;
import ca.gc.cra.cmdline.application.ExtractedTokens;
import ca.gc.cra.cmdline.application.FlagExtractor;
import ca.gc.cra.cmdline.config.DispatchConfig;
import ca.gc.cra.cmdline.domain.command.ActionException;
import ca.gc.cra.cmdline.domain.command.App;
import ca.gc.cra.cmdline.domain.command.Context;
import ca.gc.cra.cmdline.domain.command.ResolutionResult;
import ca.gc.cra.cmdline.domain.command.ResultAction;
import ca.gc.cra.cmdline.domain.flag.FlagDescriptor;
import ca.gc.cra.cmdline.domain.flag.RawFlagOccurrence;
import ca.gc.cra.cmdline.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Routes a process argument vector to the matching command action.
 * <p><strong>Pipeline:</strong> drop the program name, {@link FlagExtractor#extract extract} flags,
 * {@link CommandResolver#resolve resolve} the command, print help when a help key is present (a bare help switch
 * never swallows the following word, so {@code -h add} shows help for {@code add}), otherwise build
 * a {@link Context} and invoke the matched action, falling back to the root's default action. With neither
 * action nothing happens.</p>
 * <p><strong>Thread-safety:</strong> Holds only immutable configuration; safe to reuse across calls and
 * threads.</p>
 * <p><strong>Observability:</strong> DEBUG traces for resolution and no-op dispatches; ERROR when a result
 * action fails under {@link #run(App, List)}.</p>
 *
 * @since 0.1.0
 */
public final class Dispatcher {
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  private final DispatchConfig config;
  private final HelpRenderer renderer;
  private final Consumer<String> console;

  /** Creates a dispatcher with {@link DispatchConfig#defaults()} printing to stdout. */
  public Dispatcher() {
    this(DispatchConfig.defaults());
  }

  /**
   * Creates a dispatcher printing to stdout through {@link CliPrinter}.
   *
   * @param config dispatch policy
   */
  public Dispatcher(DispatchConfig config) {
    this(config, CliPrinter::println);
  }

  /**
   * Creates a dispatcher with a custom console sink.
   *
   * @param config dispatch policy
   * @param console receives help text and failure messages
   */
  public Dispatcher(DispatchConfig config, Consumer<String> console) {
    this.config = Objects.requireNonNull(config, "config");
    this.console = Objects.requireNonNull(console, "console");
    this.renderer = new HelpRenderer(config.color());
    if (config.verbose() && LoggingConfigurator.enableVerboseLogging()) {
      log.debug("Verbose logging enabled for dispatcher");
    }
  }

  /**
   * Dispatches {@code processArgs}; index 0 is the program name and is ignored.
   *
   * <p>An {@link ActionException} raised by a result action is logged and its message printed; it never
   * terminates the process.</p>
   *
   * @param app application tree
   * @param processArgs full argument vector including the program name; {@code null} or empty runs the
   *     default action with no arguments
   */
  public void run(App app, List<String> processArgs) {
    try {
      runWithResult(app, processArgs);
    } catch (ActionException ex) {
      log.error("Command failed: {}", ex.getMessage(), ex);
      console.accept(ex.getMessage());
    }
  }

  /**
   * Array variant of {@link #run(App, List)} for {@code main(String[])} callers that prepend the program
   * name.
   *
   * @param app application tree
   * @param processArgs full argument vector including the program name
   */
  public void run(App app, String... processArgs) {
    run(app, processArgs == null ? List.of() : Arrays.asList(processArgs));
  }

  /**
   * Dispatches {@code processArgs} and propagates action failures to the caller.
   *
   * @param app application tree
   * @param processArgs full argument vector including the program name
   * @throws ActionException when the invoked result action fails
   */
  public void runWithResult(App app, List<String> processArgs) throws ActionException {
    Objects.requireNonNull(app, "app");
    List<String> tokens = processArgs == null || processArgs.isEmpty()
        ? List.of()
        : processArgs.subList(1, processArgs.size());

    ExtractedTokens extracted = FlagExtractor.extract(tokens);
    ResolutionResult resolution = CommandResolver.resolve(app.root(), extracted.positionals());

    Set<String> triggers = helpTriggers(resolution, extracted.occurrences());
    if (!triggers.isEmpty()) {
      ResolutionResult target = CommandResolver.resolve(app.root(),
          FlagExtractor.extract(withoutHelpSwitches(tokens, triggers)).positionals());
      log.debug("Help requested for command '{}'", target.command().name());
      console.accept(renderer.render(app, target));
      return;
    }

    String helpText = renderer.render(app, resolution);
    Context context = Context.of(resolution, extracted.occurrences(), helpText, console);
    Optional<ResultAction> action = resolution.command().action().or(() -> app.root().action());
    if (action.isEmpty()) {
      log.debug("No action for command '{}' and no default action; nothing to run",
          resolution.command().name());
      return;
    }
    action.get().execute(context);
  }

  public DispatchConfig config() {
    return config;
  }

  // A help key only triggers help when no flag in scope claims it.
  private Set<String> helpTriggers(ResolutionResult resolution, List<RawFlagOccurrence> occurrences) {
    Set<String> triggers = new HashSet<>();
    if (!config.helpEnabled()) {
      return triggers;
    }
    for (RawFlagOccurrence occurrence : occurrences) {
      if (config.helpKeys().contains(occurrence.key()) && !declared(resolution, occurrence.key())) {
        triggers.add(occurrence.key());
      }
    }
    return triggers;
  }

  // Drops bare help switches so a word after one ("-h add") counts as a command name again.
  private static List<String> withoutHelpSwitches(List<String> tokens, Set<String> triggers) {
    List<String> kept = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      if (!isHelpSwitch(token, triggers)) {
        kept.add(token);
      }
    }
    return kept;
  }

  private static boolean isHelpSwitch(String token, Set<String> triggers) {
    for (String key : triggers) {
      if (token.equals("--" + key) || token.equals("-" + key)) {
        return true;
      }
    }
    return false;
  }

  private static boolean declared(ResolutionResult resolution, String key) {
    for (FlagDescriptor flag : resolution.visibleFlags()) {
      if (flag.matches(key)) {
        return true;
      }
    }
    return false;
  }
}
