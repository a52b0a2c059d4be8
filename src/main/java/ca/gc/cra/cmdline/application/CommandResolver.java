package ca.gc.cra.cmdline.application;

import ca.gc.cra.cmdline.domain.command.CommandDescriptor;
import ca.gc.cra.cmdline.domain.command.ResolutionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Finds the most specific command named by the leading positional tokens.
 * <p><strong>Algorithm:</strong> greedy, leftmost, depth-first descent without backtracking. While the next
 * positional equals the name or an alias of a child of the current command (first declared child wins), the
 * resolver descends into it and consumes the token. The first token that names no child, or running out of
 * tokens or children, ends the walk; the remaining tokens become the matched command's arguments.</p>
 * <p>Resolution never fails: with no match the root itself is returned with every positional as an
 * argument.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CommandResolver {
  private static final Logger log = LoggerFactory.getLogger(CommandResolver.class);

  private CommandResolver() {}

  /**
   * Walks the tree rooted at {@code root} against {@code positionals}.
   *
   * @param root root of the command tree; never {@code null}
   * @param positionals positional tokens in command-line order; {@code null} is treated as empty
   * @return matched command, its path from the root, and the unconsumed positionals
   */
  public static ResolutionResult resolve(CommandDescriptor root, List<String> positionals) {
    Objects.requireNonNull(root, "root");
    List<String> tokens = positionals == null ? List.of() : positionals;

    CommandDescriptor current = root;
    List<CommandDescriptor> path = new ArrayList<>();
    path.add(current);
    int cursor = 0;
    while (cursor < tokens.size()) {
      Optional<CommandDescriptor> child = current.findChild(tokens.get(cursor));
      if (child.isEmpty()) {
        break;
      }
      current = child.get();
      path.add(current);
      cursor++;
    }

    List<String> remaining = tokens.subList(cursor, tokens.size());
    if (log.isDebugEnabled()) {
      log.debug("Resolved command '{}' (depth {}) with {} argument(s)", current.name(), path.size() - 1,
          remaining.size());
    }
    return new ResolutionResult(current, remaining, path);
  }
}
