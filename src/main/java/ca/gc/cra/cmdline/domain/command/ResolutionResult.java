package ca.gc.cra.cmdline.domain.command;

import ca.gc.cra.cmdline.domain.flag.FlagDescriptor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of walking the command tree against positional tokens.
 *
 * @param command deepest matched command; the root when nothing matched
 * @param remainingArgs positional tokens after the last matched command name
 * @param path matched chain from the root to {@code command}, inclusive
 *
 * @since 0.1.0
 */
public record ResolutionResult(CommandDescriptor command, List<String> remainingArgs, List<CommandDescriptor> path) {

  public ResolutionResult {
    command = Objects.requireNonNull(command, "command");
    remainingArgs = List.copyOf(remainingArgs);
    path = List.copyOf(path);
    if (path.isEmpty() || path.get(path.size() - 1) != command) {
      throw new IllegalArgumentException("path must end with the matched command");
    }
  }

  /**
   * Indicates whether no subcommand matched.
   *
   * @return {@code true} when the root itself is the matched command
   */
  public boolean isRoot() {
    return path.size() == 1;
  }

  /**
   * Flags visible to the matched command, nearest declaration first.
   *
   * <p>A flag whose name is claimed by a nearer declaration (as a name or alias) is hidden entirely, aliases
   * included.</p>
   *
   * @return visible flag declarations, nearest command first
   */
  public List<FlagDescriptor> visibleFlags() {
    Set<String> claimed = new HashSet<>();
    List<FlagDescriptor> visible = new ArrayList<>();
    for (int i = path.size() - 1; i >= 0; i--) {
      for (FlagDescriptor flag : path.get(i).flags()) {
        if (claimed.contains(flag.name())) {
          continue;
        }
        claimed.addAll(flag.keys());
        visible.add(flag);
      }
    }
    return List.copyOf(visible);
  }
}
