package ca.gc.cra.cmdline.application;

import ca.gc.cra.cmdline.domain.flag.RawFlagOccurrence;
import java.util.List;

/**
 * Command-line tokens partitioned into positional arguments and flag occurrences.
 *
 * @param positionals non-flag tokens in original order
 * @param occurrences flag tokens in original order, with any consumed value
 *
 * @since 0.1.0
 */
public record ExtractedTokens(List<String> positionals, List<RawFlagOccurrence> occurrences) {

  public ExtractedTokens {
    positionals = List.copyOf(positionals);
    occurrences = List.copyOf(occurrences);
  }
}
