package ca.gc.cra.cmdline.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cmdline.domain.flag.RawFlagOccurrence;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FlagExtractorTest {

  @Test
  void longFlagConsumesFollowingValue() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("--age", "10"));

    assertEquals(List.of(), tokens.positionals());
    assertEquals(List.of(RawFlagOccurrence.withValue("age", "10")), tokens.occurrences());
  }

  @Test
  void equalsSyntaxSplitsOnFirstEquals() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("--query=a=b", "-n=3", "rest"));

    assertEquals(List.of("rest"), tokens.positionals());
    assertEquals(List.of(
        RawFlagOccurrence.withValue("query", "a=b"),
        RawFlagOccurrence.withValue("n", "3")), tokens.occurrences());
  }

  @Test
  void emptyValueAfterEqualsIsPresentButEmpty() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("--name="));

    assertEquals(Optional.of(""), tokens.occurrences().get(0).value());
  }

  @Test
  void trailingFlagHasNoValue() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("alice", "--age"));

    assertEquals(List.of("alice"), tokens.positionals());
    RawFlagOccurrence occurrence = tokens.occurrences().get(0);
    assertEquals("age", occurrence.key());
    assertFalse(occurrence.hasValue());
  }

  @Test
  void flagFollowedByFlagHasNoValue() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("--bye", "-a", "7"));

    assertEquals(List.of(
        RawFlagOccurrence.withoutValue("bye"),
        RawFlagOccurrence.withValue("a", "7")), tokens.occurrences());
  }

  @Test
  void lookaheadIsTypeAgnostic() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("hello", "--bye", "alice"));

    assertEquals(List.of("hello"), tokens.positionals());
    assertEquals(List.of(RawFlagOccurrence.withValue("bye", "alice")), tokens.occurrences());
  }

  @Test
  void shortFlagsAreNotClustered() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("-abc"));

    assertEquals(List.of(RawFlagOccurrence.withoutValue("abc")), tokens.occurrences());
  }

  @Test
  void positionalsKeepRelativeOrderAroundFlags() {
    ExtractedTokens tokens = FlagExtractor.extract(
        List.of("add", "--x", "1", "sub", "-y", "--z=3", "2", "3"));

    assertEquals(List.of("add", "sub", "2", "3"), tokens.positionals());
    assertEquals(List.of(
        RawFlagOccurrence.withValue("x", "1"),
        RawFlagOccurrence.withoutValue("y"),
        RawFlagOccurrence.withValue("z", "3")), tokens.occurrences());
  }

  @Test
  void bareDashesArePositional() {
    ExtractedTokens tokens = FlagExtractor.extract(List.of("-", "--", "--=x"));

    assertEquals(List.of("-", "--", "--=x"), tokens.positionals());
    assertTrue(tokens.occurrences().isEmpty());
  }

  @Test
  void everyTokenLandsExactlyOnce() {
    List<String> input = List.of("a", "--k", "v", "-s", "--e=", "b", "--t", "-u", "w", "c");

    ExtractedTokens tokens = FlagExtractor.extract(input);

    int consumed = tokens.positionals().size();
    for (RawFlagOccurrence occurrence : tokens.occurrences()) {
      // --e= is one token even though it carries a value
      boolean inline = input.contains("--" + occurrence.key() + "=" + occurrence.value().orElse(""))
          || input.contains("-" + occurrence.key() + "=" + occurrence.value().orElse(""));
      consumed += occurrence.hasValue() && !inline ? 2 : 1;
    }
    assertEquals(input.size(), consumed);
    assertEquals(List.of("a", "b", "c"), tokens.positionals());
  }

  @Test
  void extractionIsRepeatable() {
    List<String> input = List.of("add", "--age", "10", "x");

    assertEquals(FlagExtractor.extract(input), FlagExtractor.extract(input));
  }

  @Test
  void nullListIsEmptyButNullTokenIsRejected() {
    ExtractedTokens empty = FlagExtractor.extract(null);

    assertTrue(empty.positionals().isEmpty());
    assertTrue(empty.occurrences().isEmpty());
    assertThrows(NullPointerException.class, () -> FlagExtractor.extract(Arrays.asList("a", null)));
  }

  @Test
  void isFlagClassifiesTokens() {
    assertTrue(FlagExtractor.isFlag("--age"));
    assertTrue(FlagExtractor.isFlag("-a=1"));
    assertFalse(FlagExtractor.isFlag("age"));
    assertFalse(FlagExtractor.isFlag("--"));
  }
}
