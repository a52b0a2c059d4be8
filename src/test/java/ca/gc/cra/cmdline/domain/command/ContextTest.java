package ca.gc.cra.cmdline.domain.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cmdline.domain.flag.FlagDescriptor;
import ca.gc.cra.cmdline.domain.flag.FlagError;
import ca.gc.cra.cmdline.domain.flag.FlagException;
import ca.gc.cra.cmdline.domain.flag.FlagType;
import ca.gc.cra.cmdline.domain.flag.RawFlagOccurrence;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextTest {

  private static final CommandDescriptor HELLO = CommandDescriptor.builder("hello")
      .flag(FlagDescriptor.builder("bye", FlagType.BOOL).alias("b").build())
      .flag(FlagDescriptor.builder("age", FlagType.INT).alias("a").build())
      .flag(FlagDescriptor.of("name", FlagType.STRING))
      .flag(FlagDescriptor.of("ratio", FlagType.FLOAT))
      .build();

  private static Context context(List<RawFlagOccurrence> occurrences, CommandDescriptor... path) {
    List<CommandDescriptor> chain = List.of(path);
    ResolutionResult resolution = new ResolutionResult(chain.get(chain.size() - 1), List.of("alice"), chain);
    return Context.of(resolution, occurrences);
  }

  private static FlagError errorOf(ThrowingAccess access) {
    return assertThrows(FlagException.class, access::run).error();
  }

  @FunctionalInterface
  private interface ThrowingAccess {
    void run() throws FlagException;
  }

  @Test
  void intFlagReturnsParsedValue() throws FlagException {
    Context ctx = context(List.of(RawFlagOccurrence.withValue("age", "10")), HELLO);

    assertEquals(10L, ctx.intFlag("age"));
    assertEquals(List.of("alice"), ctx.args());
  }

  @Test
  void intFlagWithoutValueIsArgumentError() {
    Context ctx = context(List.of(RawFlagOccurrence.withoutValue("age")), HELLO);

    assertEquals(FlagError.ARGUMENT_ERROR, errorOf(() -> ctx.intFlag("age")));
  }

  @Test
  void unparsableIntIsValueTypeError() {
    Context ctx = context(List.of(RawFlagOccurrence.withValue("age", "x")), HELLO);

    assertEquals(FlagError.VALUE_TYPE_ERROR, errorOf(() -> ctx.intFlag("age")));
  }

  @Test
  void absentIntIsNotFound() {
    Context ctx = context(List.of(), HELLO);

    assertEquals(FlagError.NOT_FOUND, errorOf(() -> ctx.intFlag("age")));
  }

  @Test
  void wrongAccessorIsTypeError() {
    Context ctx = context(List.of(RawFlagOccurrence.withValue("age", "10")), HELLO);

    assertEquals(FlagError.TYPE_ERROR, errorOf(() -> ctx.stringFlag("age")));
    assertEquals(FlagError.TYPE_ERROR, errorOf(() -> ctx.floatFlag("age")));
  }

  @Test
  void undeclaredNameIsUndefined() {
    Context ctx = context(List.of(RawFlagOccurrence.withValue("unknown", "1")), HELLO);

    assertEquals(FlagError.UNDEFINED, errorOf(() -> ctx.intFlag("unknown")));
  }

  @Test
  void typeIsCheckedBeforePresence() {
    Context ctx = context(List.of(), HELLO);

    assertEquals(FlagError.TYPE_ERROR, errorOf(() -> ctx.intFlag("name")));
  }

  @Test
  void lastOccurrenceWins() throws FlagException {
    Context ctx = context(List.of(
        RawFlagOccurrence.withValue("age", "10"),
        RawFlagOccurrence.withValue("a", "20")), HELLO);

    assertEquals(20L, ctx.intFlag("age"));
  }

  @Test
  void lastOccurrenceWithoutValueReplacesEarlierValue() {
    Context ctx = context(List.of(
        RawFlagOccurrence.withValue("age", "10"),
        RawFlagOccurrence.withoutValue("age")), HELLO);

    assertEquals(FlagError.ARGUMENT_ERROR, errorOf(() -> ctx.intFlag("age")));
  }

  @Test
  void accessorsAcceptAliases() throws FlagException {
    Context ctx = context(List.of(RawFlagOccurrence.withValue("age", "42")), HELLO);

    assertEquals(42L, ctx.intFlag("a"));
  }

  @Test
  void boolFlagReflectsPresenceOnly() {
    Context withValue = context(List.of(RawFlagOccurrence.withValue("bye", "bob")), HELLO);
    Context withAlias = context(List.of(RawFlagOccurrence.withoutValue("b")), HELLO);
    Context absent = context(List.of(), HELLO);

    assertTrue(withValue.boolFlag("bye"));
    assertTrue(withAlias.boolFlag("bye"));
    assertFalse(absent.boolFlag("bye"));
    assertFalse(absent.boolFlag("unknown"));
    assertFalse(withValue.boolFlag("age"));
  }

  @Test
  void stringFlagAllowsEmptyValue() throws FlagException {
    Context ctx = context(List.of(RawFlagOccurrence.withValue("name", "")), HELLO);

    assertEquals("", ctx.stringFlag("name"));
  }

  @Test
  void floatFlagParsesDecimalsAndRejectsSuffixes() throws FlagException {
    Context ok = context(List.of(RawFlagOccurrence.withValue("ratio", "1.23")), HELLO);
    Context suffixed = context(List.of(RawFlagOccurrence.withValue("ratio", "1.5f")), HELLO);
    Context empty = context(List.of(RawFlagOccurrence.withValue("ratio", "")), HELLO);

    assertEquals(1.23, ok.floatFlag("ratio"));
    assertEquals(FlagError.VALUE_TYPE_ERROR, errorOf(() -> suffixed.floatFlag("ratio")));
    assertEquals(FlagError.VALUE_TYPE_ERROR, errorOf(() -> empty.floatFlag("ratio")));
  }

  @Test
  void ancestorFlagsAreVisibleToDescendants() throws FlagException {
    CommandDescriptor child = CommandDescriptor.builder("child").build();
    CommandDescriptor root = CommandDescriptor.builder("root")
        .flag(FlagDescriptor.builder("verbose", FlagType.BOOL).alias("v").build())
        .flag(FlagDescriptor.of("level", FlagType.INT))
        .command(child)
        .build();

    Context ctx = context(List.of(
        RawFlagOccurrence.withoutValue("v"),
        RawFlagOccurrence.withValue("level", "3")), root, child);

    assertTrue(ctx.boolFlag("verbose"));
    assertEquals(3L, ctx.intFlag("level"));
  }

  @Test
  void descendantDeclarationShadowsAncestor() throws FlagException {
    CommandDescriptor child = CommandDescriptor.builder("child")
        .flag(FlagDescriptor.of("level", FlagType.STRING))
        .build();
    CommandDescriptor root = CommandDescriptor.builder("root")
        .flag(FlagDescriptor.of("level", FlagType.INT))
        .command(child)
        .build();

    Context ctx = context(List.of(RawFlagOccurrence.withValue("level", "high")), root, child);

    assertEquals("high", ctx.stringFlag("level"));
    assertEquals(FlagError.TYPE_ERROR, errorOf(() -> ctx.intFlag("level")));
  }

  @Test
  void aliasOfShadowedAncestorFlagIsHidden() throws FlagException {
    CommandDescriptor hello = CommandDescriptor.builder("hello")
        .flag(FlagDescriptor.of("verbose", FlagType.INT))
        .build();
    CommandDescriptor root = CommandDescriptor.builder("cli")
        .flag(FlagDescriptor.builder("verbose", FlagType.BOOL).alias("v").build())
        .command(hello)
        .build();

    Context bare = context(List.of(RawFlagOccurrence.withoutValue("v")), root, hello);
    Context valued = context(List.of(RawFlagOccurrence.withValue("v", "7")), root, hello);
    Context own = context(List.of(RawFlagOccurrence.withValue("verbose", "3")), root, hello);

    assertEquals(FlagError.NOT_FOUND, errorOf(() -> bare.intFlag("verbose")));
    assertFalse(bare.boolFlag("v"));
    assertEquals(FlagError.NOT_FOUND, errorOf(() -> valued.intFlag("verbose")));
    assertFalse(valued.boolFlag("v"));
    assertEquals(3L, own.intFlag("verbose"));
    assertFalse(own.boolFlag("v"));
    assertEquals(FlagError.UNDEFINED, errorOf(() -> own.stringFlag("v")));
  }

  @Test
  void numericAccessorsRejectHexAndNonAsciiDigits() {
    Context hexFloat = context(List.of(RawFlagOccurrence.withValue("ratio", "0x1p3")), HELLO);
    Context paddedFloat = context(List.of(RawFlagOccurrence.withValue("ratio", " 1.5")), HELLO);
    Context arabicInt = context(List.of(RawFlagOccurrence.withValue("age", "١٠")), HELLO);

    assertEquals(FlagError.VALUE_TYPE_ERROR, errorOf(() -> hexFloat.floatFlag("ratio")));
    assertEquals(FlagError.VALUE_TYPE_ERROR, errorOf(() -> paddedFloat.floatFlag("ratio")));
    assertEquals(FlagError.VALUE_TYPE_ERROR, errorOf(() -> arabicInt.intFlag("age")));
  }

  @Test
  void signedNumbersStillParse() throws FlagException {
    Context negative = context(List.of(
        RawFlagOccurrence.withValue("age", "-4"),
        RawFlagOccurrence.withValue("ratio", "-2.5e1")), HELLO);

    assertEquals(-4L, negative.intFlag("age"));
    assertEquals(-25.0, negative.floatFlag("ratio"));
  }

  @Test
  void flagsOfSiblingCommandsAreNotVisible() {
    CommandDescriptor other = CommandDescriptor.builder("other")
        .flag(FlagDescriptor.of("depth", FlagType.INT))
        .build();
    CommandDescriptor child = CommandDescriptor.builder("child").build();
    CommandDescriptor root = CommandDescriptor.builder("root").command(child).command(other).build();

    Context ctx = context(List.of(RawFlagOccurrence.withValue("depth", "1")), root, child);

    assertEquals(FlagError.UNDEFINED, errorOf(() -> ctx.intFlag("depth")));
  }

  @Test
  void helpWritesRenderedTextToSink() {
    List<String> printed = new ArrayList<>();
    ResolutionResult resolution = new ResolutionResult(HELLO, List.of(), List.of(HELLO));
    Context ctx = Context.of(resolution, List.of(), "Name:\n    hello", printed::add);

    ctx.help();

    assertEquals(List.of("Name:\n    hello"), printed);
    assertEquals("Name:\n    hello", ctx.helpText());
  }
}
