package ca.gc.cra.cmdline.domain.flag;

import java.util.Objects;
import java.util.Optional;

/**
 * One flag token as it appeared on the command line.
 *
 * <p>The key is stored exactly as typed (name or alias, without the dash prefix). The value is present when
 * the token used {@code key=value} syntax or when the following token was consumed as its value.</p>
 *
 * @param key key as typed; never {@code null}
 * @param value optional value; {@code Optional.of("")} for {@code --key=}
 *
 * @since 0.1.0
 */
public record RawFlagOccurrence(String key, Optional<String> value) {

  public RawFlagOccurrence {
    key = Objects.requireNonNull(key, "key");
    value = value == null ? Optional.empty() : value;
  }

  public static RawFlagOccurrence withValue(String key, String value) {
    return new RawFlagOccurrence(key, Optional.of(value));
  }

  public static RawFlagOccurrence withoutValue(String key) {
    return new RawFlagOccurrence(key, Optional.empty());
  }

  public boolean hasValue() {
    return value.isPresent();
  }
}
