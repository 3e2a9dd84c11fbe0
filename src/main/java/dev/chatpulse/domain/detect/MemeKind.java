package dev.chatpulse.domain.detect;

import dev.chatpulse.validation.Strings;
import java.util.List;

/**
 * A recurring chat phrase tracked by the detector.
 *
 * <p>Each form lists the core characters of one spelling in order; fillers between them are tolerated
 * by {@link MemeMatcher}. A kind with several forms matches when any form does.</p>
 *
 * @param key stable identifier used in metrics and archives (e.g., {@code ji_chang})
 * @param displayName human-readable name used in descriptions and logs
 * @param forms one or more spellings, each a non-empty sequence of core characters
 * @since 0.1.0
 */
public record MemeKind(String key, String displayName, List<String> forms) {

  /** Validates identifiers and freezes the form list. */
  public MemeKind {
    key = Strings.requireNonBlank("key", key);
    displayName = Strings.requireNonBlank("displayName", displayName);
    if (forms == null || forms.isEmpty()) {
      throw new IllegalArgumentException("meme " + key + " must declare at least one form");
    }
    for (String form : forms) {
      if (form == null || form.isBlank()) {
        throw new IllegalArgumentException("meme " + key + " contains a blank form");
      }
      if (form.codePoints().anyMatch(MemeMatcher::isFiller)) {
        throw new IllegalArgumentException("meme " + key + " form must not contain filler characters");
      }
    }
    forms = List.copyOf(forms);
  }

  /**
   * Convenience factory for a kind with one or more spellings.
   *
   * @param key stable identifier
   * @param displayName display name
   * @param forms spellings
   * @return meme kind
   */
  public static MemeKind of(String key, String displayName, String... forms) {
    return new MemeKind(key, displayName, List.of(forms));
  }
}
