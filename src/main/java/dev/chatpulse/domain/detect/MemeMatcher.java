package dev.chatpulse.domain.detect;

import java.util.List;
import java.util.Objects;

/**
 * Finite-state matcher for one {@link MemeKind}.
 *
 * <p>For each form the matcher walks the text in two states: <em>expecting</em> core character
 * {@code i}, or <em>consuming filler</em> after core character {@code i-1}. A filler keeps the state, the
 * expected character advances it, anything else aborts the attempt and scanning restarts at the next
 * start position. Cost is bounded by {@code text length x form length}.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class MemeMatcher {
  private static final int HANGUL_LONG_VOWEL = 'ㅡ';

  private final MemeKind kind;
  private final List<int[]> forms;

  /**
   * Compiles the forms of a meme kind.
   *
   * @param kind meme kind; must not be {@code null}
   */
  public MemeMatcher(MemeKind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.forms = kind.forms().stream().map(form -> form.codePoints().toArray()).toList();
  }

  /**
   * Returns the kind this matcher recognizes.
   *
   * @return meme kind
   */
  public MemeKind kind() {
    return kind;
  }

  /**
   * Tests whether any form occurs in {@code text}.
   *
   * @param text chat message; {@code null} never matches
   * @return {@code true} on the first occurrence of any form
   */
  public boolean matches(CharSequence text) {
    if (text == null || text.length() == 0) {
      return false;
    }
    int[] codePoints = text.codePoints().toArray();
    for (int[] form : forms) {
      if (matchesForm(codePoints, form)) {
        return true;
      }
    }
    return false;
  }

  private static boolean matchesForm(int[] text, int[] form) {
    for (int start = 0; start <= text.length - form.length; start++) {
      if (text[start] != form[0]) {
        continue;
      }
      int expected = 1;
      for (int pos = start + 1; pos < text.length && expected < form.length; pos++) {
        int cp = text[pos];
        if (cp == form[expected]) {
          expected++;
        } else if (!isFiller(cp)) {
          break;
        }
      }
      if (expected == form.length) {
        return true;
      }
    }
    return false;
  }

  /**
   * Reports whether a code point may appear between core characters.
   *
   * @param codePoint code point to test
   * @return {@code true} for whitespace (including no-break spaces), {@code ㅡ}, {@code ~}, and {@code -}
   */
  public static boolean isFiller(int codePoint) {
    return Character.isWhitespace(codePoint)
        || Character.isSpaceChar(codePoint)
        || codePoint == HANGUL_LONG_VOWEL
        || codePoint == '~'
        || codePoint == '-';
  }
}
