package dev.chatpulse.domain.detect;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable set of meme kinds the detector tracks.
 *
 * @since 0.1.0
 */
public final class MemeCatalog {
  private static final MemeCatalog DEFAULT = new MemeCatalog(List.of(
      MemeKind.of("ji_chang", "지창", "지창"),
      MemeKind.of("sesin", "세신", "세신"),
      MemeKind.of("jjajang", "짜장면", "짜장면"),
      MemeKind.of("djrg", "ㄷㅈㄹㄱ", "ㄷㅈㄹㄱ"),
      MemeKind.of("sdn", "ㅆㄷㄴ", "ㅆㄷㄴ", "쌋다나", "쌌다나")));

  private final List<MemeKind> kinds;

  /**
   * Creates a catalog.
   *
   * @param kinds meme kinds in reporting order; keys must be unique
   * @throws IllegalArgumentException when the list is empty or keys repeat
   */
  public MemeCatalog(List<MemeKind> kinds) {
    Objects.requireNonNull(kinds, "kinds");
    if (kinds.isEmpty()) {
      throw new IllegalArgumentException("catalog must contain at least one meme kind");
    }
    Set<String> keys = new LinkedHashSet<>();
    for (MemeKind kind : kinds) {
      if (!keys.add(kind.key())) {
        throw new IllegalArgumentException("duplicate meme key: " + kind.key());
      }
    }
    this.kinds = List.copyOf(kinds);
  }

  /**
   * Returns the built-in catalog of the five tracked memes.
   *
   * @return default catalog
   */
  public static MemeCatalog defaults() {
    return DEFAULT;
  }

  /**
   * Returns the kinds in reporting order.
   *
   * @return unmodifiable list of kinds
   */
  public List<MemeKind> kinds() {
    return kinds;
  }

  /**
   * Keeps only the kinds whose keys are listed.
   *
   * @param keys keys to retain; unknown keys are rejected
   * @return narrowed catalog preserving the original order
   * @throws IllegalArgumentException when a key is unknown or nothing remains
   */
  public MemeCatalog select(Set<String> keys) {
    Objects.requireNonNull(keys, "keys");
    for (String key : keys) {
      if (kinds.stream().noneMatch(kind -> kind.key().equals(key))) {
        throw new IllegalArgumentException("unknown meme key: " + key);
      }
    }
    return new MemeCatalog(kinds.stream().filter(kind -> keys.contains(kind.key())).toList());
  }
}
