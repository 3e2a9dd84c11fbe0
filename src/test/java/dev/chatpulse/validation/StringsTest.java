package dev.chatpulse.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("token", "room\ftoken"));
  }

  @Test
  void requireIdentifierAllowsHostLikeValues() {
    assertEquals("chat-01.example.net", Strings.requireIdentifier("host", "chat-01.example.net"));
  }

  @Test
  void requireIdentifierRejectsSeparators() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("broadcaster", "a/b"));
  }

  @Test
  void optionalTreatsBlankAsAbsent() {
    assertNull(Strings.optional("title", "   "));
    assertEquals("Friday", Strings.optional("title", " Friday "));
  }
}
