package dev.chatpulse.infrastructure.protocol;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.chatpulse.domain.chat.ServiceType;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ChatPacketBuilderTest {

  @Test
  void loginPacketHasEscapeHeaderAndBody() {
    byte[] packet = ChatPacketBuilder.login();

    assertArrayEquals(new byte[] {0x1B, 0x09}, Arrays.copyOf(packet, 2));
    assertEquals("0001000006" + "00" + "\f\f\f16\f", ascii(packet, 2));
  }

  @Test
  void joinPacketCarriesRoomAndToken() {
    byte[] packet = ChatPacketBuilder.join("12345", "tok");

    String expectedBody = "\f12345\ftok\f0\f\f";
    assertEquals("0002" + String.format("%06d", expectedBody.length()) + "00" + expectedBody, ascii(packet, 2));
  }

  @Test
  void pingPacketIsSingleSeparator() {
    assertEquals("000000000100\f", ascii(ChatPacketBuilder.ping(), 2));
  }

  @Test
  void bodyLengthCountsUtf8Bytes() {
    byte[] packet = ChatPacketBuilder.packet(ServiceType.CHAT, "지창");

    assertEquals("0005000006", new String(packet, 2, 10, StandardCharsets.US_ASCII));
    assertEquals(ChatPacketBuilder.HEADER_LENGTH + 6, packet.length);
  }

  @Test
  void nullBodyEncodesAsEmpty() {
    assertEquals("000500000000", ascii(ChatPacketBuilder.packet(ServiceType.CHAT, null), 2));
  }

  @Test
  void rejectsOversizedBody() {
    String body = "a".repeat(ChatPacketBuilder.MAX_BODY_LENGTH + 1);
    assertThrows(IllegalArgumentException.class, () -> ChatPacketBuilder.packet(ServiceType.CHAT, body));
  }

  private static String ascii(byte[] packet, int offset) {
    return new String(packet, offset, packet.length - offset, StandardCharsets.UTF_8);
  }
}
