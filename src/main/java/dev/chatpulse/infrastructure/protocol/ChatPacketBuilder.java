package dev.chatpulse.infrastructure.protocol;

import dev.chatpulse.domain.chat.RawFrame;
import dev.chatpulse.domain.chat.ServiceType;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Encodes outbound packets: {@code ESC(1B 09) + service(4) + bodyLength(6) + "00" + body}.
 *
 * <p>The body length is the UTF-8 byte count, zero-padded to six digits.</p>
 *
 * @since 0.1.0
 */
public final class ChatPacketBuilder {
  /** Two-byte sequence that opens every packet. */
  static final byte[] ESCAPE = {0x1B, 0x09};
  /** Escape plus the 12-character ASCII header. */
  static final int HEADER_LENGTH = ESCAPE.length + 12;
  static final int MAX_BODY_LENGTH = 999_999;

  private static final String SEP = String.valueOf(RawFrame.FIELD_SEPARATOR);
  private static final String HEADER_SUFFIX = "00";
  private static final String LOGIN_BODY = SEP + SEP + SEP + "16" + SEP;

  private ChatPacketBuilder() {
    // Utility
  }

  /**
   * Builds one packet.
   *
   * @param type service type
   * @param body packet body; {@code null} is treated as empty
   * @return wire bytes
   * @throws IllegalArgumentException if the encoded body exceeds six decimal digits
   */
  public static byte[] packet(ServiceType type, String body) {
    Objects.requireNonNull(type, "type");
    byte[] payload = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
    if (payload.length > MAX_BODY_LENGTH) {
      throw new IllegalArgumentException("body too long: " + payload.length + " bytes");
    }
    String header = type.code() + String.format(Locale.ROOT, "%06d", payload.length) + HEADER_SUFFIX;
    byte[] headerBytes = header.getBytes(StandardCharsets.US_ASCII);
    byte[] out = new byte[ESCAPE.length + headerBytes.length + payload.length];
    System.arraycopy(ESCAPE, 0, out, 0, ESCAPE.length);
    System.arraycopy(headerBytes, 0, out, ESCAPE.length, headerBytes.length);
    System.arraycopy(payload, 0, out, ESCAPE.length + headerBytes.length, payload.length);
    return out;
  }

  /**
   * Returns the LOGIN body.
   *
   * @return {@code FF FF FF "16" FF}
   */
  public static String loginBody() {
    return LOGIN_BODY;
  }

  /**
   * Returns the JOIN body for a chat room.
   *
   * @param chatRoomId chat-room number
   * @param entryToken room credential
   * @return {@code FF chatRoomId FF entryToken FF "0" FF FF}
   */
  public static String joinBody(String chatRoomId, String entryToken) {
    Objects.requireNonNull(chatRoomId, "chatRoomId");
    Objects.requireNonNull(entryToken, "entryToken");
    return SEP + chatRoomId + SEP + entryToken + SEP + "0" + SEP + SEP;
  }

  /**
   * Returns the keep-alive body.
   *
   * @return one field separator
   */
  public static String pingBody() {
    return SEP;
  }

  /**
   * Convenience for {@code packet(LOGIN, loginBody())}.
   *
   * @return LOGIN packet
   */
  public static byte[] login() {
    return packet(ServiceType.LOGIN, LOGIN_BODY);
  }

  /**
   * Convenience for {@code packet(JOIN, joinBody(...))}.
   *
   * @param chatRoomId chat-room number
   * @param entryToken room credential
   * @return JOIN packet
   */
  public static byte[] join(String chatRoomId, String entryToken) {
    return packet(ServiceType.JOIN, joinBody(chatRoomId, entryToken));
  }

  /**
   * Convenience for {@code packet(PING, pingBody())}.
   *
   * @return PING packet
   */
  public static byte[] ping() {
    return packet(ServiceType.PING, SEP);
  }
}
