package dev.chatpulse.domain.chat;

import java.util.Optional;

/**
 * Service-type codes carried in the 4-digit field of every chat packet header.
 *
 * <p>Only the codes the handshake and the detector care about are listed; any other code decodes to
 * {@link Optional#empty()} and the frame is ignored.</p>
 *
 * @since 0.1.0
 */
public enum ServiceType {
  /** Keep-alive sent by the client while streaming. */
  PING("0000"),
  /** Login request; the server echoes the code as acknowledgement. */
  LOGIN("0001"),
  /** Chat-room join request; the server echoes the code once the join succeeded. */
  JOIN("0002"),
  /** Chat message. */
  CHAT("0005"),
  /** Star/point donation. */
  DONATION("0018");

  private final String code;

  ServiceType(String code) {
    this.code = code;
  }

  /**
   * Returns the 4-digit wire code.
   *
   * @return ASCII code such as {@code "0005"}
   */
  public String code() {
    return code;
  }

  /**
   * Resolves a wire code to a known service type.
   *
   * @param code 4-digit code read from a frame header; may be {@code null}
   * @return matching service type, or empty for unrecognized codes
   */
  public static Optional<ServiceType> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (ServiceType type : values()) {
      if (type.code.equals(code)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
