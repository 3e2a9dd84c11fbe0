package dev.chatpulse.domain.chat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable body of one chat-protocol frame, tagged with its header fields.
 * <p><strong>Why:</strong> Lets the transport hand complete frames to the handshake logic and the event
 * interpreter without exposing the decoder's accumulation buffer.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the body is defensively copied on the way in and out.</p>
 *
 * @param serviceCode 4-digit service-type code from the header
 * @param bodyLength body length declared by the header, in bytes
 * @param body body bytes; defensively copied
 * @since 0.1.0
 */
public record RawFrame(String serviceCode, int bodyLength, byte[] body) {
  /** Field separator inside a frame body. */
  public static final char FIELD_SEPARATOR = '\f';

  /**
   * Validates the header fields and copies the body.
   */
  public RawFrame {
    Objects.requireNonNull(serviceCode, "serviceCode");
    if (bodyLength < 0) {
      throw new IllegalArgumentException("bodyLength must be >= 0 (was " + bodyLength + ")");
    }
    body = body != null ? body.clone() : new byte[0];
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  /**
   * Resolves the header code to a known service type.
   *
   * @return known service type or empty when the frame is of an unrecognized kind
   */
  public Optional<ServiceType> serviceType() {
    return ServiceType.fromCode(serviceCode);
  }

  /**
   * Splits the UTF-8 body on {@link #FIELD_SEPARATOR}.
   *
   * <p>Bodies start with a separator, so index 0 is normally empty and the first payload field sits at
   * index 1. Trailing empty fields are kept.</p>
   *
   * @return sub-fields in wire order
   */
  public String[] fields() {
    String text = new String(body, StandardCharsets.UTF_8);
    return text.split(String.valueOf(FIELD_SEPARATOR), -1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawFrame that)) {
      return false;
    }
    return bodyLength == that.bodyLength
        && serviceCode.equals(that.serviceCode)
        && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    int result = serviceCode.hashCode();
    result = 31 * result + Integer.hashCode(bodyLength);
    result = 31 * result + Arrays.hashCode(body);
    return result;
  }

  @Override
  public String toString() {
    return "RawFrame{"
        + "serviceCode=" + serviceCode
        + ", bodyLength=" + bodyLength
        + '}';
  }
}
