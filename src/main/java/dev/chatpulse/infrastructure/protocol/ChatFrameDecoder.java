package dev.chatpulse.infrastructure.protocol;

import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.domain.chat.ChatEvent;
import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.chat.LiveEvent;
import dev.chatpulse.domain.chat.RawFrame;
import dev.chatpulse.domain.chat.ServiceType;
import dev.chatpulse.logging.Logs;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the inbound byte stream into {@link RawFrame}s and interprets chat and donation frames.
 *
 * <p>Framing is length-based: the 12-character header after the escape sequence carries the body
 * length, so a frame completes once {@code 2 + 12 + bodyLength} bytes are buffered. Partial frames stay
 * buffered across {@link #feed(byte[])} calls, which makes the output independent of chunk
 * boundaries. Bytes before an escape are skipped. A non-numeric header, or an escape sequence inside
 * the declared body, marks the frame malformed; it is dropped and decoding resumes at the next
 * escape.</p>
 *
 * <p>{@link #feed(byte[])} is not thread-safe and belongs to one reader thread. {@link #interpret(RawFrame)}
 * is stateless apart from the shared {@link BadgeCache}.</p>
 *
 * @since 0.1.0
 */
public final class ChatFrameDecoder {
  private static final Logger log = LoggerFactory.getLogger(ChatFrameDecoder.class);

  private static final int CHAT_MIN_FIELDS = 8;
  private static final int CHAT_TEXT = 1;
  private static final int CHAT_USER_ID = 2;
  private static final int CHAT_NICKNAME = 6;
  private static final int CHAT_FLAGS = 7;
  private static final int DONATION_MIN_FIELDS = 5;
  private static final int DONATION_NICKNAME = 3;
  private static final int DONATION_COUNT = 4;
  private static final byte ESC = ChatPacketBuilder.ESCAPE[0];

  private final FrameBuffer buffer = new FrameBuffer();
  private final BadgeCache badges;
  private final MetricsPort metrics;

  /**
   * Creates a decoder.
   *
   * @param badges shared badge memo
   * @param metrics metrics sink for {@code decode.*} counters
   */
  public ChatFrameDecoder(BadgeCache badges, MetricsPort metrics) {
    this.badges = Objects.requireNonNull(badges, "badges");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Appends {@code chunk} and extracts every frame it completes.
   *
   * @param chunk bytes as read from the socket; may be empty
   * @return complete frames in stream order; empty when none completed
   */
  public List<RawFrame> feed(byte[] chunk) {
    Objects.requireNonNull(chunk, "chunk");
    buffer.write(chunk);
    List<RawFrame> frames = new ArrayList<>();
    while (true) {
      int start = buffer.indexOf(ChatPacketBuilder.ESCAPE, 0);
      if (start < 0) {
        skipGarbage();
        break;
      }
      if (start > 0) {
        metrics.observe("decode.bytes.skipped", start);
        buffer.discard(start);
      }
      if (buffer.readableBytes() < ChatPacketBuilder.HEADER_LENGTH) {
        break;
      }
      if (!headerIsNumeric()) {
        malformed("non-numeric header", ChatPacketBuilder.ESCAPE.length);
        continue;
      }
      int bodyLength = parseDigits(ChatPacketBuilder.ESCAPE.length + 4, 6);
      int total = ChatPacketBuilder.HEADER_LENGTH + bodyLength;
      int nextEscape = buffer.indexOf(ChatPacketBuilder.ESCAPE, ChatPacketBuilder.HEADER_LENGTH);
      if (nextEscape >= 0 && nextEscape < total) {
        malformed("escape inside declared body", nextEscape);
        continue;
      }
      if (buffer.readableBytes() < total) {
        break;
      }
      String serviceCode = ascii(ChatPacketBuilder.ESCAPE.length, 4);
      buffer.discard(ChatPacketBuilder.HEADER_LENGTH);
      frames.add(new RawFrame(serviceCode, bodyLength, buffer.take(bodyLength)));
      metrics.increment("decode.frames");
    }
    return frames;
  }

  /**
   * Interprets a frame as a chat message or donation.
   *
   * @param frame complete frame
   * @return decoded event, or empty for other service types, system notices, and malformed bodies
   */
  public Optional<LiveEvent> interpret(RawFrame frame) {
    Objects.requireNonNull(frame, "frame");
    Optional<ServiceType> type = frame.serviceType();
    if (type.isEmpty()) {
      metrics.increment("decode.frame.ignored");
      return Optional.empty();
    }
    return switch (type.get()) {
      case CHAT -> interpretChat(frame.fields());
      case DONATION -> interpretDonation(frame.fields());
      default -> {
        metrics.increment("decode.frame.ignored");
        yield Optional.empty();
      }
    };
  }

  /** Drops any partially buffered frame. */
  public void reset() {
    buffer.clear();
  }

  private Optional<LiveEvent> interpretChat(String[] fields) {
    if (fields.length < CHAT_MIN_FIELDS) {
      metrics.increment("decode.chat.malformed");
      log.debug("Dropping chat frame with {} fields", fields.length);
      return Optional.empty();
    }
    String text = fields[CHAT_TEXT];
    if (isSystemNotice(text)) {
      metrics.increment("decode.chat.system");
      return Optional.empty();
    }
    int bitmask = parseFlags(fields[CHAT_FLAGS]);
    if (log.isTraceEnabled()) {
      log.trace("Chat from {}: {}", fields[CHAT_NICKNAME], Logs.truncate(text, Logs.CHAT_TEXT_BUDGET));
    }
    return Optional.of(new ChatEvent(
        text, fields[CHAT_USER_ID], fields[CHAT_NICKNAME], bitmask, badges.flagsFor(bitmask)));
  }

  private Optional<LiveEvent> interpretDonation(String[] fields) {
    if (fields.length < DONATION_MIN_FIELDS) {
      metrics.increment("decode.donation.malformed");
      return Optional.empty();
    }
    int count;
    try {
      count = Integer.parseInt(fields[DONATION_COUNT].trim());
    } catch (NumberFormatException ex) {
      metrics.increment("decode.donation.malformed");
      log.debug("Dropping donation with count '{}'", fields[DONATION_COUNT]);
      return Optional.empty();
    }
    if (count < 0) {
      metrics.increment("decode.donation.malformed");
      return Optional.empty();
    }
    return Optional.of(new DonationEvent(fields[DONATION_NICKNAME], count));
  }

  private int parseFlags(String raw) {
    int bar = raw.indexOf('|');
    String first = bar >= 0 ? raw.substring(0, bar) : raw;
    try {
      return Integer.parseInt(first.trim());
    } catch (NumberFormatException ex) {
      metrics.increment("decode.chat.flags.invalid");
      return 0;
    }
  }

  static boolean isSystemNotice(String text) {
    return "-1".equals(text) || "1".equals(text) || text.contains("fw=");
  }

  private void skipGarbage() {
    int readable = buffer.readableBytes();
    // a trailing ESC may be the first half of the next escape sequence
    int keep = readable > 0 && buffer.byteAt(readable - 1) == ESC ? 1 : 0;
    int drop = readable - keep;
    if (drop > 0) {
      metrics.observe("decode.bytes.skipped", drop);
      buffer.discard(drop);
    }
  }

  private void malformed(String reason, int resyncOffset) {
    metrics.increment("decode.frame.malformed");
    log.debug("Dropping malformed frame ({}); resynchronizing", reason);
    buffer.discard(resyncOffset);
  }

  private boolean headerIsNumeric() {
    for (int i = ChatPacketBuilder.ESCAPE.length; i < ChatPacketBuilder.HEADER_LENGTH; i++) {
      byte b = buffer.byteAt(i);
      if (b < '0' || b > '9') {
        return false;
      }
    }
    return true;
  }

  private int parseDigits(int offset, int length) {
    int value = 0;
    for (int i = 0; i < length; i++) {
      value = value * 10 + (buffer.byteAt(offset + i) - '0');
    }
    return value;
  }

  private String ascii(int offset, int length) {
    byte[] out = new byte[length];
    for (int i = 0; i < length; i++) {
      out[i] = buffer.byteAt(offset + i);
    }
    return new String(out, StandardCharsets.US_ASCII);
  }
}
