package dev.chatpulse.infrastructure.protocol;

import static dev.chatpulse.testutil.ChatFrames.concat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.chatpulse.domain.chat.Badge;
import dev.chatpulse.domain.chat.ChatEvent;
import dev.chatpulse.domain.chat.DonationEvent;
import dev.chatpulse.domain.chat.LiveEvent;
import dev.chatpulse.domain.chat.RawFrame;
import dev.chatpulse.domain.chat.ServiceType;
import dev.chatpulse.testutil.ChatFrames;
import dev.chatpulse.testutil.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatFrameDecoderTest {
  private RecordingMetricsPort metrics;
  private ChatFrameDecoder decoder;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    decoder = new ChatFrameDecoder(new BadgeCache(), metrics);
  }

  @Test
  void decodesSingleFrame() {
    List<RawFrame> frames = decoder.feed(ChatFrames.chat("지창"));

    assertEquals(1, frames.size());
    assertEquals("0005", frames.get(0).serviceCode());
    assertEquals("지창", frames.get(0).fields()[1]);
    assertEquals(1, metrics.count("decode.frames"));
  }

  @Test
  void outputIsIndependentOfChunkBoundaries() {
    byte[] stream = concat(
        ChatFrames.ack(ServiceType.LOGIN),
        ChatFrames.chat("지창 ㅋㅋ"),
        ChatFrames.donation("fan", 10),
        ChatFrames.chat("쌋다나~", "4|0"));
    List<RawFrame> whole = new ChatFrameDecoder(new BadgeCache(), metrics).feed(stream);
    assertEquals(4, whole.size());

    for (int split = 1; split < stream.length; split++) {
      ChatFrameDecoder fresh = new ChatFrameDecoder(new BadgeCache(), metrics);
      List<RawFrame> frames = new ArrayList<>(fresh.feed(Arrays.copyOfRange(stream, 0, split)));
      frames.addAll(fresh.feed(Arrays.copyOfRange(stream, split, stream.length)));
      assertEquals(whole, frames, "split at " + split);
    }

    ChatFrameDecoder bytewise = new ChatFrameDecoder(new BadgeCache(), metrics);
    List<RawFrame> frames = new ArrayList<>();
    for (byte b : stream) {
      frames.addAll(bytewise.feed(new byte[] {b}));
    }
    assertEquals(whole, frames);
  }

  @Test
  void skipsBytesBeforeEscape() {
    byte[] stream = concat("noise".getBytes(StandardCharsets.US_ASCII), ChatFrames.chat("세신"));

    List<RawFrame> frames = decoder.feed(stream);

    assertEquals(1, frames.size());
    assertEquals(List.of(5L), metrics.observed("decode.bytes.skipped"));
  }

  @Test
  void dropsFrameWithNonNumericHeaderAndResynchronizes() {
    byte[] broken = concat(new byte[] {0x1B, 0x09}, "00x5000003001ab".getBytes(StandardCharsets.US_ASCII));
    byte[] stream = concat(broken, ChatFrames.chat("짜장면"));

    List<RawFrame> frames = decoder.feed(stream);

    assertEquals(1, frames.size());
    assertEquals("짜장면", frames.get(0).fields()[1]);
    assertEquals(1, metrics.count("decode.frame.malformed"));
  }

  @Test
  void dropsFrameWhoseDeclaredBodyRunsIntoNextEscape() {
    // declares a 100-byte body but the next packet starts after 3 bytes
    byte[] truncated = concat(new byte[] {0x1B, 0x09}, "000500010000abc".getBytes(StandardCharsets.US_ASCII));
    byte[] stream = concat(truncated, ChatFrames.chat("ㄷㅈㄹㄱ"));

    List<RawFrame> frames = decoder.feed(stream);

    assertEquals(1, frames.size());
    assertEquals("ㄷㅈㄹㄱ", frames.get(0).fields()[1]);
    assertEquals(1, metrics.count("decode.frame.malformed"));
  }

  @Test
  void resetDropsPartialFrame() {
    byte[] packet = ChatFrames.chat("지창");
    decoder.feed(Arrays.copyOf(packet, packet.length - 2));
    decoder.reset();

    assertTrue(decoder.feed(ChatFrames.chat("세신")).stream().allMatch(f -> f.fields()[1].equals("세신")));
  }

  @Test
  void interpretsChatWithBadges() {
    RawFrame frame = decoder.feed(ChatFrames.chat("지창", (Badge.BROADCASTER.bit() | Badge.FAN_CLUB.bit()) + "|77"))
        .get(0);

    Optional<LiveEvent> event = decoder.interpret(frame);

    ChatEvent chat = assertInstanceOf(ChatEvent.class, event.orElseThrow());
    assertEquals("지창", chat.text());
    assertEquals("viewer01", chat.userId());
    assertEquals("viewer", chat.nickname());
    assertEquals(EnumSet.of(Badge.BROADCASTER, Badge.FAN_CLUB), chat.badges());
  }

  @Test
  void invalidFlagsDecodeAsNoBadges() {
    RawFrame frame = ChatFrames.frame(ServiceType.CHAT, ChatFrames.chatBody("지창", "u", "n", "abc"));

    ChatEvent chat = (ChatEvent) decoder.interpret(frame).orElseThrow();

    assertEquals(0, chat.bitmask());
    assertTrue(chat.badges().isEmpty());
    assertEquals(1, metrics.count("decode.chat.flags.invalid"));
  }

  @Test
  void filtersSystemNotices() {
    for (String text : List.of("-1", "1", "abc fw=12 def")) {
      RawFrame frame = ChatFrames.frame(ServiceType.CHAT, ChatFrames.chatBody(text, "u", "n", "0"));
      assertTrue(decoder.interpret(frame).isEmpty(), text);
    }
    assertEquals(3, metrics.count("decode.chat.system"));
  }

  @Test
  void dropsChatWithTooFewFields() {
    RawFrame frame = ChatFrames.frame(ServiceType.CHAT, "\f지창\fuser\f");

    assertTrue(decoder.interpret(frame).isEmpty());
    assertEquals(1, metrics.count("decode.chat.malformed"));
  }

  @Test
  void interpretsDonation() {
    RawFrame frame = decoder.feed(ChatFrames.donation("fan", 100)).get(0);

    DonationEvent donation = assertInstanceOf(DonationEvent.class, decoder.interpret(frame).orElseThrow());

    assertEquals("fan", donation.nickname());
    assertEquals(100, donation.count());
  }

  @Test
  void dropsDonationWithBadCount() {
    RawFrame frame = ChatFrames.frame(ServiceType.DONATION, "\f1\f2\ffan\fmany\f");

    assertTrue(decoder.interpret(frame).isEmpty());
    assertEquals(1, metrics.count("decode.donation.malformed"));
  }

  @Test
  void ignoresOtherServiceTypes() {
    assertTrue(decoder.interpret(ChatFrames.frame(ServiceType.LOGIN, "\f")).isEmpty());
    assertTrue(decoder.interpret(new RawFrame("0099", 1, new byte[] {'\f'})).isEmpty());
    assertEquals(2, metrics.count("decode.frame.ignored"));
  }
}
