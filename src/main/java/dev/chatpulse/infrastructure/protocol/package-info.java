/**
 * Wire codec for the chat protocol: packet encoding, length-based frame decoding, and chat/donation
 * interpretation.
 * <p><strong>Concurrency:</strong> {@link dev.chatpulse.infrastructure.protocol.ChatFrameDecoder} buffers state and
 * is owned by the reader thread; {@link dev.chatpulse.infrastructure.protocol.BadgeCache} is shared and locked.</p>
 * <p><strong>Metrics:</strong> {@code decode.frames}, {@code decode.frame.malformed}, {@code decode.frame.ignored},
 * {@code decode.chat.system}, {@code decode.chat.malformed}, {@code decode.chat.flags.invalid},
 * {@code decode.donation.malformed}, {@code decode.bytes.skipped}.</p>
 */
package dev.chatpulse.infrastructure.protocol;
