package dev.chatpulse.domain.session;

import dev.chatpulse.logging.Logs;
import dev.chatpulse.validation.Strings;
import java.time.Instant;
import java.util.Objects;

/**
 * Broadcast status reported by the poller.
 *
 * <p>A {@link LiveStatus#LIVE} status carries everything needed to open a chat session; an
 * {@link LiveStatus#OFFLINE} status carries nothing.</p>
 *
 * @param status live or offline
 * @param broadcastId broadcast number; identifies one session
 * @param title broadcast title; may be empty
 * @param chatRoomId chat-room number used in JOIN
 * @param entryToken room credential used in JOIN
 * @param endpoint chat server address
 * @param startedAt broadcast start time as reported by the poller
 * @since 0.1.0
 */
public record BroadcastStatus(
    LiveStatus status,
    String broadcastId,
    String title,
    String chatRoomId,
    String entryToken,
    ChatEndpoint endpoint,
    Instant startedAt) {

  /** Broadcast liveness. */
  public enum LiveStatus {
    LIVE,
    OFFLINE
  }

  /** Validates the fields a LIVE status requires. */
  public BroadcastStatus {
    Objects.requireNonNull(status, "status");
    if (status == LiveStatus.LIVE) {
      broadcastId = Strings.requireNonBlank("broadcastId", broadcastId);
      chatRoomId = Strings.requireNonBlank("chatRoomId", chatRoomId);
      entryToken = Strings.requireNonBlank("entryToken", entryToken);
      Objects.requireNonNull(endpoint, "endpoint");
      Objects.requireNonNull(startedAt, "startedAt");
    }
    title = Objects.requireNonNullElse(title, "");
  }

  /**
   * Creates a LIVE status.
   *
   * @param broadcastId broadcast number
   * @param title broadcast title
   * @param chatRoomId chat-room number
   * @param entryToken room credential
   * @param endpoint chat server address
   * @param startedAt broadcast start
   * @return live status
   */
  public static BroadcastStatus live(
      String broadcastId,
      String title,
      String chatRoomId,
      String entryToken,
      ChatEndpoint endpoint,
      Instant startedAt) {
    return new BroadcastStatus(LiveStatus.LIVE, broadcastId, title, chatRoomId, entryToken, endpoint, startedAt);
  }

  /**
   * Creates an OFFLINE status.
   *
   * @return offline status
   */
  public static BroadcastStatus offline() {
    return new BroadcastStatus(LiveStatus.OFFLINE, null, null, null, null, null, null);
  }

  /**
   * Reports whether the broadcast is live.
   *
   * @return {@code true} for LIVE
   */
  public boolean isLive() {
    return status == LiveStatus.LIVE;
  }

  @Override
  public String toString() {
    return "BroadcastStatus{"
        + "status=" + status
        + ", broadcastId=" + broadcastId
        + ", title=" + Logs.truncate(title, Logs.CHAT_TEXT_BUDGET)
        + ", chatRoomId=" + chatRoomId
        + ", entryToken=" + Logs.redact(entryToken)
        + ", endpoint=" + endpoint
        + '}';
  }
}
