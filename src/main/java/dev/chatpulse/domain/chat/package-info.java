/**
 * Domain values of the chat protocol: frames, service types, decoded chat and donation events, badges.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to hand between the reader thread and
 * detection workers.</p>
 * <p><strong>Security:</strong> Chat text and nicknames are user content; log them through
 * {@link dev.chatpulse.logging.Logs#truncate(String, int)}.</p>
 */
package dev.chatpulse.domain.chat;
