/**
 * Command-line entry points: {@link dev.chatpulse.api.Main} dispatches to {@code watch}.
 * <p><strong>Role:</strong> Adapter layer translating {@code key=value} arguments and flags into a
 * {@link dev.chatpulse.config.MonitorConfig} and mapping failures to {@link dev.chatpulse.api.ExitCode}s.</p>
 * <p><strong>Security:</strong> The chat-room token is never printed or logged.</p>
 */
package dev.chatpulse.api;
