package dev.chatpulse.application.port;

import dev.chatpulse.domain.session.SessionSnapshot;
import java.io.IOException;

/**
 * <strong>What:</strong> Output port storing closed sessions.
 * <p><strong>Why:</strong> Session history outlives the process; where it goes is an adapter concern.</p>
 * <p><strong>Thread-safety:</strong> Called from the closing thread only.</p>
 *
 * @since 0.1.0
 * @see dev.chatpulse.infrastructure.persistence.JsonSessionArchive
 */
public interface SessionArchive {
  /**
   * Persists a frozen session.
   *
   * @param snapshot frozen session snapshot
   * @throws IOException if the store cannot be written; the caller keeps the snapshot and retries later
   */
  void store(SessionSnapshot snapshot) throws IOException;
}
