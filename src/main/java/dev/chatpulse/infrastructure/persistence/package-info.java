/**
 * File-based {@link dev.chatpulse.application.port.SessionArchive} writing daily JSON documents with the Jackson
 * streaming API.
 * <p><strong>Concurrency:</strong> One writer per directory; stores are serialized per instance.</p>
 */
package dev.chatpulse.infrastructure.persistence;
