package dev.chatpulse.application.pipeline;

import dev.chatpulse.application.port.ChatTransport;
import dev.chatpulse.application.port.ClockPort;
import dev.chatpulse.application.port.MetricsPort;
import dev.chatpulse.application.port.SessionArchive;
import dev.chatpulse.application.port.TransportException;
import dev.chatpulse.application.port.TransportFactory;
import dev.chatpulse.domain.chat.LiveEvent;
import dev.chatpulse.domain.chat.RawFrame;
import dev.chatpulse.domain.chat.TransportState;
import dev.chatpulse.domain.detect.DetectionSettings;
import dev.chatpulse.domain.detect.HotMomentRecord;
import dev.chatpulse.domain.detect.MemeCatalog;
import dev.chatpulse.domain.session.BroadcastStatus;
import dev.chatpulse.domain.session.Session;
import dev.chatpulse.domain.session.SessionSnapshot;
import dev.chatpulse.domain.session.SessionState;
import dev.chatpulse.infrastructure.exec.ExecutorFactories;
import dev.chatpulse.infrastructure.protocol.ChatFrameDecoder;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Owns the live session: opens it on LIVE, wires transport, queue, workers, and detector, and closes
 * and archives it on OFFLINE.
 *
 * <p>Lifecycle {@code IDLE -> ACTIVE -> CLOSING -> IDLE}. One reader thread runs
 * {@code open -> connect -> join -> run} and retries transport failures with the {@link RetryPolicy}
 * backoff; once the retries are exhausted (or a detection worker fails) the reader abandons the
 * session itself. Closing stops intake, closes the transport, joins the reader, drains the queue
 * through the workers, freezes the session, and hands the frozen snapshot to the
 * {@link SessionArchive}. Snapshots that fail to persist stay pending until {@link #flushPending()}
 * or the next close succeeds.</p>
 *
 * <p>Thread-safe. {@link #onStatus(BroadcastStatus)} and {@link #close()} serialize on one monitor;
 * the reader's self-abandonment claims {@code CLOSING} by compare-and-set and never takes that
 * monitor. {@link #snapshot()} only takes the session's own lock.</p>
 *
 * @since 0.1.0
 */
public final class SessionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final TransportFactory transports;
  private final ChatFrameDecoder interpreter;
  private final SessionArchive archive;
  private final MemeCatalog catalog;
  private final DetectionSettings detection;
  private final PipelineSettings pipelineSettings;
  private final RetryPolicy retry;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private final Object lifecycleLock = new Object();
  private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
  private final AtomicInteger sessionSequence = new AtomicInteger();
  private final List<SessionSnapshot> pendingArchives = new ArrayList<>();
  private final List<Consumer<HotMomentRecord>> hotMomentListeners = new CopyOnWriteArrayList<>();

  private volatile Pipeline current;
  private volatile SessionSnapshot lastClosed;

  /**
   * Creates an idle session manager.
   *
   * @param transports opens one transport per connection attempt
   * @param interpreter turns frames into chat and donation events
   * @param archive receives frozen sessions
   * @param catalog memes to track
   * @param detection detector tuning
   * @param pipelineSettings queue and worker tuning
   * @param retry reconnect policy
   * @param clock time source for detection and session timestamps
   * @param metrics metrics sink for {@code session.*} and the pipeline below it
   */
  public SessionManager(
      TransportFactory transports,
      ChatFrameDecoder interpreter,
      SessionArchive archive,
      MemeCatalog catalog,
      DetectionSettings detection,
      PipelineSettings pipelineSettings,
      RetryPolicy retry,
      ClockPort clock,
      MetricsPort metrics) {
    this.transports = Objects.requireNonNull(transports, "transports");
    this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
    this.archive = Objects.requireNonNull(archive, "archive");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.detection = Objects.requireNonNull(detection, "detection");
    this.pipelineSettings = Objects.requireNonNull(pipelineSettings, "pipelineSettings");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Applies a broadcast status reported by the poller.
   *
   * <p>LIVE while idle opens a session; LIVE for a different broadcast closes the current session and
   * opens a new one; LIVE for the current broadcast is a no-op; LIVE while closing is ignored. OFFLINE
   * closes the active session and blocks until it is archived.</p>
   *
   * @param status broadcast status
   */
  public void onStatus(BroadcastStatus status) {
    Objects.requireNonNull(status, "status");
    synchronized (lifecycleLock) {
      SessionState observed = state.get();
      if (!status.isLive()) {
        if (observed == SessionState.ACTIVE) {
          closeActive("broadcast offline");
        } else if (observed == SessionState.CLOSING) {
          awaitClosed();
        }
        return;
      }
      if (observed == SessionState.CLOSING) {
        metrics.increment("session.status.ignored");
        log.info("Ignoring LIVE for broadcast {} while the previous session is closing", status.broadcastId());
        return;
      }
      if (observed == SessionState.ACTIVE) {
        Pipeline active = current;
        if (active != null && active.status.broadcastId().equals(status.broadcastId())) {
          return;
        }
        log.info("Broadcast changed to {}; closing the current session", status.broadcastId());
        closeActive("broadcast changed");
        if (state.get() != SessionState.IDLE) {
          return;
        }
      }
      open(status);
    }
  }

  /**
   * Closes the active session, if any, and waits until it is archived. A session the reader is
   * already abandoning is waited for as well.
   */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      SessionState observed = state.get();
      if (observed == SessionState.ACTIVE) {
        closeActive("shutdown");
      } else if (observed == SessionState.CLOSING) {
        awaitClosed();
      }
    }
  }

  /**
   * Returns a copy of the current session, or of the last closed one while idle.
   *
   * @return snapshot, or empty when no session was ever opened
   */
  public Optional<SessionSnapshot> snapshot() {
    Pipeline active = current;
    if (active != null) {
      return Optional.of(active.session.snapshot(state.get(), active.transportState(), active.lastTransportError));
    }
    SessionSnapshot closed = lastClosed;
    return Optional.ofNullable(closed).map(s -> s.withPipeline(SessionState.IDLE, TransportState.DISCONNECTED,
        s.lastTransportError()));
  }

  public SessionState state() {
    return state.get();
  }

  /**
   * Subscribes to completed hot moments. Listener exceptions are logged and counted.
   *
   * @param listener callback invoked on a worker thread
   */
  public void addHotMomentListener(Consumer<HotMomentRecord> listener) {
    hotMomentListeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Unsubscribes a hot-moment listener.
   *
   * @param listener previously added callback
   */
  public void removeHotMomentListener(Consumer<HotMomentRecord> listener) {
    hotMomentListeners.remove(listener);
  }

  /**
   * Retries archiving sessions whose earlier store failed.
   *
   * @return number of snapshots still pending
   */
  public int flushPending() {
    synchronized (pendingArchives) {
      while (!pendingArchives.isEmpty()) {
        SessionSnapshot next = pendingArchives.get(0);
        try {
          archive.store(next);
        } catch (IOException ex) {
          metrics.increment("session.archive.failed");
          log.warn("Failed to archive session {}; keeping it in memory ({} pending)",
              next.broadcastId(), pendingArchives.size(), ex);
          return pendingArchives.size();
        }
        pendingArchives.remove(0);
        metrics.increment("session.archive.stored");
        log.info("Archived session {}", next.broadcastId());
      }
      return 0;
    }
  }

  /**
   * Returns the snapshots awaiting a successful archive.
   *
   * @return copy of the pending list, oldest first
   */
  public List<SessionSnapshot> pendingArchives() {
    synchronized (pendingArchives) {
      return List.copyOf(pendingArchives);
    }
  }

  private void open(BroadcastStatus status) {
    int sequence = sessionSequence.incrementAndGet();
    Session session = new Session(status.broadcastId(), status.title(), status.startedAt(), catalog.kinds());
    Pipeline pipeline = new Pipeline(status, session, sequence);
    current = pipeline;
    state.set(SessionState.ACTIVE);
    pipeline.workers.start();
    pipeline.reader.start();
    metrics.increment("session.opened");
    log.info("Opened session for broadcast {} ({} workers, queue capacity {})",
        status.broadcastId(), pipelineSettings.workers(), pipelineSettings.queueCapacity());
  }

  private void closeActive(String reason) {
    if (!state.compareAndSet(SessionState.ACTIVE, SessionState.CLOSING)) {
      return;
    }
    shutdownPipeline(current, reason);
  }

  private void abandon(Pipeline pipeline, String reason) {
    if (current != pipeline || !state.compareAndSet(SessionState.ACTIVE, SessionState.CLOSING)) {
      return;
    }
    metrics.increment("session.abandoned");
    log.error("Abandoning session for broadcast {}: {}", pipeline.status.broadcastId(), reason);
    shutdownPipeline(pipeline, "abandoned");
  }

  private void shutdownPipeline(Pipeline pipeline, String reason) {
    try {
      log.info("Closing session for broadcast {} ({})", pipeline.status.broadcastId(), reason);
      pipeline.requestStop();
      long timeoutMillis = pipelineSettings.shutdownTimeout().toMillis();
      if (Thread.currentThread() != pipeline.reader) {
        joinReader(pipeline, timeoutMillis);
      }
      pipeline.workers.shutdown(pipelineSettings.shutdownTimeout());
      pipeline.session.freeze(Instant.ofEpochMilli(clock.nowMillis()));
      SessionSnapshot frozen =
          pipeline.session.snapshot(SessionState.IDLE, TransportState.DISCONNECTED, pipeline.lastTransportError);
      metrics.increment("session.closed");
      log.info("Session {} closed: {} matches, {} waves, {} hot moments, {} donations ({} stars)",
          frozen.broadcastId(), frozen.totalMatches(), frozen.waveCount(), frozen.hotMoments().size(),
          frozen.donationCount(), frozen.donationTotal());
      synchronized (pendingArchives) {
        pendingArchives.add(frozen);
      }
      flushPending();
      lastClosed = frozen;
    } finally {
      // IDLE only once the frozen session has reached the archive or the pending list
      current = null;
      state.set(SessionState.IDLE);
      pipeline.closed.countDown();
    }
  }

  private void awaitClosed() {
    Pipeline closing = current;
    if (closing == null) {
      return;
    }
    try {
      closing.closed.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for session {} to be archived", closing.status.broadcastId());
    }
  }

  private void joinReader(Pipeline pipeline, long timeoutMillis) {
    try {
      pipeline.reader.join(timeoutMillis);
      if (pipeline.reader.isAlive()) {
        metrics.increment("session.reader.interrupted");
        log.warn("Reader thread still running after {} ms; interrupting", timeoutMillis);
        pipeline.reader.interrupt();
        pipeline.reader.join(timeoutMillis);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the reader thread to exit");
    }
  }

  private void runReader(Pipeline pipeline) {
    MDC.put("pipeline", "reader");
    int failures = 0;
    try {
      while (!pipeline.stopRequested.get()) {
        AtomicBoolean streamed = new AtomicBoolean();
        String reason;
        ChatTransport transport = transports.open(pipeline.status.endpoint());
        pipeline.transport = transport;
        try {
          if (pipeline.stopRequested.get()) {
            break;
          }
          transport.connect();
          transport.join(pipeline.status.chatRoomId(), pipeline.status.entryToken());
          log.info("Joined chat room {} for broadcast {}", pipeline.status.chatRoomId(),
              pipeline.status.broadcastId());
          transport.run(frame -> {
            streamed.set(true);
            onFrame(pipeline, frame);
          });
          reason = "connection closed by server";
        } catch (TransportException ex) {
          reason = ex.getMessage();
          log.debug("Transport failure", ex);
        } finally {
          transport.close();
        }
        if (pipeline.stopRequested.get()) {
          break;
        }
        if (streamed.get()) {
          failures = 0;
        }
        failures++;
        pipeline.lastTransportError = reason;
        metrics.increment("session.transport.failures");
        if (!retry.allowsRetry(failures)) {
          abandon(pipeline, "transport failed " + failures + " times in a row; last error: " + reason);
          return;
        }
        long delay = retry.delayMillis(failures);
        log.warn("Chat connection lost ({}); reconnecting in {} ms (attempt {}/{})",
            reason, delay, failures, retry.maxRetries());
        if (pipeline.stop.await(delay, TimeUnit.MILLISECONDS)) {
          break;
        }
      }
    } catch (InterruptedException ie) {
      // abandon before restoring the flag; the shutdown below waits on the workers
      if (!pipeline.stopRequested.get()) {
        String cause = pipeline.workers.failure()
            .map(ex -> "detection worker failed: " + ex)
            .orElse("reader interrupted");
        abandon(pipeline, cause);
      }
      Thread.currentThread().interrupt();
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void onFrame(Pipeline pipeline, RawFrame frame) throws InterruptedException {
    if (pipeline.stopRequested.get()) {
      metrics.increment("session.frames.dropped.closing");
      return;
    }
    Optional<LiveEvent> event = interpreter.interpret(frame);
    if (event.isPresent()) {
      pipeline.queue.put(event.get());
    }
  }

  private void onWorkerFailure(Pipeline pipeline, Exception failure) {
    log.error("Detection worker failed; abandoning session for broadcast {}",
        pipeline.status.broadcastId(), failure);
    pipeline.reader.interrupt();
  }

  private void notifyHotMoment(HotMomentRecord record) {
    for (Consumer<HotMomentRecord> listener : hotMomentListeners) {
      try {
        listener.accept(record);
      } catch (RuntimeException ex) {
        metrics.increment("session.listener.error");
        log.warn("Hot-moment listener {} failed", listener, ex);
      }
    }
  }

  private final class Pipeline {
    private final BroadcastStatus status;
    private final Session session;
    private final IngestQueue queue;
    private final WorkerPool workers;
    private final Thread reader;
    private final CountDownLatch stop = new CountDownLatch(1);
    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile ChatTransport transport;
    private volatile String lastTransportError;

    private Pipeline(BroadcastStatus status, Session session, int sequence) {
      this.status = status;
      this.session = session;
      this.queue = new IngestQueue(pipelineSettings.queueCapacity(), metrics);
      PatternDetector detector =
          new PatternDetector(catalog, detection, clock,
              new SessionRecorder(session, SessionManager.this::notifyHotMoment, metrics), metrics);
      this.workers = new WorkerPool(
          queue,
          detector::onEvent,
          pipelineSettings.workers(),
          "chatpulse-detect-" + sequence,
          metrics,
          ex -> onWorkerFailure(this, ex));
      this.reader = ExecutorFactories.namedThreads("chatpulse-reader-" + sequence, null)
          .newThread(() -> runReader(this));
    }

    private void requestStop() {
      stopRequested.set(true);
      stop.countDown();
      ChatTransport active = transport;
      if (active != null) {
        active.close();
      }
    }

    private TransportState transportState() {
      ChatTransport active = transport;
      return active == null ? TransportState.DISCONNECTED : active.state();
    }
  }
}
