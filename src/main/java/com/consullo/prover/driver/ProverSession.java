package com.consullo.prover.driver;

import com.consullo.prover.core.Mark;
import com.consullo.prover.core.Sentence;
import com.consullo.prover.dispatch.SequentialDispatcher;
import com.consullo.prover.display.DisplaySink;
import com.consullo.prover.display.VisibilityProxyDisplay;
import com.consullo.prover.process.ProverConnection;
import com.consullo.prover.stm.FeedbackHandler;
import com.consullo.prover.stm.Stm;
import com.consullo.prover.text.SentenceScanner;
import com.consullo.prover.text.TextDocument;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One open document checked by its own prover process.
 *
 * <p>Owns:
 * <ul>
 * <li>the prover connection and the transport behind it</li>
 * <li>a sequential dispatcher whose worker runs every exchange and drains feedback when idle</li>
 * <li>the document state machine</li>
 * <li>a visibility proxy in front of the editor's display</li>
 * </ul>
 *
 * <p>Interactive commands return {@code false} and do nothing while the session is busy, closed or
 * has lost its prover. Otherwise they clear the message panel and schedule the work.
 *
 * @since 1.0
 */
public final class ProverSession implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProverSession.class);

  private final String documentId;
  private final AutoCloseable transport;
  private final SessionConfig config;
  private final VisibilityProxyDisplay display;
  private final SequentialDispatcher dispatcher;
  private final Stm stm;
  private final SentenceScanner scanner = new SentenceScanner();

  private volatile boolean closed;

  /**
   * Assembles a session and schedules Init.
   *
   * @param documentId document id used in log lines and thread names
   * @param connection prover access
   * @param transport closed on {@link #close()} to stop the prover
   * @param config session tuning
   * @param display the editor's display
   * @param fallback handler for feedback the state machine does not consume
   */
  ProverSession(final String documentId, final ProverConnection connection, final AutoCloseable transport,
      final SessionConfig config, final DisplaySink display, final FeedbackHandler fallback) {
    Validate.notBlank(documentId, "documentId must not be blank");
    Validate.notNull(connection, "connection must not be null");
    Validate.notNull(transport, "transport must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(display, "display must not be null");
    this.documentId = documentId;
    this.transport = transport;
    this.config = config;
    this.display = new VisibilityProxyDisplay(documentId, display);
    this.dispatcher = new SequentialDispatcher(documentId, config.dispatcherCapacity(),
        config.feedbackPollInterval(), this::pollFeedback);
    this.stm = new Stm(documentId, connection, dispatcher, this.display, fallback);
    this.stm.init();
    LOGGER.info("[{}] session opened", documentId);
  }

  public String documentId() {
    return documentId;
  }

  /** Adds the sentence that follows the tip. */
  public boolean forwardOne(final TextDocument document) {
    Validate.notNull(document, "document must not be null");
    if (!beginCommand("forward")) {
      return false;
    }
    final Optional<Sentence> next = scanner.findSentenceAfter(document, stm.tipStop());
    if (next.isEmpty()) {
      LOGGER.debug("[{}] no sentence after {}", documentId, stm.tipStop());
      return false;
    }
    stm.add(List.of(next.get()));
    return true;
  }

  /** Steps back to the state before the tip. */
  public boolean backwardOne() {
    if (!beginCommand("backward")) {
      return false;
    }
    stm.editAtPrev();
    return true;
  }

  /**
   * Moves the tip to the cursor: adds every sentence that ends at or before it, or rewinds to the
   * last state ending at or before it.
   *
   * @param document document text
   * @param cursor cursor position
   * @return true if work was scheduled
   */
  public boolean toCursor(final TextDocument document, final Mark cursor) {
    Validate.notNull(document, "document must not be null");
    Validate.notNull(cursor, "cursor must not be null");
    if (!beginCommand("to cursor")) {
      return false;
    }
    final Mark tipStop = stm.tipStop();
    if (tipStop.isBefore(cursor)) {
      final List<Sentence> sentences = new ArrayList<>();
      Optional<Sentence> next = scanner.findSentenceAfter(document, tipStop);
      while (next.isPresent() && !next.get().stop().isAfter(cursor)) {
        sentences.add(next.get());
        next = scanner.findSentenceAfter(document, next.get().stop());
      }
      if (sentences.isEmpty()) {
        return false;
      }
      stm.add(sentences);
      return true;
    }
    if (tipStop.isAfter(cursor)) {
      stm.editAt(cursor);
      return true;
    }
    return false;
  }

  public void focus() {
    display.focus();
  }

  public void unfocus() {
    display.unfocus();
  }

  public void setActive() {
    display.setActive();
  }

  public void setInactive() {
    display.setInactive();
  }

  public boolean isBusy() {
    return dispatcher.isBusy();
  }

  public boolean isClosed() {
    return closed;
  }

  public Mark tipStop() {
    return stm.tipStop();
  }

  public Mark endStop() {
    return stm.endStop();
  }

  public Stm stm() {
    return stm;
  }

  public VisibilityProxyDisplay display() {
    return display;
  }

  /**
   * Waits until every scheduled exchange has finished.
   *
   * @param timeout maximum wait
   * @return true if idle
   * @throws InterruptedException if interrupted
   */
  public boolean awaitIdle(final Duration timeout) throws InterruptedException {
    return dispatcher.awaitIdle(timeout);
  }

  /**
   * Stops the prover and releases every highlight. Safe to call more than once.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    stm.markClosing();
    try {
      transport.close();
    } catch (final Exception e) {
      LOGGER.warn("[{}] closing the prover failed", documentId, e);
    }
    dispatcher.shutdown(config.closeTimeout());
    stm.close();
    LOGGER.info("[{}] session closed", documentId);
  }

  private boolean beginCommand(final String command) {
    if (closed) {
      LOGGER.debug("[{}] {} ignored, session closed", documentId, command);
      return false;
    }
    final Stm.Phase phase = stm.phase();
    if (phase == Stm.Phase.LOST || phase == Stm.Phase.FAILED || phase == Stm.Phase.CLOSED) {
      LOGGER.debug("[{}] {} ignored in phase {}", documentId, command, phase);
      return false;
    }
    if (dispatcher.isBusy()) {
      LOGGER.debug("[{}] {} ignored, session busy", documentId, command);
      return false;
    }
    display.clearMessages();
    return true;
  }

  private void pollFeedback() {
    final Stm s = stm;
    if (s != null) {
      s.pollFeedback();
    }
  }
}
