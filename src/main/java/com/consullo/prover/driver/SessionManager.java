package com.consullo.prover.driver;

import com.consullo.prover.core.Mark;
import com.consullo.prover.display.DisplaySink;
import com.consullo.prover.text.TextDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sessions of every open document, keyed by document id.
 *
 * <p>At most one document is focused: focusing one unfocuses the previous one. Commands on a
 * document without a session return {@code false}.
 *
 * @since 1.0
 */
public final class SessionManager implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

  /**
   * Opens the session of one document.
   */
  @FunctionalInterface
  public interface SessionOpener {
    ProverSession open(String documentId, DisplaySink display) throws IOException;
  }

  private final DisplaySink display;
  private final SessionOpener opener;
  private final Map<String, ProverSession> sessions = new LinkedHashMap<>();
  private String focusedDocument;

  public SessionManager(final DisplaySink display, final SessionOpener opener) {
    Validate.notNull(display, "display must not be null");
    Validate.notNull(opener, "opener must not be null");
    this.display = display;
    this.opener = opener;
  }

  /**
   * Opens a session, or returns the one already open for the document.
   *
   * @param documentId document id
   * @return the session
   * @throws IOException if the prover cannot be started
   */
  public synchronized ProverSession open(final String documentId) throws IOException {
    Validate.notBlank(documentId, "documentId must not be blank");
    final ProverSession existing = sessions.get(documentId);
    if (existing != null) {
      return existing;
    }
    final ProverSession session = opener.open(documentId, display);
    sessions.put(documentId, session);
    LOGGER.debug("Opened session for {} ({} open)", documentId, sessions.size());
    return session;
  }

  public synchronized Optional<ProverSession> session(final String documentId) {
    return Optional.ofNullable(sessions.get(documentId));
  }

  public synchronized Set<String> documentIds() {
    return Set.copyOf(sessions.keySet());
  }

  public synchronized Optional<String> focusedDocument() {
    return Optional.ofNullable(focusedDocument);
  }

  /**
   * Closes a document's session.
   *
   * @param documentId document id
   * @return true if a session was open
   */
  public boolean close(final String documentId) {
    final ProverSession session;
    synchronized (this) {
      session = sessions.remove(documentId);
      if (documentId.equals(focusedDocument)) {
        focusedDocument = null;
      }
    }
    if (session == null) {
      return false;
    }
    session.close();
    return true;
  }

  public void closeAll() {
    final List<ProverSession> open;
    synchronized (this) {
      open = new ArrayList<>(sessions.values());
      sessions.clear();
      focusedDocument = null;
    }
    for (ProverSession session : open) {
      session.close();
    }
  }

  @Override
  public void close() {
    closeAll();
  }

  public boolean forwardOne(final String documentId, final TextDocument document) {
    return session(documentId).map(s -> s.forwardOne(document)).orElse(false);
  }

  public boolean backwardOne(final String documentId) {
    return session(documentId).map(ProverSession::backwardOne).orElse(false);
  }

  public boolean toCursor(final String documentId, final TextDocument document, final Mark cursor) {
    return session(documentId).map(s -> s.toCursor(document, cursor)).orElse(false);
  }

  /**
   * Moves the focus to a document, unfocusing the previous one.
   *
   * @param documentId document id, or {@code null} to unfocus every document
   */
  public synchronized void focus(final String documentId) {
    if (focusedDocument != null && !focusedDocument.equals(documentId)) {
      final ProverSession previous = sessions.get(focusedDocument);
      if (previous != null) {
        previous.unfocus();
      }
    }
    focusedDocument = null;
    if (documentId == null) {
      return;
    }
    final ProverSession next = sessions.get(documentId);
    if (next != null) {
      next.focus();
      focusedDocument = documentId;
    }
  }

  public void setActive(final String documentId) {
    session(documentId).ifPresent(ProverSession::setActive);
  }

  public void setInactive(final String documentId) {
    session(documentId).ifPresent(ProverSession::setInactive);
  }
}
