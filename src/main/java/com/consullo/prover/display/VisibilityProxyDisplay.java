package com.consullo.prover.display;

import com.consullo.prover.core.Goals;
import com.consullo.prover.core.MessageLevel;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a document's display state current while forwarding to the real display only what is
 * visible.
 *
 * <p>Goals and messages are always recorded but reach the delegate only while the document is
 * focused; {@link #focus()} replays the recorded state. Highlights are always tracked but drawn only
 * while the document is active; {@link #setActive()} draws every live highlight and
 * {@link #setInactive()} erases them without forgetting them.
 *
 * <p>Updates come from the session's dispatcher thread while focus changes come from the editor, so
 * every method synchronizes on the proxy.
 *
 * @since 1.0
 */
public final class VisibilityProxyDisplay implements DisplaySink {

  private static final Logger LOGGER = LoggerFactory.getLogger(VisibilityProxyDisplay.class);

  /**
   * A recorded message.
   *
   * @param level severity
   * @param text message text
   */
  public record Message(MessageLevel level, String text) {
  }

  private final String documentId;
  private final DisplaySink delegate;
  private final List<Message> messages = new ArrayList<>();
  private final Set<ProxyHandle> highlights = new LinkedHashSet<>();

  private Goals goals;
  private boolean focused;
  private boolean active;

  public VisibilityProxyDisplay(final String documentId, final DisplaySink delegate) {
    Validate.notBlank(documentId, "documentId must not be blank");
    Validate.notNull(delegate, "delegate must not be null");
    this.documentId = documentId;
    this.delegate = delegate;
  }

  @Override
  public synchronized void showGoals(final Goals goals) {
    this.goals = goals;
    if (focused) {
      delegate.showGoals(goals);
    }
  }

  @Override
  public synchronized void showMessage(final MessageLevel level, final String text) {
    Validate.notNull(level, "level must not be null");
    Validate.notNull(text, "text must not be null");
    messages.add(new Message(level, text));
    if (focused) {
      delegate.showMessage(level, text);
    }
  }

  @Override
  public synchronized void clearMessages() {
    messages.clear();
    if (focused) {
      delegate.clearMessages();
    }
  }

  @Override
  public synchronized HighlightHandle highlight(final Region region, final HighlightKind kind) {
    Validate.notNull(region, "region must not be null");
    Validate.notNull(kind, "kind must not be null");
    final ProxyHandle handle = new ProxyHandle(region, kind);
    highlights.add(handle);
    if (active) {
      handle.show();
    }
    return handle;
  }

  @Override
  public void connectionLost() {
    delegate.connectionLost();
  }

  /** Starts forwarding goals and messages, replaying what was recorded meanwhile. */
  public synchronized void focus() {
    if (focused) {
      return;
    }
    focused = true;
    LOGGER.debug("[{}] focused, replaying {} messages", documentId, messages.size());
    delegate.clearMessages();
    for (Message message : messages) {
      delegate.showMessage(message.level(), message.text());
    }
    delegate.showGoals(goals);
  }

  public synchronized void unfocus() {
    focused = false;
  }

  /** Draws every live highlight. */
  public synchronized void setActive() {
    if (active) {
      return;
    }
    active = true;
    for (ProxyHandle handle : highlights) {
      handle.show();
    }
  }

  /** Erases every drawn highlight but keeps tracking it. */
  public synchronized void setInactive() {
    if (!active) {
      return;
    }
    active = false;
    for (ProxyHandle handle : highlights) {
      handle.hide();
    }
  }

  public synchronized boolean isFocused() {
    return focused;
  }

  public synchronized boolean isActive() {
    return active;
  }

  public synchronized Goals goals() {
    return goals;
  }

  public synchronized List<Message> messages() {
    return List.copyOf(messages);
  }

  /** Number of highlights not yet removed, drawn or not. */
  public synchronized int highlightCount() {
    return highlights.size();
  }

  private final class ProxyHandle implements HighlightHandle {

    private final Region region;
    private final HighlightKind kind;
    private HighlightHandle shown;

    ProxyHandle(final Region region, final HighlightKind kind) {
      this.region = region;
      this.kind = kind;
    }

    void show() {
      if (shown == null) {
        shown = delegate.highlight(region, kind);
      }
    }

    void hide() {
      if (shown != null) {
        shown.remove();
        shown = null;
      }
    }

    @Override
    public void remove() {
      synchronized (VisibilityProxyDisplay.this) {
        if (highlights.remove(this)) {
          hide();
        }
      }
    }

    @Override
    public String toString() {
      return kind + region.toString();
    }
  }
}
