package com.consullo.prover.stm;

import com.consullo.prover.core.Goals;
import com.consullo.prover.core.Location;
import com.consullo.prover.core.Mark;
import com.consullo.prover.core.MessageLevel;
import com.consullo.prover.core.Sentence;
import com.consullo.prover.core.StateId;
import com.consullo.prover.dispatch.SequentialDispatcher;
import com.consullo.prover.display.DisplaySink;
import com.consullo.prover.process.ProverConnection;
import com.consullo.prover.process.ProverQuitException;
import com.consullo.prover.protocol.AddCall;
import com.consullo.prover.protocol.AddResult;
import com.consullo.prover.protocol.CallResult;
import com.consullo.prover.protocol.EditAtCall;
import com.consullo.prover.protocol.EditAtResult;
import com.consullo.prover.protocol.Feedback;
import com.consullo.prover.protocol.FeedbackContent;
import com.consullo.prover.protocol.FocusedProof;
import com.consullo.prover.protocol.GoalCall;
import com.consullo.prover.protocol.InitCall;
import com.consullo.prover.protocol.ProtocolError;
import com.consullo.prover.protocol.ProverCall;
import com.consullo.prover.protocol.XmlDecodeException;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which sentences of one document the prover has accepted.
 *
 * <p>Every public command schedules one dispatcher task per prover exchange and returns at once.
 * The tasks, the feedback handling and therefore every history mutation run on the dispatcher's
 * single worker thread, in submission order. Add and Edit_at commands are followed by a Goal call
 * that refreshes the displayed goals.
 *
 * <p>Lifecycle:
 * <ol>
 * <li>{@link #init()} schedules the Init exchange; its answer becomes the root state</li>
 * <li>{@link #add(List)}, {@link #editAt(StateId)}, {@link #editAt(Mark)} and {@link #editAtPrev()}
 * move the tip forward and backward</li>
 * <li>losing the prover empties the history and reports {@link DisplaySink#connectionLost()} once;
 * later tasks do nothing</li>
 * <li>{@link #markClosing()} and {@link #close()} tear down without reporting a loss</li>
 * </ol>
 *
 * @since 1.0
 */
public final class Stm {

  private static final Logger LOGGER = LoggerFactory.getLogger(Stm.class);

  /** Maximum number of Edit_at retries at a prover-suggested state. */
  static final int MAX_EDIT_AT_HOPS = 16;

  static final String FIX_ERROR_FIRST = "Fix the error first.";

  /**
   * Session-level phase.
   */
  public enum Phase {
    /** Init not answered yet. */
    STARTING,
    READY,
    /** Init was refused. */
    FAILED,
    /** The prover is gone. */
    LOST,
    CLOSED
  }

  private final String documentId;
  private final ProverConnection connection;
  private final SequentialDispatcher dispatcher;
  private final DisplaySink display;
  private final FeedbackRouter feedbackRouter;

  private volatile Phase phase = Phase.STARTING;
  private volatile StateHistory history;
  private volatile boolean initScheduled;
  private volatile boolean closing;
  private State failedState;
  private int lastEditId;

  /**
   * Creates a state machine.
   *
   * @param documentId id used in log lines
   * @param connection prover access
   * @param dispatcher the session's dispatcher; all exchanges run on its worker
   * @param display display sink
   * @param fallback handler for feedback the state machine does not consume
   */
  public Stm(final String documentId, final ProverConnection connection, final SequentialDispatcher dispatcher,
      final DisplaySink display, final FeedbackHandler fallback) {
    Validate.notBlank(documentId, "documentId must not be blank");
    Validate.notNull(connection, "connection must not be null");
    Validate.notNull(dispatcher, "dispatcher must not be null");
    Validate.notNull(display, "display must not be null");
    Validate.notNull(fallback, "fallback must not be null");
    this.documentId = documentId;
    this.connection = connection;
    this.dispatcher = dispatcher;
    this.display = display;
    this.feedbackRouter = new FeedbackRouter(documentId, List.of(this::handleFeedback, fallback));
  }

  /**
   * Schedules the Init exchange. Must be called once, before any other command.
   *
   * @throws IllegalStateException if called twice
   */
  public void init() {
    Validate.validState(!initScheduled, "[%s] init already called", documentId);
    initScheduled = true;
    dispatcher.schedule("init", this::runInit);
  }

  /**
   * Schedules the sentences as a single task that sends one Add each, followed by a Goal refresh.
   *
   * <p>Refused with an error message if the tip carries an error. Sentences already live are
   * skipped when their turn comes. The first refused sentence cancels the rest of the batch, as does
   * a lost connection.
   *
   * @param sentences sentences in document order
   */
  public void add(final List<Sentence> sentences) {
    Validate.noNullElements(sentences, "sentences must not contain null");
    if (!acceptsCommands("add")) {
      return;
    }
    if (sentences.isEmpty()) {
      return;
    }
    final StateHistory h = history;
    if (h != null && h.tip().hasError()) {
      LOGGER.debug("[{}] add refused, tip {} has an error", documentId, h.tip());
      display.showMessage(MessageLevel.ERROR, FIX_ERROR_FIRST);
      return;
    }
    final List<Sentence> batch = List.copyOf(sentences);
    dispatcher.schedule("add " + batch.size() + " sentences up to " + batch.get(batch.size() - 1).stop(),
        () -> runAddBatch(batch));
    scheduleGoal();
  }

  /**
   * Schedules a rewind to the given state followed by a Goal refresh.
   *
   * @param target live state id
   */
  public void editAt(final StateId target) {
    Validate.notNull(target, "target must not be null");
    if (!acceptsCommands("edit_at")) {
      return;
    }
    dispatcher.schedule("edit_at " + target.value(), () -> runEditAt(target));
    scheduleGoal();
  }

  /**
   * Schedules a rewind to the latest state whose sentence ends at or before {@code mark}.
   *
   * @param mark cursor position
   */
  public void editAt(final Mark mark) {
    Validate.notNull(mark, "mark must not be null");
    if (!acceptsCommands("edit_at")) {
      return;
    }
    dispatcher.schedule("edit_at " + mark, () -> {
      if (ready()) {
        runEditAt(history.findLastAtOrBefore(mark).id());
      }
    });
    scheduleGoal();
  }

  /** Schedules a rewind to the state before the tip. Does nothing when the tip is the root. */
  public void editAtPrev() {
    if (!acceptsCommands("edit_at_prev")) {
      return;
    }
    final StateHistory h = history;
    if (h != null && h.tip().isRoot()) {
      LOGGER.debug("[{}] already at the root", documentId);
      return;
    }
    dispatcher.schedule("edit_at_prev", () -> {
      if (!ready()) {
        return;
      }
      final State previous = history.previous(history.tip().id());
      if (previous != null) {
        runEditAt(previous.id());
      }
    });
    scheduleGoal();
  }

  /**
   * Drains the feedback received so far and routes it. Must run on the dispatcher's worker.
   */
  public void pollFeedback() {
    for (Feedback feedback : connection.drainFeedbacks()) {
      if (phase != Phase.READY) {
        LOGGER.trace("[{}] dropping feedback in phase {}: {}", documentId, phase, feedback);
        continue;
      }
      feedbackRouter.route(feedback);
    }
  }

  public Phase phase() {
    return phase;
  }

  public boolean isBusy() {
    return dispatcher.isBusy();
  }

  public int pendingCount() {
    return dispatcher.pendingCount();
  }

  /**
   * Live history.
   *
   * @return the history, empty before Init is answered
   */
  public Optional<StateHistory> history() {
    return Optional.ofNullable(history);
  }

  /**
   * The sentence refused by the last failed Add, kept off the history until the next Add or Edit_at.
   *
   * @return the failed state, if any
   */
  public synchronized Optional<State> failedState() {
    return Optional.ofNullable(failedState);
  }

  public Mark tipStop() {
    final StateHistory h = history;
    return h == null ? Mark.ORIGIN : h.tipStop();
  }

  public Mark endStop() {
    final StateHistory h = history;
    return h == null ? Mark.ORIGIN : h.endStop();
  }

  /**
   * Stops reacting to the prover: drops pending tasks and suppresses the connection-lost report that
   * closing the channel would trigger.
   */
  public void markClosing() {
    closing = true;
    dispatcher.discardPending();
  }

  /** Releases every highlight. Call after the dispatcher has stopped. */
  public void close() {
    markClosing();
    phase = Phase.CLOSED;
    final StateHistory h = history;
    if (h != null) {
      releaseAll(h.clear());
    }
    clearFailedState();
    LOGGER.debug("[{}] state machine closed", documentId);
  }

  private boolean acceptsCommands(final String command) {
    Validate.validState(initScheduled, "[%s] %s before init", documentId, command);
    if (closing || phase == Phase.LOST || phase == Phase.FAILED || phase == Phase.CLOSED) {
      LOGGER.warn("[{}] {} ignored in phase {}", documentId, command, closing ? Phase.CLOSED : phase);
      return false;
    }
    return true;
  }

  private boolean ready() {
    return phase == Phase.READY && !closing;
  }

  private void scheduleGoal() {
    dispatcher.schedule("goal", this::runGoal);
  }

  private void runInit() throws InterruptedException {
    final CallResult<StateId> result = exchange(new InitCall());
    if (result == null) {
      return;
    }
    if (!result.isGood()) {
      phase = Phase.FAILED;
      LOGGER.error("[{}] prover refused Init: {}", documentId, result.error().message());
      display.showMessage(MessageLevel.ERROR, result.error().message());
      return;
    }
    history = new StateHistory(State.root(result.value()));
    phase = Phase.READY;
    LOGGER.info("[{}] session ready, root state {}", documentId, result.value().value());
  }

  private void runAddBatch(final List<Sentence> batch) throws InterruptedException {
    for (int i = 0; i < batch.size(); i++) {
      if (!runAdd(batch.get(i))) {
        if (i + 1 < batch.size()) {
          LOGGER.debug("[{}] dropping the remaining {} sentences of the batch", documentId, batch.size() - i - 1);
        }
        return;
      }
    }
  }

  /**
   * Sends one Add.
   *
   * @return false if the batch must stop here
   */
  private boolean runAdd(final Sentence sentence) throws InterruptedException {
    if (!ready()) {
      return false;
    }
    clearFailedState();
    if (history.contains(sentence)) {
      LOGGER.debug("[{}] sentence at {} already added", documentId, sentence.start());
      return true;
    }
    final State tip = history.tip();
    if (tip.hasError()) {
      LOGGER.debug("[{}] skipping add, tip {} has an error", documentId, tip);
      return false;
    }
    final CallResult<AddResult> result = exchange(new AddCall(sentence.text(), nextEditId(), tip.id(), false));
    if (result == null) {
      return false;
    }
    final boolean added = result.isGood();
    if (added) {
      final AddResult answer = result.value();
      final State state = new State(answer.stateId(), sentence);
      history.insertAfter(tip.id(), state);
      state.markSent(display);
      history.setTip(state.id());
      if (answer.closedProof()) {
        if (history.contains(answer.closedProofNextStateId())) {
          history.setTip(answer.closedProofNextStateId());
        } else {
          LOGGER.warn("[{}] closed proof continues at unknown state {}", documentId,
              answer.closedProofNextStateId().value());
        }
      }
      LOGGER.debug("[{}] added state {} at {}", documentId, state.id().value(), sentence.stop());
      if (!answer.message().isEmpty()) {
        display.showMessage(MessageLevel.INFO, answer.message());
      }
    } else {
      final ProtocolError error = result.error();
      LOGGER.debug("[{}] add at {} failed: {}", documentId, sentence.start(), error.message());
      final int dropped = dispatcher.discardPending();
      final State failed = new State(StateId.NONE, sentence);
      failed.markError(error.location(), display);
      synchronized (this) {
        failedState = failed;
      }
      display.showMessage(MessageLevel.ERROR, error.message());
      if (dropped > 0) {
        LOGGER.debug("[{}] cancelled {} scheduled tasks", documentId, dropped);
      }
      scheduleGoal();
    }
    pollFeedback();
    return added;
  }

  private void runEditAt(final StateId target) throws InterruptedException {
    if (!ready()) {
      return;
    }
    clearFailedState();
    StateId current = target;
    for (int hop = 0; hop < MAX_EDIT_AT_HOPS; hop++) {
      if (!history.contains(current)) {
        LOGGER.warn("[{}] edit_at target {} is not live", documentId, current.value());
        return;
      }
      final CallResult<EditAtResult> result = exchange(new EditAtCall(current));
      if (result == null) {
        return;
      }
      if (result.isGood()) {
        applyEditAt(current, result.value());
        pollFeedback();
        return;
      }
      final ProtocolError error = result.error();
      final StateId suggested = error.stateId();
      if (suggested.equals(current) || !history.contains(suggested)) {
        LOGGER.debug("[{}] edit_at {} failed with no usable rewind point: {}", documentId, current.value(),
            error.message());
        display.showMessage(MessageLevel.ERROR, error.message());
        return;
      }
      LOGGER.debug("[{}] edit_at {} refused, retrying at {}", documentId, current.value(), suggested.value());
      current = suggested;
    }
    LOGGER.warn("[{}] edit_at gave up after {} retries", documentId, MAX_EDIT_AT_HOPS);
    display.showMessage(MessageLevel.ERROR, "Cannot go back to the requested position.");
  }

  private void applyEditAt(final StateId target, final EditAtResult result) {
    final List<State> removed;
    if (result.focusChanged()) {
      final FocusedProof focus = result.focusedProof();
      // only a Qed still linked after the target closes a proof that can be kept
      if (history.isAfter(focus.qedStateId(), target)) {
        removed = history.removeBetween(target, focus.qedStateId());
      } else {
        removed = history.removeAfter(target);
      }
    } else {
      removed = history.removeAfter(target);
    }
    releaseAll(removed);
    history.setTip(target);
    LOGGER.debug("[{}] rewound to {}, removed {} states", documentId, target.value(), removed.size());
  }

  private void runGoal() throws InterruptedException {
    if (!ready()) {
      return;
    }
    final CallResult<Optional<Goals>> result = exchange(new GoalCall());
    if (result == null) {
      return;
    }
    if (result.isGood()) {
      display.showGoals(result.value().orElse(null));
    } else {
      display.showMessage(MessageLevel.ERROR, result.error().message());
    }
    pollFeedback();
  }

  /**
   * Runs one exchange. A lost or garbled connection is handled here.
   *
   * @return the answer, or {@code null} if the connection is lost
   */
  private <R> CallResult<R> exchange(final ProverCall<R> call) throws InterruptedException {
    try {
      return connection.call(call);
    } catch (final ProverQuitException e) {
      LOGGER.debug("[{}] {} lost the prover: {}", documentId, call.name(), e.getMessage());
      onConnectionLost();
      return null;
    } catch (final XmlDecodeException e) {
      LOGGER.error("[{}] undecodable answer to {}", documentId, call.name(), e);
      onConnectionLost();
      return null;
    }
  }

  private void onConnectionLost() {
    dispatcher.discardPending();
    final StateHistory h = history;
    if (h != null) {
      releaseAll(h.clear());
    }
    clearFailedState();
    if (closing || phase == Phase.LOST || phase == Phase.CLOSED) {
      return;
    }
    phase = Phase.LOST;
    LOGGER.warn("[{}] connection to the prover lost", documentId);
    display.connectionLost();
  }

  private boolean handleFeedback(final Feedback feedback) {
    final FeedbackContent content = feedback.content();
    switch (feedback.kind()) {
      case ADDED_AXIOM: {
        final State state = liveState(feedback.stateId());
        if (state == null) {
          return false;
        }
        state.markAxiom(display);
        return true;
      }
      case PROCESSED: {
        final State state = liveState(feedback.stateId());
        if (state == null) {
          return false;
        }
        state.markVerified(display);
        return true;
      }
      case ERROR_MSG: {
        final FeedbackContent.ErrorMsg error = (FeedbackContent.ErrorMsg) content;
        onErrorFeedback(feedback.stateId(), error.location(), error.text());
        return true;
      }
      case MESSAGE: {
        final FeedbackContent.Message message = (FeedbackContent.Message) content;
        if (message.level() == MessageLevel.ERROR) {
          onErrorFeedback(feedback.stateId(), message.location(), message.text());
        } else {
          display.showMessage(message.level(), message.text());
        }
        return true;
      }
      case INCOMPLETE:
      case IN_PROGRESS:
      case PROCESSING_IN:
      case FILE_DEPENDENCY:
      case FILE_LOADED:
      case UNHANDLED:
      default:
        return false;
    }
  }

  /**
   * An error reported against a live state turns it into the tip: everything after it is dropped
   * along with the tasks that would build on it.
   */
  private void onErrorFeedback(final StateId stateId, final Location location, final String text) {
    final State state = liveState(stateId);
    if (state != null) {
      LOGGER.debug("[{}] state {} failed: {}", documentId, stateId.value(), text);
      state.markError(location, display);
      dispatcher.discardPending();
      releaseAll(history.removeAfter(state.id()));
      history.setTip(state.id());
    }
    display.showMessage(MessageLevel.ERROR, text);
  }

  private State liveState(final StateId id) {
    final StateHistory h = history;
    if (h == null) {
      return null;
    }
    final State state = h.get(id);
    return state == null || state.isRoot() ? null : state;
  }

  private void clearFailedState() {
    final State failed;
    synchronized (this) {
      failed = failedState;
      failedState = null;
    }
    if (failed != null) {
      failed.release();
    }
  }

  private int nextEditId() {
    lastEditId--;
    return lastEditId;
  }

  private static void releaseAll(final List<State> states) {
    for (State state : states) {
      state.release();
    }
  }
}
