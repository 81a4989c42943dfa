package com.consullo.prover.stm;

import com.consullo.prover.core.Flag;
import com.consullo.prover.core.Goals;
import com.consullo.prover.core.Location;
import com.consullo.prover.core.Mark;
import com.consullo.prover.core.MessageLevel;
import com.consullo.prover.core.Sentence;
import com.consullo.prover.core.StateId;
import com.consullo.prover.dispatch.SequentialDispatcher;
import com.consullo.prover.display.HighlightKind;
import com.consullo.prover.display.RecordingDisplay;
import com.consullo.prover.display.Region;
import com.consullo.prover.protocol.AddCall;
import com.consullo.prover.protocol.EditAtCall;
import com.consullo.prover.protocol.Feedback;
import com.consullo.prover.protocol.FeedbackContent;
import com.consullo.prover.protocol.ProtocolError;
import com.consullo.prover.protocol.XmlDecodeException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the document state machine against a scripted prover.
 *
 * @since 1.0
 */
public class StmTest {

  private static final Duration WAIT = Duration.ofSeconds(5);

  private ScriptedConnection prover;
  private RecordingDisplay display;
  private SequentialDispatcher dispatcher;
  private List<Feedback> unhandled;
  private Stm stm;

  @BeforeEach
  void setUp() {
    prover = new ScriptedConnection();
    display = new RecordingDisplay();
    dispatcher = new SequentialDispatcher("doc", 100);
    unhandled = new ArrayList<>();
    stm = new Stm("doc", prover, dispatcher, display, feedback -> {
      unhandled.add(feedback);
      return true;
    });
  }

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  @Test
  @DisplayName("Should add a sentence, refresh goals, and rewind to the root")
  void freshSession_AddThenEditAtPrev_ReturnsToRoot() throws Exception {
    final Sentence proof = new Sentence("Proof.", new Mark(1, 1), new Mark(1, 7));

    stm.init();
    awaitIdle();
    assertThat(stm.phase()).isEqualTo(Stm.Phase.READY);
    assertThat(stm.history().orElseThrow().root().id()).isEqualTo(StateId.of(1));

    stm.add(List.of(proof));
    awaitIdle();
    final State tip = stm.history().orElseThrow().tip();
    assertThat(tip.id()).isEqualTo(StateId.of(2));
    assertThat(tip.flag()).isEqualTo(Flag.SENT);
    assertThat(prover.callNames()).containsExactly("Init", "Add", "Goal");
    assertThat(stm.tipStop()).isEqualTo(new Mark(1, 7));

    stm.editAtPrev();
    awaitIdle();
    final List<EditAtCall> edits = prover.callsOf(EditAtCall.class);
    assertThat(edits).hasSize(1);
    assertThat(edits.get(0).stateId()).isEqualTo(StateId.of(1));
    assertThat(stm.history().orElseThrow().tip().isRoot()).isTrue();
    assertThat(stm.history().orElseThrow().contains(StateId.of(2))).isFalse();
    assertThat(stm.tipStop()).isEqualTo(Mark.ORIGIN);
    assertThat(display.liveHighlights()).isEmpty();
  }

  @Test
  @DisplayName("Should send fresh negative edit ids and the tip state id without verbose output")
  void add_Batch_ChainsStateIds() throws Exception {
    start();

    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof."), sentence(3, "exact I.")));
    awaitIdle();

    final List<AddCall> adds = prover.addCalls();
    assertThat(adds).extracting(AddCall::editId).containsExactly(-1, -2, -3);
    assertThat(adds).extracting(AddCall::stateId).containsExactly(StateId.of(1), StateId.of(2), StateId.of(3));
    assertThat(adds).extracting(AddCall::verbose).containsOnly(false);
    assertThat(prover.callNames()).containsExactly("Init", "Add", "Add", "Add", "Goal");
    assertThat(stm.history().orElseThrow().size()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should not send a sentence that is already live")
  void add_SameSentenceTwice_SendsOneAdd() throws Exception {
    start();
    final Sentence s = sentence(1, "Proof.");

    stm.add(List.of(s));
    awaitIdle();
    stm.add(List.of(s));
    awaitIdle();

    assertThat(prover.addCalls()).hasSize(1);
    assertThat(stm.history().orElseThrow().size()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should stop a batch at the first refused sentence and still refresh goals once")
  void add_MiddleSentenceFails_LaterSentencesNeverSent() throws Exception {
    start();
    final Sentence s1 = sentence(1, "Lemma a : True.");
    final Sentence s2 = sentence(2, "Proof bad.");
    final Sentence s3 = sentence(3, "exact I.");
    prover.answer("Add", ScriptedConnection.added(2, ""));
    prover.fail("Add", new ProtocolError(new Location(6, 9), StateId.of(2), "Syntax error."));

    stm.add(List.of(s1, s2, s3));
    awaitIdle();

    assertThat(prover.addCalls()).extracting(AddCall::command).containsExactly(s1.text(), s2.text());
    assertThat(prover.callNames()).containsExactly("Init", "Add", "Add", "Goal");
    assertThat(stm.history().orElseThrow().tip().sentence()).isEqualTo(s1);
    final State failed = stm.failedState().orElseThrow();
    assertThat(failed.flag()).isEqualTo(Flag.ERROR);
    assertThat(failed.sentence()).isEqualTo(s2);
    assertThat(failed.errorLocation()).isEqualTo(new Location(6, 9));
    assertThat(display.messageTexts(MessageLevel.ERROR)).containsExactly("Syntax error.");
    assertThat(display.liveHighlights()).extracting(RecordingDisplay.Drawn::kind)
        .containsExactlyInAnyOrder(HighlightKind.SENT, HighlightKind.ERROR, HighlightKind.ERROR_PART);
    assertThat(dispatcher.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should send a batch longer than the dispatcher queue as one task")
  void add_BatchLargerThanQueue_AllSentencesSent() throws Exception {
    start();
    final List<Sentence> batch = new ArrayList<>();
    for (int line = 1; line <= 150; line++) {
      batch.add(sentence(line, "Check " + line + "."));
    }

    stm.add(batch);
    awaitIdle();

    assertThat(prover.addCalls()).hasSize(150);
    assertThat(prover.callNames()).filteredOn("Goal"::equals).hasSize(1);
    assertThat(prover.callNames()).endsWith("Add", "Goal");
    final StateHistory history = stm.history().orElseThrow();
    assertThat(history.size()).isEqualTo(150);
    assertThat(history.tip().sentence()).isEqualTo(batch.get(149));
  }

  @Test
  @DisplayName("Should highlight the blamed part of a failed sentence at document positions")
  void add_FailureWithLocation_HighlightsSubRange() throws Exception {
    start();
    final Sentence s = new Sentence("Theorem a:\n  1 = 1.", new Mark(1, 1), new Mark(2, 9));
    prover.fail("Add", new ProtocolError(new Location(13, 18), StateId.of(1), "Bad."));

    stm.add(List.of(s));
    awaitIdle();

    final List<RecordingDisplay.Drawn> live = display.liveHighlights();
    assertThat(live).hasSize(2);
    assertThat(live.get(0).kind()).isEqualTo(HighlightKind.ERROR);
    assertThat(live.get(0).region()).isEqualTo(new Region(new Mark(1, 1), new Mark(2, 9)));
    assertThat(live.get(1).kind()).isEqualTo(HighlightKind.ERROR_PART);
    assertThat(live.get(1).region()).isEqualTo(new Region(new Mark(2, 3), new Mark(2, 8)));
  }

  @Test
  @DisplayName("Should clear the failed sentence when the next add runs")
  void add_AfterFailure_ReleasesFailedState() throws Exception {
    start();
    prover.fail("Add", new ProtocolError(null, StateId.of(1), "Nope."));
    stm.add(List.of(sentence(1, "Fail.")));
    awaitIdle();
    assertThat(stm.failedState()).isPresent();

    stm.add(List.of(sentence(1, "Proof.")));
    awaitIdle();

    assertThat(stm.failedState()).isEmpty();
    assertThat(display.liveHighlights()).extracting(RecordingDisplay.Drawn::kind)
        .containsExactly(HighlightKind.SENT);
  }

  @Test
  @DisplayName("Should show a non-empty add message as information")
  void add_ResultMessage_ShownAsInfo() throws Exception {
    start();
    prover.answer("Add", ScriptedConnection.added(2, "a is defined"));

    stm.add(List.of(sentence(1, "Definition a := 1.")));
    awaitIdle();

    assertThat(display.messageTexts(MessageLevel.INFO)).containsExactly("a is defined");
  }

  @Test
  @DisplayName("Should move the tip to the state named by a closed proof")
  void add_ClosedProof_TipJumpsToNextState() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof.")));
    awaitIdle();
    prover.answer("Add", ScriptedConnection.closedProof(4, 2));

    stm.add(List.of(sentence(3, "Qed.")));
    awaitIdle();

    final StateHistory history = stm.history().orElseThrow();
    assertThat(history.tip().id()).isEqualTo(StateId.of(2));
    assertThat(history.states()).extracting(State::id)
        .containsExactly(StateId.of(1), StateId.of(2), StateId.of(3), StateId.of(4));
  }

  @Test
  @DisplayName("Should refuse a whole batch while the tip carries an error")
  void add_TipHasError_NothingSent() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof.")));
    awaitIdle();
    prover.push(new Feedback(StateId.of(3), new FeedbackContent.ErrorMsg(new Location(0, 6), "Boom")));
    poll();
    final int callsBefore = prover.calls().size();

    stm.add(List.of(sentence(3, "exact I.")));
    awaitIdle();

    assertThat(prover.calls()).hasSize(callsBefore);
    assertThat(display.messageTexts(MessageLevel.ERROR)).containsExactly("Boom", Stm.FIX_ERROR_FIRST);
  }

  @Test
  @DisplayName("Should rewind to the last state ending before the cursor")
  void editAt_Mark_TruncatesAfterTarget() throws Exception {
    start();
    final Sentence s1 = sentence(1, "Lemma a : True.");
    stm.add(List.of(s1, sentence(2, "Proof."), sentence(3, "exact I.")));
    awaitIdle();

    stm.editAt(new Mark(2, 3));
    awaitIdle();

    final StateHistory history = stm.history().orElseThrow();
    assertThat(prover.callsOf(EditAtCall.class).get(0).stateId()).isEqualTo(StateId.of(2));
    assertThat(stm.tipStop()).isEqualTo(s1.stop());
    assertThat(history.states()).extracting(State::id).containsExactly(StateId.of(1), StateId.of(2));
    assertThat(history.endStop()).isEqualTo(s1.stop());
    assertThat(display.liveHighlights()).hasSize(1);
    assertThat(prover.callNames()).endsWith("Edit_at", "Goal");
  }

  @Test
  @DisplayName("Should keep the states after a reopened proof and drop the proof through its Qed")
  void editAt_FocusedProof_RemovesThroughQed() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof."), sentence(3, "exact I."),
        sentence(4, "Qed."), sentence(5, "Lemma b : True.")));
    awaitIdle();
    prover.answer("Edit_at", ScriptedConnection.focusedProof(2, 5, 6));

    stm.editAt(StateId.of(3));
    awaitIdle();

    final StateHistory history = stm.history().orElseThrow();
    assertThat(history.states()).extracting(State::id)
        .containsExactly(StateId.of(1), StateId.of(2), StateId.of(3), StateId.of(6));
    assertThat(history.tip().id()).isEqualTo(StateId.of(3));
    assertThat(history.endStop()).isEqualTo(sentence(5, "Lemma b : True.").stop());
  }

  @Test
  @DisplayName("Should truncate after the target when the reported Qed state is unknown")
  void editAt_FocusedProofQedNotLive_TruncatesAfterTarget() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof."), sentence(3, "exact I."),
        sentence(4, "Qed."), sentence(5, "Lemma b : True.")));
    awaitIdle();
    prover.answer("Edit_at", ScriptedConnection.focusedProof(2, 42, 6));

    stm.editAt(StateId.of(3));
    awaitIdle();

    final StateHistory history = stm.history().orElseThrow();
    assertThat(history.states()).extracting(State::id)
        .containsExactly(StateId.of(1), StateId.of(2), StateId.of(3));
    assertThat(history.tip().id()).isEqualTo(StateId.of(3));
    assertThat(display.liveHighlights()).hasSize(2);
  }

  @Test
  @DisplayName("Should truncate after the target when the reported Qed state comes before it")
  void editAt_FocusedProofQedBeforeTarget_TruncatesAfterTarget() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof."), sentence(3, "exact I."),
        sentence(4, "Qed."), sentence(5, "Lemma b : True.")));
    awaitIdle();
    prover.answer("Edit_at", ScriptedConnection.focusedProof(2, 3, 6));

    stm.editAt(StateId.of(5));
    awaitIdle();

    final StateHistory history = stm.history().orElseThrow();
    assertThat(history.states()).extracting(State::id)
        .containsExactly(StateId.of(1), StateId.of(2), StateId.of(3), StateId.of(4), StateId.of(5));
    assertThat(history.tip().id()).isEqualTo(StateId.of(5));
    assertThat(stm.phase()).isEqualTo(Stm.Phase.READY);
    assertThat(prover.callNames()).endsWith("Edit_at", "Goal");
  }

  @Test
  @DisplayName("Should insert new sentences before the states kept after a reopened proof")
  void add_AfterFocusedProof_InsertsAfterTip() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof."), sentence(3, "exact I."),
        sentence(4, "Qed."), sentence(5, "Lemma b : True.")));
    awaitIdle();
    prover.answer("Edit_at", ScriptedConnection.focusedProof(2, 5, 6));
    stm.editAt(StateId.of(3));
    awaitIdle();
    prover.answer("Add", ScriptedConnection.added(7, ""));
    prover.answer("Add", ScriptedConnection.closedProof(8, 6));

    stm.add(List.of(sentence(3, "exact I. "), sentence(4, "Qed. ")));
    awaitIdle();

    final StateHistory history = stm.history().orElseThrow();
    assertThat(history.states()).extracting(State::id)
        .containsExactly(StateId.of(1), StateId.of(2), StateId.of(3), StateId.of(7), StateId.of(8), StateId.of(6));
    assertThat(history.tip().id()).isEqualTo(StateId.of(6));
  }

  @Test
  @DisplayName("Should retry Edit_at at the state the prover suggests")
  void editAt_Refused_RetriesAtSuggestedState() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof."), sentence(3, "exact I.")));
    awaitIdle();
    prover.fail("Edit_at", new ProtocolError(null, StateId.of(2), "Cannot go there."));

    stm.editAt(StateId.of(3));
    awaitIdle();

    assertThat(prover.callsOf(EditAtCall.class)).extracting(EditAtCall::stateId)
        .containsExactly(StateId.of(3), StateId.of(2));
    assertThat(stm.history().orElseThrow().tip().id()).isEqualTo(StateId.of(2));
    assertThat(display.messageTexts(MessageLevel.ERROR)).isEmpty();
  }

  @Test
  @DisplayName("Should give up on Edit_at when the suggested state is not live")
  void editAt_SuggestionUnknown_ShowsError() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof.")));
    awaitIdle();
    prover.fail("Edit_at", new ProtocolError(null, StateId.of(42), "Cannot go there."));

    stm.editAt(StateId.of(2));
    awaitIdle();

    assertThat(prover.callsOf(EditAtCall.class)).hasSize(1);
    assertThat(stm.history().orElseThrow().size()).isEqualTo(2);
    assertThat(display.messageTexts(MessageLevel.ERROR)).containsExactly("Cannot go there.");
  }

  @Test
  @DisplayName("Should do nothing when stepping back from the root")
  void editAtPrev_AtRoot_NoCall() throws Exception {
    start();

    stm.editAtPrev();
    awaitIdle();

    assertThat(prover.callNames()).containsExactly("Init");
  }

  @Test
  @DisplayName("Should keep the axiom flag when processed arrives later")
  void feedback_ProcessedAfterAxiom_KeepsAxiom() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Axiom a : False.")));
    awaitIdle();

    prover.push(new Feedback(StateId.of(2), new FeedbackContent.AddedAxiom()));
    prover.push(new Feedback(StateId.of(2), new FeedbackContent.Processed()));
    poll();

    assertThat(stm.history().orElseThrow().get(StateId.of(2)).flag()).isEqualTo(Flag.AXIOM);
    assertThat(display.liveHighlights()).extracting(RecordingDisplay.Drawn::kind)
        .containsExactly(HighlightKind.AXIOM);
  }

  @Test
  @DisplayName("Should mark a sent state verified on processed")
  void feedback_Processed_MarksVerified() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Proof.")));
    awaitIdle();

    prover.push(new Feedback(StateId.of(2), new FeedbackContent.Processed()));
    poll();

    assertThat(stm.history().orElseThrow().get(StateId.of(2)).flag()).isEqualTo(Flag.VERIFIED);
    assertThat(unhandled).isEmpty();
  }

  @Test
  @DisplayName("Should truncate after a state reported as failed and make it the tip")
  void feedback_ErrorOnLiveState_Truncates() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True."), sentence(2, "Proof."), sentence(3, "exact I.")));
    awaitIdle();

    prover.push(new Feedback(StateId.of(3), new FeedbackContent.Message(MessageLevel.ERROR, null, "Oops")));
    poll();

    final StateHistory history = stm.history().orElseThrow();
    assertThat(history.tip().id()).isEqualTo(StateId.of(3));
    assertThat(history.tip().flag()).isEqualTo(Flag.ERROR);
    assertThat(history.contains(StateId.of(4))).isFalse();
    assertThat(display.messageTexts(MessageLevel.ERROR)).containsExactly("Oops");
  }

  @Test
  @DisplayName("Should show messages for unknown states and pass other feedback down the chain")
  void feedback_NotForLiveState_Forwarded() throws Exception {
    start();

    prover.push(new Feedback(StateId.of(7), new FeedbackContent.ErrorMsg(new Location(0, 1), "Stale")));
    prover.push(new Feedback(StateId.of(7), new FeedbackContent.Message(MessageLevel.WARNING, null, "Careful")));
    prover.push(new Feedback(StateId.of(7), new FeedbackContent.Processed()));
    prover.push(new Feedback(StateId.of(1), new FeedbackContent.FileLoaded("Coq.Init", "Init.vo")));
    poll();

    assertThat(display.messages()).extracting(m -> m.level() + ":" + m.text())
        .containsExactly("ERROR:Stale", "WARNING:Careful");
    assertThat(unhandled).extracting(Feedback::kind)
        .containsExactly(FeedbackContent.Kind.PROCESSED, FeedbackContent.Kind.FILE_LOADED);
  }

  @Test
  @DisplayName("Should drop everything and report a lost connection once when the prover quits mid-batch")
  void add_ProverQuits_ConnectionLostOnce() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Lemma a : True.")));
    awaitIdle();
    prover.quitOn("Add");

    stm.add(List.of(sentence(2, "Proof."), sentence(3, "exact I.")));
    awaitIdle();

    assertThat(prover.addCalls()).extracting(AddCall::command).containsExactly("Lemma a : True.", "Proof.");
    assertThat(display.connectionLostCount()).isEqualTo(1);
    assertThat(stm.phase()).isEqualTo(Stm.Phase.LOST);
    assertThat(stm.history().orElseThrow().size()).isZero();
    assertThat(stm.tipStop()).isEqualTo(Mark.ORIGIN);
    assertThat(dispatcher.pendingCount()).isZero();
    assertThat(display.liveHighlights()).isEmpty();

    stm.add(List.of(sentence(2, "Proof.")));
    awaitIdle();
    assertThat(display.connectionLostCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should treat an undecodable answer as a lost connection")
  void add_DecodeError_ConnectionLost() throws Exception {
    start();
    prover.script("Add", call -> {
      throw new XmlDecodeException("Unrecognized tag <weird>");
    });

    stm.add(List.of(sentence(1, "Proof.")));
    awaitIdle();

    assertThat(stm.phase()).isEqualTo(Stm.Phase.LOST);
    assertThat(display.connectionLostCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should not report a lost connection while closing")
  void close_ProverQuits_NoConnectionLost() throws Exception {
    start();
    stm.add(List.of(sentence(1, "Proof.")));
    awaitIdle();

    stm.markClosing();
    prover.quit();
    stm.close();

    assertThat(display.connectionLostCount()).isZero();
    assertThat(display.liveHighlights()).isEmpty();
    assertThat(stm.phase()).isEqualTo(Stm.Phase.CLOSED);
  }

  @Test
  @DisplayName("Should refuse commands after a failed init")
  void init_Refused_FailedPhase() throws Exception {
    prover.fail("Init", new ProtocolError(null, StateId.NONE, "No prelude."));

    stm.init();
    awaitIdle();
    stm.add(List.of(sentence(1, "Proof.")));
    awaitIdle();

    assertThat(stm.phase()).isEqualTo(Stm.Phase.FAILED);
    assertThat(prover.callNames()).containsExactly("Init");
    assertThat(display.messageTexts(MessageLevel.ERROR)).containsExactly("No prelude.");
  }

  @Test
  @DisplayName("Should reject commands before init and a second init")
  void commands_OutOfOrder_Rejected() {
    assertThatThrownBy(() -> stm.add(List.of(sentence(1, "Proof."))))
        .isInstanceOf(IllegalStateException.class);
    stm.init();
    assertThatThrownBy(stm::init).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should show the goals returned after each command")
  void goal_Answer_ShownOnDisplay() throws Exception {
    start();

    stm.add(List.of(sentence(1, "Proof.")));
    awaitIdle();

    assertThat(display.goals()).containsExactly((Goals) null);
    assertThat(prover.callNames()).endsWith("Goal");
  }

  private void start() throws InterruptedException {
    stm.init();
    awaitIdle();
  }

  private void poll() throws InterruptedException {
    dispatcher.schedule("poll", stm::pollFeedback);
    awaitIdle();
  }

  private void awaitIdle() throws InterruptedException {
    assertThat(dispatcher.awaitIdle(WAIT)).isTrue();
  }

  /** One sentence per line, starting at column 1. */
  private static Sentence sentence(final int line, final String text) {
    return new Sentence(text, new Mark(line, 1), new Mark(line, text.length() + 1));
  }
}
