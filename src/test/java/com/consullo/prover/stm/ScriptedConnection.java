package com.consullo.prover.stm;

import com.consullo.prover.core.StateId;
import com.consullo.prover.process.ProverConnection;
import com.consullo.prover.process.ProverQuitException;
import com.consullo.prover.protocol.AddCall;
import com.consullo.prover.protocol.CallResult;
import com.consullo.prover.protocol.Feedback;
import com.consullo.prover.protocol.ProtocolError;
import com.consullo.prover.protocol.ProverCall;
import com.consullo.prover.protocol.Union;
import com.consullo.prover.protocol.Unit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.tuple.Pair;

/**
 * In-memory prover for state machine tests.
 *
 * <p>Unscripted calls get default answers: Init returns state 1, each Add returns the next state
 * id, Edit_at reports no focus change and Goal returns no goals. Scripted answers are consumed
 * first, per call name.
 *
 * <p>Answers are decoded payloads as the codec produces them, interpreted by the call itself, or a
 * {@link ProtocolError} for a failed call.
 */
public final class ScriptedConnection implements ProverConnection {

  /**
   * A scripted answer: the payload of a good answer, or a {@link ProtocolError}.
   */
  @FunctionalInterface
  public interface Answer {
    Object answer(ProverCall<?> call) throws ProverQuitException;
  }

  private final List<ProverCall<?>> calls = new ArrayList<>();
  private final Map<String, Deque<Answer>> scripted = new HashMap<>();
  private final Deque<Feedback> feedbacks = new ArrayDeque<>();
  private int nextStateId = 2;
  private boolean quit;

  public synchronized ScriptedConnection script(final String callName, final Answer answer) {
    scripted.computeIfAbsent(callName, k -> new ArrayDeque<>()).add(answer);
    return this;
  }

  public ScriptedConnection answer(final String callName, final Object payload) {
    return script(callName, call -> payload);
  }

  public ScriptedConnection fail(final String callName, final ProtocolError error) {
    return answer(callName, error);
  }

  /** Add payload for a new state that closes no proof. */
  public static Object added(final int stateId, final String message) {
    return Pair.of(StateId.of(stateId), Pair.of(Union.left(Unit.INSTANCE), message));
  }

  /** Add payload for a new state that closes a proof, resuming at {@code nextStateId}. */
  public static Object closedProof(final int stateId, final int nextStateId) {
    return Pair.of(StateId.of(stateId), Pair.of(Union.right(StateId.of(nextStateId)), ""));
  }

  /** Edit_at payload for a target inside a focused proof. */
  public static Object focusedProof(final int proofStateId, final int qedStateId, final int oldFocusedStateId) {
    return Union.right(Pair.of(StateId.of(proofStateId),
        Pair.of(StateId.of(qedStateId), StateId.of(oldFocusedStateId))));
  }

  public ScriptedConnection quitOn(final String callName) {
    return script(callName, call -> {
      quit();
      throw new ProverQuitException("prover quit");
    });
  }

  /** Every later call fails as if the process had exited. */
  public synchronized void quit() {
    quit = true;
  }

  public synchronized void push(final Feedback feedback) {
    feedbacks.add(feedback);
  }

  public synchronized List<ProverCall<?>> calls() {
    return new ArrayList<>(calls);
  }

  public synchronized List<String> callNames() {
    final List<String> out = new ArrayList<>();
    for (ProverCall<?> call : calls) {
      out.add(call.name());
    }
    return out;
  }

  public synchronized List<AddCall> addCalls() {
    final List<AddCall> out = new ArrayList<>();
    for (ProverCall<?> call : calls) {
      if (call instanceof AddCall add) {
        out.add(add);
      }
    }
    return out;
  }

  public synchronized <T extends ProverCall<?>> List<T> callsOf(final Class<T> type) {
    final List<T> out = new ArrayList<>();
    for (ProverCall<?> call : calls) {
      if (type.isInstance(call)) {
        out.add(type.cast(call));
      }
    }
    return out;
  }

  @Override
  public <R> CallResult<R> call(final ProverCall<R> call) throws ProverQuitException {
    final Answer answer;
    synchronized (this) {
      if (quit) {
        throw new ProverQuitException("prover has quit");
      }
      calls.add(call);
      final Deque<Answer> queue = scripted.get(call.name());
      answer = queue == null || queue.isEmpty() ? null : queue.poll();
    }
    final Object payload = answer != null ? answer.answer(call) : defaultPayload(call);
    if (payload instanceof ProtocolError error) {
      return CallResult.fail(error);
    }
    return CallResult.good(call.interpret(payload));
  }

  @Override
  public synchronized List<Feedback> drainFeedbacks() {
    final List<Feedback> out = new ArrayList<>(feedbacks);
    feedbacks.clear();
    return out;
  }

  private synchronized Object defaultPayload(final ProverCall<?> call) {
    switch (call.name()) {
      case "Init":
        return StateId.of(1);
      case "Add":
        return added(nextStateId++, "");
      case "Edit_at":
        return Union.left(Unit.INSTANCE);
      case "Goal":
        return Optional.empty();
      default:
        throw new IllegalArgumentException("unexpected call " + call.name());
    }
  }
}
