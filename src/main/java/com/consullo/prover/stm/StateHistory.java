package com.consullo.prover.stm;

import com.consullo.prover.core.Mark;
import com.consullo.prover.core.Sentence;
import com.consullo.prover.core.StateId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Ordered sequence of live states rooted at the initial state.
 *
 * <p>States are kept in an arena indexed by id with explicit previous/next links, so removing the
 * states after or between two ids is a walk over the links. The tip is tracked separately because
 * it does not always sit at the end: a closed proof moves it forward to a state the prover names,
 * and a reopened proof moves it back before preserved states.
 *
 * <p>Mutated only by the dispatcher thread; methods synchronize so editor threads can read tip
 * and end positions.
 *
 * @since 1.0
 */
public final class StateHistory {

  private static final class Node {
    private final State state;
    private StateId prev;
    private StateId next;

    Node(final State state) {
      this.state = state;
    }
  }

  private final Map<StateId, Node> nodes = new HashMap<>();
  private final Map<Sentence, StateId> bySentence = new HashMap<>();
  private final State root;
  private StateId last;
  private StateId tip;

  StateHistory(final State root) {
    Validate.notNull(root, "root must not be null");
    Validate.isTrue(root.isRoot(), "root state must not carry a sentence");
    this.root = root;
    nodes.put(root.id(), new Node(root));
    this.last = root.id();
    this.tip = root.id();
  }

  public State root() {
    return root;
  }

  public synchronized State tip() {
    return nodes.get(tip).state;
  }

  synchronized void setTip(final StateId id) {
    Validate.isTrue(nodes.containsKey(id), "state %s is not live", id);
    tip = id;
  }

  public synchronized boolean contains(final StateId id) {
    return nodes.containsKey(id);
  }

  public synchronized boolean contains(final Sentence sentence) {
    return bySentence.containsKey(sentence);
  }

  /**
   * Looks up a live state.
   *
   * @param id state id
   * @return the state, or {@code null} if it is not live
   */
  public synchronized State get(final StateId id) {
    final Node node = nodes.get(id);
    return node == null ? null : node.state;
  }

  /**
   * The live state before the given one.
   *
   * @param id live state id
   * @return previous state, {@code null} for the root
   */
  public synchronized State previous(final StateId id) {
    final Node node = node(id);
    return node.prev == null ? null : nodes.get(node.prev).state;
  }

  /** Number of live states, not counting the root. */
  public synchronized int size() {
    return nodes.size() - 1;
  }

  /** Live states in document order, root first. */
  public synchronized List<State> states() {
    final List<State> out = new ArrayList<>(nodes.size());
    for (StateId id = root.id(); id != null; id = nodes.get(id).next) {
      out.add(nodes.get(id).state);
    }
    return out;
  }

  /**
   * Links a new state right after {@code anchor}.
   *
   * @param anchor live state to insert after
   * @param state new state
   * @throws IllegalArgumentException if the id or sentence is already live
   */
  synchronized void insertAfter(final StateId anchor, final State state) {
    Validate.notNull(state, "state must not be null");
    Validate.isTrue(!state.isRoot(), "cannot insert a second root");
    Validate.isTrue(!nodes.containsKey(state.id()), "state %s is already live", state.id());
    Validate.isTrue(!bySentence.containsKey(state.sentence()), "sentence at %s is already live",
        state.sentence().start());
    final Node before = node(anchor);
    final Node node = new Node(state);
    node.prev = anchor;
    node.next = before.next;
    if (before.next != null) {
      nodes.get(before.next).prev = state.id();
    } else {
      last = state.id();
    }
    before.next = state.id();
    nodes.put(state.id(), node);
    bySentence.put(state.sentence(), state.id());
  }

  /**
   * Unlinks every state strictly after {@code id}.
   *
   * @param id live state id
   * @return removed states in document order
   */
  synchronized List<State> removeAfter(final StateId id) {
    final Node from = node(id);
    final List<State> removed = unlinkChain(from.next, null);
    from.next = null;
    last = id;
    fixTip(id);
    return removed;
  }

  /**
   * Unlinks the states strictly after {@code from} up to and including {@code through}. States
   * after {@code through} stay linked.
   *
   * @param from live state id kept in place
   * @param through live state id after {@code from}, removed with the ones before it
   * @return removed states in document order
   */
  synchronized List<State> removeBetween(final StateId from, final StateId through) {
    final Node start = node(from);
    final Node end = node(through);
    Validate.isTrue(isAfter(through, from), "state %s does not follow %s", through, from);
    final StateId resume = end.next;
    final List<State> removed = unlinkChain(start.next, resume);
    start.next = resume;
    if (resume != null) {
      nodes.get(resume).prev = from;
    } else {
      last = from;
    }
    fixTip(from);
    return removed;
  }

  /**
   * Unlinks every state but the root.
   *
   * @return removed states in document order
   */
  synchronized List<State> clear() {
    return removeAfter(root.id());
  }

  /**
   * The latest state whose sentence ends at or before {@code mark}.
   *
   * @param mark document position
   * @return that state, or the root if no sentence ends there
   */
  public synchronized State findLastAtOrBefore(final Mark mark) {
    State found = root;
    for (StateId id = nodes.get(root.id()).next; id != null; id = nodes.get(id).next) {
      final State state = nodes.get(id).state;
      if (state.stop().isAfter(mark)) {
        break;
      }
      found = state;
    }
    return found;
  }

  /** Stop of the tip's sentence; the origin when only the root is live. */
  public synchronized Mark tipStop() {
    return nodes.get(tip).state.stop();
  }

  /** Largest stop among live sentences; the origin when only the root is live. */
  public synchronized Mark endStop() {
    Mark end = Mark.ORIGIN;
    for (Node node : nodes.values()) {
      if (node.state.stop().isAfter(end)) {
        end = node.state.stop();
      }
    }
    return end;
  }

  /**
   * Whether {@code candidate} is linked somewhere after {@code from}.
   *
   * @param candidate state id to look for
   * @param from live state id where the walk starts
   * @return false if {@code candidate} is not live or precedes {@code from}
   */
  synchronized boolean isAfter(final StateId candidate, final StateId from) {
    for (StateId id = nodes.get(from).next; id != null; id = nodes.get(id).next) {
      if (id.equals(candidate)) {
        return true;
      }
    }
    return false;
  }

  private List<State> unlinkChain(final StateId first, final StateId stopAt) {
    final List<State> removed = new ArrayList<>();
    StateId id = first;
    while (id != null && !id.equals(stopAt)) {
      final Node node = nodes.remove(id);
      bySentence.remove(node.state.sentence());
      removed.add(node.state);
      id = node.next;
    }
    return removed;
  }

  private void fixTip(final StateId fallback) {
    if (!nodes.containsKey(tip)) {
      tip = fallback;
    }
  }

  private Node node(final StateId id) {
    final Node node = nodes.get(id);
    Validate.isTrue(node != null, "state %s is not live", id);
    return node;
  }

  @Override
  public synchronized String toString() {
    return "StateHistory[tip=" + tip.value() + ", last=" + last.value() + ", states=" + states() + "]";
  }
}
