package com.consullo.prover.stm;

import com.consullo.prover.core.Mark;
import com.consullo.prover.core.Sentence;
import com.consullo.prover.core.StateId;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the linked state arena.
 *
 * @since 1.0
 */
public class StateHistoryTest {

  private StateHistory history;

  @BeforeEach
  void setUp() {
    history = new StateHistory(State.root(StateId.of(1)));
  }

  @Test
  @DisplayName("Should report the origin as tip and end stop when only the root is live")
  void emptyHistory_StopsAreOrigin() {
    assertThat(history.tipStop()).isEqualTo(Mark.ORIGIN);
    assertThat(history.endStop()).isEqualTo(Mark.ORIGIN);
    assertThat(history.size()).isZero();
    assertThat(history.findLastAtOrBefore(new Mark(9, 9))).isSameAs(history.root());
  }

  @Test
  @DisplayName("Should keep document order when inserting after the tip")
  void insertAfter_Tip_AppendsInOrder() {
    append(2, 1);
    append(3, 2);

    assertThat(ids(history.states())).containsExactly(1, 2, 3);
    assertThat(history.previous(StateId.of(3)).id()).isEqualTo(StateId.of(2));
    assertThat(history.previous(StateId.of(1))).isNull();
    assertThat(history.tipStop()).isEqualTo(new Mark(2, 6));
  }

  @Test
  @DisplayName("Should insert in the middle and keep later states linked")
  void insertAfter_Middle_RelinksNeighbours() {
    append(2, 1);
    append(3, 3);
    history.setTip(StateId.of(2));

    final State middle = new State(StateId.of(4), line(2));
    history.insertAfter(StateId.of(2), middle);

    assertThat(ids(history.states())).containsExactly(1, 2, 4, 3);
    assertThat(history.previous(StateId.of(3)).id()).isEqualTo(StateId.of(4));
    assertThat(history.endStop()).isEqualTo(new Mark(3, 6));
  }

  @Test
  @DisplayName("Should reject duplicate ids and duplicate sentences")
  void insertAfter_Duplicate_Rejected() {
    append(2, 1);

    assertThatThrownBy(() -> history.insertAfter(StateId.of(2), new State(StateId.of(2), line(2))))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> history.insertAfter(StateId.of(2), new State(StateId.of(5), line(1))))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(history.contains(line(1))).isTrue();
  }

  @Test
  @DisplayName("Should remove every state after the target and move the tip back")
  void removeAfter_Target_TruncatesTail() {
    append(2, 1);
    append(3, 2);
    append(4, 3);

    final List<State> removed = history.removeAfter(StateId.of(2));

    assertThat(ids(removed)).containsExactly(3, 4);
    assertThat(ids(history.states())).containsExactly(1, 2);
    assertThat(history.tip().id()).isEqualTo(StateId.of(2));
    assertThat(history.contains(line(3))).isFalse();
  }

  @Test
  @DisplayName("Should remove the states between two ids, inclusive of the second")
  void removeBetween_KeepsStatesAfterEnd() {
    append(2, 1);
    append(3, 2);
    append(4, 3);
    append(5, 4);

    final List<State> removed = history.removeBetween(StateId.of(2), StateId.of(4));

    assertThat(ids(removed)).containsExactly(3, 4);
    assertThat(ids(history.states())).containsExactly(1, 2, 5);
    assertThat(history.previous(StateId.of(5)).id()).isEqualTo(StateId.of(2));
  }

  @Test
  @DisplayName("Should refuse to remove between states in the wrong order")
  void removeBetween_WrongOrder_Rejected() {
    append(2, 1);
    append(3, 2);

    assertThatThrownBy(() -> history.removeBetween(StateId.of(3), StateId.of(2)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should tell whether a state is linked after another")
  void isAfter_Order_FollowsLinks() {
    append(2, 1);
    append(3, 2);

    assertThat(history.isAfter(StateId.of(3), StateId.of(1))).isTrue();
    assertThat(history.isAfter(StateId.of(2), StateId.of(3))).isFalse();
    assertThat(history.isAfter(StateId.of(2), StateId.of(2))).isFalse();
    assertThat(history.isAfter(StateId.of(42), StateId.of(1))).isFalse();
  }

  @Test
  @DisplayName("Should find the latest state ending at or before a mark")
  void findLastAtOrBefore_Mark_PicksCoveringState() {
    append(2, 1);
    append(3, 2);

    assertThat(history.findLastAtOrBefore(new Mark(2, 6)).id()).isEqualTo(StateId.of(3));
    assertThat(history.findLastAtOrBefore(new Mark(2, 5)).id()).isEqualTo(StateId.of(2));
    assertThat(history.findLastAtOrBefore(new Mark(1, 1)).isRoot()).isTrue();
  }

  @Test
  @DisplayName("Should unlink everything but the root on clear")
  void clear_LeavesRoot() {
    append(2, 1);
    append(3, 2);

    assertThat(ids(history.clear())).containsExactly(2, 3);
    assertThat(history.tip().isRoot()).isTrue();
    assertThat(history.size()).isZero();
  }

  private void append(final int id, final int line) {
    final State state = new State(StateId.of(id), line(line));
    history.insertAfter(history.tip().id(), state);
    history.setTip(state.id());
  }

  /** "Stmt." on the given line, columns 1 to 6. */
  private static Sentence line(final int line) {
    return new Sentence("Stmt.", new Mark(line, 1), new Mark(line, 6));
  }

  private static List<Integer> ids(final List<State> states) {
    final List<Integer> out = new ArrayList<>(states.size());
    for (State state : states) {
      out.add(state.id().value());
    }
    return out;
  }
}
