package com.consullo.prover.core;

import java.util.List;
import org.apache.commons.lang3.tuple.Pair;

/**
 * The proof obligations displayed for the current tip.
 *
 * @param foreground focused goals
 * @param background unfocused goals, as a stack of (before, after) lists
 * @param shelved shelved goals
 * @param abandoned given-up goals
 * @since 1.0
 */
public record Goals(
    List<Goal> foreground,
    List<Pair<List<Goal>, List<Goal>>> background,
    List<Goal> shelved,
    List<Goal> abandoned) {

  public Goals {
    foreground = List.copyOf(foreground);
    background = List.copyOf(background);
    shelved = List.copyOf(shelved);
    abandoned = List.copyOf(abandoned);
  }

  public static Goals empty() {
    return new Goals(List.of(), List.of(), List.of(), List.of());
  }

  public boolean isComplete() {
    if (!foreground.isEmpty()) {
      return false;
    }
    for (Pair<List<Goal>, List<Goal>> level : background) {
      if (!level.getLeft().isEmpty() || !level.getRight().isEmpty()) {
        return false;
      }
    }
    return true;
  }
}
