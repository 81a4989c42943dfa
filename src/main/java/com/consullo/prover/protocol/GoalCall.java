package com.consullo.prover.protocol;

import com.consullo.prover.core.Goals;
import java.util.Optional;

/**
 * Fetches the goals at the current tip.
 *
 * @since 1.0
 */
public record GoalCall() implements ProverCall<Optional<Goals>> {

  @Override
  public String name() {
    return "Goal";
  }

  @Override
  public Object argument() {
    return Unit.INSTANCE;
  }

  @Override
  public Optional<Goals> interpret(final Object payload) {
    final Optional<?> option = Payloads.as(payload, Optional.class, "Goal");
    return option.map(goals -> Payloads.as(goals, Goals.class, "Goal goals"));
  }
}
