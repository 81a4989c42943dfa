package com.consullo.prover.core;

import java.util.List;

/**
 * One proof obligation.
 *
 * @param id prover-side goal name
 * @param hypotheses rendered hypotheses, in context order
 * @param conclusion rendered conclusion
 * @since 1.0
 */
public record Goal(String id, List<String> hypotheses, String conclusion) {

  public Goal {
    hypotheses = List.copyOf(hypotheses);
  }
}
