package com.consullo.prover.display;

/**
 * Decoration applied to a region of the document.
 *
 * @since 1.0
 */
public enum HighlightKind {
  /** Sent to the prover, not yet checked. */
  SENT,
  /** Accepted as an axiom; unsafe. */
  AXIOM,
  /** Checked by the prover. */
  VERIFIED,
  /** Whole sentence that failed. */
  ERROR,
  /** Exact sub-range the prover blamed inside a failed sentence. */
  ERROR_PART
}
