package com.consullo.prover.process;

import com.consullo.prover.protocol.CallResult;
import com.consullo.prover.protocol.Feedback;
import com.consullo.prover.protocol.ProverCall;
import java.util.List;

/**
 * Typed request/response access to a running prover.
 *
 * @since 1.0
 */
public interface ProverConnection {

  /**
   * Sends a call and blocks until its answer arrives.
   *
   * @param call the request
   * @param <R> answer type
   * @return good value or protocol error
   * @throws ProverQuitException if the prover quits before answering
   * @throws InterruptedException if the waiting thread is interrupted
   * @throws com.consullo.prover.protocol.XmlDecodeException if the answer is malformed
   */
  <R> CallResult<R> call(ProverCall<R> call) throws ProverQuitException, InterruptedException;

  /**
   * Returns the feedback received since the last drain, in arrival order. Non-blocking.
   *
   * @return decoded feedback
   */
  List<Feedback> drainFeedbacks();
}
