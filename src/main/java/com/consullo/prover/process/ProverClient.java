package com.consullo.prover.process;

import com.consullo.prover.protocol.CallResult;
import com.consullo.prover.protocol.Feedback;
import com.consullo.prover.protocol.ProverCall;
import com.consullo.prover.protocol.XmlDecodeException;
import com.consullo.prover.protocol.XmlProtocol;
import com.consullo.prover.protocol.XmlSupport;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * {@link ProverConnection} over a {@link ProverChannel}.
 *
 * @since 1.0
 */
public final class ProverClient implements ProverConnection {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProverClient.class);

  private final ProverChannel channel;
  private final XmlProtocol protocol;

  public ProverClient(final ProverChannel channel, final XmlProtocol protocol) {
    Validate.notNull(channel, "channel must not be null");
    Validate.notNull(protocol, "protocol must not be null");
    this.channel = channel;
    this.protocol = protocol;
  }

  @Override
  public <R> CallResult<R> call(final ProverCall<R> call) throws ProverQuitException, InterruptedException {
    Validate.notNull(call, "call must not be null");
    final Element answer;
    try {
      answer = channel.call(protocol.toXml(call)).get();
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof ProverQuitException quit) {
        throw quit;
      }
      throw new ProverQuitException(call.name() + " failed", e.getCause());
    }
    LOGGER.debug("{} answered: {}", call.name(), XmlSupport.toString(answer));
    return protocol.fromXml(call, answer);
  }

  @Override
  public List<Feedback> drainFeedbacks() {
    final List<Element> raw = channel.drainFeedbacks();
    final List<Feedback> out = new ArrayList<>(raw.size());
    for (Element element : raw) {
      try {
        out.add(protocol.feedbackFromXml(element));
      } catch (final XmlDecodeException e) {
        LOGGER.error("Dropping malformed feedback {}", XmlSupport.toString(element), e);
      }
    }
    return out;
  }
}
