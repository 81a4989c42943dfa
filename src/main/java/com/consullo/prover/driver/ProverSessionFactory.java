package com.consullo.prover.driver;

import com.consullo.prover.display.DisplaySink;
import com.consullo.prover.process.ProverChannel;
import com.consullo.prover.process.ProverClient;
import com.consullo.prover.process.ProverProcessConfig;
import com.consullo.prover.protocol.XmlProtocol;
import com.consullo.prover.stm.FeedbackHandler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Factory for prover sessions with sensible defaults.
 *
 * <p>Centralizes:
 * <ul>
 * <li>the prover command line ({@code coqtop} in IDE mode, overridable through {@code COQTOP})</li>
 * <li>pipe encoding and shutdown timeout</li>
 * <li>working directory defaults</li>
 * </ul>
 *
 * @since 1.0
 */
public final class ProverSessionFactory {

  /** Environment variable naming the prover executable. */
  public static final String PROVER_ENV = "COQTOP";

  static final String DEFAULT_EXECUTABLE = "coqtop";

  static final List<String> IDE_ARGUMENTS =
      List.of("-ideslave", "-main-channel", "stdfds", "-async-proofs", "on");

  static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private ProverSessionFactory() {
  }

  /**
   * Builds the default process configuration.
   *
   * @param workingDirectory working dir (if null, uses current directory)
   * @param environment environment to read {@code COQTOP} from
   * @return process configuration
   */
  public static ProverProcessConfig defaultProcessConfig(final Path workingDirectory,
      final Map<String, String> environment) {
    final String executable = StringUtils.defaultIfBlank(
        environment == null ? null : environment.get(PROVER_ENV), DEFAULT_EXECUTABLE);
    final List<String> command = new ArrayList<>();
    command.add(executable);
    command.addAll(IDE_ARGUMENTS);
    final Path workDir = workingDirectory != null
        ? workingDirectory
        : Path.of(".").toAbsolutePath().normalize();
    return new ProverProcessConfig(command, workDir, null, StandardCharsets.UTF_8, SHUTDOWN_TIMEOUT);
  }

  /**
   * Starts a prover with the default configuration and opens a session on it.
   *
   * @param documentId document id
   * @param workingDirectory working dir (if null, uses current directory)
   * @param display the editor's display
   * @return session, Init already scheduled
   * @throws IOException if the prover cannot be started
   */
  public static ProverSession openSession(final String documentId, final Path workingDirectory,
      final DisplaySink display) throws IOException {
    return openSession(documentId, defaultProcessConfig(workingDirectory, System.getenv()),
        SessionConfig.DEFAULT, display, FeedbackHandler.NONE, new ProverChannel(documentId));
  }

  /**
   * Starts a prover on the given channel and opens a session on it.
   *
   * @param documentId document id
   * @param processConfig process configuration
   * @param sessionConfig session tuning
   * @param display the editor's display
   * @param fallback handler for feedback the state machine does not consume
   * @param channel unspawned channel
   * @return session, Init already scheduled
   * @throws IOException if the prover cannot be started
   */
  public static ProverSession openSession(final String documentId, final ProverProcessConfig processConfig,
      final SessionConfig sessionConfig, final DisplaySink display, final FeedbackHandler fallback,
      final ProverChannel channel) throws IOException {
    Validate.notNull(channel, "channel must not be null");
    channel.spawn(processConfig);
    try {
      final ProverClient client = new ProverClient(channel, new XmlProtocol());
      return new ProverSession(documentId, client, channel, sessionConfig, display, fallback);
    } catch (final RuntimeException e) {
      channel.close();
      throw e;
    }
  }
}
