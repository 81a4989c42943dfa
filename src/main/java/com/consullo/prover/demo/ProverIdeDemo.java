package com.consullo.prover.demo;

import com.consullo.prover.core.Goal;
import com.consullo.prover.core.Goals;
import com.consullo.prover.core.MessageLevel;
import com.consullo.prover.display.DisplaySink;
import com.consullo.prover.display.HighlightHandle;
import com.consullo.prover.display.HighlightKind;
import com.consullo.prover.display.Region;
import com.consullo.prover.driver.ProverSession;
import com.consullo.prover.driver.ProverSessionFactory;
import com.consullo.prover.stm.State;
import com.consullo.prover.text.StringTextDocument;
import com.consullo.prover.text.TextDocument;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that steps through a proof script with a real prover and prints what an editor
 * would display.
 *
 * <p>Usage: {@code ProverIdeDemo file.v}. Set {@code COQTOP} to pick the prover executable.
 *
 * @since 1.0
 */
public final class ProverIdeDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProverIdeDemo.class);

  private static final Duration STEP_TIMEOUT = Duration.ofSeconds(30);

  private ProverIdeDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args the script to check
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    if (args.length != 1) {
      System.err.println("usage: ProverIdeDemo <file.v>");
      System.exit(2);
    }
    final Path script = Path.of(args[0]).toAbsolutePath().normalize();
    final TextDocument document = new StringTextDocument(Files.readString(script, StandardCharsets.UTF_8));

    try (ProverSession session = ProverSessionFactory.openSession(
        script.getFileName().toString(), script.getParent(), new ConsoleDisplay())) {
      session.focus();
      session.setActive();
      if (!session.awaitIdle(STEP_TIMEOUT)) {
        LOGGER.error("Prover did not answer Init within {}", STEP_TIMEOUT);
        return;
      }
      int steps = 0;
      while (session.forwardOne(document)) {
        if (!session.awaitIdle(STEP_TIMEOUT)) {
          LOGGER.error("Prover did not answer within {}", STEP_TIMEOUT);
          return;
        }
        steps++;
        if (session.stm().history().map(h -> h.tip().hasError()).orElse(true)
            || session.stm().failedState().isPresent()) {
          break;
        }
      }
      System.out.println("=== Checked " + steps + " sentences, tip at " + session.tipStop() + " ===");
      session.stm().history().ifPresent(h -> {
        for (State state : h.states()) {
          System.out.println(state);
        }
      });
      LOGGER.info("Demo completed");
    }
  }

  private static final class ConsoleDisplay implements DisplaySink {

    @Override
    public void showGoals(final Goals goals) {
      if (goals == null) {
        System.out.println("[goals] not in proof mode");
        return;
      }
      System.out.println("[goals] " + goals.foreground().size() + " focused");
      for (Goal goal : goals.foreground()) {
        for (String hypothesis : goal.hypotheses()) {
          System.out.println("  " + hypothesis);
        }
        System.out.println("  ============================");
        System.out.println("  " + goal.conclusion());
      }
    }

    @Override
    public void showMessage(final MessageLevel level, final String text) {
      System.out.println("[" + level.wireName() + "] " + text);
    }

    @Override
    public HighlightHandle highlight(final Region region, final HighlightKind kind) {
      LOGGER.debug("highlight {} {}..{}", kind, region.start(), region.stop());
      return () -> LOGGER.debug("unhighlight {} {}..{}", kind, region.start(), region.stop());
    }

    @Override
    public void connectionLost() {
      System.out.println("[prover] connection lost");
    }
  }
}
