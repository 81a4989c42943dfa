package com.consullo.prover.process;

import com.consullo.prover.protocol.XmlSupport;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Owns one prover subprocess and exchanges framed XML messages over its pipes.
 *
 * <p>Threads:
 * <ul>
 * <li>callers write requests through {@link #call(Element)}, one message at a time</li>
 * <li>a reader thread parses the inbound stream; {@code value} elements resolve the oldest pending
 * call, {@code feedback} elements are queued for {@link #drainFeedbacks()}</li>
 * </ul>
 *
 * <p>Once the inbound stream ends or the outbound pipe breaks the channel is closed for good: pending
 * and later calls fail with {@link ProverQuitException}.
 *
 * @since 1.0
 */
public final class ProverChannel implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProverChannel.class);

  /**
   * Starts the subprocess. Tests substitute in-memory pipes.
   */
  @FunctionalInterface
  public interface Launcher {
    ProverProcessController launch(ProverProcessConfig config) throws Exception;
  }

  private final String name;
  private final Launcher launcher;

  private final Object lock = new Object();
  private final Object writeLock = new Object();
  private final Map<Long, CompletableFuture<Element>> pendingCalls = new LinkedHashMap<>();
  private final AtomicLong requestSequence = new AtomicLong();
  private final Queue<Element> feedbacks = new ConcurrentLinkedQueue<>();

  private ProverProcessController controller;
  private ProverProcessConfig config;
  private OutputStream processInput;
  private InputStream processOutput;
  private Thread readerThread;
  private volatile boolean closed;

  public ProverChannel(final String name) {
    this(name, ProverProcessControllerJdk::new);
  }

  public ProverChannel(final String name, final Launcher launcher) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(launcher, "launcher must not be null");
    this.name = name;
    this.launcher = launcher;
  }

  /**
   * Starts the child process and the inbound reader.
   *
   * @param config process configuration
   * @throws IOException if the process cannot be started
   * @throws IllegalStateException if already spawned
   */
  public void spawn(final ProverProcessConfig config) throws IOException {
    Validate.notNull(config, "config must not be null");
    synchronized (lock) {
      Validate.validState(controller == null, "channel %s already spawned", name);
      try {
        this.controller = launcher.launch(config);
        this.processInput = controller.getProcessInput();
        this.processOutput = controller.getProcessOutput();
      } catch (final IOException e) {
        throw e;
      } catch (final Exception e) {
        throw new IOException("Failed to start prover for " + name, e);
      }
      this.config = config;
      final XmlFrameReader reader = new XmlFrameReader(processOutput, config.charset(), new Inbound());
      this.readerThread = new Thread(reader, "ProverReader-" + name);
      this.readerThread.setDaemon(true);
      this.readerThread.start();
    }
    LOGGER.info("[{}] prover started: {}", name, config.command());
  }

  /**
   * Writes a request and returns a future for its answer.
   *
   * <p>Blocks only on the pipe write. The future completes on the reader thread, or exceptionally
   * with {@link ProverQuitException} if the process quits first.
   *
   * @param request {@code call} element
   * @return the answering {@code value} element
   */
  public CompletableFuture<Element> call(final Element request) {
    Validate.notNull(request, "request must not be null");
    final CompletableFuture<Element> answer = new CompletableFuture<>();
    final long requestId = requestSequence.incrementAndGet();
    synchronized (lock) {
      Validate.validState(controller != null, "channel %s not spawned", name);
      if (closed) {
        answer.completeExceptionally(new ProverQuitException("Prover for " + name + " has quit"));
        return answer;
      }
      pendingCalls.put(requestId, answer);
    }
    try {
      send(request);
    } catch (final ProverQuitException e) {
      synchronized (lock) {
        pendingCalls.remove(requestId);
      }
      answer.completeExceptionally(e);
    }
    return answer;
  }

  /**
   * Serializes and writes one message.
   *
   * @param message element to write
   * @throws ProverQuitException if the pipe is broken; the channel is then closed
   */
  public void send(final Element message) throws ProverQuitException {
    if (closed) {
      throw new ProverQuitException("Prover for " + name + " has quit");
    }
    final byte[] bytes = XmlSupport.toBytes(message, config.charset());
    LOGGER.debug("[{}] send: {}", name, new String(bytes, config.charset()));
    synchronized (writeLock) {
      try {
        processInput.write(bytes);
        processInput.flush();
      } catch (final IOException e) {
        LOGGER.debug("[{}] prover input is broken: {}", name, e.getMessage());
        markClosed();
        throw new ProverQuitException("Prover input for " + name + " is broken", e);
      }
    }
  }

  /**
   * Removes and returns every feedback element received so far, in arrival order. Non-blocking.
   *
   * @return feedback elements
   */
  public List<Element> drainFeedbacks() {
    final List<Element> out = new ArrayList<>();
    Element next;
    while ((next = feedbacks.poll()) != null) {
      out.add(next);
    }
    return out;
  }

  public boolean isClosed() {
    return closed;
  }

  public int pendingCallCount() {
    synchronized (lock) {
      return pendingCalls.size();
    }
  }

  /**
   * Closes stdin and waits for the process to exit. A prover still running after the shutdown
   * timeout is asked to terminate, then killed. Joins the reader afterwards. Safe to call more than
   * once.
   */
  @Override
  public void close() {
    final ProverProcessController c;
    final Thread reader;
    synchronized (lock) {
      c = this.controller;
      reader = this.readerThread;
    }
    if (c == null) {
      return;
    }
    final Duration timeout = config.shutdownTimeout();
    try {
      try {
        processInput.close();
      } catch (final IOException e) {
        LOGGER.debug("[{}] closing prover input failed: {}", name, e.getMessage());
      }
      if (!c.waitFor(timeout)) {
        LOGGER.warn("[{}] prover did not exit within {}, terminating it", name, timeout);
        c.close();
        if (!c.waitFor(timeout)) {
          LOGGER.warn("[{}] prover ignored termination, killing it", name);
          c.destroyForcibly();
          if (!c.waitFor(timeout)) {
            LOGGER.error("[{}] prover survived a forced kill", name);
          }
        }
      }
      reader.join(timeout.toMillis());
      if (reader.isAlive()) {
        LOGGER.warn("[{}] reader still blocked, closing prover output", name);
        processOutput.close();
        reader.join(timeout.toMillis());
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      c.destroyForcibly();
    } catch (final IOException e) {
      LOGGER.debug("[{}] closing prover output failed: {}", name, e.getMessage());
    } finally {
      markClosed();
    }
    LOGGER.info("[{}] prover closed", name);
  }

  private void markClosed() {
    final List<CompletableFuture<Element>> orphans;
    synchronized (lock) {
      closed = true;
      orphans = new ArrayList<>(pendingCalls.values());
      pendingCalls.clear();
    }
    for (CompletableFuture<Element> orphan : orphans) {
      LOGGER.debug("[{}] failing an unanswered call", name);
      orphan.completeExceptionally(new ProverQuitException("Prover for " + name + " has quit"));
    }
  }

  private final class Inbound implements XmlFrameReader.Listener {

    @Override
    public void onElement(final Element element) {
      switch (element.getTagName()) {
        case "value":
          resolveOldest(element);
          break;
        case "feedback":
          feedbacks.add(element);
          break;
        default:
          LOGGER.warn("[{}] ignoring unexpected element <{}>", name, element.getTagName());
          break;
      }
    }

    @Override
    public void onClosed() {
      LOGGER.debug("[{}] prover output closed", name);
      markClosed();
    }

    private void resolveOldest(final Element value) {
      CompletableFuture<Element> answer = null;
      synchronized (lock) {
        final Iterator<CompletableFuture<Element>> it = pendingCalls.values().iterator();
        if (it.hasNext()) {
          answer = it.next();
          it.remove();
        }
      }
      if (answer == null) {
        LOGGER.warn("[{}] unexpected answer with no pending call: {}", name, XmlSupport.toString(value));
        return;
      }
      answer.complete(value);
    }
  }
}
