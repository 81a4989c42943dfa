package com.consullo.prover.process;

import com.consullo.prover.protocol.XmlSupport;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.List;
import javax.xml.parsers.DocumentBuilder;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * Splits an unframed stream of XML elements into complete top-level elements.
 *
 * <p>The prover writes elements back to back with no length prefix or delimiter. Every chunk is
 * appended to a buffer, and the whole buffer is parsed wrapped in a synthetic {@code <root>} so that
 * several sibling elements parse as one document. A parse failure means the buffer ends in the middle
 * of an element: the buffer is kept and parsing is retried when the next chunk arrives. On success
 * every top-level element is handed to the listener and the buffer is cleared.
 *
 * <p>The listener is invoked on the reader thread and must only hand elements off.
 *
 * @since 1.0
 */
public final class XmlFrameReader implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(XmlFrameReader.class);

  static final int CHUNK_SIZE = 1000;

  private static final String DOCTYPE =
      "<!DOCTYPE root [<!ENTITY nbsp \"&#160;\"> <!ENTITY quot \"&#34;\">]>";

  /**
   * Receives parsed elements and the end of the stream.
   */
  public interface Listener {

    void onElement(Element element);

    /** Called exactly once, when the stream reaches EOF or fails. */
    void onClosed();
  }

  private final InputStream in;
  private final Listener listener;
  private final Charset charset;
  private final byte[] prefix;
  private final byte[] suffix;
  private final DocumentBuilder builder;
  private final ByteArrayOutputStream pending = new ByteArrayOutputStream(4096);

  /**
   * Creates a reader.
   *
   * @param in the prover's output
   * @param charset stream encoding
   * @param listener element consumer
   */
  public XmlFrameReader(final InputStream in, final Charset charset, final Listener listener) {
    Validate.notNull(in, "in must not be null");
    Validate.notNull(charset, "charset must not be null");
    Validate.notNull(listener, "listener must not be null");
    this.in = in;
    this.listener = listener;
    this.charset = charset;
    this.prefix = ("<?xml version=\"1.0\" encoding=\"" + charset.name() + "\"?>" + DOCTYPE + "<root>")
        .getBytes(charset);
    this.suffix = "</root>".getBytes(charset);
    this.builder = XmlSupport.newDocumentBuilder();
  }

  @Override
  public void run() {
    final byte[] buffer = new byte[CHUNK_SIZE];
    try {
      while (true) {
        final int n;
        try {
          n = in.read(buffer);
        } catch (final IOException e) {
          LOGGER.debug("Prover output failed: {}", e.getMessage());
          return;
        }
        if (n < 0) {
          LOGGER.debug("Prover output reached EOF");
          return;
        }
        if (n == 0) {
          continue;
        }
        if (LOGGER.isTraceEnabled()) {
          LOGGER.trace("Received: {}", new String(buffer, 0, n, charset));
        }
        for (Element element : feed(buffer, 0, n)) {
          listener.onElement(element);
        }
      }
    } catch (final RuntimeException e) {
      LOGGER.error("Prover output reader failed", e);
    } finally {
      listener.onClosed();
    }
  }

  /**
   * Appends bytes and returns the elements completed by them.
   *
   * @param data byte array
   * @param off offset
   * @param len length
   * @return complete top-level elements, empty while the buffer ends inside an element
   */
  List<Element> feed(final byte[] data, final int off, final int len) {
    pending.write(data, off, len);
    final Document doc;
    try {
      final InputStream wrapped = new SequenceInputStream(Collections.enumeration(List.of(
          new ByteArrayInputStream(prefix),
          new ByteArrayInputStream(pending.toByteArray()),
          new ByteArrayInputStream(suffix))));
      doc = XmlSupport.parse(builder, wrapped);
    } catch (final SAXException | IOException e) {
      LOGGER.trace("Incomplete frame of {} bytes: {}", pending.size(), e.getMessage());
      return List.of();
    }
    pending.reset();
    return XmlSupport.childElements(doc.getDocumentElement());
  }

  int pendingBytes() {
    return pending.size();
  }
}
