package com.consullo.prover.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * DOM helpers shared by the codec and the inbound stream parser.
 *
 * <p>External DTDs and schemas are never fetched. Internal entity declarations are honoured because
 * the prover output relies on them for {@code &nbsp;}.
 *
 * @since 1.0
 */
public final class XmlSupport {

  private static final ErrorHandler SILENT = new ErrorHandler() {
    @Override
    public void warning(final SAXParseException exception) {
    }

    @Override
    public void error(final SAXParseException exception) throws SAXException {
      throw exception;
    }

    @Override
    public void fatalError(final SAXParseException exception) throws SAXException {
      throw exception;
    }
  };

  private XmlSupport() {
  }

  /**
   * Creates a document builder that reports malformed input by throwing instead of printing.
   *
   * @return a new, non-thread-safe builder
   */
  public static DocumentBuilder newDocumentBuilder() {
    try {
      final DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
      dbf.setNamespaceAware(false);
      dbf.setExpandEntityReferences(true);
      final DocumentBuilder builder = dbf.newDocumentBuilder();
      builder.setErrorHandler(SILENT);
      return builder;
    } catch (final ParserConfigurationException e) {
      throw new IllegalStateException("XML parser is not available", e);
    }
  }

  public static Document newDocument() {
    return newDocumentBuilder().newDocument();
  }

  /**
   * Parses a complete document.
   *
   * @param builder builder from {@link #newDocumentBuilder()}
   * @param in document bytes
   * @return the parsed document
   * @throws SAXException if the input is not well-formed
   * @throws IOException if reading fails
   */
  public static Document parse(final DocumentBuilder builder, final InputStream in)
      throws SAXException, IOException {
    return builder.parse(new InputSource(in));
  }

  /**
   * Parses a single element from text. Intended for tests and diagnostics.
   *
   * @param xml element markup
   * @return the root element
   */
  public static Element parseElement(final String xml) {
    try {
      final Document doc = newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
      return doc.getDocumentElement();
    } catch (final Exception e) {
      throw new XmlDecodeException("Malformed XML: " + xml, e);
    }
  }

  /**
   * Serializes an element without an XML declaration.
   *
   * @param element element to write
   * @param charset output encoding
   * @return encoded bytes
   */
  public static byte[] toBytes(final Element element, final Charset charset) {
    try {
      final Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
      transformer.setOutputProperty(OutputKeys.ENCODING, charset.name());
      transformer.setOutputProperty(OutputKeys.INDENT, "no");
      final ByteArrayOutputStream out = new ByteArrayOutputStream(256);
      transformer.transform(new DOMSource(element), new StreamResult(out));
      return out.toByteArray();
    } catch (final TransformerException e) {
      throw new IllegalStateException("Failed to serialize <" + element.getTagName() + ">", e);
    }
  }

  public static String toString(final Element element) {
    return new String(toBytes(element, StandardCharsets.UTF_8), StandardCharsets.UTF_8);
  }

  /**
   * Returns the element children of a node, skipping text, comments and processing instructions.
   *
   * @param parent parent node
   * @return child elements in document order
   */
  public static List<Element> childElements(final Node parent) {
    final NodeList nodes = parent.getChildNodes();
    final List<Element> out = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      if (nodes.item(i) instanceof Element child) {
        out.add(child);
      }
    }
    return out;
  }
}
