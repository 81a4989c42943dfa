package com.consullo.prover.protocol;

import com.consullo.prover.core.Location;
import com.consullo.prover.core.MessageLevel;
import com.consullo.prover.core.StateId;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Translates calls, answers and feedback between their typed form and protocol elements.
 *
 * <p>Requests are {@code <call val="Name">argument</call>}. Answers are
 * {@code <value val="good">payload</value>} or
 * {@code <value val="fail" loc_s=".." loc_e="..">state_id message</value>}. Feedback is
 * {@code <feedback object="state" route="0">state_id feedback_content</feedback>}.
 *
 * @since 1.0
 */
public final class XmlProtocol {

  private final XmlCodec codec;

  public XmlProtocol() {
    this(new XmlCodec());
  }

  public XmlProtocol(final XmlCodec codec) {
    Validate.notNull(codec, "codec must not be null");
    this.codec = codec;
  }

  public XmlCodec codec() {
    return codec;
  }

  /**
   * Builds the request element for a call.
   *
   * @param call call to encode
   * @return {@code call} element owned by a fresh document
   */
  public Element toXml(final ProverCall<?> call) {
    Validate.notNull(call, "call must not be null");
    final Document doc = XmlSupport.newDocument();
    final Element element = doc.createElement("call");
    element.setAttribute("val", call.name());
    element.appendChild(codec.encode(doc, call.argument()));
    doc.appendChild(element);
    return element;
  }

  /**
   * Decodes the answer to a call.
   *
   * @param call the call this element answers
   * @param value {@code value} element
   * @param <R> answer type
   * @return the good value or the protocol error
   * @throws XmlDecodeException if the element is not a well-formed answer
   */
  public <R> CallResult<R> fromXml(final ProverCall<R> call, final Element value) {
    Validate.notNull(call, "call must not be null");
    Validate.notNull(value, "value must not be null");
    if (!"value".equals(value.getTagName())) {
      throw new XmlDecodeException("Expected <value> but found <" + value.getTagName() + ">");
    }
    final String status = value.getAttribute("val");
    final List<Element> children = XmlSupport.childElements(value);
    if ("good".equals(status)) {
      if (children.size() != 1) {
        throw new XmlDecodeException("Good answer to " + call.name() + " must have one child, found "
            + children.size());
      }
      return CallResult.good(call.interpret(codec.decode(children.get(0))));
    }
    if ("fail".equals(status)) {
      return CallResult.fail(errorFromXml(value, children));
    }
    throw new XmlDecodeException("Invalid value status: " + status);
  }

  /**
   * Decodes a feedback element.
   *
   * <p>Feedback that is not state-scoped, or whose content kind is unknown, decodes to
   * {@link FeedbackContent.Unhandled}.
   *
   * @param xml {@code feedback} element
   * @return typed feedback
   * @throws XmlDecodeException if a known kind has an unexpected shape
   */
  public Feedback feedbackFromXml(final Element xml) {
    Validate.notNull(xml, "xml must not be null");
    if (!"feedback".equals(xml.getTagName())) {
      throw new XmlDecodeException("Expected <feedback> but found <" + xml.getTagName() + ">");
    }
    final List<Element> children = XmlSupport.childElements(xml);
    final String object = xml.getAttribute("object");
    if (!object.isEmpty() && !"state".equals(object)) {
      return new Feedback(StateId.NONE, new FeedbackContent.Unhandled(object, XmlSupport.toString(xml)));
    }
    if (children.size() != 2) {
      throw new XmlDecodeException("<feedback> expects 2 children but has " + children.size());
    }
    final StateId stateId = codec.decodeAs(children.get(0), StateId.class);
    final Element content = children.get(1);
    return new Feedback(stateId, contentFromXml(content));
  }

  private FeedbackContent contentFromXml(final Element content) {
    final String type = content.getAttribute("val");
    final List<Element> args = XmlSupport.childElements(content);
    final FeedbackContent.Kind kind = FeedbackContent.Kind.fromWireName(type);
    switch (kind) {
      case ADDED_AXIOM:
        return new FeedbackContent.AddedAxiom();
      case PROCESSED:
        return new FeedbackContent.Processed();
      case INCOMPLETE:
        return new FeedbackContent.Incomplete();
      case IN_PROGRESS:
        return new FeedbackContent.InProgress(args.isEmpty() ? 0 : codec.decodeAs(args.get(0), Integer.class));
      case PROCESSING_IN:
        return new FeedbackContent.ProcessingIn(codec.decodeAs(arg(args, 0, type), String.class));
      case ERROR_MSG:
        return new FeedbackContent.ErrorMsg(
            codec.decodeAs(arg(args, 0, type), Location.class),
            codec.decodeAs(arg(args, 1, type), String.class));
      case MESSAGE:
        return messageFromXml(arg(args, 0, type));
      case FILE_DEPENDENCY: {
        final Optional<?> source = codec.decodeAs(arg(args, 0, type), Optional.class);
        return new FeedbackContent.FileDependency(
            (String) source.orElse(null),
            codec.decodeAs(arg(args, 1, type), String.class));
      }
      case FILE_LOADED:
        return new FeedbackContent.FileLoaded(
            codec.decodeAs(arg(args, 0, type), String.class),
            codec.decodeAs(arg(args, 1, type), String.class));
      case UNHANDLED:
      default:
        return new FeedbackContent.Unhandled(type, XmlSupport.toString(content));
    }
  }

  private FeedbackContent.Message messageFromXml(final Element message) {
    final List<Element> parts = XmlSupport.childElements(message);
    if (parts.size() != 2 && parts.size() != 3) {
      throw new XmlDecodeException("<message> expects 2 or 3 children but has " + parts.size());
    }
    final MessageLevel level;
    try {
      level = MessageLevel.fromWireName(parts.get(0).getAttribute("val"));
    } catch (final IllegalArgumentException e) {
      throw new XmlDecodeException("Invalid message level: " + parts.get(0).getAttribute("val"), e);
    }
    Location location = null;
    if (parts.size() == 3) {
      final Optional<?> loc = codec.decodeAs(parts.get(1), Optional.class);
      location = (Location) loc.filter(Location.class::isInstance).orElse(null);
    }
    final String text = codec.decodeAs(parts.get(parts.size() - 1), String.class);
    return new FeedbackContent.Message(level, location, text);
  }

  private ProtocolError errorFromXml(final Element value, final List<Element> children) {
    if (children.size() != 2) {
      throw new XmlDecodeException("Failed answer must have 2 children, found " + children.size());
    }
    Location location = null;
    if (value.hasAttribute("loc_s") && value.hasAttribute("loc_e")) {
      try {
        location = new Location(
            Integer.parseInt(value.getAttribute("loc_s")),
            Integer.parseInt(value.getAttribute("loc_e")));
      } catch (final NumberFormatException e) {
        throw new XmlDecodeException("Invalid error location on failed answer", e);
      }
    }
    final StateId stateId = codec.decodeAs(children.get(0), StateId.class);
    final String message = codec.decodeAs(children.get(1), String.class);
    return new ProtocolError(location, stateId, message);
  }

  private static Element arg(final List<Element> args, final int index, final String type) {
    if (index >= args.size()) {
      throw new XmlDecodeException("Feedback '" + type + "' is missing argument " + index);
    }
    return args.get(index);
  }
}
