package com.consullo.prover.protocol;

import com.consullo.prover.core.Goal;
import com.consullo.prover.core.Goals;
import com.consullo.prover.core.Location;
import com.consullo.prover.core.StateId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.tuple.Pair;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Maps values to and from the prover's tagged-tree wire format.
 *
 * <p>Java representation of each wire shape:
 * <ul>
 * <li>{@code unit} - {@link Unit#INSTANCE}</li>
 * <li>{@code bool} - {@link Boolean}</li>
 * <li>{@code string} - {@link String}</li>
 * <li>{@code int} - {@link Integer}</li>
 * <li>{@code state_id} - {@link StateId}</li>
 * <li>{@code list} - {@link List}</li>
 * <li>{@code option} - {@link Optional}</li>
 * <li>{@code pair} - {@link Pair}</li>
 * <li>{@code union} - {@link Union}</li>
 * <li>{@code goals}, {@code goal}, {@code loc} - {@link Goals}, {@link Goal}, {@link Location}</li>
 * </ul>
 *
 * <p>{@code richpp} is decode-only: its markup is dropped and the embedded text concatenated.
 *
 * @since 1.0
 */
public final class XmlCodec {

  /**
   * Encodes a value into a new element owned by {@code doc}.
   *
   * @param doc owner document
   * @param value value to encode
   * @return the element
   * @throws IllegalArgumentException if no wire shape matches the value's runtime type
   */
  public Element encode(final Document doc, final Object value) {
    if (value instanceof Unit) {
      return doc.createElement("unit");
    }
    if (value instanceof Boolean b) {
      final Element e = doc.createElement("bool");
      e.setAttribute("val", b ? "true" : "false");
      return e;
    }
    if (value instanceof String s) {
      final Element e = doc.createElement("string");
      e.setTextContent(s);
      return e;
    }
    if (value instanceof Integer i) {
      final Element e = doc.createElement("int");
      e.setTextContent(Integer.toString(i));
      return e;
    }
    if (value instanceof StateId id) {
      final Element e = doc.createElement("state_id");
      e.setAttribute("val", Integer.toString(id.value()));
      return e;
    }
    if (value instanceof List<?> list) {
      return withChildren(doc, doc.createElement("list"), list);
    }
    if (value instanceof Optional<?> opt) {
      final Element e = doc.createElement("option");
      if (opt.isPresent()) {
        e.setAttribute("val", "some");
        e.appendChild(encode(doc, opt.get()));
      } else {
        e.setAttribute("val", "none");
      }
      return e;
    }
    if (value instanceof Pair<?, ?> pair) {
      return withChildren(doc, doc.createElement("pair"), List.of(pair.getLeft(), pair.getRight()));
    }
    if (value instanceof Union union) {
      final Element e = doc.createElement("union");
      e.setAttribute("val", union.side().wireName());
      e.appendChild(encode(doc, union.value()));
      return e;
    }
    if (value instanceof Goals goals) {
      return withChildren(doc, doc.createElement("goals"),
          List.of(goals.foreground(), goals.background(), goals.shelved(), goals.abandoned()));
    }
    if (value instanceof Goal goal) {
      return withChildren(doc, doc.createElement("goal"),
          List.of(goal.id(), goal.hypotheses(), goal.conclusion()));
    }
    if (value instanceof Location loc) {
      final Element e = doc.createElement("loc");
      e.setAttribute("start", Integer.toString(loc.start()));
      e.setAttribute("stop", Integer.toString(loc.stop()));
      return e;
    }
    throw new IllegalArgumentException("Cannot encode value of type "
        + (value == null ? "null" : value.getClass().getName()) + ": " + value);
  }

  /**
   * Encodes a value into an element owned by a fresh document.
   *
   * @param value value to encode
   * @return the element
   */
  public Element encode(final Object value) {
    final Document doc = XmlSupport.newDocument();
    final Element element = encode(doc, value);
    doc.appendChild(element);
    return element;
  }

  /**
   * Decodes an element by its tag (and {@code val} attribute for bool, option and union).
   *
   * @param element wire element
   * @return decoded value
   * @throws XmlDecodeException if the tag or its shape is not recognized
   */
  public Object decode(final Element element) {
    final String tag = element.getTagName();
    switch (tag) {
      case "unit":
        return Unit.INSTANCE;
      case "bool":
        return decodeBool(element);
      case "string":
        return element.getTextContent();
      case "int":
        return parseInt(element, element.getTextContent().trim());
      case "state_id":
        return StateId.of(parseInt(element, element.getAttribute("val")));
      case "list":
        return decodeChildren(element);
      case "option":
        return decodeOption(element);
      case "pair": {
        final List<Element> children = children(element, 2);
        return Pair.of(decode(children.get(0)), decode(children.get(1)));
      }
      case "union":
        return decodeUnion(element);
      case "richpp":
        return element.getTextContent();
      case "goals": {
        final List<Element> children = children(element, 4);
        return new Goals(
            decodeList(children.get(0), Goal.class),
            decodeBackground(children.get(1)),
            decodeList(children.get(2), Goal.class),
            decodeList(children.get(3), Goal.class));
      }
      case "goal": {
        final List<Element> children = children(element, 3);
        return new Goal(
            decodeAs(children.get(0), String.class),
            decodeList(children.get(1), String.class),
            decodeAs(children.get(2), String.class));
      }
      case "loc":
        return new Location(
            parseInt(element, element.getAttribute("start")),
            parseInt(element, element.getAttribute("stop")));
      default:
        throw new XmlDecodeException("Unrecognized tag <" + tag + ">: " + XmlSupport.toString(element));
    }
  }

  /**
   * Decodes an element and checks the result type.
   *
   * @param element wire element
   * @param type expected Java type
   * @param <T> expected type
   * @return decoded value
   * @throws XmlDecodeException if the decoded value has another type
   */
  public <T> T decodeAs(final Element element, final Class<T> type) {
    final Object value = decode(element);
    if (!type.isInstance(value)) {
      throw new XmlDecodeException("Expected " + type.getSimpleName() + " but <"
          + element.getTagName() + "> decoded to " + value);
    }
    return type.cast(value);
  }

  private Element withChildren(final Document doc, final Element parent, final List<?> values) {
    for (Object v : values) {
      parent.appendChild(encode(doc, v));
    }
    return parent;
  }

  private Boolean decodeBool(final Element element) {
    final String val = element.getAttribute("val");
    if ("true".equals(val)) {
      return Boolean.TRUE;
    }
    if ("false".equals(val)) {
      return Boolean.FALSE;
    }
    throw new XmlDecodeException("Invalid bool value: " + val);
  }

  private Optional<Object> decodeOption(final Element element) {
    final String val = element.getAttribute("val");
    if ("none".equals(val)) {
      return Optional.empty();
    }
    if ("some".equals(val)) {
      return Optional.of(decode(children(element, 1).get(0)));
    }
    throw new XmlDecodeException("Invalid option value: " + val);
  }

  private Union decodeUnion(final Element element) {
    final String val = element.getAttribute("val");
    final Object inner = decode(children(element, 1).get(0));
    for (Union.Side side : Union.Side.values()) {
      if (side.wireName().equals(val)) {
        return new Union(side, inner);
      }
    }
    throw new XmlDecodeException("Invalid union value: " + val);
  }

  private List<Object> decodeChildren(final Element element) {
    final List<Element> children = XmlSupport.childElements(element);
    final List<Object> out = new ArrayList<>(children.size());
    for (Element child : children) {
      out.add(decode(child));
    }
    return out;
  }

  private <T> List<T> decodeList(final Element element, final Class<T> itemType) {
    if (!"list".equals(element.getTagName())) {
      throw new XmlDecodeException("Expected <list> but found <" + element.getTagName() + ">");
    }
    final List<Element> children = XmlSupport.childElements(element);
    final List<T> out = new ArrayList<>(children.size());
    for (Element child : children) {
      out.add(decodeAs(child, itemType));
    }
    return out;
  }

  private List<Pair<List<Goal>, List<Goal>>> decodeBackground(final Element element) {
    if (!"list".equals(element.getTagName())) {
      throw new XmlDecodeException("Expected <list> but found <" + element.getTagName() + ">");
    }
    final List<Pair<List<Goal>, List<Goal>>> out = new ArrayList<>();
    for (Element child : XmlSupport.childElements(element)) {
      final List<Element> halves = children(child, 2);
      out.add(Pair.of(decodeList(halves.get(0), Goal.class), decodeList(halves.get(1), Goal.class)));
    }
    return out;
  }

  private static List<Element> children(final Element element, final int expected) {
    final List<Element> children = XmlSupport.childElements(element);
    if (children.size() != expected) {
      throw new XmlDecodeException("<" + element.getTagName() + "> expects " + expected
          + " children but has " + children.size());
    }
    return children;
  }

  private static int parseInt(final Element element, final String text) {
    try {
      return Integer.parseInt(text);
    } catch (final NumberFormatException e) {
      throw new XmlDecodeException("Invalid integer in <" + element.getTagName() + ">: " + text, e);
    }
  }
}
