/*
 * Copyright (c) 2023, Folio Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.folio;

import com.google.common.base.Splitter;
import io.folio.api.Frame;
import io.folio.decorator.AbstractFrameDecorator;
import io.folio.decorator.FrameFactory;
import io.folio.decorator.PageFrameDecorator;
import io.folio.decorator.StrategyRegistry;
import io.folio.node.FrameTree;
import io.folio.node.FrameTreeBuilder;
import io.folio.settings.LayoutConfiguration;
import io.folio.style.Display;
import io.folio.style.Style;
import io.folio.style.StyleProperty;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds documents, frame trees and decorated trees for tests.
 *
 * <p>
 * Elements get a default display by tag ({@code html}, {@code body}, {@code div}, {@code p} are
 * blocks, {@code li} a list item, anything else inline) and their {@code style} attribute applied
 * on top, for instance {@code style="margin-top: 10; counter-reset: c"}.
 * </p>
 */
public final class LayoutTestHelper {

  private static final Set<String> BLOCK_TAGS = Set.of("html", "body", "div", "p", "ul", "h1");

  private static final Splitter DECLARATIONS = Splitter.on(';').trimResults().omitEmptyStrings();

  private static final Splitter PROPERTY = Splitter.on(':').trimResults().limit(2);

  private LayoutTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Parse an XML string.
   *
   * @param xml the document
   * @return the DOM
   */
  public static Document parse(final String xml) {
    try {
      final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    } catch (final ParserConfigurationException | SAXException | IOException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * The specified style of an element.
   *
   * @param element the element
   * @return its style
   */
  public static Style styleOf(final Element element) {
    final Style style = new Style();
    final String tag = element.getTagName().toLowerCase(Locale.ROOT);
    if (BLOCK_TAGS.contains(tag)) {
      style.setDisplay(Display.BLOCK);
    } else if ("li".equals(tag)) {
      style.setDisplay(Display.LIST_ITEM);
    }
    for (final String declaration : DECLARATIONS.split(element.getAttribute("style"))) {
      final List<String> parts = PROPERTY.splitToList(declaration);
      style.set(StyleProperty.fromCss(parts.get(0)), parts.get(1));
    }
    return style;
  }

  public static FrameTree buildTree(final String xml) {
    return new FrameTreeBuilder(LayoutTestHelper::styleOf).build(parse(xml));
  }

  public static FrameFactory factory() {
    return new FrameFactory(LayoutConfiguration.defaults(), StrategyRegistry.nullStrategies());
  }

  /**
   * Build and decorate the frame tree of {@code xml} with null strategies.
   *
   * @param xml the document
   * @return the page decorating the document element
   */
  public static PageFrameDecorator decorate(final String xml) {
    return decorate(xml, factory());
  }

  public static PageFrameDecorator decorate(final String xml, final FrameFactory factory) {
    final FrameTree tree = buildTree(xml);
    return factory.decorateRoot(tree.getRootFrame());
  }

  /**
   * Find the decorated frame rendering the element with the given {@code id}.
   *
   * @param page the root
   * @param id the element id
   * @return the frame
   * @throws IllegalArgumentException if there is none
   */
  public static AbstractFrameDecorator byId(final PageFrameDecorator page, final String id) {
    for (final Frame frame : page.getSubtree()) {
      if (frame.getNode() instanceof Element && id.equals(((Element) frame.getNode()).getAttribute("id"))) {
        return (AbstractFrameDecorator) frame;
      }
    }
    throw new IllegalArgumentException("No frame with id " + id);
  }

  /**
   * The tags of the children of {@code frame}, joined by commas, ids used where present.
   *
   * @param frame the parent
   * @return for instance {@code "a,b,#text"}
   */
  public static String childNames(final Frame frame) {
    final StringBuilder builder = new StringBuilder();
    for (Frame child = frame.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (builder.length() > 0) {
        builder.append(',');
      }
      builder.append(name(child));
    }
    return builder.toString();
  }

  /**
   * The id of the element of {@code frame}, else its original id, else its tag.
   */
  public static String name(final Frame frame) {
    if (frame.getNode() instanceof Element) {
      final Element element = (Element) frame.getNode();
      if (element.hasAttribute("id")) {
        return element.getAttribute("id");
      }
      final String originalId = LayoutConfiguration.defaults().getOriginalIdAttribute();
      if (element.hasAttribute(originalId)) {
        return element.getAttribute(originalId);
      }
    }
    return frame.getTag();
  }
}
