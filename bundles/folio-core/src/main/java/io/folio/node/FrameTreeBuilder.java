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

package io.folio.node;

import io.folio.style.Style;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link FrameTree} mirroring a DOM document: one frame per element and per text node
 * that is not blank. Comments, processing instructions and blank text are skipped.
 */
public final class FrameTreeBuilder {

  /** Computes the specified style of an element. */
  private final Function<Element, Style> styler;

  /**
   * Constructor.
   *
   * @param styler computes the specified style of each element, inherited values are added by
   *        the builder
   */
  public FrameTreeBuilder(final Function<Element, Style> styler) {
    this.styler = requireNonNull(styler);
  }

  /**
   * Build the frame tree of {@code document}. The DOM is not modified.
   *
   * @param document the document
   * @return a new tree whose root frame renders the document element
   */
  public FrameTree build(final Document document) {
    final Element documentElement = document.getDocumentElement();
    requireNonNull(documentElement, "The document has no document element.");

    final FrameTree tree = new FrameTree(document);
    final FrameNode root = tree.createRootFrame(documentElement, styler.apply(documentElement));
    addChildren(tree, root);
    return tree;
  }

  private void addChildren(final FrameTree tree, final FrameNode parent) {
    for (Node child = parent.getNode().getFirstChild(); child != null; child = child.getNextSibling()) {
      final Style style;
      switch (child.getNodeType()) {
        case Node.ELEMENT_NODE:
          style = styler.apply((Element) child);
          break;
        case Node.TEXT_NODE:
        case Node.CDATA_SECTION_NODE:
          if (child.getNodeValue().isBlank()) {
            continue;
          }
          style = new Style();
          break;
        default:
          continue;
      }
      style.inherit(parent.getStyle());
      final FrameNode frame = tree.createFrame(child, style);
      parent.appendChild(frame, false);
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        addChildren(tree, frame);
      }
    }
  }
}
