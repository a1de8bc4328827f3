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

package io.folio.api;

import io.folio.node.FrameNode;
import io.folio.node.FrameTree;
import io.folio.node.Point;
import io.folio.node.Rect;
import io.folio.style.Style;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.w3c.dom.Node;

/**
 * A box of the layout tree.
 *
 * <p>
 * Frames are either primitive {@link FrameNode}s, stored in a {@link FrameTree}, or decorators
 * wrapping another frame. All navigation methods resolve to the outermost decoration of the
 * neighbour they return, so a caller walking the tree only ever sees the outermost layer. All
 * mutation methods accept frames of either kind and operate on the primitive links underneath.
 * </p>
 */
public interface Frame {

  /**
   * Key of the primitive frame in its tree. Every decoration layer of a frame shares it.
   *
   * @return the frame key
   */
  long getFrameKey();

  /**
   * The tree storing the primitive frame.
   *
   * @return the owning tree
   */
  FrameTree getTree();

  /**
   * The primitive frame at the bottom of the decoration chain.
   *
   * @return the primitive frame
   */
  FrameNode getFrameNode();

  /**
   * The document node this frame renders.
   *
   * @return the DOM node
   */
  Node getNode();

  /**
   * The node name of the document node, {@code #text} for text frames.
   *
   * @return the tag
   */
  String getTag();

  Style getStyle();

  void setStyle(Style style);

  // Geometry.

  @Nullable
  Point getPosition();

  void setPosition(@Nullable Point position);

  @Nullable
  Frame getContainingBlock();

  void setContainingBlock(@Nullable Frame containingBlock);

  Rect getMarginBox();

  Rect getBorderBox();

  Rect getPaddingBox();

  Rect getContentBox();

  float getMarginWidth();

  float getMarginHeight();

  boolean isAutoWidth();

  boolean isAutoHeight();

  default boolean isBlock() {
    return getStyle().getDisplay().isBlock();
  }

  default boolean isPositioned() {
    return getStyle().getPositionScheme().isPositioned();
  }

  // Navigation.

  @Nullable
  Frame getParent();

  @Nullable
  Frame getFirstChild();

  @Nullable
  Frame getLastChild();

  @Nullable
  Frame getPrevSibling();

  @Nullable
  Frame getNextSibling();

  @NonNegative
  int getChildCount();

  // Mutation.

  /**
   * Insert {@code child} as the first child of this frame, detaching it from its current parent.
   *
   * @param child the frame to insert
   * @param updateNode whether to move the DOM node as well
   */
  void prependChild(Frame child, boolean updateNode);

  default void prependChild(final Frame child) {
    prependChild(child, true);
  }

  /**
   * Insert {@code child} as the last child of this frame, detaching it from its current parent.
   *
   * @param child the frame to insert
   * @param updateNode whether to move the DOM node as well
   */
  void appendChild(Frame child, boolean updateNode);

  default void appendChild(final Frame child) {
    appendChild(child, true);
  }

  /**
   * Insert {@code child} right before {@code reference}, which must be a child of this frame.
   *
   * @param child the frame to insert
   * @param reference the child to insert before
   * @param updateNode whether to move the DOM node as well
   */
  void insertChildBefore(Frame child, Frame reference, boolean updateNode);

  default void insertChildBefore(final Frame child, final Frame reference) {
    insertChildBefore(child, reference, true);
  }

  /**
   * Insert {@code child} right after {@code reference}, which must be a child of this frame.
   *
   * @param child the frame to insert
   * @param reference the child to insert after
   * @param updateNode whether to move the DOM node as well
   */
  void insertChildAfter(Frame child, Frame reference, boolean updateNode);

  default void insertChildAfter(final Frame child, final Frame reference) {
    insertChildAfter(child, reference, true);
  }

  /**
   * Detach {@code child}, which must be a child of this frame. The frame stays in its tree.
   *
   * @param child the child to remove
   * @param updateNode whether to remove the DOM node as well
   */
  void removeChild(Frame child, boolean updateNode);

  default void removeChild(final Frame child) {
    removeChild(child, true);
  }

  /**
   * Throw away all layout results of this frame: position, containing block and inherited style
   * values.
   */
  void reset();

  /**
   * The decorator wrapping this very layer, if any. Following this relation until it yields
   * {@code null} leads to the outermost decoration.
   *
   * @return the next decoration layer or {@code null}
   */
  @Nullable
  Frame getDecorator();
}
