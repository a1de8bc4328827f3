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

import com.google.common.base.MoreObjects;
import io.folio.api.Frame;
import io.folio.settings.Fixed;
import io.folio.style.Style;
import io.folio.style.StyleProperty;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.w3c.dom.Node;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Primitive frame stored in a {@link FrameTree}.
 *
 * <p>
 * Structural links are frame keys resolved through the tree. Navigation returns the outermost
 * decoration of the neighbour, mutation accepts any layer of the frames involved.
 * </p>
 */
public final class FrameNode implements Frame {

  private static final long NULL_KEY = Fixed.NULL_FRAME_KEY.getStandardProperty();

  /** The owning arena. */
  private final FrameTree tree;

  /** Key of this frame. */
  private final long key;

  /** The rendered document node. */
  private final Node node;

  /** Structural links. */
  private final FrameLinks links;

  /** The style. */
  private Style style;

  /** Position of the margin box, {@code null} until positioned. */
  private @Nullable Point position;

  /** Containing block, {@code null} until reflowed. */
  private @Nullable Frame containingBlock;

  FrameNode(final FrameTree tree, final long key, final Node node, final Style style) {
    this.tree = tree;
    this.key = key;
    this.node = node;
    this.style = style;
    links = new FrameLinks();
  }

  @Override
  public long getFrameKey() {
    return key;
  }

  @Override
  public FrameTree getTree() {
    return tree;
  }

  @Override
  public FrameNode getFrameNode() {
    return this;
  }

  FrameLinks getLinks() {
    return links;
  }

  @Override
  public Node getNode() {
    return node;
  }

  @Override
  public String getTag() {
    return node.getNodeName();
  }

  @Override
  public Style getStyle() {
    return style;
  }

  @Override
  public void setStyle(final Style style) {
    this.style = requireNonNull(style);
  }

  @Override
  public @Nullable Point getPosition() {
    return position;
  }

  @Override
  public void setPosition(final @Nullable Point position) {
    this.position = position;
  }

  @Override
  public @Nullable Frame getContainingBlock() {
    return containingBlock;
  }

  @Override
  public void setContainingBlock(final @Nullable Frame containingBlock) {
    this.containingBlock = containingBlock;
  }

  @Override
  public Rect getContentBox() {
    final Point origin = position == null ? Point.ORIGIN : position;
    final float left = style.getLength(StyleProperty.MARGIN_LEFT) + style.getLength(StyleProperty.BORDER_LEFT_WIDTH)
        + style.getLength(StyleProperty.PADDING_LEFT);
    final float top = style.getLength(StyleProperty.MARGIN_TOP) + style.getLength(StyleProperty.BORDER_TOP_WIDTH)
        + style.getLength(StyleProperty.PADDING_TOP);
    return new Rect(origin.x() + left, origin.y() + top, style.getLength(StyleProperty.WIDTH),
        style.getLength(StyleProperty.HEIGHT));
  }

  @Override
  public Rect getPaddingBox() {
    return getContentBox().expand(style.getLength(StyleProperty.PADDING_TOP),
        style.getLength(StyleProperty.PADDING_RIGHT), style.getLength(StyleProperty.PADDING_BOTTOM),
        style.getLength(StyleProperty.PADDING_LEFT));
  }

  @Override
  public Rect getBorderBox() {
    return getPaddingBox().expand(style.getLength(StyleProperty.BORDER_TOP_WIDTH),
        style.getLength(StyleProperty.BORDER_RIGHT_WIDTH), style.getLength(StyleProperty.BORDER_BOTTOM_WIDTH),
        style.getLength(StyleProperty.BORDER_LEFT_WIDTH));
  }

  @Override
  public Rect getMarginBox() {
    return getBorderBox().expand(style.getLength(StyleProperty.MARGIN_TOP),
        style.getLength(StyleProperty.MARGIN_RIGHT), style.getLength(StyleProperty.MARGIN_BOTTOM),
        style.getLength(StyleProperty.MARGIN_LEFT));
  }

  @Override
  public float getMarginWidth() {
    return getMarginBox().width();
  }

  @Override
  public float getMarginHeight() {
    return getMarginBox().height();
  }

  @Override
  public boolean isAutoWidth() {
    return style.isAuto(StyleProperty.WIDTH);
  }

  @Override
  public boolean isAutoHeight() {
    return style.isAuto(StyleProperty.HEIGHT);
  }

  @Override
  public @Nullable Frame getParent() {
    return outermost(links.getParentKey());
  }

  @Override
  public @Nullable Frame getFirstChild() {
    return outermost(links.getFirstChildKey());
  }

  @Override
  public @Nullable Frame getLastChild() {
    return outermost(links.getLastChildKey());
  }

  @Override
  public @Nullable Frame getPrevSibling() {
    return outermost(links.getLeftSiblingKey());
  }

  @Override
  public @Nullable Frame getNextSibling() {
    return outermost(links.getRightSiblingKey());
  }

  @Override
  public @NonNegative int getChildCount() {
    return links.getChildCount();
  }

  /**
   * Resolve a key to the outermost decoration of its frame.
   */
  private @Nullable Frame outermost(final long frameKey) {
    final FrameNode primitive = tree.getFrame(frameKey);
    if (primitive == null) {
      return null;
    }
    Frame current = primitive;
    Frame next;
    while ((next = current.getDecorator()) != null) {
      current = next;
    }
    return current;
  }

  @Override
  public void prependChild(final Frame child, final boolean updateNode) {
    final FrameNode first = tree.getFrame(links.getFirstChildKey());
    if (first == null) {
      appendChild(child, updateNode);
    } else {
      insertChildBefore(child, first, updateNode);
    }
  }

  @Override
  public void appendChild(final Frame child, final boolean updateNode) {
    final FrameNode childNode = checkInsertable(child);
    detachFromParent(childNode);

    final long lastKey = links.getLastChildKey();
    if (lastKey == NULL_KEY) {
      links.setFirstChildKey(childNode.key);
    } else {
      tree.getFrame(lastKey).links.setRightSiblingKey(childNode.key);
      childNode.links.setLeftSiblingKey(lastKey);
    }
    links.setLastChildKey(childNode.key);
    childNode.links.setParentKey(key);
    links.incrementChildCount();

    if (updateNode) {
      node.appendChild(childNode.node);
    }
  }

  @Override
  public void insertChildBefore(final Frame child, final Frame reference, final boolean updateNode) {
    final FrameNode referenceNode = checkChild(reference);
    final FrameNode childNode = checkInsertable(child);
    if (childNode == referenceNode) {
      return;
    }
    detachFromParent(childNode);

    final long leftKey = referenceNode.links.getLeftSiblingKey();
    if (leftKey == NULL_KEY) {
      links.setFirstChildKey(childNode.key);
    } else {
      tree.getFrame(leftKey).links.setRightSiblingKey(childNode.key);
    }
    childNode.links.setLeftSiblingKey(leftKey);
    childNode.links.setRightSiblingKey(referenceNode.key);
    referenceNode.links.setLeftSiblingKey(childNode.key);
    childNode.links.setParentKey(key);
    links.incrementChildCount();

    if (updateNode) {
      if (referenceNode.node.getParentNode() == node) {
        node.insertBefore(childNode.node, referenceNode.node);
      } else {
        node.appendChild(childNode.node);
      }
    }
  }

  @Override
  public void insertChildAfter(final Frame child, final Frame reference, final boolean updateNode) {
    final FrameNode referenceNode = checkChild(reference);
    final FrameNode nextNode = tree.getFrame(referenceNode.links.getRightSiblingKey());
    if (nextNode == null) {
      appendChild(child, updateNode);
      return;
    }
    final FrameNode childNode = checkInsertable(child);
    if (childNode == referenceNode || childNode == nextNode) {
      return;
    }
    detachFromParent(childNode);

    referenceNode.links.setRightSiblingKey(childNode.key);
    nextNode.links.setLeftSiblingKey(childNode.key);
    childNode.links.setLeftSiblingKey(referenceNode.key);
    childNode.links.setRightSiblingKey(nextNode.key);
    childNode.links.setParentKey(key);
    links.incrementChildCount();

    if (updateNode) {
      if (referenceNode.node.getParentNode() == node) {
        final Node domNext = referenceNode.node.getNextSibling();
        if (domNext != childNode.node) {
          node.insertBefore(childNode.node, domNext);
        }
      } else {
        node.appendChild(childNode.node);
      }
    }
  }

  @Override
  public void removeChild(final Frame child, final boolean updateNode) {
    final FrameNode childNode = checkChild(child);
    unlink(childNode);
    if (updateNode && childNode.node.getParentNode() == node) {
      node.removeChild(childNode.node);
    }
  }

  private void detachFromParent(final FrameNode child) {
    final FrameNode oldParent = tree.getFrame(child.links.getParentKey());
    if (oldParent != null) {
      oldParent.unlink(child);
    }
  }

  private void unlink(final FrameNode child) {
    final long leftKey = child.links.getLeftSiblingKey();
    final long rightKey = child.links.getRightSiblingKey();
    if (leftKey == NULL_KEY) {
      links.setFirstChildKey(rightKey);
    } else {
      tree.getFrame(leftKey).links.setRightSiblingKey(rightKey);
    }
    if (rightKey == NULL_KEY) {
      links.setLastChildKey(leftKey);
    } else {
      tree.getFrame(rightKey).links.setLeftSiblingKey(leftKey);
    }
    child.links.detach();
    links.decrementChildCount();
  }

  private FrameNode checkChild(final Frame frame) {
    final FrameNode child = frame.getFrameNode();
    checkArgument(child.tree == tree && child.links.getParentKey() == key, "Frame %s is not a child of frame %s.",
        child.key, key);
    return child;
  }

  private FrameNode checkInsertable(final Frame frame) {
    final FrameNode child = frame.getFrameNode();
    checkArgument(child.tree == tree, "Frame %s belongs to another tree.", child.key);
    checkArgument(tree.getFrame(child.key) == child, "Frame %s has been released.", child.key);
    for (FrameNode ancestor = this; ancestor != null; ancestor = tree.getFrame(ancestor.links.getParentKey())) {
      checkArgument(ancestor != child, "Frame %s cannot become a descendant of itself.", child.key);
    }
    return child;
  }

  @Override
  public void reset() {
    position = null;
    containingBlock = null;
    style.reset();
  }

  @Override
  public @Nullable Frame getDecorator() {
    return tree.decoratorOf(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("key", key)
                      .add("tag", getTag())
                      .add("links", links)
                      .add("position", position)
                      .toString();
  }
}
