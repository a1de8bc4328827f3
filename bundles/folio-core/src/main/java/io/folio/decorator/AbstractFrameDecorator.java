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

package io.folio.decorator;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ForwardingObject;
import com.google.common.collect.ImmutableMap;
import io.folio.api.Frame;
import io.folio.api.MinMaxWidth;
import io.folio.api.Positioner;
import io.folio.api.Reflower;
import io.folio.axis.ChildAxis;
import io.folio.axis.DescendantAxis;
import io.folio.axis.IncludeSelf;
import io.folio.counter.CounterStyle;
import io.folio.counter.CounterTable;
import io.folio.exception.FrameStructureException;
import io.folio.node.FrameNode;
import io.folio.node.FrameTree;
import io.folio.node.Point;
import io.folio.node.Rect;
import io.folio.settings.LayoutConfiguration;
import io.folio.style.Display;
import io.folio.style.Style;
import io.folio.style.StyleProperty;
import io.folio.utils.LogWrapper;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Map;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Base class of all frame decorators.
 *
 * <p>
 * A decorator wraps one frame (a primitive {@link FrameNode} or another decorator) and adds what
 * layout needs on top of the bare box: the positioning and reflow strategies, the CSS counters the
 * frame owns, generated-content and split state, and cached ancestor lookups. Decorators register
 * themselves with the {@link FrameTree} of the wrapped frame on construction, which makes them the
 * outermost layer of that frame.
 * </p>
 */
public abstract class AbstractFrameDecorator extends ForwardingObject implements Frame {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(AbstractFrameDecorator.class));

  /** The wrapped frame. */
  private final Frame frame;

  /** Factory decorating copies and anonymous children. */
  private final FrameFactory factory;

  /** Counters owned by this frame. */
  private final CounterTable counters;

  /** Root of the decorated tree. */
  private @Nullable AbstractFrameDecorator root;

  private @Nullable Positioner positioner;

  private @Nullable Reflower reflower;

  /** Determines if generated content and counters have been materialized. */
  private boolean contentSet;

  /** Determines if this frame has been split and has a successor fragment. */
  private boolean isSplit;

  /** Determines if this frame is a successor fragment produced by a split. */
  private boolean isSplitOff;

  private @Nullable Frame cachedParent;

  private @Nullable Frame blockParent;

  private @Nullable Frame positionedParent;

  /**
   * Constructor.
   *
   * @param frame the frame to decorate, must be the outermost layer of its primitive frame
   * @param factory the factory decorating frames of this tree
   */
  protected AbstractFrameDecorator(final Frame frame, final FrameFactory factory) {
    this.frame = requireNonNull(frame);
    this.factory = requireNonNull(factory);
    counters = new CounterTable();
    frame.getTree().attachDecorator(this, frame);
  }

  @Override
  protected Frame delegate() {
    return frame;
  }

  /**
   * The frame this decorator wraps directly.
   *
   * @return the wrapped frame
   */
  public Frame getWrapped() {
    return frame;
  }

  @Override
  public FrameNode getFrameNode() {
    Frame current = frame;
    while (current instanceof AbstractFrameDecorator) {
      current = ((AbstractFrameDecorator) current).frame;
    }
    return current.getFrameNode();
  }

  public FrameFactory getFactory() {
    return factory;
  }

  protected LayoutConfiguration getConfiguration() {
    return factory.getConfiguration();
  }

  @Override
  public long getFrameKey() {
    return frame.getFrameKey();
  }

  @Override
  public FrameTree getTree() {
    return frame.getTree();
  }

  @Override
  public Node getNode() {
    return frame.getNode();
  }

  @Override
  public String getTag() {
    return frame.getTag();
  }

  @Override
  public Style getStyle() {
    return frame.getStyle();
  }

  @Override
  public void setStyle(final Style style) {
    frame.setStyle(style);
  }

  @Override
  public @Nullable Point getPosition() {
    return frame.getPosition();
  }

  @Override
  public void setPosition(final @Nullable Point position) {
    frame.setPosition(position);
  }

  @Override
  public @Nullable Frame getContainingBlock() {
    return frame.getContainingBlock();
  }

  @Override
  public void setContainingBlock(final @Nullable Frame containingBlock) {
    frame.setContainingBlock(containingBlock);
  }

  @Override
  public Rect getMarginBox() {
    return frame.getMarginBox();
  }

  @Override
  public Rect getBorderBox() {
    return frame.getBorderBox();
  }

  @Override
  public Rect getPaddingBox() {
    return frame.getPaddingBox();
  }

  @Override
  public Rect getContentBox() {
    return frame.getContentBox();
  }

  @Override
  public float getMarginWidth() {
    return frame.getMarginWidth();
  }

  @Override
  public float getMarginHeight() {
    return frame.getMarginHeight();
  }

  @Override
  public boolean isAutoWidth() {
    return frame.isAutoWidth();
  }

  @Override
  public boolean isAutoHeight() {
    return frame.isAutoHeight();
  }

  /**
   * Determines if this frame renders the document body.
   *
   * @return {@code true} for the body element
   */
  public boolean isBody() {
    return getTag().equalsIgnoreCase(getConfiguration().getBodyTag());
  }

  // Navigation ---------------------------------------------------------------------------------

  @Override
  public @Nullable Frame getParent() {
    return getParent(getConfiguration().isParentLookupCacheEnabled());
  }

  /**
   * The outermost decoration of the parent frame.
   *
   * @param useCache {@code true} to answer from, and fill, the parent cache
   * @return the parent or {@code null} for the root
   */
  public @Nullable Frame getParent(final boolean useCache) {
    if (useCache && cachedParent != null) {
      return cachedParent;
    }
    cachedParent = getFrameNode().getParent();
    return cachedParent;
  }

  @Override
  public @Nullable Frame getFirstChild() {
    return getFrameNode().getFirstChild();
  }

  @Override
  public @Nullable Frame getLastChild() {
    return getFrameNode().getLastChild();
  }

  @Override
  public @Nullable Frame getPrevSibling() {
    return getFrameNode().getPrevSibling();
  }

  @Override
  public @Nullable Frame getNextSibling() {
    return getFrameNode().getNextSibling();
  }

  @Override
  public @NonNegative int getChildCount() {
    return getFrameNode().getChildCount();
  }

  /**
   * The children of this frame. The current child may be removed while iterating.
   *
   * @return a child axis
   */
  public ChildAxis getChildren() {
    return new ChildAxis(this);
  }

  /**
   * This frame and all its descendants in document order.
   *
   * @return a descendant axis including this frame
   */
  public DescendantAxis getSubtree() {
    return new DescendantAxis(this, IncludeSelf.YES);
  }

  @Override
  public @Nullable Frame getDecorator() {
    return getTree().decoratorOf(this);
  }

  /**
   * The nearest block-level ancestor.
   *
   * @return the block ancestor or {@code null}
   */
  public @Nullable Frame findBlockParent() {
    if (blockParent != null) {
      return blockParent;
    }
    Frame parent = getParent();
    while (parent != null && !parent.isBlock()) {
      parent = parent.getParent();
    }
    blockParent = parent;
    return blockParent;
  }

  /**
   * The nearest positioned ancestor, else the root.
   *
   * @return the ancestor establishing the positioning context
   */
  public @Nullable Frame findPositionedParent() {
    if (positionedParent != null) {
      return positionedParent;
    }
    Frame parent = getParent();
    while (parent != null && !parent.isPositioned()) {
      parent = parent.getParent();
    }
    positionedParent = parent == null ? root : parent;
    return positionedParent;
  }

  // Mutation -----------------------------------------------------------------------------------

  @Override
  public void prependChild(final Frame child, final boolean updateNode) {
    getFrameNode().prependChild(child, updateNode);
  }

  @Override
  public void appendChild(final Frame child, final boolean updateNode) {
    getFrameNode().appendChild(child, updateNode);
  }

  @Override
  public void insertChildBefore(final Frame child, final Frame reference, final boolean updateNode) {
    getFrameNode().insertChildBefore(child, reference, updateNode);
  }

  @Override
  public void insertChildAfter(final Frame child, final Frame reference, final boolean updateNode) {
    getFrameNode().insertChildAfter(child, reference, updateNode);
  }

  @Override
  public void removeChild(final Frame child, final boolean updateNode) {
    getFrameNode().removeChild(child, updateNode);
  }

  // Content lifecycle --------------------------------------------------------------------------

  /**
   * A decorated copy of this frame rendering {@code node}. The copy gets a reset clone of this
   * style and is not attached anywhere. An {@code id} of {@code node} moves to the original-id
   * attribute.
   *
   * @param node the document node of the copy
   * @return the copy
   */
  public AbstractFrameDecorator copy(final Node node) {
    final Style style = getStyle().copy();
    style.reset();
    final FrameNode copy = getTree().createFrame(node, style);

    if (node instanceof Element) {
      final Element element = (Element) node;
      if (element.hasAttribute("id")) {
        element.setAttribute(getConfiguration().getOriginalIdAttribute(), element.getAttribute("id"));
        element.removeAttribute("id");
      }
    }

    return factory.decorateFrame(copy, root);
  }

  /**
   * Copy this frame and all its descendants, DOM nodes included.
   *
   * @return the root of the copied subtree
   */
  public AbstractFrameDecorator deepCopy() {
    final AbstractFrameDecorator copy = copy(getNode().cloneNode(false));
    for (final Frame child : getChildren()) {
      copy.appendChild(decorated(child).deepCopy());
    }
    return copy;
  }

  /**
   * Create an anonymous box, such as an implied table row, as a detached frame whose style
   * inherits from this one.
   *
   * @param tag the element name of the synthesized node
   * @param display the display of the box
   * @return the decorated, detached frame
   */
  public AbstractFrameDecorator createAnonymousChild(final String tag, final Display display) {
    final Style style = new Style().setDisplay(display);
    style.inherit(getStyle());
    final Element element = getTree().getDocument().createElement(tag);
    return factory.decorateFrame(getTree().createFrame(element, style), root);
  }

  /**
   * Throw away the layout state of this frame and its subtree so that it can be laid out again.
   * Counter increments materialized by this frame are reverted, generated content is removed.
   */
  @Override
  public void reset() {
    frame.reset();
    if (reflower != null) {
      reflower.reset();
    }
    resetGeneratedContent();
    revertCounterIncrement();

    contentSet = false;
    counters.clear();

    cachedParent = null;
    blockParent = null;
    positionedParent = null;

    for (final Frame child : getChildren()) {
      child.reset();
    }
  }

  /**
   * Remove the children of a generated-content frame; they are regenerated on the next reflow.
   */
  protected void resetGeneratedContent() {
    if (!contentSet || !getTag().equals(getConfiguration().getGeneratedContentTag())) {
      return;
    }
    final String content = getStyle().getContent();
    if ("normal".equals(content) || "none".equals(content)) {
      return;
    }
    int removed = 0;
    for (final Frame child : getChildren()) {
      removeChild(child);
      getTree().release(child);
      removed++;
    }
    LOGWRAPPER.debug("Removed {} generated frames of frame {}.", removed, getFrameKey());
  }

  /**
   * Undo the counter increments this frame applied, unless it is the body. Counters whose owner
   * has been reset in the meantime are gone already and are not instantiated again.
   */
  protected void revertCounterIncrement() {
    if (!contentSet || isBody()) {
      return;
    }
    for (final Map.Entry<String, Integer> entry : getStyle().getCounterIncrement().entrySet()) {
      final AbstractFrameDecorator owner = lookupCounterFrame(entry.getKey(), false);
      if (owner != null) {
        owner.counters.add(entry.getKey(), -entry.getValue());
      }
    }
  }

  /**
   * Apply the {@code counter-reset} and {@code counter-increment} of this frame, once per layout
   * pass.
   */
  public void applyCounterDirectives() {
    if (contentSet) {
      return;
    }
    resetCounters(getStyle().getCounterReset());
    incrementCounters(getStyle().getCounterIncrement());
    contentSet = true;
  }

  public boolean isContentSet() {
    return contentSet;
  }

  public void setContentSet(final boolean contentSet) {
    this.contentSet = contentSet;
  }

  // Counters -----------------------------------------------------------------------------------

  /**
   * The counters owned by this frame.
   *
   * @return the live counter table
   */
  public CounterTable getCounters() {
    return counters;
  }

  public void resetCounters(final Map<String, Integer> resets) {
    for (final Map.Entry<String, Integer> entry : resets.entrySet()) {
      resetCounter(entry.getKey(), entry.getValue());
    }
  }

  public void resetCounter() {
    resetCounter(CounterTable.DEFAULT_COUNTER, 0);
  }

  /**
   * Set counter {@code id} in the scope of the parent, which makes the counter visible to this
   * frame and its following siblings. The root resets on itself.
   *
   * @param id the counter identifier
   * @param value the new value
   */
  public void resetCounter(final String id, final int value) {
    counterScope().counters.set(id, value);
  }

  public void decrementCounters(final Map<String, Integer> decrements) {
    for (final Map.Entry<String, Integer> entry : decrements.entrySet()) {
      decrementCounter(entry.getKey(), entry.getValue());
    }
  }

  public void incrementCounters(final Map<String, Integer> increments) {
    for (final Map.Entry<String, Integer> entry : increments.entrySet()) {
      incrementCounter(entry.getKey(), entry.getValue());
    }
  }

  public void incrementCounter() {
    incrementCounter(CounterTable.DEFAULT_COUNTER, 1);
  }

  public void incrementCounter(final String id) {
    incrementCounter(id, 1);
  }

  /**
   * Add {@code increment} to counter {@code id} on the nearest ancestor owning it, instantiating
   * the counter on the parent if no ancestor does.
   *
   * @param id the counter identifier
   * @param increment the amount to add, may be negative
   */
  public void incrementCounter(final String id, final int increment) {
    final AbstractFrameDecorator owner = lookupCounterFrame(id, true);
    owner.counters.add(id, increment);
  }

  public void decrementCounter(final String id, final int decrement) {
    incrementCounter(id, -decrement);
  }

  /**
   * Find the nearest ancestor, excluding this frame, owning counter {@code id}.
   *
   * @param id the counter identifier
   * @param autoReset instantiate the counter at {@code 0} on the parent if no ancestor owns it
   * @return the owner, {@code null} if there is none and {@code autoReset} is {@code false}
   */
  public @Nullable AbstractFrameDecorator lookupCounterFrame(final String id, final boolean autoReset) {
    requireNonNull(id);
    for (Frame ancestor = getParent(); ancestor != null; ancestor = ancestor.getParent()) {
      if (ancestor instanceof AbstractFrameDecorator && ((AbstractFrameDecorator) ancestor).counters.contains(id)) {
        return (AbstractFrameDecorator) ancestor;
      }
    }
    if (!autoReset) {
      return null;
    }
    final AbstractFrameDecorator owner = counterScope();
    owner.counters.set(id, 0);
    return owner;
  }

  private AbstractFrameDecorator counterScope() {
    final Frame parent = getParent();
    return parent instanceof AbstractFrameDecorator ? (AbstractFrameDecorator) parent : this;
  }

  public String counterValue() {
    return counterValue(CounterTable.DEFAULT_COUNTER, CounterStyle.DECIMAL);
  }

  /**
   * Format the value of counter {@code id} in this frame's own table.
   *
   * @param id the counter identifier
   * @param type a {@code list-style-type} keyword, unknown keywords format as decimal
   * @return the formatted value, {@code 0} for absent counters
   */
  public String counterValue(final String id, final String type) {
    return counterValue(id, CounterStyle.fromCss(type));
  }

  public String counterValue(final String id, final CounterStyle style) {
    return style.format(counters.get(id));
  }

  /**
   * Format the value counter {@code id} has in the scope of this frame, as CSS {@code counter()}
   * does: the value in the table of the nearest ancestor owning it.
   *
   * @param id the counter identifier
   * @param style the counter style
   * @return the formatted value, {@code 0} if no ancestor owns the counter
   */
  public String resolveCounterValue(final String id, final CounterStyle style) {
    final AbstractFrameDecorator owner = lookupCounterFrame(id, false);
    return owner == null ? style.format(0) : owner.counterValue(id, style);
  }

  // Splitting ----------------------------------------------------------------------------------

  public boolean isSplit() {
    return isSplit;
  }

  public boolean isSplitOff() {
    return isSplitOff;
  }

  /**
   * Ask the parent to split around this frame.
   *
   * @throws FrameStructureException if this frame has no decorated parent
   */
  public void split() throws FrameStructureException {
    split(null, false, false);
  }

  /**
   * Split this frame at {@code child}. This frame is copied, the copy is inserted as the next
   * sibling, {@code child} and its following siblings move into the copy, and the parent is asked
   * to split around the copy in turn.
   *
   * @param child the first child of the successor fragment, {@code null} to split the parent
   *        around this frame instead
   * @param pageBreak whether the split is caused by a page break
   * @param forced whether the break is forced
   * @throws FrameStructureException if {@code child} is not a child of this frame or the chain of
   *         decorated ancestors the split propagates through is broken, in which case nothing has
   *         been changed
   */
  public void split(final @Nullable Frame child, final boolean pageBreak, final boolean forced)
      throws FrameStructureException {
    if (child == null) {
      decoratedParent().split(this, pageBreak, forced);
      return;
    }

    checkChild(child);
    checkSplitChain(pageBreak);
    final AbstractFrameDecorator parent = decoratedParent();

    revertCounterIncrement();

    final AbstractFrameDecorator fragment = copy(getNode().cloneNode(false));
    final Style style = getStyle();
    final Style fragmentStyle = fragment.getStyle();

    // Truncate the box decoration at the split, except for the body.
    if (!isBody()) {
      style.setLength(StyleProperty.MARGIN_BOTTOM, 0f)
           .setLength(StyleProperty.PADDING_BOTTOM, 0f)
           .setLength(StyleProperty.BORDER_BOTTOM_WIDTH, 0f)
           .setLength(StyleProperty.BORDER_BOTTOM_LEFT_RADIUS, 0f)
           .setLength(StyleProperty.BORDER_BOTTOM_RIGHT_RADIUS, 0f);

      fragmentStyle.setLength(StyleProperty.MARGIN_TOP, 0f)
                   .setLength(StyleProperty.PADDING_TOP, 0f)
                   .setLength(StyleProperty.BORDER_TOP_WIDTH, 0f)
                   .setLength(StyleProperty.BORDER_TOP_LEFT_RADIUS, 0f)
                   .setLength(StyleProperty.BORDER_TOP_RIGHT_RADIUS, 0f)
                   .setKeyword(StyleProperty.PAGE_BREAK_BEFORE, "auto");
    }

    fragmentStyle.setLength(StyleProperty.TEXT_INDENT, 0f).setCounterReset(ImmutableMap.of());

    isSplit = true;
    fragment.isSplitOff = true;

    parent.insertChildAfter(fragment, this);

    truncateLineBoxes(child);

    if (!forced) {
      // An unforced break does not carry the top margin over.
      child.getStyle().setLength(StyleProperty.MARGIN_TOP, 0f);
    }

    moveFollowingChildren(child, fragment);

    LOGWRAPPER.debug("Split frame {} at frame {} into fragment {} (page break: {}, forced: {}).", getFrameKey(),
        child.getFrameKey(), fragment.getFrameKey(), pageBreak, forced);

    parent.split(fragment, pageBreak, forced);

    // After the parent split, as resets along the chain clear counters.
    fragment.counters.copyFrom(counters);
  }

  /**
   * Remove the frames moving to a successor fragment from the bookkeeping of this frame.
   *
   * @param child the first frame moving
   */
  protected void truncateLineBoxes(final Frame child) {
  }

  /**
   * Reset {@code child} and each of its following siblings and append them to {@code fragment}.
   */
  protected final void moveFollowingChildren(final Frame child, final AbstractFrameDecorator fragment) {
    Frame iter = outermost(child);
    while (iter != null) {
      final Frame current = iter;
      iter = iter.getNextSibling();
      current.reset();
      fragment.appendChild(current);
    }
  }

  /**
   * Fail unless {@code child} is a direct child of this frame.
   */
  protected final void checkChild(final Frame child) throws FrameStructureException {
    final Frame parent = child.getFrameNode().getParent();
    if (parent == null || parent.getFrameNode() != getFrameNode()) {
      throw new FrameStructureException("Unable to split: frame %s is not a child of frame %s.",
          child.getFrameKey(), getFrameKey());
    }
  }

  /**
   * Fail unless the split of a child of this frame can propagate up to a frame terminating it.
   * By default every frame splits its parent in turn.
   *
   * @param pageBreak whether the split is caused by a page break
   * @throws FrameStructureException if some frame of the chain has no decorated parent
   */
  protected void checkSplitChain(final boolean pageBreak) throws FrameStructureException {
    decoratedParent().checkSplitChain(pageBreak);
  }

  /**
   * Set the split state of a fragment created by a subclass split.
   */
  protected final void markSplit(final AbstractFrameDecorator fragment) {
    isSplit = true;
    fragment.isSplitOff = true;
  }

  protected final AbstractFrameDecorator decoratedParent() throws FrameStructureException {
    final Frame parent = getParent(false);
    if (!(parent instanceof AbstractFrameDecorator)) {
      throw new FrameStructureException("Unable to split: frame %s has no decorated parent.", getFrameKey());
    }
    return (AbstractFrameDecorator) parent;
  }

  private static Frame outermost(final Frame frame) {
    Frame current = frame;
    Frame next;
    while ((next = current.getDecorator()) != null) {
      current = next;
    }
    return current;
  }

  private static AbstractFrameDecorator decorated(final Frame frame) {
    final Frame outermost = outermost(frame);
    checkState(outermost instanceof AbstractFrameDecorator, "Frame %s is not decorated.", frame.getFrameKey());
    return (AbstractFrameDecorator) outermost;
  }

  // Strategies ---------------------------------------------------------------------------------

  public @Nullable AbstractFrameDecorator getRoot() {
    return root;
  }

  /**
   * Set the root of the decorated tree, on this layer and every decorator it wraps.
   *
   * @param root the root decorator
   */
  public void setRoot(final AbstractFrameDecorator root) {
    this.root = requireNonNull(root);
    if (frame instanceof AbstractFrameDecorator) {
      ((AbstractFrameDecorator) frame).setRoot(root);
    }
  }

  public @Nullable Positioner getPositioner() {
    return positioner;
  }

  public void setPositioner(final Positioner positioner) {
    this.positioner = requireNonNull(positioner);
    if (frame instanceof AbstractFrameDecorator) {
      ((AbstractFrameDecorator) frame).setPositioner(positioner);
    }
  }

  public @Nullable Reflower getReflower() {
    return reflower;
  }

  public void setReflower(final Reflower reflower) {
    this.reflower = requireNonNull(reflower);
    if (frame instanceof AbstractFrameDecorator) {
      ((AbstractFrameDecorator) frame).setReflower(reflower);
    }
  }

  public final void position() {
    checkState(positioner != null, "No positioner attached to frame %s.", getFrameKey());
    positioner.position(this);
  }

  public final void move(final float offsetX, final float offsetY) {
    move(offsetX, offsetY, false);
  }

  public final void move(final float offsetX, final float offsetY, final boolean ignoreSelf) {
    checkState(positioner != null, "No positioner attached to frame %s.", getFrameKey());
    positioner.move(this, offsetX, offsetY, ignoreSelf);
  }

  public final void reflow() {
    reflow(null);
  }

  public final void reflow(final @Nullable BlockFrameDecorator block) {
    checkState(reflower != null, "No reflower attached to frame %s.", getFrameKey());
    reflower.reflow(block);
  }

  public final MinMaxWidth getMinMaxWidth() {
    checkState(reflower != null, "No reflower attached to frame %s.", getFrameKey());
    return reflower.getMinMaxWidth();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("key", getFrameKey())
                      .add("tag", getTag())
                      .add("split", isSplit)
                      .add("splitOff", isSplitOff)
                      .add("counters", counters)
                      .toString();
  }
}
