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

import io.folio.api.Frame;
import io.folio.settings.Fixed;
import io.folio.style.Style;
import io.folio.utils.LogWrapper;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Arena owning the primitive frames of one document together with their decoration chains.
 *
 * <p>
 * Frames reference each other by key only. A decoration chain is the list of decorators stacked
 * on one primitive frame, innermost first. Releasing a frame drops its subtree's frames and chains
 * from the arena; closing the tree drops everything.
 * </p>
 */
public final class FrameTree implements AutoCloseable {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(FrameTree.class));

  private static final long NULL_KEY = Fixed.NULL_FRAME_KEY.getStandardProperty();

  /** The document all frame nodes belong to. */
  private final Document document;

  /** Primitive frames by key. */
  private final Long2ObjectMap<FrameNode> frames;

  /** Decoration chains by frame key, innermost decorator first. */
  private final Long2ObjectMap<List<Frame>> decorations;

  /** Key handed out to the next frame. */
  private long nextKey;

  /** Key of the root frame. */
  private long rootKey;

  /** Determines if the tree has been closed. */
  private boolean isClosed;

  /**
   * Constructor.
   *
   * @param document the document the frames render
   */
  public FrameTree(final Document document) {
    this.document = requireNonNull(document);
    frames = new Long2ObjectOpenHashMap<>();
    decorations = new Long2ObjectOpenHashMap<>();
    nextKey = Fixed.FIRST_FRAME_KEY.getStandardProperty();
    rootKey = NULL_KEY;
  }

  public Document getDocument() {
    return document;
  }

  /**
   * Create a detached frame.
   *
   * @param node the document node the frame renders
   * @param style the frame style, owned by the frame from now on
   * @return the new frame
   */
  public FrameNode createFrame(final Node node, final Style style) {
    assertNotClosed();
    final FrameNode frame = new FrameNode(this, nextKey++, requireNonNull(node), requireNonNull(style));
    frames.put(frame.getFrameKey(), frame);
    return frame;
  }

  /**
   * Create the root frame. A tree has at most one.
   *
   * @param node the document node the frame renders, usually the document element
   * @param style the frame style
   * @return the root frame
   */
  public FrameNode createRootFrame(final Node node, final Style style) {
    checkState(rootKey == NULL_KEY, "The tree already has a root frame.");
    final FrameNode root = createFrame(node, style);
    rootKey = root.getFrameKey();
    return root;
  }

  public @Nullable FrameNode getRootFrame() {
    return rootKey == NULL_KEY ? null : frames.get(rootKey);
  }

  /**
   * Look up a primitive frame.
   *
   * @param key the frame key
   * @return the frame, or {@code null} for {@link Fixed#NULL_FRAME_KEY} and released keys
   */
  public @Nullable FrameNode getFrame(final long key) {
    return key == NULL_KEY ? null : frames.get(key);
  }

  public boolean contains(final Frame frame) {
    return frames.get(frame.getFrameKey()) == frame.getFrameNode();
  }

  public int size() {
    return frames.size();
  }

  /**
   * Stack {@code decorator} on top of {@code wrapped}, which must be the current outermost layer
   * of its primitive frame.
   *
   * @param decorator the new outermost layer
   * @param wrapped the layer it wraps
   */
  public void attachDecorator(final Frame decorator, final Frame wrapped) {
    assertNotClosed();
    requireNonNull(decorator);
    final FrameNode primitive = wrapped.getFrameNode();
    checkArgument(frames.get(primitive.getFrameKey()) == primitive, "Frame %s is not part of this tree.",
        primitive.getFrameKey());
    checkArgument(wrapped.getDecorator() == null, "Frame %s is already decorated.", primitive.getFrameKey());
    decorations.computeIfAbsent(primitive.getFrameKey(), key -> new ArrayList<>(2)).add(decorator);
  }

  /**
   * The decorator stacked directly on {@code layer}.
   *
   * @param layer a layer of a decoration chain, or the primitive frame itself
   * @return the next layer, {@code null} if {@code layer} is the outermost one
   */
  public @Nullable Frame decoratorOf(final Frame layer) {
    final List<Frame> chain = decorations.get(layer.getFrameKey());
    if (chain == null) {
      return null;
    }
    if (layer instanceof FrameNode) {
      return chain.get(0);
    }
    for (int i = 0, size = chain.size(); i < size; i++) {
      if (chain.get(i) == layer) {
        return i + 1 < size ? chain.get(i + 1) : null;
      }
    }
    return null;
  }

  /**
   * Detach {@code frame} from its parent (leaving the DOM untouched) and drop it and all its
   * descendants, with their decoration chains, from the arena.
   *
   * @param frame any layer of the frame to release
   */
  public void release(final Frame frame) {
    final FrameNode node = frame.getFrameNode();
    checkArgument(frames.get(node.getFrameKey()) == node, "Frame %s is not part of this tree.",
        node.getFrameKey());
    final FrameNode parent = getFrame(node.getLinks().getParentKey());
    if (parent != null) {
      parent.removeChild(node, false);
    }

    final LongArrayList released = new LongArrayList();
    collect(node, released);
    for (int i = released.size() - 1; i >= 0; i--) {
      final long key = released.getLong(i);
      frames.remove(key);
      decorations.remove(key);
      if (key == rootKey) {
        rootKey = NULL_KEY;
      }
    }
    if (LOGWRAPPER.isDebugEnabled()) {
      LOGWRAPPER.debug("Released {} frames starting at frame {}.", released.size(), node.getFrameKey());
    }
  }

  private void collect(final FrameNode node, final LongArrayList keys) {
    keys.add(node.getFrameKey());
    for (long key = node.getLinks().getFirstChildKey(); key != NULL_KEY; ) {
      final FrameNode child = frames.get(key);
      collect(child, keys);
      key = child.getLinks().getRightSiblingKey();
    }
  }

  public boolean isClosed() {
    return isClosed;
  }

  private void assertNotClosed() {
    checkState(!isClosed, "The frame tree is already closed.");
  }

  @Override
  public void close() {
    if (!isClosed) {
      frames.clear();
      decorations.clear();
      rootKey = NULL_KEY;
      isClosed = true;
    }
  }
}
