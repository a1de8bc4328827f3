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

import io.folio.api.Frame;
import io.folio.node.FrameNode;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Decorator for block containers. Keeps the line boxes its inline content has been laid out in
 * and the floats placed against it. There is always at least one line box.
 */
public class BlockFrameDecorator extends AbstractFrameDecorator {

  /** Line boxes, top to bottom. */
  private final List<LineBox> lineBoxes;

  /** Floats placed against this block. */
  private final List<Frame> floats;

  public BlockFrameDecorator(final Frame frame, final FrameFactory factory) {
    super(frame, factory);
    lineBoxes = new ArrayList<>();
    lineBoxes.add(new LineBox(this, 0f));
    floats = new ArrayList<>();
  }

  public List<LineBox> getLineBoxes() {
    return Collections.unmodifiableList(lineBoxes);
  }

  public LineBox getCurrentLineBox() {
    return lineBoxes.get(lineBoxes.size() - 1);
  }

  /**
   * Close the current line and start a new one below it.
   *
   * @param br whether the current line ends with a forced line break
   * @return the new current line
   */
  public LineBox addLine(final boolean br) {
    final LineBox current = getCurrentLineBox();
    current.setBr(br);
    final LineBox line = new LineBox(this, current.getY() + current.getHeight());
    line.recomputeFloatOffsets();
    lineBoxes.add(line);
    return line;
  }

  public LineBox addLine() {
    return addLine(false);
  }

  public void addFrameToLine(final Frame frame) {
    getCurrentLineBox().addFrame(frame);
  }

  public void registerFloat(final Frame frame) {
    floats.add(requireNonNull(frame));
  }

  public List<Frame> getFloats() {
    return Collections.unmodifiableList(floats);
  }

  /**
   * Remove {@code frame}, everything after it, and every frame it contains from the line boxes.
   * Lines after the one holding {@code frame} are dropped, that line is truncated at
   * {@code frame} or dropped if {@code frame} is its first frame.
   *
   * @param frame the first frame to remove
   */
  public void removeFramesFromLine(final Frame frame) {
    final FrameNode target = frame.getFrameNode();
    for (int i = 0; i < lineBoxes.size(); i++) {
      final List<Frame> lineFrames = lineBoxes.get(i).getFrames();
      for (int j = 0; j < lineFrames.size(); j++) {
        if (isSelfOrDescendant(lineFrames.get(j), target)) {
          lineBoxes.subList(i + 1, lineBoxes.size()).clear();
          if (j == 0) {
            final LineBox removed = lineBoxes.remove(i);
            if (lineBoxes.isEmpty()) {
              lineBoxes.add(new LineBox(this, removed.getY()));
            }
          } else {
            lineBoxes.get(i).truncate(j);
          }
          return;
        }
      }
    }
  }

  @Override
  protected void truncateLineBoxes(final Frame child) {
    removeFramesFromLine(child);

    final LongSet moved = new LongOpenHashSet();
    for (Frame sibling = child; sibling != null; sibling = sibling.getNextSibling()) {
      moved.add(sibling.getFrameKey());
    }
    floats.removeIf(floating -> isWithin(floating, moved));

    // Recalculate the float offsets after paging.
    for (final LineBox line : lineBoxes) {
      line.recomputeFloatOffsets();
    }
  }

  private boolean isSelfOrDescendant(final Frame frame, final FrameNode ancestor) {
    for (Frame current = frame.getFrameNode(); current != null; current = current.getFrameNode().getParent()) {
      final FrameNode node = current.getFrameNode();
      if (node == ancestor) {
        return true;
      }
      if (node == getFrameNode()) {
        return false;
      }
    }
    return false;
  }

  private boolean isWithin(final Frame frame, final LongSet keys) {
    for (Frame current = frame.getFrameNode(); current != null; current = current.getFrameNode().getParent()) {
      if (current.getFrameKey() == getFrameKey()) {
        return false;
      }
      if (keys.contains(current.getFrameKey())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void reset() {
    super.reset();
    lineBoxes.clear();
    lineBoxes.add(new LineBox(this, 0f));
    floats.clear();
  }
}
