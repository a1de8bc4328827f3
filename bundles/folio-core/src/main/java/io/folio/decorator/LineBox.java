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
import io.folio.api.Frame;
import io.folio.node.Rect;
import io.folio.style.Floating;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

/**
 * A horizontal run of inline-level frames inside a {@link BlockFrameDecorator}.
 */
public final class LineBox {

  /** The block owning this line. */
  private final BlockFrameDecorator block;

  /** Frames on the line, left to right. */
  private final List<Frame> frames;

  /** Top of the line relative to the block content box. */
  private final float y;

  private float width;

  private float height;

  /** Width taken by left floats beside this line. */
  private float left;

  /** Width taken by right floats beside this line. */
  private float right;

  /** Determines if the line ends with a forced line break. */
  private boolean br;

  LineBox(final BlockFrameDecorator block, final float y) {
    this.block = requireNonNull(block);
    this.y = y;
    frames = new ArrayList<>();
  }

  public BlockFrameDecorator getBlock() {
    return block;
  }

  public List<Frame> getFrames() {
    return Collections.unmodifiableList(frames);
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  public float getY() {
    return y;
  }

  public float getWidth() {
    return width;
  }

  public float getHeight() {
    return height;
  }

  public float getLeft() {
    return left;
  }

  public float getRight() {
    return right;
  }

  public boolean isBr() {
    return br;
  }

  void setBr(final boolean br) {
    this.br = br;
  }

  void addFrame(final Frame frame) {
    frames.add(requireNonNull(frame));
    width += frame.getMarginWidth();
    height = Math.max(height, frame.getMarginHeight());
  }

  /**
   * Drop the frames from index {@code from} on.
   *
   * @param from index of the first frame to drop
   */
  void truncate(final int from) {
    checkElementIndex(from, frames.size());
    frames.subList(from, frames.size()).clear();
    width = 0f;
    height = 0f;
    for (final Frame frame : frames) {
      width += frame.getMarginWidth();
      height = Math.max(height, frame.getMarginHeight());
    }
  }

  /**
   * Recompute the space taken by the floats of the block that overlap this line vertically.
   */
  public void recomputeFloatOffsets() {
    left = 0f;
    right = 0f;
    final float bottom = y + height;
    for (final Frame floating : block.getFloats()) {
      final Rect box = floating.getMarginBox();
      final boolean overlaps = box.y() <= y ? box.getBottom() > y : box.y() < bottom;
      if (!overlaps) {
        continue;
      }
      final Floating side = floating.getStyle().getFloat();
      if (side == Floating.LEFT) {
        left += box.width();
      } else if (side == Floating.RIGHT) {
        right += box.width();
      }
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("y", y)
                      .add("width", width)
                      .add("height", height)
                      .add("left", left)
                      .add("right", right)
                      .add("frames", frames.size())
                      .toString();
  }
}
