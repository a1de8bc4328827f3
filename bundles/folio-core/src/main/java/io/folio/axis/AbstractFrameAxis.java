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

package io.folio.axis;

import com.google.common.collect.AbstractIterator;
import io.folio.api.Frame;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;

import static java.util.Objects.requireNonNull;

/**
 * Skeletal axis over the frames reachable from a start frame. Axes are single-use: they are
 * their own iterator, so they can be used in enhanced for loops exactly once.
 */
public abstract class AbstractFrameAxis extends AbstractIterator<Frame> implements Iterable<Frame> {

  /** The frame the axis starts at. */
  private final Frame startFrame;

  /** Determines if the start frame is part of the result. */
  private final IncludeSelf includeSelf;

  /**
   * Constructor.
   *
   * @param startFrame the frame to start at
   * @param includeSelf determines if the start frame is included
   */
  protected AbstractFrameAxis(final Frame startFrame, final IncludeSelf includeSelf) {
    this.startFrame = requireNonNull(startFrame);
    this.includeSelf = requireNonNull(includeSelf);
  }

  protected final Frame getStartFrame() {
    return startFrame;
  }

  protected final IncludeSelf includeSelf() {
    return includeSelf;
  }

  @Override
  protected final Frame computeNext() {
    final Frame next = nextFrame();
    return next == null ? endOfData() : next;
  }

  /**
   * The next frame of the axis.
   *
   * @return the next frame, {@code null} once the axis is exhausted
   */
  protected abstract @Nullable Frame nextFrame();

  @Override
  public final Iterator<Frame> iterator() {
    return this;
  }
}
