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

import io.folio.api.Frame;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * <p>
 * Iterate over all descendants starting at a given frame (in preorder). Self might or might not
 * be included.
 * </p>
 */
public final class DescendantAxis extends AbstractFrameAxis {

  /** Stack for remembering the next right sibling in document order. */
  private final Deque<Frame> rightSiblingStack;

  /** The frame returned last. */
  private @Nullable Frame current;

  /** Determines if it's the first call. */
  private boolean first;

  public DescendantAxis(final Frame startFrame) {
    this(startFrame, IncludeSelf.NO);
  }

  public DescendantAxis(final Frame startFrame, final IncludeSelf includeSelf) {
    super(startFrame, includeSelf);
    rightSiblingStack = new ArrayDeque<>();
    first = true;
  }

  @Override
  protected @Nullable Frame nextFrame() {
    if (first) {
      first = false;
      current = includeSelf() == IncludeSelf.YES ? getStartFrame() : getStartFrame().getFirstChild();
      return current;
    }
    if (current == null) {
      return null;
    }

    // Always follow first child if there is one.
    final Frame firstChild = current.getFirstChild();
    if (firstChild != null) {
      if (current != getStartFrame()) {
        final Frame rightSibling = current.getNextSibling();
        if (rightSibling != null) {
          rightSiblingStack.push(rightSibling);
        }
      }
      current = firstChild;
      return current;
    }

    // Then follow right sibling if there is one.
    final Frame rightSibling = current == getStartFrame() ? null : current.getNextSibling();
    if (rightSibling != null) {
      current = rightSibling;
      return current;
    }

    // Then follow right sibling on stack.
    current = rightSiblingStack.poll();
    return current;
  }
}
