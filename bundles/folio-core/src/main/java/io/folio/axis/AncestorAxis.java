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

/**
 * Iterates over the ancestors of a frame, nearest first, up to the root.
 */
public final class AncestorAxis extends AbstractFrameAxis {

  /** The frame returned last. */
  private @Nullable Frame current;

  /** First touch of the start frame. */
  private boolean first;

  public AncestorAxis(final Frame startFrame) {
    this(startFrame, IncludeSelf.NO);
  }

  public AncestorAxis(final Frame startFrame, final IncludeSelf includeSelf) {
    super(startFrame, includeSelf);
    current = startFrame;
    first = true;
  }

  @Override
  protected @Nullable Frame nextFrame() {
    if (first) {
      first = false;
      if (includeSelf() == IncludeSelf.YES) {
        return current;
      }
    }
    current = current == null ? null : current.getParent();
    return current;
  }
}
