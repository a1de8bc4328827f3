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

package io.folio.positioner;

import io.folio.api.Frame;
import io.folio.api.Positioner;
import io.folio.decorator.AbstractFrameDecorator;
import io.folio.node.Point;

/**
 * Skeletal positioner. Moving a frame is a rigid translation of the frame and its subtree, which
 * holds for every positioning scheme; subclasses only implement {@link #position}.
 */
public abstract class AbstractPositioner implements Positioner {

  @Override
  public void move(final AbstractFrameDecorator frame, final float offsetX, final float offsetY,
      final boolean ignoreSelf) {
    if (!ignoreSelf) {
      translate(frame, offsetX, offsetY);
    }
    for (final Frame child : frame.getChildren()) {
      if (child instanceof AbstractFrameDecorator) {
        ((AbstractFrameDecorator) child).move(offsetX, offsetY);
      } else {
        translate(child, offsetX, offsetY);
      }
    }
  }

  private static void translate(final Frame frame, final float offsetX, final float offsetY) {
    final Point position = frame.getPosition();
    if (position != null) {
      frame.setPosition(position.translate(offsetX, offsetY));
    }
  }
}
