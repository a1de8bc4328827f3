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

import io.folio.LayoutTestHelper;
import io.folio.api.Frame;
import io.folio.decorator.AbstractFrameDecorator;
import io.folio.decorator.PageFrameDecorator;
import io.folio.node.Point;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public final class AbstractPositionerTest {

  private PageFrameDecorator page;

  @BeforeEach
  public void setUp() {
    page = LayoutTestHelper.decorate("<html><body id='body'><p id='p'><span id='s'/></p><div id='d'/></body></html>");
    for (final Frame frame : page.getSubtree()) {
      frame.setPosition(new Point(1f, 2f));
    }
    LayoutTestHelper.byId(page, "d").setPosition(null);
  }

  @Test
  public void testMoveTranslatesSubtree() {
    page.move(10f, 20f);

    assertEquals(new Point(11f, 22f), page.getPosition());
    assertEquals(new Point(11f, 22f), LayoutTestHelper.byId(page, "body").getPosition());
    assertEquals(new Point(11f, 22f), LayoutTestHelper.byId(page, "s").getPosition());
  }

  @Test
  public void testMoveIgnoringSelf() {
    final AbstractFrameDecorator p = LayoutTestHelper.byId(page, "p");

    p.move(-1f, -2f, true);

    assertEquals(new Point(1f, 2f), p.getPosition());
    assertEquals(Point.ORIGIN, LayoutTestHelper.byId(page, "s").getPosition());
    assertEquals(new Point(1f, 2f), page.getPosition());
  }

  @Test
  public void testUnpositionedFramesStayUnpositioned() {
    page.move(5f, 5f);

    assertNull(LayoutTestHelper.byId(page, "d").getPosition());
  }

  @Test
  public void testNullPositionerLeavesPositionAlone() {
    final AbstractFrameDecorator p = LayoutTestHelper.byId(page, "p");

    p.position();

    assertEquals(new Point(1f, 2f), p.getPosition());
  }
}
