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

import io.folio.LayoutTestHelper;
import io.folio.exception.FrameStructureException;
import io.folio.style.StyleProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class BlockFrameDecoratorTest {

  private static final String DOCUMENT = "<html><body id='body'><p id='p'>"
      + "<span id='s1' style='width: 10; height: 12'/>"
      + "<span id='s2' style='width: 20; height: 8'><em id='e' style='width: 4; height: 4'/></span>"
      + "<span id='f' style='float: left; width: 30; height: 20'/>"
      + "<span id='s3' style='width: 5; height: 5'/>"
      + "</p></body></html>";

  private PageFrameDecorator page;

  private BlockFrameDecorator p;

  @BeforeEach
  public void setUp() {
    page = LayoutTestHelper.decorate(DOCUMENT);
    p = (BlockFrameDecorator) LayoutTestHelper.byId(page, "p");
  }

  private AbstractFrameDecorator frame(final String id) {
    return LayoutTestHelper.byId(page, id);
  }

  @Test
  public void testInitialLine() {
    assertEquals(1, p.getLineBoxes().size());
    final LineBox line = p.getCurrentLineBox();
    assertTrue(line.isEmpty());
    assertEquals(0f, line.getY());
    assertSame(p, line.getBlock());
  }

  @Test
  public void testAddFramesAndLines() {
    p.addFrameToLine(frame("s1"));
    p.addFrameToLine(frame("s2"));
    assertEquals(30f, p.getCurrentLineBox().getWidth());
    assertEquals(12f, p.getCurrentLineBox().getHeight());

    final LineBox second = p.addLine(true);
    assertTrue(p.getLineBoxes().get(0).isBr());
    assertFalse(second.isBr());
    assertEquals(12f, second.getY());
    assertSame(second, p.getCurrentLineBox());
  }

  @Test
  public void testRemoveTruncatesLineAndDropsFollowingLines() {
    p.addFrameToLine(frame("s1"));
    p.addFrameToLine(frame("s2"));
    p.addLine();
    p.addFrameToLine(frame("s3"));

    p.removeFramesFromLine(frame("s2"));

    assertEquals(1, p.getLineBoxes().size());
    assertEquals(1, p.getCurrentLineBox().getFrames().size());
    assertEquals(10f, p.getCurrentLineBox().getWidth());
    assertEquals(12f, p.getCurrentLineBox().getHeight());
  }

  @Test
  public void testRemoveMatchesFramesInside() {
    p.addFrameToLine(frame("s1"));
    p.addFrameToLine(frame("e"));

    p.removeFramesFromLine(frame("s2"));

    assertEquals(1, p.getCurrentLineBox().getFrames().size());
    assertSame(frame("s1"), p.getCurrentLineBox().getFrames().get(0));
  }

  @Test
  public void testRemoveFirstFrameDropsLine() {
    p.addFrameToLine(frame("s1"));
    p.addLine();
    p.addFrameToLine(frame("s2"));

    p.removeFramesFromLine(frame("s2"));
    assertEquals(1, p.getLineBoxes().size());
    assertSame(frame("s1"), p.getCurrentLineBox().getFrames().get(0));

    p.removeFramesFromLine(frame("s1"));
    assertEquals(1, p.getLineBoxes().size());
    assertTrue(p.getCurrentLineBox().isEmpty());
    assertEquals(0f, p.getCurrentLineBox().getY());
  }

  @Test
  public void testRemoveUnknownFrameKeepsLines() {
    p.addFrameToLine(frame("s1"));
    p.addLine();
    p.addFrameToLine(frame("s2"));

    p.removeFramesFromLine(frame("s3"));

    assertEquals(2, p.getLineBoxes().size());
  }

  @Test
  public void testFloatOffsets() {
    p.registerFloat(frame("f"));
    final LineBox beside = p.addLine();
    assertEquals(30f, beside.getLeft());
    assertEquals(0f, beside.getRight());

    p.addFrameToLine(frame("s1"));
    p.addLine();
    p.addFrameToLine(frame("s2"));
    final LineBox below = p.addLine();
    assertEquals(20f, below.getY());
    assertEquals(0f, below.getLeft());
  }

  @Test
  public void testRightFloat() {
    final AbstractFrameDecorator floating = frame("f");
    floating.getStyle().set(StyleProperty.FLOAT, "right");
    p.registerFloat(floating);

    final LineBox line = p.getCurrentLineBox();
    line.recomputeFloatOffsets();
    assertEquals(0f, line.getLeft());
    assertEquals(30f, line.getRight());
  }

  @Test
  public void testSplitBehindFloatKeepsIt() throws FrameStructureException {
    p.registerFloat(frame("f"));
    p.addFrameToLine(frame("s1"));
    p.addLine();
    p.addFrameToLine(frame("s3"));

    p.split(frame("s3"), false, false);

    assertEquals(1, p.getLineBoxes().size());
    assertEquals(1, p.getFloats().size());
    assertEquals(30f, p.getCurrentLineBox().getLeft());
  }

  @Test
  public void testSplitAtFloatDropsIt() throws FrameStructureException {
    p.registerFloat(frame("f"));
    p.addFrameToLine(frame("s1"));
    p.getCurrentLineBox().recomputeFloatOffsets();
    assertEquals(30f, p.getCurrentLineBox().getLeft());

    p.split(frame("f"), false, false);

    assertTrue(p.getFloats().isEmpty());
    assertEquals(0f, p.getCurrentLineBox().getLeft());
    assertEquals("s1,s2", LayoutTestHelper.childNames(p));
  }

  @Test
  public void testResetClearsLinesAndFloats() {
    p.registerFloat(frame("f"));
    p.addFrameToLine(frame("s1"));
    p.addLine();

    p.reset();

    assertEquals(1, p.getLineBoxes().size());
    assertTrue(p.getCurrentLineBox().isEmpty());
    assertTrue(p.getFloats().isEmpty());
  }
}
