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

package io.folio.style;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class StyleTest {

  @Test
  public void testInitialValues() {
    final Style style = new Style();
    assertSame(Display.INLINE, style.getDisplay());
    assertSame(PositionScheme.STATIC, style.getPositionScheme());
    assertSame(Floating.NONE, style.getFloat());
    assertTrue(style.isAuto(StyleProperty.WIDTH));
    assertEquals(0f, style.getLength(StyleProperty.WIDTH));
    assertEquals(0f, style.getLength(StyleProperty.MARGIN_TOP));
    assertEquals("normal", style.getContent());
    assertEquals("auto", style.getPageBreakBefore());
    assertTrue(style.getCounterIncrement().isEmpty());
  }

  @Test
  public void testSetFromCss() {
    final Style style = new Style().set(StyleProperty.DISPLAY, "list-item")
                                   .set(StyleProperty.POSITION, "relative")
                                   .set(StyleProperty.FLOAT, "left")
                                   .set(StyleProperty.MARGIN_TOP, "12pt")
                                   .set(StyleProperty.WIDTH, "auto")
                                   .set(StyleProperty.HEIGHT, "40")
                                   .set(StyleProperty.COUNTER_INCREMENT, "item")
                                   .set(StyleProperty.COUNTER_RESET, "item 4");
    assertSame(Display.LIST_ITEM, style.getDisplay());
    assertTrue(style.getPositionScheme().isPositioned());
    assertSame(Floating.LEFT, style.getFloat());
    assertEquals(12f, style.getLength(StyleProperty.MARGIN_TOP));
    assertTrue(style.isAuto(StyleProperty.WIDTH));
    assertEquals(40f, style.getLength(StyleProperty.HEIGHT));
    assertEquals(ImmutableMap.of("item", 1), style.getCounterIncrement());
    assertEquals(ImmutableMap.of("item", 4), style.getCounterReset());
  }

  @Test
  public void testInvalidValuesAreRejected() {
    final Style style = new Style();
    assertThrows(IllegalArgumentException.class, () -> style.set(StyleProperty.MARGIN_TOP, "auto"));
    assertThrows(IllegalArgumentException.class, () -> style.set(StyleProperty.MARGIN_TOP, "wide"));
    assertThrows(IllegalArgumentException.class, () -> style.set(StyleProperty.DISPLAY, "grid-ish"));
    assertThrows(IllegalArgumentException.class, () -> style.getLength(StyleProperty.COLOR));
    assertThrows(IllegalArgumentException.class, () -> style.setKeyword(StyleProperty.MARGIN_TOP, "x"));
  }

  @Test
  public void testInheritAndReset() {
    final Style parent = new Style().setKeyword(StyleProperty.COLOR, "red")
                                    .setLength(StyleProperty.TEXT_INDENT, 8f)
                                    .setLength(StyleProperty.MARGIN_TOP, 5f);
    final Style child = new Style();
    child.inherit(parent);

    assertTrue(child.hasInheritedValues());
    assertEquals("red", child.getKeyword(StyleProperty.COLOR));
    assertEquals(8f, child.getLength(StyleProperty.TEXT_INDENT));
    assertEquals(0f, child.getLength(StyleProperty.MARGIN_TOP), "margins are not inherited");

    child.setLength(StyleProperty.TEXT_INDENT, 2f);
    assertEquals(2f, child.getLength(StyleProperty.TEXT_INDENT), "specified values win");

    child.reset();
    assertFalse(child.hasInheritedValues());
    assertEquals("black", child.getKeyword(StyleProperty.COLOR));
    assertEquals(2f, child.getLength(StyleProperty.TEXT_INDENT));
  }

  @Test
  public void testCopyIsIndependent() {
    final Style style = new Style().setLength(StyleProperty.MARGIN_BOTTOM, 3f);
    final Style copy = style.copy();
    assertNotSame(style, copy);
    assertEquals(style, copy);

    copy.setLength(StyleProperty.MARGIN_BOTTOM, 0f);
    assertEquals(3f, style.getLength(StyleProperty.MARGIN_BOTTOM));
  }

  @Test
  public void testCounterDirectivesAreCopiedAndKeptOnReset() {
    final Style style = new Style().set(StyleProperty.COUNTER_RESET, "chapter 2 section");
    assertTrue(style.isSpecified(StyleProperty.COUNTER_RESET));
    assertFalse(style.isSpecified(StyleProperty.COUNTER_INCREMENT));
    assertEquals(ImmutableMap.of("chapter", 2, "section", 0), style.get(StyleProperty.COUNTER_RESET));

    final Style copy = style.copy();
    copy.setCounterReset(ImmutableMap.of());
    copy.reset();

    assertTrue(copy.getCounterReset().isEmpty());
    assertEquals(ImmutableMap.of("chapter", 2, "section", 0), style.getCounterReset());
    assertNotEquals(style, copy);
  }

  @Test
  public void testPropertyLookupByCssName() {
    assertSame(StyleProperty.BORDER_TOP_LEFT_RADIUS, StyleProperty.fromCss("Border-Top-Left-Radius"));
    assertThrows(IllegalArgumentException.class, () -> StyleProperty.fromCss("colour"));
  }
}
