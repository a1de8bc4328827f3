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

import com.google.common.collect.ImmutableMap;
import io.folio.LayoutTestHelper;
import io.folio.counter.CounterStyle;
import io.folio.counter.CounterTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

public final class CounterScopeTest {

  private PageFrameDecorator page;

  private AbstractFrameDecorator body;

  private AbstractFrameDecorator d1;

  private AbstractFrameDecorator d2;

  private AbstractFrameDecorator d3;

  @BeforeEach
  public void setUp() {
    page = LayoutTestHelper.decorate(
        "<html><body id='body'><div id='d1'><div id='d2'><div id='d3'/></div></div></body></html>");
    body = LayoutTestHelper.byId(page, "body");
    d1 = LayoutTestHelper.byId(page, "d1");
    d2 = LayoutTestHelper.byId(page, "d2");
    d3 = LayoutTestHelper.byId(page, "d3");
  }

  @Test
  @DisplayName("Nested increments share the counter of the single owning ancestor")
  public void testNestedIncrementsShareOneCounter() {
    d1.incrementCounter("c");
    d2.incrementCounter("c");
    d3.incrementCounter("c");

    assertEquals(ImmutableMap.of("c", 3), body.getCounters().asMap());
    assertFalse(d1.getCounters().contains("c"));
    assertFalse(d2.getCounters().contains("c"));
    assertFalse(d3.getCounters().contains("c"));
    assertEquals("3", body.counterValue("c", "decimal"));
    assertEquals("3", d1.resolveCounterValue("c", CounterStyle.DECIMAL));
    assertEquals("3", d2.resolveCounterValue("c", CounterStyle.DECIMAL));
    assertEquals("iii", d3.resolveCounterValue("c", CounterStyle.LOWER_ROMAN));
  }

  @Test
  public void testResetCounterScopesToParent() {
    d1.incrementCounter("c");
    d2.resetCounter("c", 5);
    d3.incrementCounter("c", 2);

    assertEquals(7, d1.getCounters().get("c"));
    assertEquals(1, body.getCounters().get("c"));
    assertSame(d1, d3.lookupCounterFrame("c", false));
    assertSame(body, d1.lookupCounterFrame("c", false));
  }

  @Test
  public void testLookupWithoutOwner() {
    assertNull(d3.lookupCounterFrame("missing", false));
    assertEquals("0", d3.counterValue("missing", "decimal"));
    assertEquals("0", d3.resolveCounterValue("missing", CounterStyle.DECIMAL));

    assertSame(d2, d3.lookupCounterFrame("missing", true));
    assertEquals(0, d2.getCounters().get("missing"));
    assertSame(d2, d3.lookupCounterFrame("missing", false));
  }

  @Test
  public void testRootIsItsOwnScope() {
    page.resetCounter("x", 2);
    page.incrementCounter("y");

    assertEquals(ImmutableMap.of("x", 2, "y", 1), page.getCounters().asMap());
  }

  @Test
  public void testDefaultCounterAndDirectiveMaps() {
    d2.resetCounter();
    d3.incrementCounter();
    d3.incrementCounters(ImmutableMap.of(CounterTable.DEFAULT_COUNTER, 3));
    assertEquals("4", d1.counterValue());

    d3.decrementCounters(ImmutableMap.of(CounterTable.DEFAULT_COUNTER, 2));
    assertEquals("02", d1.counterValue(CounterTable.DEFAULT_COUNTER, "decimal-leading-zero"));

    d3.resetCounters(ImmutableMap.of("a", 1, "b", 2));
    assertEquals(ImmutableMap.of("a", 1, "b", 2), d2.getCounters().asMap());
  }

  @Test
  public void testDecrementSingleCounter() {
    d1.incrementCounter("c", 5);
    d3.decrementCounter("c", 2);
    assertEquals(3, body.getCounters().get("c"));

    d3.decrementCounter("fresh", 1);
    assertEquals(-1, d2.getCounters().get("fresh"));
    assertEquals("-1", d3.resolveCounterValue("fresh", CounterStyle.DECIMAL));
  }

  @Test
  public void testFormattingOfOwnedValues() {
    body.getCounters().set("c", 4);
    assertEquals("IV", body.counterValue("c", "upper-roman"));
    assertEquals("d", body.counterValue("c", "lower-alpha"));
    assertEquals("4", body.counterValue("c", "no-such-style"));

    body.getCounters().set("c", 27);
    assertEquals("A", body.counterValue("c", "upper-alpha"));
  }
}
