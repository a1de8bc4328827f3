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

import io.folio.LayoutTestHelper;
import io.folio.api.Frame;
import io.folio.decorator.AbstractFrameDecorator;
import io.folio.decorator.PageFrameDecorator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public final class ChildAxisTest {

  private static final String DOCUMENT =
      "<html><body><div id='a'/><div id='b'><p id='b1'/></div><div id='c'/></body></html>";

  @Test
  public void testChildrenInOrder() {
    final PageFrameDecorator page = LayoutTestHelper.decorate(DOCUMENT);
    final List<String> names = new ArrayList<>();
    for (final Frame child : new ChildAxis(LayoutTestHelper.byId(page, "b").getParent())) {
      names.add(LayoutTestHelper.name(child));
    }
    assertEquals(List.of("a", "b", "c"), names);
  }

  @Test
  public void testRemovingCurrentChild() {
    final PageFrameDecorator page = LayoutTestHelper.decorate(DOCUMENT);
    final AbstractFrameDecorator body = (AbstractFrameDecorator) page.getFirstChild();
    final List<String> names = new ArrayList<>();
    for (final Frame child : body.getChildren()) {
      names.add(LayoutTestHelper.name(child));
      body.removeChild(child);
    }
    assertEquals(List.of("a", "b", "c"), names);
    assertEquals(0, body.getChildCount());
  }

  @Test
  public void testLeaf() {
    final PageFrameDecorator page = LayoutTestHelper.decorate(DOCUMENT);
    assertFalse(new ChildAxis(LayoutTestHelper.byId(page, "a")).hasNext());
  }
}
