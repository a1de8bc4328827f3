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
import io.folio.decorator.PageFrameDecorator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public final class DescendantAxisTest {

  private static final String DOCUMENT = "<html><body id='body'><div id='a'><p id='a1'/><p id='a2'><span id='a21'/></p>"
      + "</div><div id='b'/></body><div id='after'/></html>";

  private static List<String> names(final AbstractFrameAxis axis) {
    final List<String> names = new ArrayList<>();
    for (final Frame frame : axis) {
      names.add(LayoutTestHelper.name(frame));
    }
    return names;
  }

  @Test
  public void testPreorderWithoutSelf() {
    final PageFrameDecorator page = LayoutTestHelper.decorate(DOCUMENT);
    assertEquals(List.of("a", "a1", "a2", "a21", "b"),
        names(new DescendantAxis(LayoutTestHelper.byId(page, "body"))));
  }

  @Test
  public void testPreorderWithSelfStopsAtSubtree() {
    final PageFrameDecorator page = LayoutTestHelper.decorate(DOCUMENT);
    assertEquals(List.of("a", "a1", "a2", "a21"),
        names(new DescendantAxis(LayoutTestHelper.byId(page, "a"), IncludeSelf.YES)));
  }

  @Test
  public void testLeaf() {
    final PageFrameDecorator page = LayoutTestHelper.decorate(DOCUMENT);
    assertFalse(new DescendantAxis(LayoutTestHelper.byId(page, "b")).hasNext());
    assertEquals(List.of("b"), names(new DescendantAxis(LayoutTestHelper.byId(page, "b"), IncludeSelf.YES)));
  }
}
