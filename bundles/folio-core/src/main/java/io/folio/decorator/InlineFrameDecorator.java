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
import io.folio.api.Frame;
import io.folio.exception.FrameStructureException;
import io.folio.style.Style;
import io.folio.style.StyleProperty;
import io.folio.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

/**
 * Decorator for inline boxes and text.
 *
 * <p>
 * An inline box breaks horizontally: splitting it truncates its right edge and the left edge of
 * the successor fragment, and only a page break is passed on to the parent.
 * </p>
 */
public class InlineFrameDecorator extends AbstractFrameDecorator {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(InlineFrameDecorator.class));

  public InlineFrameDecorator(final Frame frame, final FrameFactory factory) {
    super(frame, factory);
  }

  @Override
  public void split(final @Nullable Frame child, final boolean pageBreak, final boolean forced)
      throws FrameStructureException {
    if (child == null) {
      super.split(null, pageBreak, forced);
      return;
    }

    checkChild(child);
    checkSplitChain(pageBreak);
    final AbstractFrameDecorator parent = decoratedParent();

    revertCounterIncrement();

    final AbstractFrameDecorator fragment = copy(getNode().cloneNode(false));
    final Style style = getStyle();
    final Style fragmentStyle = fragment.getStyle();

    style.setLength(StyleProperty.MARGIN_RIGHT, 0f)
         .setLength(StyleProperty.PADDING_RIGHT, 0f)
         .setLength(StyleProperty.BORDER_RIGHT_WIDTH, 0f)
         .setLength(StyleProperty.BORDER_TOP_RIGHT_RADIUS, 0f)
         .setLength(StyleProperty.BORDER_BOTTOM_RIGHT_RADIUS, 0f);

    fragmentStyle.setLength(StyleProperty.MARGIN_LEFT, 0f)
                 .setLength(StyleProperty.PADDING_LEFT, 0f)
                 .setLength(StyleProperty.BORDER_LEFT_WIDTH, 0f)
                 .setLength(StyleProperty.BORDER_TOP_LEFT_RADIUS, 0f)
                 .setLength(StyleProperty.BORDER_BOTTOM_LEFT_RADIUS, 0f);

    fragmentStyle.setLength(StyleProperty.TEXT_INDENT, 0f).setCounterReset(ImmutableMap.of());

    // Generated content is materialized once, on the first fragment.
    if (fragment.getTag().equals(getConfiguration().getGeneratedContentTag())) {
      fragmentStyle.setKeyword(StyleProperty.CONTENT, "normal");
    }

    markSplit(fragment);
    parent.insertChildAfter(fragment, this);
    moveFollowingChildren(child, fragment);

    LOGWRAPPER.debug("Split inline frame {} at frame {} into fragment {}.", getFrameKey(), child.getFrameKey(),
        fragment.getFrameKey());

    if (pageBreak) {
      parent.split(fragment, true, forced);
    }

    fragment.getCounters().copyFrom(getCounters());
  }

  /**
   * Without a page break the fragment stays on the line of the parent, which is not split.
   */
  @Override
  protected void checkSplitChain(final boolean pageBreak) throws FrameStructureException {
    if (pageBreak) {
      super.checkSplitChain(true);
    } else {
      decoratedParent();
    }
  }
}
