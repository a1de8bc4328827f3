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

import io.folio.api.Frame;
import io.folio.exception.FrameStructureException;
import io.folio.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

/**
 * Decorator of the root frame. The page ends every split chain: it does not split itself but
 * records that a page break occurred, after which the layout driver starts the next page.
 */
public class PageFrameDecorator extends AbstractFrameDecorator {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(PageFrameDecorator.class));

  /** Counter holding the current page number. */
  public static final String PAGE_COUNTER = "page";

  /** Determines if the current page is full. */
  private boolean isFull;

  /** The frame a page break was requested at. */
  private @Nullable Frame breakFrame;

  public PageFrameDecorator(final Frame frame, final FrameFactory factory) {
    super(frame, factory);
  }

  /**
   * Record a break before {@code child}. Without a child there is nothing to do, as the page has
   * no parent to split.
   */
  @Override
  public void split(final @Nullable Frame child, final boolean pageBreak, final boolean forced)
      throws FrameStructureException {
    if (child == null) {
      return;
    }
    checkChild(child);
    if (pageBreak) {
      isFull = true;
      breakFrame = child;
      LOGWRAPPER.debug("Page break before frame {} (forced: {}).", child.getFrameKey(), forced);
    }
  }

  /**
   * The page terminates every split chain.
   */
  @Override
  protected void checkSplitChain(final boolean pageBreak) {
  }

  public boolean isFull() {
    return isFull;
  }

  /**
   * The frame starting the next page.
   *
   * @return the frame passed to the last page-breaking split, {@code null} if the page is not full
   */
  public @Nullable Frame getBreakFrame() {
    return breakFrame;
  }

  /**
   * Start a new page: the page is no longer full and the page counter is incremented.
   */
  public void nextPage() {
    isFull = false;
    breakFrame = null;
    getCounters().add(PAGE_COUNTER, 1);
  }

  public int getPageNumber() {
    return getCounters().get(PAGE_COUNTER);
  }

  @Override
  public void reset() {
    super.reset();
    isFull = false;
    breakFrame = null;
  }
}
