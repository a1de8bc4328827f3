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
import io.folio.axis.DescendantAxis;
import io.folio.node.FrameNode;
import io.folio.settings.LayoutConfiguration;
import io.folio.style.Display;
import io.folio.style.Style;
import io.folio.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Wraps frames into the decorator matching their display and attaches the strategies the
 * {@link StrategyRegistry} has for them.
 */
public final class FrameFactory {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(FrameFactory.class));

  private final LayoutConfiguration configuration;

  private final StrategyRegistry strategies;

  public FrameFactory(final LayoutConfiguration configuration, final StrategyRegistry strategies) {
    this.configuration = requireNonNull(configuration);
    this.strategies = requireNonNull(strategies);
  }

  public LayoutConfiguration getConfiguration() {
    return configuration;
  }

  public StrategyRegistry getStrategies() {
    return strategies;
  }

  /**
   * Decorate the root frame as a page and every frame below it.
   *
   * @param root the root frame of a tree
   * @return the page, root of the decorated tree
   */
  public PageFrameDecorator decorateRoot(final FrameNode root) {
    root.getStyle().setDisplay(Display.PAGE);
    final PageFrameDecorator page = (PageFrameDecorator) decorateFrame(root, null);
    page.setRoot(page);

    int decorated = 1;
    for (final Frame frame : new DescendantAxis(page)) {
      decorateFrame(frame, page);
      decorated++;
    }
    if (LOGWRAPPER.isDebugEnabled()) {
      LOGWRAPPER.debug("Decorated {} frames below root frame {}.", decorated, root.getFrameKey());
    }
    return page;
  }

  /**
   * Wrap {@code frame}, which must be the outermost layer of its primitive frame, into the
   * decorator for its display and attach its strategies.
   *
   * @param frame the frame to decorate
   * @param root the root of the decorated tree, {@code null} while decorating the root itself
   * @return the new outermost layer of the frame
   */
  public AbstractFrameDecorator decorateFrame(final Frame frame, final @Nullable AbstractFrameDecorator root) {
    final Style style = frame.getStyle();
    final Display display = style.getDisplay();

    final AbstractFrameDecorator decorator;
    switch (display) {
      case PAGE:
        decorator = new PageFrameDecorator(frame, this);
        break;
      case NONE:
        decorator = new NullFrameDecorator(frame, this);
        break;
      case INLINE:
        decorator = new InlineFrameDecorator(frame, this);
        break;
      default:
        decorator = new BlockFrameDecorator(frame, this);
    }

    decorator.setPositioner(strategies.positionerFor(display, style.getPositionScheme()));
    decorator.setReflower(strategies.reflowerFor(display).create(decorator));
    if (root != null) {
      decorator.setRoot(root);
    }
    return decorator;
  }
}
