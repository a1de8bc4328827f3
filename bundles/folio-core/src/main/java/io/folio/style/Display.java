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

import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Values of the CSS {@code display} property, plus the internal page box.
 */
public enum Display {

  INLINE("inline"),

  BLOCK("block"),

  INLINE_BLOCK("inline-block"),

  LIST_ITEM("list-item"),

  TABLE("table"),

  INLINE_TABLE("inline-table"),

  TABLE_ROW_GROUP("table-row-group"),

  TABLE_HEADER_GROUP("table-header-group"),

  TABLE_FOOTER_GROUP("table-footer-group"),

  TABLE_ROW("table-row"),

  TABLE_COLUMN_GROUP("table-column-group"),

  TABLE_COLUMN("table-column"),

  TABLE_CELL("table-cell"),

  TABLE_CAPTION("table-caption"),

  FLEX("flex"),

  INLINE_FLEX("inline-flex"),

  NONE("none"),

  /** The page box wrapping the document root. */
  PAGE("-folio-page");

  private static final ImmutableMap<String, Display> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Display> builder = ImmutableMap.builder();
    for (final Display display : values()) {
      builder.put(display.cssName, display);
    }
    BY_NAME = builder.build();
  }

  private final String cssName;

  Display(final String cssName) {
    this.cssName = cssName;
  }

  public String getCssName() {
    return cssName;
  }

  /**
   * Determines if a box with this display is a block container, that is whether its content is
   * laid out in line boxes and block boxes of its own.
   *
   * @return {@code true} for block containers
   */
  public boolean isBlock() {
    switch (this) {
      case BLOCK:
      case INLINE_BLOCK:
      case LIST_ITEM:
      case TABLE_CELL:
      case TABLE_CAPTION:
        return true;
      default:
        return false;
    }
  }

  /**
   * Determines if a box with this display sits on a line of its parent.
   *
   * @return {@code true} for inline-level boxes
   */
  public boolean isInlineLevel() {
    switch (this) {
      case INLINE:
      case INLINE_BLOCK:
      case INLINE_TABLE:
      case INLINE_FLEX:
        return true;
      default:
        return false;
    }
  }

  /**
   * Parse a CSS {@code display} keyword.
   *
   * @param name the keyword
   * @return the display
   * @throws IllegalArgumentException if the keyword is unknown
   */
  public static Display fromCss(final String name) {
    final Display display = BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    checkArgument(display != null, "Unknown display value: %s", name);
    return display;
  }
}
