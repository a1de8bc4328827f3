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
 * The style properties the decoration layer reads or writes, with their CSS name, whether they are
 * inherited, the kind of value they hold, and their initial value.
 */
public enum StyleProperty {

  DISPLAY("display", false, ValueType.DISPLAY, Display.INLINE),

  POSITION("position", false, ValueType.POSITION, PositionScheme.STATIC),

  FLOAT("float", false, ValueType.FLOAT, Floating.NONE),

  /** {@code null} stands for {@code auto}. */
  WIDTH("width", false, ValueType.LENGTH, null),

  /** {@code null} stands for {@code auto}. */
  HEIGHT("height", false, ValueType.LENGTH, null),

  MARGIN_TOP("margin-top", false, ValueType.LENGTH, 0f),

  MARGIN_RIGHT("margin-right", false, ValueType.LENGTH, 0f),

  MARGIN_BOTTOM("margin-bottom", false, ValueType.LENGTH, 0f),

  MARGIN_LEFT("margin-left", false, ValueType.LENGTH, 0f),

  PADDING_TOP("padding-top", false, ValueType.LENGTH, 0f),

  PADDING_RIGHT("padding-right", false, ValueType.LENGTH, 0f),

  PADDING_BOTTOM("padding-bottom", false, ValueType.LENGTH, 0f),

  PADDING_LEFT("padding-left", false, ValueType.LENGTH, 0f),

  BORDER_TOP_WIDTH("border-top-width", false, ValueType.LENGTH, 0f),

  BORDER_RIGHT_WIDTH("border-right-width", false, ValueType.LENGTH, 0f),

  BORDER_BOTTOM_WIDTH("border-bottom-width", false, ValueType.LENGTH, 0f),

  BORDER_LEFT_WIDTH("border-left-width", false, ValueType.LENGTH, 0f),

  BORDER_TOP_LEFT_RADIUS("border-top-left-radius", false, ValueType.LENGTH, 0f),

  BORDER_TOP_RIGHT_RADIUS("border-top-right-radius", false, ValueType.LENGTH, 0f),

  BORDER_BOTTOM_RIGHT_RADIUS("border-bottom-right-radius", false, ValueType.LENGTH, 0f),

  BORDER_BOTTOM_LEFT_RADIUS("border-bottom-left-radius", false, ValueType.LENGTH, 0f),

  TEXT_INDENT("text-indent", true, ValueType.LENGTH, 0f),

  COLOR("color", true, ValueType.KEYWORD, "black"),

  LIST_STYLE_TYPE("list-style-type", true, ValueType.KEYWORD, "disc"),

  CONTENT("content", false, ValueType.KEYWORD, "normal"),

  COUNTER_INCREMENT("counter-increment", false, ValueType.COUNTERS, ImmutableMap.of()),

  COUNTER_RESET("counter-reset", false, ValueType.COUNTERS, ImmutableMap.of()),

  PAGE_BREAK_BEFORE("page-break-before", false, ValueType.KEYWORD, "auto"),

  PAGE_BREAK_AFTER("page-break-after", false, ValueType.KEYWORD, "auto");

  /** Kind of value a property holds. */
  public enum ValueType {
    /** A {@link Display}. */
    DISPLAY,

    /** A {@link PositionScheme}. */
    POSITION,

    /** A {@link Floating}. */
    FLOAT,

    /** A {@code Float} in points, {@code null} meaning {@code auto}. */
    LENGTH,

    /** A plain keyword or string. */
    KEYWORD,

    /** Counter names mapped to numbers, empty meaning {@code none}. */
    COUNTERS
  }

  private static final ImmutableMap<String, StyleProperty> BY_NAME;

  static {
    final ImmutableMap.Builder<String, StyleProperty> builder = ImmutableMap.builder();
    for (final StyleProperty property : values()) {
      builder.put(property.cssName, property);
    }
    BY_NAME = builder.build();
  }

  private final String cssName;

  private final boolean inherited;

  private final ValueType valueType;

  private final Object initialValue;

  StyleProperty(final String cssName, final boolean inherited, final ValueType valueType, final Object initialValue) {
    this.cssName = cssName;
    this.inherited = inherited;
    this.valueType = valueType;
    this.initialValue = initialValue;
  }

  public String getCssName() {
    return cssName;
  }

  public boolean isInherited() {
    return inherited;
  }

  public ValueType getValueType() {
    return valueType;
  }

  Object getInitialValue() {
    return initialValue;
  }

  /**
   * Look up a property by its CSS name.
   *
   * @param name the CSS name, for instance {@code "margin-top"}
   * @return the property
   * @throws IllegalArgumentException if the name is not known
   */
  public static StyleProperty fromCss(final String name) {
    final StyleProperty property = BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    checkArgument(property != null, "Unsupported style property: %s", name);
    return property;
  }
}
