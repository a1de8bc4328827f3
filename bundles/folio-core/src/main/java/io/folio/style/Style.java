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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import io.folio.counter.CounterDirectives;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Style of a single frame.
 *
 * <p>
 * A style keeps the values specified for its frame apart from the values it inherited from the
 * parent frame's style. Resetting a style throws the inherited values away (they are taken again
 * from the parent on the next layout pass) but keeps everything specified, including values the
 * layout itself wrote, such as margins truncated by a page split.
 * </p>
 */
public final class Style {

  private static final String LENGTH_UNIT = "pt";

  /** Values specified for the frame. */
  private final EnumMap<StyleProperty, Object> specified;

  /** Values taken over from the parent style by {@link #inherit(Style)}. */
  private final EnumMap<StyleProperty, Object> inherited;

  /** Specified counter directives, kept apart from the untyped values. */
  private final EnumMap<StyleProperty, ImmutableMap<String, Integer>> counters;

  public Style() {
    specified = new EnumMap<>(StyleProperty.class);
    inherited = new EnumMap<>(StyleProperty.class);
    counters = new EnumMap<>(StyleProperty.class);
  }

  private Style(final Style other) {
    specified = new EnumMap<>(other.specified);
    inherited = new EnumMap<>(other.inherited);
    counters = new EnumMap<>(other.counters);
  }

  /**
   * Create an independent copy of this style.
   *
   * @return the copy
   */
  public Style copy() {
    return new Style(this);
  }

  /**
   * Forget all inherited values.
   */
  public void reset() {
    inherited.clear();
  }

  /**
   * Take over the values of all inherited properties this style does not specify itself.
   *
   * @param parent the parent style
   */
  public void inherit(final Style parent) {
    requireNonNull(parent);
    for (final StyleProperty property : StyleProperty.values()) {
      if (property.isInherited()) {
        inherited.put(property, parent.get(property));
      }
    }
  }

  public boolean hasInheritedValues() {
    return !inherited.isEmpty();
  }

  public boolean isSpecified(final StyleProperty property) {
    return specified.containsKey(property) || counters.containsKey(property);
  }

  /**
   * The effective value of a property: the specified one, else the inherited one for inherited
   * properties, else the initial value.
   *
   * @param property the property
   * @return the value, {@code null} only for {@code auto} lengths
   */
  public @Nullable Object get(final StyleProperty property) {
    if (property.getValueType() == StyleProperty.ValueType.COUNTERS) {
      return getCounters(property);
    }
    if (specified.containsKey(property)) {
      return specified.get(property);
    }
    if (property.isInherited() && inherited.containsKey(property)) {
      return inherited.get(property);
    }
    return property.getInitialValue();
  }

  /**
   * Set a property from its CSS text, for instance {@code set(StyleProperty.MARGIN_TOP, "12pt")}.
   * Lengths are given in points, with or without the {@code pt} unit.
   *
   * @param property the property
   * @param cssValue the CSS text
   * @return this style
   * @throws IllegalArgumentException if the text is not a valid value for the property
   */
  public Style set(final StyleProperty property, final String cssValue) {
    requireNonNull(cssValue);
    final String value = cssValue.trim();
    switch (property.getValueType()) {
      case DISPLAY:
        specified.put(property, Display.fromCss(value));
        break;
      case POSITION:
        specified.put(property, PositionScheme.fromCss(value));
        break;
      case FLOAT:
        specified.put(property, Floating.fromCss(value));
        break;
      case LENGTH:
        specified.put(property, parseLength(property, value));
        break;
      case COUNTERS:
        counters.put(property, CounterDirectives.parse(value, property == StyleProperty.COUNTER_INCREMENT
            ? CounterDirectives.DEFAULT_INCREMENT
            : CounterDirectives.DEFAULT_RESET));
        break;
      case KEYWORD:
      default:
        specified.put(property, value);
    }
    return this;
  }

  public Display getDisplay() {
    return (Display) get(StyleProperty.DISPLAY);
  }

  public Style setDisplay(final Display display) {
    specified.put(StyleProperty.DISPLAY, requireNonNull(display));
    return this;
  }

  public PositionScheme getPositionScheme() {
    return (PositionScheme) get(StyleProperty.POSITION);
  }

  public Style setPositionScheme(final PositionScheme scheme) {
    specified.put(StyleProperty.POSITION, requireNonNull(scheme));
    return this;
  }

  public Floating getFloat() {
    return (Floating) get(StyleProperty.FLOAT);
  }

  public Style setFloat(final Floating floating) {
    specified.put(StyleProperty.FLOAT, requireNonNull(floating));
    return this;
  }

  /**
   * A length in points, {@code 0} for {@code auto}.
   *
   * @param property a {@link StyleProperty.ValueType#LENGTH} property
   * @return the length
   */
  public float getLength(final StyleProperty property) {
    checkLength(property);
    final Object value = get(property);
    return value == null ? 0f : (Float) value;
  }

  public Style setLength(final StyleProperty property, final float points) {
    checkLength(property);
    specified.put(property, points);
    return this;
  }

  public boolean isAuto(final StyleProperty property) {
    checkLength(property);
    return get(property) == null;
  }

  public Style setAuto(final StyleProperty property) {
    checkLength(property);
    specified.put(property, null);
    return this;
  }

  public String getKeyword(final StyleProperty property) {
    checkArgument(property.getValueType() == StyleProperty.ValueType.KEYWORD, "%s is not a keyword property",
        property);
    return (String) get(property);
  }

  public Style setKeyword(final StyleProperty property, final String keyword) {
    checkArgument(property.getValueType() == StyleProperty.ValueType.KEYWORD, "%s is not a keyword property",
        property);
    specified.put(property, requireNonNull(keyword));
    return this;
  }

  public String getContent() {
    return getKeyword(StyleProperty.CONTENT);
  }

  public String getPageBreakBefore() {
    return getKeyword(StyleProperty.PAGE_BREAK_BEFORE);
  }

  /**
   * The {@code counter-increment} entries.
   *
   * @return counter names mapped to increments, empty for {@code none}
   */
  public ImmutableMap<String, Integer> getCounterIncrement() {
    return getCounters(StyleProperty.COUNTER_INCREMENT);
  }

  public Style setCounterIncrement(final Map<String, Integer> increments) {
    counters.put(StyleProperty.COUNTER_INCREMENT, ImmutableMap.copyOf(increments));
    return this;
  }

  /**
   * The {@code counter-reset} entries.
   *
   * @return counter names mapped to reset values, empty for {@code none}
   */
  public ImmutableMap<String, Integer> getCounterReset() {
    return getCounters(StyleProperty.COUNTER_RESET);
  }

  public Style setCounterReset(final Map<String, Integer> resets) {
    counters.put(StyleProperty.COUNTER_RESET, ImmutableMap.copyOf(resets));
    return this;
  }

  private ImmutableMap<String, Integer> getCounters(final StyleProperty property) {
    final ImmutableMap<String, Integer> directives = counters.get(property);
    return directives == null ? ImmutableMap.of() : directives;
  }

  private static void checkLength(final StyleProperty property) {
    checkArgument(property.getValueType() == StyleProperty.ValueType.LENGTH, "%s is not a length property",
        property);
  }

  private static @Nullable Float parseLength(final StyleProperty property, final String value) {
    if ("auto".equalsIgnoreCase(value)) {
      checkArgument(property == StyleProperty.WIDTH || property == StyleProperty.HEIGHT,
          "%s does not accept auto", property);
      return null;
    }
    final String number = value.endsWith(LENGTH_UNIT) ? value.substring(0, value.length() - LENGTH_UNIT.length()) : value;
    try {
      return Float.valueOf(number.trim());
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid length for " + property.getCssName() + ": " + value, e);
    }
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Style)) {
      return false;
    }
    final Style other = (Style) obj;
    return specified.equals(other.specified) && inherited.equals(other.inherited) && counters.equals(other.counters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(specified, inherited, counters);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("specified", specified)
                      .add("inherited", inherited)
                      .add("counters", counters)
                      .toString();
  }
}
