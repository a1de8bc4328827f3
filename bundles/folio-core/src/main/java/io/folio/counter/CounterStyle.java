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

package io.folio.counter;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/**
 * The list-style types a counter value can be rendered with.
 */
public enum CounterStyle {

  DECIMAL("decimal") {
    @Override
    public String format(final int value) {
      return Integer.toString(value);
    }
  },

  DECIMAL_LEADING_ZERO("decimal-leading-zero") {
    @Override
    public String format(final int value) {
      return Strings.padStart(Integer.toString(value), 2, '0');
    }
  },

  LOWER_ROMAN("lower-roman") {
    @Override
    public String format(final int value) {
      return Numerals.toRoman(value);
    }
  },

  UPPER_ROMAN("upper-roman") {
    @Override
    public String format(final int value) {
      return Numerals.toRoman(value).toUpperCase(Locale.ROOT);
    }
  },

  LOWER_LATIN("lower-latin", "lower-alpha") {
    @Override
    public String format(final int value) {
      return Numerals.toLatin(value, 'a');
    }
  },

  UPPER_LATIN("upper-latin", "upper-alpha") {
    @Override
    public String format(final int value) {
      return Numerals.toLatin(value, 'A');
    }
  },

  LOWER_GREEK("lower-greek") {
    @Override
    public String format(final int value) {
      return Numerals.toGreek(value, Numerals.LOWER_GREEK_OFFSET);
    }
  },

  UPPER_GREEK("upper-greek") {
    @Override
    public String format(final int value) {
      return Numerals.toGreek(value, Numerals.UPPER_GREEK_OFFSET);
    }
  };

  private static final ImmutableMap<String, CounterStyle> BY_NAME;

  static {
    final ImmutableMap.Builder<String, CounterStyle> builder = ImmutableMap.builder();
    for (final CounterStyle style : values()) {
      for (final String name : style.names) {
        builder.put(name, style);
      }
    }
    BY_NAME = builder.build();
  }

  private final String[] names;

  CounterStyle(final String... names) {
    this.names = names;
  }

  /**
   * Render a counter value.
   *
   * @param value the counter value
   * @return the textual representation
   */
  public abstract String format(int value);

  /**
   * The CSS keyword of this style (the first one where CSS defines aliases).
   *
   * @return the keyword
   */
  public String getCssName() {
    return names[0];
  }

  /**
   * Look up the style for a CSS list-style keyword. Unknown keywords fall back to
   * {@link #DECIMAL}.
   *
   * @param name the keyword, for instance {@code "upper-roman"}
   * @return the style
   */
  public static CounterStyle fromCss(final String name) {
    if (name == null) {
      return DECIMAL;
    }
    return BY_NAME.getOrDefault(name.trim().toLowerCase(Locale.ROOT), DECIMAL);
  }
}
