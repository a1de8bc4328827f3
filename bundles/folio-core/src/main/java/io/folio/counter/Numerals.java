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

/**
 * Conversions of counter values to the non-decimal numbering systems of CSS list styles.
 *
 * <p>
 * All conversions are total. Values below {@code 1} have no representation in the roman,
 * alphabetic or greek systems and convert to the empty string.
 * </p>
 */
public final class Numerals {

  private static final String[] ONES = { "", "i", "ii", "iii", "iv", "v", "vi", "vii", "viii", "ix" };

  private static final String[] TENS = { "", "x", "xx", "xxx", "xl", "l", "lx", "lxx", "lxxx", "xc" };

  private static final String[] HUNDREDS = { "", "c", "cc", "ccc", "cd", "d", "dc", "dcc", "dccc", "cm" };

  private static final int LATIN_LETTERS = 26;

  /** Offset from a counter value to the lower-case greek code point ({@code 1} is alpha). */
  static final int LOWER_GREEK_OFFSET = 944;

  /** Offset from a counter value to the upper-case greek code point ({@code 1} is Alpha). */
  static final int UPPER_GREEK_OFFSET = 912;

  private Numerals() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Lower-case roman numeral. Thousands are written as repeated {@code m}, so the conversion has
   * no upper bound.
   *
   * @param value the value
   * @return the numeral, empty for values below {@code 1}
   */
  public static String toRoman(final int value) {
    if (value < 1) {
      return "";
    }
    return Strings.repeat("m", value / 1000) + HUNDREDS[(value / 100) % 10] + TENS[(value / 10) % 10]
        + ONES[value % 10];
  }

  /**
   * Letter of the latin alphabet, restarting at the first letter every 26 values.
   *
   * @param value the value
   * @param first {@code 'a'} or {@code 'A'}
   * @return the letter, empty for values below {@code 1}
   */
  public static String toLatin(final int value, final char first) {
    if (value < 1) {
      return "";
    }
    return String.valueOf((char) (first + (value - 1) % LATIN_LETTERS));
  }

  /**
   * Greek letter found by a fixed code point offset.
   *
   * @param value the value
   * @param offset {@link #LOWER_GREEK_OFFSET} or {@link #UPPER_GREEK_OFFSET}
   * @return the letter, empty for values below {@code 1} or past the last code point
   */
  public static String toGreek(final int value, final int offset) {
    if (value < 1 || value > Character.MAX_CODE_POINT - offset) {
      return "";
    }
    return new String(Character.toChars(value + offset));
  }
}
