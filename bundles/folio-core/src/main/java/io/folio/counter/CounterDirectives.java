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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parser for the values of {@code counter-reset} and {@code counter-increment}: a list of counter
 * names, each optionally followed by an integer, or the keyword {@code none}.
 */
public final class CounterDirectives {

  private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /** Default amount of a {@code counter-increment} entry without a number. */
  public static final int DEFAULT_INCREMENT = 1;

  /** Default value of a {@code counter-reset} entry without a number. */
  public static final int DEFAULT_RESET = 0;

  private CounterDirectives() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Parse a directive list. A name repeated later in the list replaces the earlier entry.
   *
   * @param value the CSS value, for instance {@code "chapter section 2"}
   * @param defaultValue the number assumed for names without one
   * @return counter names mapped to their numbers, empty for {@code none}
   * @throws IllegalArgumentException if the value starts with a number or a name is not an
   *         identifier
   */
  public static ImmutableMap<String, Integer> parse(final String value, final int defaultValue) {
    if (value == null || value.isBlank() || "none".equalsIgnoreCase(value.trim())) {
      return ImmutableMap.of();
    }
    final List<String> tokens = WHITESPACE.splitToList(value);
    final Map<String, Integer> directives = new LinkedHashMap<>();
    final Iterator<String> iter = tokens.iterator();
    String name = null;
    while (iter.hasNext()) {
      final String token = iter.next();
      final Integer number = parseInteger(token);
      if (number != null) {
        checkArgument(name != null, "Counter amount %s is not preceded by a counter name in '%s'", token, value);
        directives.put(name, number);
        name = null;
      } else {
        if (name != null) {
          directives.put(name, defaultValue);
        }
        checkArgument(isIdentifier(token), "'%s' is not a valid counter name", token);
        name = token;
      }
    }
    if (name != null) {
      directives.put(name, defaultValue);
    }
    return ImmutableMap.copyOf(directives);
  }

  private static Integer parseInteger(final String token) {
    try {
      return Integer.valueOf(token);
    } catch (final NumberFormatException e) {
      return null;
    }
  }

  private static boolean isIdentifier(final String token) {
    final char first = token.charAt(0);
    return (Character.isLetter(first) || first == '_' || first == '-') && !"none".equalsIgnoreCase(token);
  }
}
