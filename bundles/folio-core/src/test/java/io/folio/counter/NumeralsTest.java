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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class NumeralsTest {

  @Test
  public void testRoman() {
    assertEquals("iii", Numerals.toRoman(3));
    assertEquals("ix", Numerals.toRoman(9));
    assertEquals("xliv", Numerals.toRoman(44));
    assertEquals("cdxc", Numerals.toRoman(490));
    assertEquals("mmxxvi", Numerals.toRoman(2026));
    assertEquals("mmmmm", Numerals.toRoman(5000));
    assertEquals("", Numerals.toRoman(0));
  }

  @Test
  public void testLatinWrapsEvery26() {
    assertEquals("a", Numerals.toLatin(1, 'a'));
    assertEquals("z", Numerals.toLatin(26, 'a'));
    assertEquals("B", Numerals.toLatin(28, 'A'));
    assertEquals("a", Numerals.toLatin(53, 'a'));
    assertEquals("", Numerals.toLatin(0, 'a'));
  }

  @Test
  public void testGreek() {
    assertEquals("β", Numerals.toGreek(2, Numerals.LOWER_GREEK_OFFSET));
    assertEquals("Β", Numerals.toGreek(2, Numerals.UPPER_GREEK_OFFSET));
    assertEquals("", Numerals.toGreek(-5, Numerals.LOWER_GREEK_OFFSET));
    assertEquals("", Numerals.toGreek(Integer.MAX_VALUE, Numerals.LOWER_GREEK_OFFSET));
  }
}
