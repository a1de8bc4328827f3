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

import java.util.Locale;

/**
 * Values of the CSS {@code position} property.
 */
public enum PositionScheme {

  STATIC,

  RELATIVE,

  ABSOLUTE,

  FIXED;

  /**
   * Determines if boxes with this scheme establish a positioning context for their descendants.
   *
   * @return {@code true} unless {@link #STATIC}
   */
  public boolean isPositioned() {
    return this != STATIC;
  }

  /**
   * Determines if boxes with this scheme are taken out of the normal flow.
   *
   * @return {@code true} for {@link #ABSOLUTE} and {@link #FIXED}
   */
  public boolean isOutOfFlow() {
    return this == ABSOLUTE || this == FIXED;
  }

  public String getCssName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PositionScheme fromCss(final String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
