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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import io.folio.api.Positioner;
import io.folio.api.ReflowerProvider;
import io.folio.positioner.NullPositioner;
import io.folio.reflower.NullReflower;
import io.folio.style.Display;
import io.folio.style.PositionScheme;

import java.util.EnumMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Maps the kind of a frame to the strategies it is laid out with. Positioners are looked up by
 * position scheme first, so that absolute and fixed boxes get their own positioner whatever their
 * display, then by display. Reflowers are looked up by display. Kinds without a registered
 * strategy get the null strategies.
 */
public final class StrategyRegistry {

  private final ImmutableMap<PositionScheme, Positioner> schemePositioners;

  private final ImmutableMap<Display, Positioner> displayPositioners;

  private final ImmutableMap<Display, ReflowerProvider> reflowers;

  private final Positioner defaultPositioner;

  private final ReflowerProvider defaultReflower;

  private StrategyRegistry(final Builder builder) {
    schemePositioners = ImmutableMap.copyOf(builder.schemePositioners);
    displayPositioners = ImmutableMap.copyOf(builder.displayPositioners);
    reflowers = ImmutableMap.copyOf(builder.reflowers);
    defaultPositioner = builder.defaultPositioner;
    defaultReflower = builder.defaultReflower;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * A registry handing out null strategies only.
   *
   * @return the registry
   */
  public static StrategyRegistry nullStrategies() {
    return newBuilder().build();
  }

  public Positioner positionerFor(final Display display, final PositionScheme scheme) {
    final Positioner positioner = schemePositioners.get(scheme);
    return positioner != null ? positioner : displayPositioners.getOrDefault(display, defaultPositioner);
  }

  public ReflowerProvider reflowerFor(final Display display) {
    return reflowers.getOrDefault(display, defaultReflower);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("schemePositioners", schemePositioners.keySet())
                      .add("displayPositioners", displayPositioners.keySet())
                      .add("reflowers", reflowers.keySet())
                      .toString();
  }

  /**
   * Builder for {@link StrategyRegistry}.
   */
  public static final class Builder {

    private final Map<PositionScheme, Positioner> schemePositioners = new EnumMap<>(PositionScheme.class);

    private final Map<Display, Positioner> displayPositioners = new EnumMap<>(Display.class);

    private final Map<Display, ReflowerProvider> reflowers = new EnumMap<>(Display.class);

    private Positioner defaultPositioner = NullPositioner.INSTANCE;

    private ReflowerProvider defaultReflower = frame -> new NullReflower();

    private Builder() {
    }

    public Builder positioner(final PositionScheme scheme, final Positioner positioner) {
      schemePositioners.put(requireNonNull(scheme), requireNonNull(positioner));
      return this;
    }

    public Builder positioner(final Display display, final Positioner positioner) {
      displayPositioners.put(requireNonNull(display), requireNonNull(positioner));
      return this;
    }

    public Builder reflower(final Display display, final ReflowerProvider provider) {
      reflowers.put(requireNonNull(display), requireNonNull(provider));
      return this;
    }

    public Builder defaultPositioner(final Positioner positioner) {
      defaultPositioner = requireNonNull(positioner);
      return this;
    }

    public Builder defaultReflower(final ReflowerProvider provider) {
      defaultReflower = requireNonNull(provider);
      return this;
    }

    public StrategyRegistry build() {
      return new StrategyRegistry(this);
    }
  }
}
